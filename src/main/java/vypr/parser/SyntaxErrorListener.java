package vypr.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.NoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import vypr.exception.SyntaxException;

/**
 * Stops the parse at the first syntax error. The SyntaxException travels out of the
 * generated parser as the cause of a ParseCancellationException.
 */
class SyntaxErrorListener extends BaseErrorListener {
    private final int tabWidth;

    SyntaxErrorListener(int tabWidth) {
        this.tabWidth = tabWidth;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        StringBuilder message = new StringBuilder();
        if (e instanceof NoViableAltException
                && ((NoViableAltException) e).getStartToken().getType() == VyprParser.LOOP) {
            message.append("Invalid loop statement: expected 'loop <name> in <expression>:' or 'loop <expression> times:'");
        } else {
            message.append(capitalize(msg));
        }
        if (isIndentationRelated(offendingSymbol, msg)) {
            message.append(" (indent with spaces; a tab counts as ").append(tabWidth).append(" columns)");
        }
        throw new ParseCancellationException(new SyntaxException(message.toString(), line, charPositionInLine + 1));
    }

    private static boolean isIndentationRelated(Object offendingSymbol, String msg) {
        if (offendingSymbol instanceof Token) {
            int type = ((Token) offendingSymbol).getType();
            if (type == VyprParser.INDENT || type == VyprParser.DEDENT) return true;
        }
        return msg != null && (msg.contains("INDENT") || msg.contains("DEDENT"));
    }

    private static String capitalize(String msg) {
        if (msg == null || msg.isEmpty()) return "Syntax error";
        return Character.toUpperCase(msg.charAt(0)) + msg.substring(1);
    }
}
