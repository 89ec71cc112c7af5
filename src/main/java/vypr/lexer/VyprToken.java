package vypr.lexer;

import org.antlr.v4.runtime.CommonToken;

/**
 * A lexed token. It is an ANTLR token so the list can feed the generated parser directly,
 * and it also keeps the decoded literal value and a 1-based column.
 */
public class VyprToken extends CommonToken {
    private final TokenKind kind;
    private final Object value;

    public VyprToken(TokenKind kind, String text, Object value, int line, int column) {
        super(kind.tokenType(), text);
        this.kind = kind;
        this.value = value;
        setLine(line);
        setCharPositionInLine(column - 1);
    }

    public TokenKind getKind() {
        return kind;
    }

    /**
     * Long for integers, Double for floats, String for strings and identifiers,
     * Boolean for booleans, the pushed width for INDENT, null otherwise.
     */
    public Object getValue() {
        return value;
    }

    public int getColumn() {
        return getCharPositionInLine() + 1;
    }

    @Override
    public String toString() {
        if (value != null) {
            return "Token(" + kind + ", '" + value + "', line=" + getLine() + ", col=" + getColumn() + ")";
        }
        return "Token(" + kind + ", line=" + getLine() + ", col=" + getColumn() + ")";
    }
}
