package vypr.exception;

import java.util.List;

/**
 * Unterminated string, invalid character or inconsistent indentation.
 */
public class LexicalException extends CompileException {
    public LexicalException(String message, int line, int column) {
        super(Phase.LEXICAL, List.of(Diagnostic.error(Phase.LEXICAL, message, line, column)));
    }
}
