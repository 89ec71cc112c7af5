package vypr.exception;

import java.util.List;

/**
 * First syntax error found by the parser; parsing stops there.
 */
public class SyntaxException extends CompileException {
    public SyntaxException(String message, int line, int column) {
        super(Phase.SYNTAX, List.of(Diagnostic.error(Phase.SYNTAX, message, line, column)));
    }
}
