package vypr.exception;

/**
 * Malformed IR reached a later stage. This is a compiler bug, never a user mistake.
 */
public class InternalCompilerError extends RuntimeException {
    public InternalCompilerError(String message) {
        super(message);
    }
}
