package vypr.exception;

/**
 * Raised by the IR executor when the running program fails.
 */
public class VyprRuntimeException extends RuntimeException {
    public VyprRuntimeException(String message) {
        super(message);
    }

    public VyprRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
