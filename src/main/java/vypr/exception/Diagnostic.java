package vypr.exception;

/**
 * One compiler message. Line and column are 1-based; 0 means the position is unknown.
 */
public record Diagnostic(Phase phase, Severity severity, String message, int line, int column) {

    public enum Severity { ERROR, WARNING }

    public static Diagnostic error(Phase phase, String message, int line, int column) {
        return new Diagnostic(phase, Severity.ERROR, message, line, column);
    }

    public static Diagnostic warning(Phase phase, String message, int line, int column) {
        return new Diagnostic(phase, Severity.WARNING, message, line, column);
    }

    public boolean hasPosition() {
        return line > 0;
    }

    @Override
    public String toString() {
        String kind = severity == Severity.ERROR ? " error" : " warning";
        if (!hasPosition()) {
            return phase.displayName() + kind + ": " + message;
        }
        return phase.displayName() + kind + " at line " + line + ", column " + column + ": " + message;
    }
}
