package vypr.exception;

import java.util.List;

/**
 * A user-facing compilation failure. Lexical and syntax failures carry exactly one
 * diagnostic, semantic failures carry every diagnostic the analyzer collected.
 */
public abstract class CompileException extends Exception {
    private final Phase phase;
    private final List<Diagnostic> diagnostics;

    protected CompileException(Phase phase, List<Diagnostic> diagnostics) {
        super(diagnostics.isEmpty() ? phase.displayName() + " error" : diagnostics.get(0).toString());
        this.phase = phase;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Phase getPhase() {
        return phase;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
