package vypr.exception;

import java.util.List;

/**
 * Every error collected during semantic analysis.
 */
public class SemanticException extends CompileException {
    public SemanticException(List<Diagnostic> diagnostics) {
        super(Phase.SEMANTIC, diagnostics);
    }
}
