package vypr;

import vypr.exception.Diagnostic;
import vypr.exception.Phase;
import vypr.ir.FunctionIR;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one compilation. On success phase is null and python and ir are set; on failure
 * phase names the stage that stopped and diagnostics holds its errors.
 */
public record CompileResult(boolean success, Phase phase, List<Diagnostic> diagnostics, List<Diagnostic> warnings,
                            String python, Map<String, FunctionIR> ir) {

    public CompileResult {
        diagnostics = List.copyOf(diagnostics);
        warnings = List.copyOf(warnings);
    }

    public static CompileResult success(String python, Map<String, FunctionIR> ir, List<Diagnostic> warnings) {
        return new CompileResult(true, null, List.of(), warnings, python, ir);
    }

    public static CompileResult failure(Phase phase, List<Diagnostic> diagnostics, List<Diagnostic> warnings) {
        return new CompileResult(false, phase, diagnostics, warnings, null, null);
    }
}
