package vypr.semantic;

import vypr.exception.Diagnostic;

import java.util.List;

public record AnalysisResult(boolean ok, List<Diagnostic> diagnostics, ScopeTree scopes) {
    public AnalysisResult {
        diagnostics = List.copyOf(diagnostics);
    }
}
