package vypr;

import vypr.ast.Program;
import vypr.codegen.PythonGenerator;
import vypr.exception.CompileException;
import vypr.exception.Diagnostic;
import vypr.exception.InternalCompilerError;
import vypr.exception.Phase;
import vypr.exception.SemanticException;
import vypr.ir.FunctionIR;
import vypr.ir.IRBuilder;
import vypr.lexer.Lexer;
import vypr.lexer.VyprToken;
import vypr.parser.AstParser;
import vypr.semantic.AnalysisResult;
import vypr.semantic.SemanticAnalyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the whole pipeline: lex, parse, analyze, lower to IR, generate Python.
 */
public class VyprCompiler {
    private final CompilerOptions options;

    public VyprCompiler() {
        this(CompilerOptions.DEFAULT);
    }

    public VyprCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompileResult compile(String source) {
        List<Diagnostic> warnings = new ArrayList<>();
        try {
            Program program = parse(source, warnings);
            AnalysisResult analysis = new SemanticAnalyzer().analyze(program);
            if (!analysis.ok()) {
                throw new SemanticException(analysis.diagnostics());
            }
            Map<String, FunctionIR> ir = new IRBuilder(options).generate(program);
            String python = new PythonGenerator(options).generate(ir);
            return CompileResult.success(python, ir, warnings);
        } catch (CompileException e) {
            return CompileResult.failure(e.getPhase(), e.getDiagnostics(), warnings);
        } catch (InternalCompilerError e) {
            return CompileResult.failure(Phase.INTERNAL,
                    List.of(Diagnostic.error(Phase.INTERNAL, e.getMessage(), 0, 0)), warnings);
        }
    }

    /** Lexes and parses only, adding parse warnings to {@code warnings}. */
    public Program parse(String source, List<Diagnostic> warnings) throws CompileException {
        List<VyprToken> tokens = Lexer.tokenize(source, options);
        AstParser parser = new AstParser(tokens, options);
        Program program = parser.parse();
        warnings.addAll(parser.getWarnings());
        return program;
    }
}
