package vypr;

import org.junit.jupiter.api.Test;
import vypr.exception.Diagnostic;
import vypr.exception.Phase;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VyprCompilerTest {
    private final VyprCompiler compiler = new VyprCompiler();

    @Test
    void successCarriesPythonAndIr() {
        CompileResult result = compiler.compile("var x = 5\nvar y = 10\nprint(x + y)\n");
        assertTrue(result.success());
        assertNull(result.phase());
        assertTrue(result.diagnostics().isEmpty());
        assertTrue(result.python().contains("def main():"));
        assertEquals(List.of("main"), List.copyOf(result.ir().keySet()));
    }

    @Test
    void lexicalErrorsStopTheRun() {
        CompileResult result = compiler.compile("var x = 1\nvar y = #\n");
        assertFalse(result.success());
        assertEquals(Phase.LEXICAL, result.phase());
        assertEquals(1, result.diagnostics().size());
        assertEquals("Lexical error at line 2, column 9: Invalid character '#'", result.diagnostics().get(0).toString());
        assertNull(result.python());
    }

    @Test
    void syntaxErrorsStopTheRun() {
        CompileResult result = compiler.compile("print (1 + \n");
        assertEquals(Phase.SYNTAX, result.phase());
        assertEquals(1, result.diagnostics().size());
        assertEquals(1, result.diagnostics().get(0).line());
    }

    @Test
    void semanticErrorsAreAllReportedAndNoIrIsBuilt() {
        CompileResult result = compiler.compile("func add(a, b):\n    return a + b\nprint add(1)\n"
                + "if true:\n    print missing\n");
        assertEquals(Phase.SEMANTIC, result.phase());
        assertNull(result.ir());
        List<String> messages = result.diagnostics().stream().map(Diagnostic::message).collect(Collectors.toList());
        assertEquals(List.of("Function 'add' expects 2 arguments, got 1", "Variable 'missing' not declared"), messages);
        assertEquals("Semantic error at line 5, column 11: Variable 'missing' not declared",
                result.diagnostics().get(1).toString());
    }

    @Test
    void warningsSurviveSuccessfulCompilation() {
        CompileResult result = compiler.compile("loop 2 times:\nprint 1\n");
        assertTrue(result.success());
        assertEquals(1, result.warnings().size());
        assertEquals(Diagnostic.Severity.WARNING, result.warnings().get(0).severity());
        assertEquals("Syntax warning at line 2, column 1: Expected indentation after loop header",
                result.warnings().get(0).toString());
    }

    @Test
    void entryFunctionNameIsConfigurable() {
        CompileResult result = new VyprCompiler(CompilerOptions.DEFAULT.withEntryFunction("start")).compile("print 1\n");
        assertTrue(result.python().contains("def start():"));
        assertTrue(result.python().endsWith("if __name__ == '__main__':\n    start()\n"));
    }
}
