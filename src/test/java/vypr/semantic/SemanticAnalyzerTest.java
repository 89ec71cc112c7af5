package vypr.semantic;

import org.junit.jupiter.api.Test;
import vypr.CompilerOptions;
import vypr.exception.CompileException;
import vypr.exception.Diagnostic;
import vypr.exception.Phase;
import vypr.lexer.Lexer;
import vypr.parser.AstParser;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticAnalyzerTest {

    private static AnalysisResult analyze(String source) throws CompileException {
        return new SemanticAnalyzer().analyze(AstParser.parse(Lexer.tokenize(source, CompilerOptions.DEFAULT)));
    }

    private static List<String> messages(AnalysisResult result) {
        return result.diagnostics().stream().map(Diagnostic::message).collect(Collectors.toList());
    }

    @Test
    void validProgramPasses() throws CompileException {
        AnalysisResult result = analyze("func calculateArea(length, width):\n    return length * width\n"
                + "var area = calculateArea(5, 3)\nprint \"The area is: \" + area\n");
        assertTrue(result.ok(), result.diagnostics().toString());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void arityMismatchNamesBothCounts() throws CompileException {
        AnalysisResult result = analyze("func add(a, b):\n    return a + b\nprint add(1)\n");
        assertFalse(result.ok());
        assertEquals(List.of("Function 'add' expects 2 arguments, got 1"), messages(result));
        Diagnostic d = result.diagnostics().get(0);
        assertEquals(Phase.SEMANTIC, d.phase());
        assertEquals(3, d.line());
        assertEquals(7, d.column());
    }

    @Test
    void reportsEveryIndependentError() throws CompileException {
        AnalysisResult result = analyze("var x = 1\nif x > 0:\n    print y\nvar x = 2\n");
        assertFalse(result.ok());
        assertEquals(List.of("Variable 'y' not declared", "Variable 'x' already declared in this scope"),
                messages(result));
        assertEquals(3, result.diagnostics().get(0).line());
        assertEquals(11, result.diagnostics().get(0).column());
        assertEquals(4, result.diagnostics().get(1).line());
    }

    @Test
    void innerBlockMayShadowOuterName() throws CompileException {
        assertTrue(analyze("var x = 1\nif true:\n    var x = 2\n    print x\nprint x\n").ok());
    }

    @Test
    void blockLocalNameIsNotVisibleAfterBlock() throws CompileException {
        AnalysisResult result = analyze("if true:\n    var t = 1\nprint t\n");
        assertEquals(List.of("Variable 't' not declared"), messages(result));
    }

    @Test
    void initializerIsCheckedBeforeDeclaration() throws CompileException {
        assertEquals(List.of("Variable 'x' not declared"), messages(analyze("var x = x\n")));
    }

    @Test
    void argumentsOfUnknownFunctionAreStillChecked() throws CompileException {
        assertEquals(List.of("Function 'foo' not declared", "Variable 'bar' not declared"),
                messages(analyze("foo(bar)\n")));
    }

    @Test
    void callingAVariable() throws CompileException {
        assertEquals(List.of("'x' is not a function"), messages(analyze("var x = 1\nx(2)\n")));
    }

    @Test
    void duplicateFunctionAndParameters() throws CompileException {
        AnalysisResult result = analyze("func f(a, a):\n    return a\nfunc f():\n    return 0\n");
        assertEquals(List.of("Parameter 'a' declared more than once in function 'f'",
                "Function 'f' already declared in this scope"), messages(result));
    }

    @Test
    void functionsMustBeTopLevel() throws CompileException {
        assertEquals(List.of("Function 'g' must be declared at the top level"),
                messages(analyze("if true:\n    func g():\n        return 1\n")));
    }

    @Test
    void bodyOfRedeclaredFunctionIsStillChecked() throws CompileException {
        AnalysisResult result = analyze("func f():\n    return 1\nfunc f():\n    print missing\n");
        assertEquals(List.of("Function 'f' already declared in this scope", "Variable 'missing' not declared"),
                messages(result));
        assertEquals(4, result.diagnostics().get(1).line());
    }

    @Test
    void bodyOfNestedFunctionIsStillChecked() throws CompileException {
        AnalysisResult result = analyze("if true:\n    func inner(p):\n        print p + missing\nprint other\n");
        assertEquals(List.of("Function 'inner' must be declared at the top level",
                "Variable 'missing' not declared", "Variable 'other' not declared"), messages(result));
    }

    @Test
    void recursionResolves() throws CompileException {
        assertTrue(analyze("func fact(n):\n    if n <= 1:\n        return 1\n    return n * fact(n - 1)\nprint fact(5)\n").ok());
    }

    @Test
    void functionCannotUseLaterGlobal() throws CompileException {
        assertEquals(List.of("Variable 'late' not declared"),
                messages(analyze("func f():\n    return late\nvar late = 1\n")));
    }

    @Test
    void assignmentTargets() throws CompileException {
        assertEquals(List.of("Variable 'z' not declared"), messages(analyze("z = 1\n")));
        assertEquals(List.of("Cannot assign to function 'f'"),
                messages(analyze("func f():\n    return 1\nf = 2\n")));
        assertEquals(List.of("Variable 'name' not declared"), messages(analyze("input name\n")));
    }

    @Test
    void loopVariableIsScopedToLoop() throws CompileException {
        assertTrue(analyze("loop item in [1, 2]:\n    print item\n").ok());
        assertEquals(List.of("Variable 'item' not declared"),
                messages(analyze("loop item in [1, 2]:\n    print item\nprint item\n")));
    }

    @Test
    void scopesRemainInspectable() throws CompileException {
        AnalysisResult result = analyze("var a = 1\nfunc f(p):\n    var q = p\n    return q\n");
        ScopeTree scopes = result.scopes();
        assertEquals(2, scopes.size());
        assertEquals(List.of("a", "f"), List.copyOf(scopes.symbolsOf(ScopeTree.GLOBAL).keySet()));
        assertEquals(List.of("p", "q"), List.copyOf(scopes.symbolsOf(1).keySet()));
        assertEquals(ScopeTree.GLOBAL, scopes.parentOf(1));
        assertTrue(scopes.describe().contains("scope 1 (parent 0): p, q"));
    }
}
