package vypr.parser;

import org.junit.jupiter.api.Test;
import vypr.CompilerOptions;
import vypr.ast.ArrayLiteral;
import vypr.ast.BinaryOperation;
import vypr.ast.BinaryOperator;
import vypr.ast.ExpressionStatement;
import vypr.ast.ForLoop;
import vypr.ast.FunctionCall;
import vypr.ast.FunctionDeclaration;
import vypr.ast.Identifier;
import vypr.ast.IfStatement;
import vypr.ast.InputStatement;
import vypr.ast.Literal;
import vypr.ast.LiteralKind;
import vypr.ast.PrintStatement;
import vypr.ast.Program;
import vypr.ast.PropertyAccess;
import vypr.ast.ReturnStatement;
import vypr.ast.TimesLoop;
import vypr.ast.UnaryOperation;
import vypr.ast.UnaryOperator;
import vypr.ast.VarDeclaration;
import vypr.ast.WhileLoop;
import vypr.exception.CompileException;
import vypr.exception.Diagnostic;
import vypr.exception.Phase;
import vypr.exception.SyntaxException;
import vypr.lexer.Lexer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AstParserTest {

    private static Program parse(String source) throws CompileException {
        return AstParser.parse(Lexer.tokenize(source, CompilerOptions.DEFAULT));
    }

    @Test
    void variableDeclarationWithAndWithoutInitializer() throws CompileException {
        Program program = parse("var x = 5\nvar y\n");
        VarDeclaration x = assertInstanceOf(VarDeclaration.class, program.statements().get(0));
        assertEquals("x", x.name());
        Literal five = assertInstanceOf(Literal.class, x.initializer());
        assertEquals(5L, five.value());
        assertEquals(LiteralKind.INTEGER, five.kind());
        assertEquals(1, x.position().line());

        VarDeclaration y = assertInstanceOf(VarDeclaration.class, program.statements().get(1));
        assertNull(y.initializer());
        assertEquals(2, y.position().line());
    }

    @Test
    void multiplicationBindsTighterThanAddition() throws CompileException {
        VarDeclaration decl = (VarDeclaration) parse("var x = 1 + 2 * 3\n").statements().get(0);
        BinaryOperation add = assertInstanceOf(BinaryOperation.class, decl.initializer());
        assertEquals(BinaryOperator.ADD, add.operator());
        assertInstanceOf(Literal.class, add.left());
        BinaryOperation mul = assertInstanceOf(BinaryOperation.class, add.right());
        assertEquals(BinaryOperator.MULTIPLY, mul.operator());
    }

    @Test
    void operatorsAreLeftAssociative() throws CompileException {
        VarDeclaration decl = (VarDeclaration) parse("var x = 10 - 4 - 3\n").statements().get(0);
        BinaryOperation outer = assertInstanceOf(BinaryOperation.class, decl.initializer());
        BinaryOperation inner = assertInstanceOf(BinaryOperation.class, outer.left());
        assertEquals(10L, ((Literal) inner.left()).value());
        assertEquals(3L, ((Literal) outer.right()).value());
    }

    @Test
    void comparisonIsLowestPrecedence() throws CompileException {
        VarDeclaration decl = (VarDeclaration) parse("var b = 1 + 1 == 2 ^ \"\"\n").statements().get(0);
        BinaryOperation eq = assertInstanceOf(BinaryOperation.class, decl.initializer());
        assertEquals(BinaryOperator.EQUAL, eq.operator());
        assertEquals(BinaryOperator.ADD, ((BinaryOperation) eq.left()).operator());
        assertEquals(BinaryOperator.CONCAT, ((BinaryOperation) eq.right()).operator());
    }

    @Test
    void unaryMinus() throws CompileException {
        VarDeclaration decl = (VarDeclaration) parse("var x = -(2 + 3)\n").statements().get(0);
        UnaryOperation neg = assertInstanceOf(UnaryOperation.class, decl.initializer());
        assertEquals(UnaryOperator.MINUS, neg.operator());
        assertInstanceOf(BinaryOperation.class, neg.operand());
    }

    @Test
    void elseIfChainNestsInElseBody() throws CompileException {
        Program program = parse("if a:\n    print 1\nelse if b:\n    print 2\nelse:\n    print 3\n");
        assertEquals(1, program.statements().size());
        IfStatement first = assertInstanceOf(IfStatement.class, program.statements().get(0));
        assertEquals(1, first.body().size());
        assertEquals(1, first.elseBody().size());
        IfStatement second = assertInstanceOf(IfStatement.class, first.elseBody().get(0));
        assertTrue(second.hasElse());
        assertInstanceOf(PrintStatement.class, second.elseBody().get(0));
    }

    @Test
    void ifWithoutElse() throws CompileException {
        IfStatement stmt = (IfStatement) parse("if x > 1:\n    print x\nprint 0\n").statements().get(0);
        assertFalse(stmt.hasElse());
        assertNull(stmt.elseBody());
    }

    @Test
    void loopForms() throws CompileException {
        Program program = parse("loop i in [1, 2]:\n    print i\nloop n times:\n    print n\nloop 3 times:\n    print 0\n");
        ForLoop forLoop = assertInstanceOf(ForLoop.class, program.statements().get(0));
        assertEquals("i", forLoop.variable());
        assertEquals(2, assertInstanceOf(ArrayLiteral.class, forLoop.iterable()).elements().size());

        TimesLoop byName = assertInstanceOf(TimesLoop.class, program.statements().get(1));
        assertEquals("n", assertInstanceOf(Identifier.class, byName.count()).name());

        TimesLoop byLiteral = assertInstanceOf(TimesLoop.class, program.statements().get(2));
        assertEquals(3L, ((Literal) byLiteral.count()).value());
    }

    @Test
    void whileLoop() throws CompileException {
        WhileLoop loop = (WhileLoop) parse("while i < 10:\n    i = i + 1\n").statements().get(0);
        assertEquals(BinaryOperator.LESS_THAN, ((BinaryOperation) loop.condition()).operator());
        assertEquals(1, loop.body().size());
    }

    @Test
    void functionDeclarationAndCalls() throws CompileException {
        Program program = parse("func add(a, b):\n    return a + b\nadd(1, 2)\nfunc nothing():\n    return\n");
        FunctionDeclaration add = assertInstanceOf(FunctionDeclaration.class, program.statements().get(0));
        assertEquals(List.of("a", "b"), add.parameters());
        assertInstanceOf(ReturnStatement.class, add.body().get(0));

        ExpressionStatement call = assertInstanceOf(ExpressionStatement.class, program.statements().get(1));
        FunctionCall fn = assertInstanceOf(FunctionCall.class, call.expression());
        assertEquals("add", fn.name());
        assertEquals(2, fn.arguments().size());

        FunctionDeclaration nothing = (FunctionDeclaration) program.statements().get(2);
        assertTrue(nothing.parameters().isEmpty());
        assertNull(((ReturnStatement) nothing.body().get(0)).value());
    }

    @Test
    void propertyAccessChains() throws CompileException {
        PrintStatement print = (PrintStatement) parse("print a.b.c\n").statements().get(0);
        PropertyAccess outer = assertInstanceOf(PropertyAccess.class, print.expression());
        assertEquals("c", outer.field());
        PropertyAccess inner = assertInstanceOf(PropertyAccess.class, outer.object());
        assertEquals("b", inner.field());
        assertEquals("a", assertInstanceOf(Identifier.class, inner.object()).name());
    }

    @Test
    void inputStatement() throws CompileException {
        InputStatement input = (InputStatement) parse("input name\n").statements().get(0);
        assertEquals("name", input.target());
    }

    @Test
    void unindentedBodyIsAcceptedWithWarning() throws CompileException {
        AstParser parser = new AstParser(Lexer.tokenize("if true:\nprint 1\n", CompilerOptions.DEFAULT));
        IfStatement stmt = (IfStatement) parser.parse().statements().get(0);
        assertEquals(1, stmt.body().size());
        List<Diagnostic> warnings = parser.getWarnings();
        assertEquals(1, warnings.size());
        assertEquals(Diagnostic.Severity.WARNING, warnings.get(0).severity());
        assertEquals("Expected indentation after if header", warnings.get(0).message());
        assertEquals(2, warnings.get(0).line());
    }

    @Test
    void unindentedFunctionBodyEndsAtNextFunction() throws CompileException {
        Program program = parse("func f():\nprint 1\nreturn 2\nfunc g():\nprint 3\n");
        assertEquals(2, program.statements().size());
        FunctionDeclaration f = assertInstanceOf(FunctionDeclaration.class, program.statements().get(0));
        FunctionDeclaration g = assertInstanceOf(FunctionDeclaration.class, program.statements().get(1));
        assertEquals(2, f.body().size());
        assertEquals("g", g.name());
        assertEquals(1, g.body().size());
    }

    @Test
    void wellFormedProgramHasNoWarnings() throws CompileException {
        AstParser parser = new AstParser(Lexer.tokenize("if true:\n    print 1\n", CompilerOptions.DEFAULT));
        parser.parse();
        assertTrue(parser.getWarnings().isEmpty());
    }

    @Test
    void failsFastOnFirstSyntaxError() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("var = 5\nvar = 6\n"));
        assertEquals(Phase.SYNTAX, e.getPhase());
        assertEquals(1, e.getDiagnostics().size());
        assertEquals(1, e.getDiagnostics().get(0).line());
        assertEquals(5, e.getDiagnostics().get(0).column());
    }

    @Test
    void malformedLoopGetsLoopMessage() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("loop:\n    print 1\n"));
        assertTrue(e.getDiagnostics().get(0).message().startsWith("Invalid loop statement"),
                e.getDiagnostics().get(0).message());
    }

    @Test
    void unexpectedIndentCarriesHint() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("print 1\n    print 2\n"));
        assertTrue(e.getDiagnostics().get(0).message().contains("a tab counts as 4 columns"),
                e.getDiagnostics().get(0).message());
        assertEquals(2, e.getDiagnostics().get(0).line());
    }
}
