package vypr.semantic;

import vypr.ast.ArrayLiteral;
import vypr.ast.Assignment;
import vypr.ast.BinaryOperation;
import vypr.ast.Expression;
import vypr.ast.ExpressionStatement;
import vypr.ast.ExpressionVisitor;
import vypr.ast.ForLoop;
import vypr.ast.FunctionCall;
import vypr.ast.FunctionDeclaration;
import vypr.ast.Identifier;
import vypr.ast.IfStatement;
import vypr.ast.InputStatement;
import vypr.ast.Literal;
import vypr.ast.PrintStatement;
import vypr.ast.Program;
import vypr.ast.PropertyAccess;
import vypr.ast.ReturnStatement;
import vypr.ast.SourcePosition;
import vypr.ast.Statement;
import vypr.ast.StatementVisitor;
import vypr.ast.TimesLoop;
import vypr.ast.UnaryOperation;
import vypr.ast.VarDeclaration;
import vypr.ast.WhileLoop;
import vypr.exception.Diagnostic;
import vypr.exception.Phase;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks declaration before use, redeclaration within one scope and call arity.
 * Errors are collected and the walk continues, so one run reports every problem.
 */
public class SemanticAnalyzer implements StatementVisitor<Void>, ExpressionVisitor<Void> {
    private final ScopeTree scopes = new ScopeTree();
    private final List<Diagnostic> errors = new ArrayList<>();

    public AnalysisResult analyze(Program program) {
        for (Statement statement : program.statements()) {
            statement.accept(this);
        }
        return new AnalysisResult(errors.isEmpty(), errors, scopes);
    }

    private void error(String message, SourcePosition at) {
        errors.add(Diagnostic.error(Phase.SEMANTIC, message, at.line(), at.column()));
    }

    private void block(List<Statement> body) {
        scopes.enterScope();
        for (Statement statement : body) {
            statement.accept(this);
        }
        scopes.exitScope();
    }

    private void check(Expression expression) {
        expression.accept(this);
    }

    @Override
    public Void visitVarDeclaration(VarDeclaration node) {
        if (node.initializer() != null) {
            check(node.initializer());
        }
        if (scopes.isDeclaredHere(node.name())) {
            error("Variable '" + node.name() + "' already declared in this scope", node.position());
        } else {
            scopes.define(new Symbol.Variable(node.name(), node.position()));
        }
        return null;
    }

    @Override
    public Void visitAssignment(Assignment node) {
        Symbol target = scopes.lookup(node.target().name());
        if (target == null) {
            error("Variable '" + node.target().name() + "' not declared", node.target().position());
        } else if (target instanceof Symbol.Function) {
            error("Cannot assign to function '" + node.target().name() + "'", node.target().position());
        }
        check(node.value());
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatement node) {
        check(node.condition());
        block(node.body());
        if (node.hasElse()) {
            block(node.elseBody());
        }
        return null;
    }

    @Override
    public Void visitTimesLoop(TimesLoop node) {
        check(node.count());
        block(node.body());
        return null;
    }

    @Override
    public Void visitWhileLoop(WhileLoop node) {
        check(node.condition());
        block(node.body());
        return null;
    }

    @Override
    public Void visitForLoop(ForLoop node) {
        check(node.iterable());
        scopes.enterScope();
        scopes.define(new Symbol.Variable(node.variable(), node.position()));
        for (Statement statement : node.body()) {
            statement.accept(this);
        }
        scopes.exitScope();
        return null;
    }

    @Override
    public Void visitFunctionDeclaration(FunctionDeclaration node) {
        if (!scopes.isGlobal()) {
            error("Function '" + node.name() + "' must be declared at the top level", node.position());
        } else if (scopes.isDeclaredHere(node.name())) {
            error("Function '" + node.name() + "' already declared in this scope", node.position());
        } else {
            scopes.define(new Symbol.Function(node.name(), node.parameters(), node.position()));
        }

        // Rejected declarations still have their bodies checked.
        scopes.enterScope();
        Set<String> seen = new HashSet<>();
        for (String parameter : node.parameters()) {
            if (!seen.add(parameter)) {
                error("Parameter '" + parameter + "' declared more than once in function '" + node.name() + "'",
                        node.position());
                continue;
            }
            scopes.define(new Symbol.Variable(parameter, node.position()));
        }
        for (Statement statement : node.body()) {
            statement.accept(this);
        }
        scopes.exitScope();
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement node) {
        if (node.value() != null) {
            check(node.value());
        }
        return null;
    }

    @Override
    public Void visitPrintStatement(PrintStatement node) {
        check(node.expression());
        return null;
    }

    @Override
    public Void visitInputStatement(InputStatement node) {
        Symbol target = scopes.lookup(node.target());
        if (target == null) {
            error("Variable '" + node.target() + "' not declared", node.position());
        } else if (target instanceof Symbol.Function) {
            error("Cannot assign to function '" + node.target() + "'", node.position());
        }
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement node) {
        check(node.expression());
        return null;
    }

    @Override
    public Void visitBinaryOperation(BinaryOperation node) {
        check(node.left());
        check(node.right());
        return null;
    }

    @Override
    public Void visitUnaryOperation(UnaryOperation node) {
        check(node.operand());
        return null;
    }

    @Override
    public Void visitLiteral(Literal node) {
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node) {
        if (scopes.lookup(node.name()) == null) {
            error("Variable '" + node.name() + "' not declared", node.position());
        }
        return null;
    }

    @Override
    public Void visitFunctionCall(FunctionCall node) {
        Symbol symbol = scopes.lookup(node.name());
        if (symbol == null) {
            error("Function '" + node.name() + "' not declared", node.position());
        } else if (!(symbol instanceof Symbol.Function)) {
            error("'" + node.name() + "' is not a function", node.position());
        } else {
            Symbol.Function function = (Symbol.Function) symbol;
            if (function.arity() != node.arguments().size()) {
                error("Function '" + node.name() + "' expects " + function.arity()
                        + " arguments, got " + node.arguments().size(), node.position());
            }
        }
        for (Expression argument : node.arguments()) {
            check(argument);
        }
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteral node) {
        for (Expression element : node.elements()) {
            check(element);
        }
        return null;
    }

    @Override
    public Void visitPropertyAccess(PropertyAccess node) {
        check(node.object());
        return null;
    }
}
