package vypr.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import vypr.ast.ArrayLiteral;
import vypr.ast.Assignment;
import vypr.ast.BinaryOperation;
import vypr.ast.BinaryOperator;
import vypr.ast.Expression;
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
import vypr.ast.SourcePosition;
import vypr.ast.Statement;
import vypr.ast.TimesLoop;
import vypr.ast.UnaryOperation;
import vypr.ast.UnaryOperator;
import vypr.ast.VarDeclaration;
import vypr.ast.WhileLoop;
import vypr.exception.Diagnostic;
import vypr.exception.Phase;
import vypr.lexer.VyprToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the generated parse tree into the AST. Every visit method returns an AST node;
 * blocks are unpacked into statement lists by {@code block}.
 */
public class AstBuilder extends VyprParserBaseVisitor<Object> {
    private final List<Diagnostic> warnings;

    public AstBuilder(List<Diagnostic> warnings) {
        this.warnings = warnings;
    }

    public Program build(VyprParser.ProgramContext ctx) {
        return visitProgram(ctx);
    }

    @Override
    public Program visitProgram(VyprParser.ProgramContext ctx) {
        return new Program(statements(ctx.statement()));
    }

    @Override
    public Object visitStatement(VyprParser.StatementContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Object visitBodyStatement(VyprParser.BodyStatementContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Object visitVarDeclaration(VyprParser.VarDeclarationContext ctx) {
        Expression initializer = ctx.expression() == null ? null : expression(ctx.expression());
        return new VarDeclaration(ctx.IDENTIFIER().getText(), initializer, position(ctx));
    }

    @Override
    public Object visitAssignment(VyprParser.AssignmentContext ctx) {
        Identifier target = new Identifier(ctx.IDENTIFIER().getText(), position(ctx.IDENTIFIER().getSymbol()));
        return new Assignment(target, expression(ctx.expression()), position(ctx));
    }

    @Override
    public Object visitIfStatement(VyprParser.IfStatementContext ctx) {
        List<Statement> elseBody = null;
        VyprParser.ElseClauseContext elseClause = ctx.elseClause();
        if (elseClause instanceof VyprParser.ElseIfContext) {
            VyprParser.IfStatementContext nested = ((VyprParser.ElseIfContext) elseClause).ifStatement();
            elseBody = List.of((Statement) visitIfStatement(nested));
        } else if (elseClause instanceof VyprParser.ElseBlockContext) {
            elseBody = block(((VyprParser.ElseBlockContext) elseClause).block(), "else");
        }
        return new IfStatement(expression(ctx.expression()), block(ctx.block(), "if"), elseBody, position(ctx));
    }

    @Override
    public Object visitWhileLoop(VyprParser.WhileLoopContext ctx) {
        return new WhileLoop(expression(ctx.expression()), block(ctx.block(), "while"), position(ctx));
    }

    @Override
    public Object visitForLoop(VyprParser.ForLoopContext ctx) {
        return new ForLoop(ctx.IDENTIFIER().getText(), expression(ctx.expression()),
                block(ctx.block(), "loop"), position(ctx));
    }

    @Override
    public Object visitTimesLoop(VyprParser.TimesLoopContext ctx) {
        return new TimesLoop(expression(ctx.expression()), block(ctx.block(), "loop"), position(ctx));
    }

    @Override
    public Object visitFunctionDeclaration(VyprParser.FunctionDeclarationContext ctx) {
        List<String> parameters = new ArrayList<>();
        if (ctx.parameters() != null) {
            for (TerminalNode parameter : ctx.parameters().IDENTIFIER()) {
                parameters.add(parameter.getText());
            }
        }
        return new FunctionDeclaration(ctx.IDENTIFIER().getText(), parameters,
                block(ctx.block(), "function"), position(ctx));
    }

    @Override
    public Object visitReturnStatement(VyprParser.ReturnStatementContext ctx) {
        Expression value = ctx.expression() == null ? null : expression(ctx.expression());
        return new ReturnStatement(value, position(ctx));
    }

    @Override
    public Object visitPrintStatement(VyprParser.PrintStatementContext ctx) {
        return new PrintStatement(expression(ctx.expression()), position(ctx));
    }

    @Override
    public Object visitInputStatement(VyprParser.InputStatementContext ctx) {
        return new InputStatement(ctx.IDENTIFIER().getText(), position(ctx));
    }

    @Override
    public Object visitExpressionStatement(VyprParser.ExpressionStatementContext ctx) {
        return new ExpressionStatement(expression(ctx.expression()), position(ctx));
    }

    @Override
    public Object visitExpression(VyprParser.ExpressionContext ctx) {
        return visitComparison(ctx.comparison());
    }

    @Override
    public Object visitComparison(VyprParser.ComparisonContext ctx) {
        Expression node = (Expression) visitArithmetic(ctx.arithmetic(0));
        for (int i = 1; i < ctx.arithmetic().size(); i++) {
            Token op = ctx.comparisonOperator(i - 1).getStart();
            Expression right = (Expression) visitArithmetic(ctx.arithmetic(i));
            node = new BinaryOperation(node, BinaryOperator.fromSymbol(op.getText()), right, position(op));
        }
        return node;
    }

    @Override
    public Object visitArithmetic(VyprParser.ArithmeticContext ctx) {
        Expression node = (Expression) visitTerm(ctx.term(0));
        for (int i = 1; i < ctx.term().size(); i++) {
            Token op = ctx.additiveOperator(i - 1).getStart();
            Expression right = (Expression) visitTerm(ctx.term(i));
            node = new BinaryOperation(node, BinaryOperator.fromSymbol(op.getText()), right, position(op));
        }
        return node;
    }

    @Override
    public Object visitTerm(VyprParser.TermContext ctx) {
        Expression node = expression(ctx.factor(0));
        for (int i = 1; i < ctx.factor().size(); i++) {
            Token op = ctx.multiplicativeOperator(i - 1).getStart();
            node = new BinaryOperation(node, BinaryOperator.fromSymbol(op.getText()), expression(ctx.factor(i)), position(op));
        }
        return node;
    }

    @Override
    public Object visitUnaryFactor(VyprParser.UnaryFactorContext ctx) {
        return new UnaryOperation(UnaryOperator.fromSymbol(ctx.op.getText()), expression(ctx.factor()), position(ctx));
    }

    @Override
    public Object visitLiteralFactor(VyprParser.LiteralFactorContext ctx) {
        Object value = ((VyprToken) ctx.value).getValue();
        LiteralKind kind;
        switch (ctx.value.getType()) {
            case VyprParser.INTEGER: kind = LiteralKind.INTEGER; break;
            case VyprParser.FLOAT: kind = LiteralKind.FLOAT; break;
            case VyprParser.STRING: kind = LiteralKind.STRING; break;
            default: kind = LiteralKind.BOOLEAN; break;
        }
        return new Literal(value, kind, position(ctx));
    }

    @Override
    public Object visitParenFactor(VyprParser.ParenFactorContext ctx) {
        return visitExpression(ctx.expression());
    }

    @Override
    public Object visitArrayFactor(VyprParser.ArrayFactorContext ctx) {
        return new ArrayLiteral(arguments(ctx.arguments()), position(ctx));
    }

    @Override
    public Object visitCallFactor(VyprParser.CallFactorContext ctx) {
        return new FunctionCall(ctx.IDENTIFIER().getText(), arguments(ctx.arguments()), position(ctx));
    }

    @Override
    public Object visitNameFactor(VyprParser.NameFactorContext ctx) {
        List<TerminalNode> names = ctx.IDENTIFIER();
        Expression node = new Identifier(names.get(0).getText(), position(ctx));
        for (int i = 1; i < names.size(); i++) {
            node = new PropertyAccess(node, names.get(i).getText(), position(names.get(i).getSymbol()));
        }
        return node;
    }

    private List<Statement> block(VyprParser.BlockContext ctx, String owner) {
        if (ctx instanceof VyprParser.IndentedBlockContext) {
            VyprParser.IndentedBlockContext indented = (VyprParser.IndentedBlockContext) ctx;
            if (indented.DEDENT() == null) {
                warn("Missing end of indented block", indented.stop);
            }
            return statements(indented.statement());
        }
        VyprParser.FlatBlockContext flat = (VyprParser.FlatBlockContext) ctx;
        Token at = flat.bodyStatement().isEmpty() ? flat.NEWLINE().getSymbol() : flat.bodyStatement(0).getStart();
        warn("Expected indentation after " + owner + " header", at);
        List<Statement> result = new ArrayList<>();
        for (VyprParser.BodyStatementContext statement : flat.bodyStatement()) {
            result.add((Statement) visitBodyStatement(statement));
        }
        return result;
    }

    private List<Statement> statements(List<VyprParser.StatementContext> contexts) {
        List<Statement> result = new ArrayList<>();
        for (VyprParser.StatementContext statement : contexts) {
            result.add((Statement) visitStatement(statement));
        }
        return result;
    }

    private List<Expression> arguments(VyprParser.ArgumentsContext ctx) {
        List<Expression> result = new ArrayList<>();
        if (ctx != null) {
            for (VyprParser.ExpressionContext expression : ctx.expression()) {
                result.add(expression(expression));
            }
        }
        return result;
    }

    private Expression expression(ParserRuleContext ctx) {
        return (Expression) visit(ctx);
    }

    private void warn(String message, Token at) {
        warnings.add(Diagnostic.warning(Phase.SYNTAX, message, at.getLine(), at.getCharPositionInLine() + 1));
    }

    private static SourcePosition position(ParserRuleContext ctx) {
        return position(ctx.getStart());
    }

    private static SourcePosition position(Token token) {
        return new SourcePosition(token.getLine(), token.getCharPositionInLine() + 1);
    }
}
