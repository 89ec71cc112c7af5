package vypr.ast;

public interface StatementVisitor<R> {
    R visitVarDeclaration(VarDeclaration node);

    R visitAssignment(Assignment node);

    R visitIfStatement(IfStatement node);

    R visitTimesLoop(TimesLoop node);

    R visitWhileLoop(WhileLoop node);

    R visitForLoop(ForLoop node);

    R visitFunctionDeclaration(FunctionDeclaration node);

    R visitReturnStatement(ReturnStatement node);

    R visitPrintStatement(PrintStatement node);

    R visitInputStatement(InputStatement node);

    R visitExpressionStatement(ExpressionStatement node);
}
