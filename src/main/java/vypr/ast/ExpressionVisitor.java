package vypr.ast;

public interface ExpressionVisitor<R> {
    R visitBinaryOperation(BinaryOperation node);

    R visitUnaryOperation(UnaryOperation node);

    R visitLiteral(Literal node);

    R visitIdentifier(Identifier node);

    R visitFunctionCall(FunctionCall node);

    R visitArrayLiteral(ArrayLiteral node);

    R visitPropertyAccess(PropertyAccess node);
}
