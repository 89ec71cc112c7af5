package vypr.ast;

public record BinaryOperation(Expression left, BinaryOperator operator, Expression right,
                              SourcePosition position) implements Expression {
    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinaryOperation(this);
    }
}
