package vypr.ast;

public record UnaryOperation(UnaryOperator operator, Expression operand, SourcePosition position) implements Expression {
    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnaryOperation(this);
    }
}
