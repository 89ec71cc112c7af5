package vypr.ast;

public record Identifier(String name, SourcePosition position) implements Expression {
    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
