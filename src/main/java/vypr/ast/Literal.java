package vypr.ast;

/**
 * value is a Long, Double, String or Boolean matching kind.
 */
public record Literal(Object value, LiteralKind kind, SourcePosition position) implements Expression {
    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
