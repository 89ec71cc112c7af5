package vypr.ast;

/**
 * {@code object.field}. Passed through to the target program unchanged.
 */
public record PropertyAccess(Expression object, String field, SourcePosition position) implements Expression {
    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPropertyAccess(this);
    }
}
