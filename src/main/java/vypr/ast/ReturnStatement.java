package vypr.ast;

/**
 * value is null for a bare {@code return}.
 */
public record ReturnStatement(Expression value, SourcePosition position) implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }
}
