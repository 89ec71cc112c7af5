package vypr.ast;

/**
 * {@code var name} or {@code var name = initializer}; initializer is null when absent.
 */
public record VarDeclaration(String name, Expression initializer, SourcePosition position) implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVarDeclaration(this);
    }
}
