package vypr.ast;

public record InputStatement(String target, SourcePosition position) implements Statement {
    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitInputStatement(this);
    }
}
