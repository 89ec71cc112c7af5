package vypr.ast;

import java.util.List;

public record WhileLoop(Expression condition, List<Statement> body, SourcePosition position) implements Statement {
    public WhileLoop {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhileLoop(this);
    }
}
