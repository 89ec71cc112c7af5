package vypr.ast;

import java.util.List;

public record ForLoop(String variable, Expression iterable, List<Statement> body,
                      SourcePosition position) implements Statement {
    public ForLoop {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForLoop(this);
    }
}
