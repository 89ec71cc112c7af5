package vypr.ast;

import java.util.List;

public record TimesLoop(Expression count, List<Statement> body, SourcePosition position) implements Statement {
    public TimesLoop {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitTimesLoop(this);
    }
}
