package vypr.ast;

import java.util.List;

/**
 * An else-if chain is an else body holding a single nested IfStatement. elseBody is null
 * when there is no else.
 */
public record IfStatement(Expression condition, List<Statement> body, List<Statement> elseBody,
                          SourcePosition position) implements Statement {
    public IfStatement {
        body = List.copyOf(body);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
    }

    public boolean hasElse() {
        return elseBody != null && !elseBody.isEmpty();
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }
}
