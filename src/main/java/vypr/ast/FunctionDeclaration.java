package vypr.ast;

import java.util.List;

public record FunctionDeclaration(String name, List<String> parameters, List<Statement> body,
                                  SourcePosition position) implements Statement {
    public FunctionDeclaration {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunctionDeclaration(this);
    }
}
