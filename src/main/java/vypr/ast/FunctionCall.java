package vypr.ast;

import java.util.List;

public record FunctionCall(String name, List<Expression> arguments, SourcePosition position) implements Expression {
    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
