package vypr.ast;

import java.util.List;

public record ArrayLiteral(List<Expression> elements, SourcePosition position) implements Expression {
    public ArrayLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitArrayLiteral(this);
    }
}
