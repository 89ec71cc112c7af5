package vypr.ast;

public sealed interface Expression extends Node
        permits BinaryOperation, UnaryOperation, Literal, Identifier, FunctionCall, ArrayLiteral, PropertyAccess {

    <R> R accept(ExpressionVisitor<R> visitor);
}
