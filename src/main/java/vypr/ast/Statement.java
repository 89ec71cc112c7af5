package vypr.ast;

public sealed interface Statement extends Node
        permits VarDeclaration, Assignment, IfStatement, TimesLoop, WhileLoop, ForLoop,
                FunctionDeclaration, ReturnStatement, PrintStatement, InputStatement, ExpressionStatement {

    <R> R accept(StatementVisitor<R> visitor);
}
