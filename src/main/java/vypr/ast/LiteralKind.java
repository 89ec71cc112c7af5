package vypr.ast;

public enum LiteralKind {
    INTEGER, FLOAT, STRING, BOOLEAN
}
