package vypr.ir;

public enum LoopKind {
    WHILE, TIMES, FOR
}
