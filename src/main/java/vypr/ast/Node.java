package vypr.ast;

public interface Node {
    SourcePosition position();
}
