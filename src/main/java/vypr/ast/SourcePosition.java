package vypr.ast;

/**
 * 1-based line and column of the token a node starts at.
 */
public record SourcePosition(int line, int column) {
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
