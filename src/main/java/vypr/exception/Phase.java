package vypr.exception;

/**
 * Pipeline stage that produced a diagnostic.
 */
public enum Phase {
    LEXICAL("Lexical"),
    SYNTAX("Syntax"),
    SEMANTIC("Semantic"),
    INTERNAL("Internal");

    private final String displayName;

    Phase(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
