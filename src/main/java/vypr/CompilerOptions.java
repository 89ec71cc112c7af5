package vypr;

/**
 * Settings shared by the pipeline stages. Instances are immutable; the {@code with}
 * methods return modified copies.
 */
public final class CompilerOptions {
    public static final CompilerOptions DEFAULT = new CompilerOptions(4, "    ", "main", true);

    private final int tabWidth;
    private final String indentUnit;
    private final String entryFunction;
    private final boolean emitHeader;

    private CompilerOptions(int tabWidth, String indentUnit, String entryFunction, boolean emitHeader) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tab width must be positive: " + tabWidth);
        }
        if (indentUnit.isEmpty() || !indentUnit.isBlank()) {
            throw new IllegalArgumentException("indent unit must be non-empty whitespace");
        }
        this.tabWidth = tabWidth;
        this.indentUnit = indentUnit;
        this.entryFunction = entryFunction;
        this.emitHeader = emitHeader;
    }

    /** Columns a tab counts for when measuring source indentation. */
    public int tabWidth() {
        return tabWidth;
    }

    /** One level of indentation in the generated program. */
    public String indentUnit() {
        return indentUnit;
    }

    /** Name of the synthesized function holding the top-level statements. */
    public String entryFunction() {
        return entryFunction;
    }

    public boolean emitHeader() {
        return emitHeader;
    }

    public CompilerOptions withTabWidth(int tabWidth) {
        return new CompilerOptions(tabWidth, indentUnit, entryFunction, emitHeader);
    }

    public CompilerOptions withIndentUnit(String indentUnit) {
        return new CompilerOptions(tabWidth, indentUnit, entryFunction, emitHeader);
    }

    public CompilerOptions withEntryFunction(String entryFunction) {
        return new CompilerOptions(tabWidth, indentUnit, entryFunction, emitHeader);
    }

    public CompilerOptions withEmitHeader(boolean emitHeader) {
        return new CompilerOptions(tabWidth, indentUnit, entryFunction, emitHeader);
    }
}
