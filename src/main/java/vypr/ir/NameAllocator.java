package vypr.ir;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps source identifiers onto names that are safe in the generated Python module.
 */
public class NameAllocator {
    private static final Set<String> PYTHON_KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield", "match", "case");

    // Builtins the generated code itself calls.
    private static final Set<String> PRELUDE_NAMES = Set.of(
            "print", "input", "range", "str", "int", "float", "bool", "list", "len", "isinstance", "__name__");

    static final String PRELUDE_PREFIX = "_vy_";

    private static final Pattern TEMP_NAME = Pattern.compile("_t\\d+");

    private final String entryFunction;

    public NameAllocator(String entryFunction) {
        this.entryFunction = entryFunction;
    }

    public boolean isReserved(String name) {
        return PYTHON_KEYWORDS.contains(name)
                || PRELUDE_NAMES.contains(name)
                || name.equals(entryFunction)
                || name.startsWith(PRELUDE_PREFIX)
                || TEMP_NAME.matcher(name).matches();
    }

    /**
     * Returns a target name for {@code source} that is not reserved and not in {@code taken}.
     * The caller records the result in its own bookkeeping.
     */
    public String allocate(String source, Set<String> taken) {
        String base = source;
        if (source.startsWith(PRELUDE_PREFIX)) {
            base = "u" + source;
        } else if (isReserved(source)) {
            base = source + "_";
        }
        if (!taken.contains(base) && !isReserved(base)) {
            return base;
        }
        int suffix = 1;
        while (taken.contains(base + "_" + suffix) || isReserved(base + "_" + suffix)) {
            suffix++;
        }
        return base + "_" + suffix;
    }
}
