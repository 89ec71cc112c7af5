package vypr.codegen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Helper functions the generated program may reference. Only the ones actually used are
 * emitted, together with the helpers they depend on.
 */
public final class PythonRuntime {
    public static final String STR = "_vy_str";
    public static final String ADD = "_vy_add";
    public static final String CONCAT = "_vy_concat";

    private static final Map<String, List<String>> SOURCES = new LinkedHashMap<>();

    static {
        SOURCES.put(STR, List.of(
                "def _vy_str(value):",
                "    if isinstance(value, bool):",
                "        return 'true' if value else 'false'",
                "    if isinstance(value, list):",
                "        return '[' + ', '.join(_vy_str(item) for item in value) + ']'",
                "    return str(value)"));
        SOURCES.put(ADD, List.of(
                "def _vy_add(left, right):",
                "    if isinstance(left, str) or isinstance(right, str):",
                "        return _vy_str(left) + _vy_str(right)",
                "    return left + right"));
        SOURCES.put(CONCAT, List.of(
                "def _vy_concat(left, right):",
                "    return _vy_str(left) + _vy_str(right)"));
    }

    private PythonRuntime() {
    }

    /** Definitions for the given helpers, in a fixed order, each as a list of lines. */
    public static List<List<String>> definitions(Set<String> used) {
        List<List<String>> result = new ArrayList<>();
        boolean needsStr = !used.isEmpty();
        for (Map.Entry<String, List<String>> entry : SOURCES.entrySet()) {
            if (used.contains(entry.getKey()) || (entry.getKey().equals(STR) && needsStr)) {
                result.add(entry.getValue());
            }
        }
        return result;
    }
}
