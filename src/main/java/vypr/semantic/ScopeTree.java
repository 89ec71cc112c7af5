package vypr.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lexical scopes kept in an arena and addressed by id. Each scope knows only its parent's
 * id, so the tree has no ownership cycles and a finished analysis can still be inspected.
 * Symbols are only ever added to a scope, never removed or replaced.
 */
public class ScopeTree {
    public static final int NO_SCOPE = -1;
    public static final int GLOBAL = 0;

    private static final class Scope {
        final int parent;
        final int depth;
        final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(int parent, int depth) {
            this.parent = parent;
            this.depth = depth;
        }
    }

    private final List<Scope> scopes = new ArrayList<>();
    private int current;

    public ScopeTree() {
        scopes.add(new Scope(NO_SCOPE, 0));
        current = GLOBAL;
    }

    public int current() {
        return current;
    }

    public int enterScope() {
        scopes.add(new Scope(current, scopes.get(current).depth + 1));
        current = scopes.size() - 1;
        return current;
    }

    public void exitScope() {
        int parent = scopes.get(current).parent;
        if (parent == NO_SCOPE) {
            throw new IllegalStateException("Cannot exit the global scope");
        }
        current = parent;
    }

    public boolean isGlobal() {
        return current == GLOBAL;
    }

    /** True when name is already declared in the current scope itself. */
    public boolean isDeclaredHere(String name) {
        return scopes.get(current).symbols.containsKey(name);
    }

    public void define(Symbol symbol) {
        Map<String, Symbol> symbols = scopes.get(current).symbols;
        if (symbols.containsKey(symbol.name())) {
            throw new IllegalStateException("'" + symbol.name() + "' is already defined in scope " + current);
        }
        symbols.put(symbol.name(), symbol);
    }

    /** Resolves name through the chain of enclosing scopes; null when it is not visible. */
    public Symbol lookup(String name) {
        for (int id = current; id != NO_SCOPE; id = scopes.get(id).parent) {
            Symbol symbol = scopes.get(id).symbols.get(name);
            if (symbol != null) return symbol;
        }
        return null;
    }

    public int parentOf(int scope) {
        return scopes.get(scope).parent;
    }

    public Map<String, Symbol> symbolsOf(int scope) {
        return Collections.unmodifiableMap(scopes.get(scope).symbols);
    }

    public int size() {
        return scopes.size();
    }

    /** Text dump of every scope the analysis created, indented by nesting depth. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (int id = 0; id < scopes.size(); id++) {
            Scope scope = scopes.get(id);
            sb.append("  ".repeat(scope.depth)).append("scope ").append(id);
            if (scope.parent != NO_SCOPE) {
                sb.append(" (parent ").append(scope.parent).append(")");
            }
            sb.append(": ").append(String.join(", ", scope.symbols.keySet())).append('\n');
        }
        return sb.toString();
    }
}
