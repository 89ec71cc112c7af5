package vypr.semantic;

import vypr.ast.SourcePosition;

import java.util.List;

public sealed interface Symbol permits Symbol.Variable, Symbol.Function {
    String name();

    SourcePosition declaredAt();

    record Variable(String name, SourcePosition declaredAt) implements Symbol {
    }

    record Function(String name, List<String> parameters, SourcePosition declaredAt) implements Symbol {
        public Function {
            parameters = List.copyOf(parameters);
        }

        public int arity() {
            return parameters.size();
        }
    }
}
