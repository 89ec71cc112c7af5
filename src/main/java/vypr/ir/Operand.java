package vypr.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Value an instruction reads: a temporary or variable, a constant, or one of the two
 * pass-through shapes (list construction and field access).
 */
public sealed interface Operand permits Location, Operand.Const, Operand.ListValue, Operand.FieldRef {

    /** value is null, Long, Double, String or Boolean. */
    record Const(Object value) implements Operand {
        @Override
        public String toString() {
            if (value == null) return "none";
            if (value instanceof String) return '"' + ((String) value).replace("\"", "\\\"") + '"';
            return value.toString();
        }
    }

    record ListValue(List<Operand> elements) implements Operand {
        public ListValue {
            elements = List.copyOf(elements);
        }

        @Override
        public String toString() {
            return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
        }
    }

    record FieldRef(Operand object, String field) implements Operand {
        @Override
        public String toString() {
            return object + "." + field;
        }
    }
}
