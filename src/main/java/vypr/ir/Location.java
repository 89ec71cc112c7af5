package vypr.ir;

/**
 * An operand that can also be written: a compiler temporary or a named variable.
 */
public sealed interface Location extends Operand permits Location.Temp, Location.Var {

    record Temp(int id) implements Location {
        @Override
        public String toString() {
            return "_t" + id;
        }
    }

    /** name is already a valid, collision-free target name (see NameAllocator). */
    record Var(String name) implements Location {
        @Override
        public String toString() {
            return name;
        }
    }
}
