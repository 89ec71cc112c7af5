package vypr.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Instructions of one function. globals lists the module-level variables the function
 * writes to, which the target program must declare before use.
 */
public class FunctionIR {
    private final String name;
    private final List<String> params;
    private final Set<String> globals = new LinkedHashSet<>();
    private final List<Instruction> instructions = new ArrayList<>();

    public FunctionIR(String name, List<String> params) {
        this.name = name;
        this.params = List.copyOf(params);
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public List<String> getGlobals() {
        return List.copyOf(globals);
    }

    public void addGlobal(String name) {
        globals.add(name);
    }

    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    public void add(Instruction instruction) {
        instructions.add(instruction);
    }

    public Instruction last() {
        return instructions.isEmpty() ? null : instructions.get(instructions.size() - 1);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FUNCTION ").append(name).append('(').append(String.join(", ", params)).append(')');
        if (!globals.isEmpty()) {
            sb.append(" GLOBAL ").append(String.join(", ", globals));
        }
        for (Instruction instruction : instructions) {
            sb.append("\n  ").append(instruction);
        }
        return sb.toString();
    }
}
