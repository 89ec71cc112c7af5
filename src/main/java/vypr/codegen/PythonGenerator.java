package vypr.codegen;

import vypr.CompilerOptions;
import vypr.ast.BinaryOperator;
import vypr.exception.InternalCompilerError;
import vypr.ir.BranchResolver;
import vypr.ir.FunctionIR;
import vypr.ir.Instruction;
import vypr.ir.InstructionVisitor;
import vypr.ir.Location;
import vypr.ir.Operand;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns IR back into structured Python 3. Conditional jumps become if/else blocks and loop
 * markers become while/for statements, so no label or jump survives in the output.
 */
public class PythonGenerator {
    private final CompilerOptions options;
    private final Set<String> helpers = new LinkedHashSet<>();

    public PythonGenerator() {
        this(CompilerOptions.DEFAULT);
    }

    public PythonGenerator(CompilerOptions options) {
        this.options = options;
    }

    public String generate(Map<String, FunctionIR> functions) {
        helpers.clear();
        List<List<String>> definitions = new ArrayList<>();
        FunctionIR entry = functions.get(options.entryFunction());
        for (FunctionIR function : functions.values()) {
            if (function != entry) {
                definitions.add(function(function));
            }
        }
        if (entry != null) {
            definitions.add(function(entry));
        }

        List<List<String>> sections = new ArrayList<>();
        if (options.emitHeader()) {
            sections.add(List.of("# Generated by vypr. Do not edit."));
        }
        sections.addAll(PythonRuntime.definitions(helpers));
        sections.addAll(definitions);
        if (entry != null) {
            sections.add(List.of("if __name__ == '__main__':", options.indentUnit() + entry.getName() + "()"));
        }

        StringBuilder out = new StringBuilder();
        for (int i = 0; i < sections.size(); i++) {
            if (i > 0) {
                out.append("\n\n");
            }
            for (String line : sections.get(i)) {
                out.append(line).append('\n');
            }
        }
        return out.toString();
    }

    private List<String> function(FunctionIR function) {
        List<String> lines = new ArrayList<>();
        lines.add("def " + function.getName() + "(" + String.join(", ", function.getParams()) + "):");
        if (!function.getGlobals().isEmpty()) {
            lines.add(options.indentUnit() + "global " + String.join(", ", function.getGlobals()));
        }
        Body body = new Body(function.getName(), function.getInstructions(), lines);
        body.block(0, function.getInstructions().size(), 1);
        return lines;
    }

    /** Emission state for one function body. */
    private final class Body implements InstructionVisitor<Void> {
        private final List<Instruction> code;
        private final BranchResolver resolver;
        private final List<String> lines;
        private int depth;

        Body(String name, List<Instruction> code, List<String> lines) {
            this.code = code;
            this.resolver = new BranchResolver(name, code);
            this.lines = lines;
        }

        void block(int from, int to, int depth) {
            int before = lines.size();
            range(from, to, depth);
            if (lines.size() == before) {
                line(depth, "pass");
            }
        }

        private void range(int from, int to, int depth) {
            int i = from;
            while (i < to) {
                Instruction instruction = code.get(i);
                if (instruction instanceof Instruction.ConditionalJump) {
                    BranchResolver.Branch branch = resolver.branchAt(i);
                    if (branch.end() >= to) {
                        throw new InternalCompilerError("Branch at " + i + " crosses the end of its enclosing block");
                    }
                    Instruction.ConditionalJump jump = (Instruction.ConditionalJump) instruction;
                    line(depth, "if " + render(jump.condition()) + ":");
                    block(branch.trueLabel() + 1, branch.trueEnd(), depth + 1);
                    if (branch.hasElse()) {
                        line(depth, "else:");
                        block(branch.falseLabel() + 1, branch.end(), depth + 1);
                    }
                    i = branch.end() + 1;
                } else if (instruction instanceof Instruction.LoopStart) {
                    int end = resolver.loopEndOf(i);
                    if (end >= to) {
                        throw new InternalCompilerError("Loop at " + i + " crosses the end of its enclosing block");
                    }
                    loop((Instruction.LoopStart) instruction, i + 1, end, depth);
                    i = end + 1;
                } else {
                    this.depth = depth;
                    instruction.accept(this);
                    i++;
                }
            }
        }

        private void loop(Instruction.LoopStart start, int from, int to, int depth) {
            switch (start.kind()) {
                case WHILE:
                    if (start.header().isEmpty()) {
                        line(depth, "while " + render(start.operand()) + ":");
                    } else {
                        line(depth, "while True:");
                        for (Instruction instruction : start.header()) {
                            this.depth = depth + 1;
                            instruction.accept(this);
                        }
                        line(depth + 1, "if not " + render(start.operand()) + ":");
                        line(depth + 2, "break");
                    }
                    break;
                case TIMES:
                    line(depth, "for " + render(start.variable()) + " in range(" + count(start.operand()) + "):");
                    break;
                default:
                    line(depth, "for " + render(start.variable()) + " in " + render(start.operand()) + ":");
                    break;
            }
            block(from, to, depth + 1);
        }

        private String count(Operand operand) {
            if (operand instanceof Operand.Const && ((Operand.Const) operand).value() instanceof Long) {
                return render(operand);
            }
            return "int(" + render(operand) + ")";
        }

        private void line(int depth, String text) {
            lines.add(options.indentUnit().repeat(depth) + text);
        }

        private void emit(String text) {
            line(depth, text);
        }

        @Override
        public Void visitLabel(Instruction.Label instruction) {
            return null;
        }

        @Override
        public Void visitJump(Instruction.Jump instruction) {
            return null;
        }

        @Override
        public Void visitBinaryOp(Instruction.BinaryOp instruction) {
            String left = render(instruction.left());
            String right = render(instruction.right());
            String value;
            if (instruction.op() == BinaryOperator.ADD) {
                helpers.add(PythonRuntime.ADD);
                value = PythonRuntime.ADD + "(" + left + ", " + right + ")";
            } else if (instruction.op() == BinaryOperator.CONCAT) {
                helpers.add(PythonRuntime.CONCAT);
                value = PythonRuntime.CONCAT + "(" + left + ", " + right + ")";
            } else {
                value = left + " " + instruction.op().symbol() + " " + right;
            }
            emit(render(instruction.dest()) + " = " + value);
            return null;
        }

        @Override
        public Void visitUnaryOp(Instruction.UnaryOp instruction) {
            emit(render(instruction.dest()) + " = " + instruction.op().symbol() + render(instruction.operand()));
            return null;
        }

        @Override
        public Void visitAssign(Instruction.Assign instruction) {
            emit(render(instruction.dest()) + " = " + render(instruction.value()));
            return null;
        }

        @Override
        public Void visitConditionalJump(Instruction.ConditionalJump instruction) {
            throw new InternalCompilerError("Conditional jump inside a loop header");
        }

        @Override
        public Void visitCall(Instruction.Call instruction) {
            String call = instruction.function() + "(" + renderAll(instruction.args()) + ")";
            emit(instruction.dest() == null ? call : render(instruction.dest()) + " = " + call);
            return null;
        }

        @Override
        public Void visitReturn(Instruction.Return instruction) {
            emit(instruction.value() == null ? "return" : "return " + render(instruction.value()));
            return null;
        }

        @Override
        public Void visitPrint(Instruction.Print instruction) {
            helpers.add(PythonRuntime.STR);
            emit("print(" + PythonRuntime.STR + "(" + render(instruction.value()) + "))");
            return null;
        }

        @Override
        public Void visitInput(Instruction.Input instruction) {
            emit(render(instruction.dest()) + " = input()");
            return null;
        }

        @Override
        public Void visitLoopStart(Instruction.LoopStart instruction) {
            throw new InternalCompilerError("Loop marker inside a loop header");
        }

        @Override
        public Void visitLoopEnd(Instruction.LoopEnd instruction) {
            throw new InternalCompilerError("Loop end without a matching start");
        }
    }

    static String render(Operand operand) {
        if (operand instanceof Location) {
            return operand.toString();
        }
        if (operand instanceof Operand.ListValue) {
            return "[" + renderAll(((Operand.ListValue) operand).elements()) + "]";
        }
        if (operand instanceof Operand.FieldRef) {
            Operand.FieldRef ref = (Operand.FieldRef) operand;
            return render(ref.object()) + "." + ref.field();
        }
        return literal(((Operand.Const) operand).value());
    }

    private static String renderAll(List<Operand> operands) {
        return operands.stream().map(PythonGenerator::render).collect(Collectors.joining(", "));
    }

    static String literal(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "True" : "False";
        }
        if (value instanceof String) {
            return quote((String) value);
        }
        return value.toString();
    }

    private static String quote(String text) {
        StringBuilder sb = new StringBuilder("'");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\'': sb.append("\\'"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('\'').toString();
    }
}
