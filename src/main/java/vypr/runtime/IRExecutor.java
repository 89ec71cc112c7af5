package vypr.runtime;

import vypr.CompilerOptions;
import vypr.exception.VyprRuntimeException;
import vypr.ir.BranchResolver;
import vypr.ir.FunctionIR;
import vypr.ir.Instruction;
import vypr.ir.InstructionVisitor;
import vypr.ir.Location;
import vypr.ir.Operand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
    IRExecutor - runs the IR produced by the IRBuilder without going through Python.
    Storage model:
    - Module globals live in one map shared by every call.
    - Each call gets a Frame holding its locals and temporaries. A name listed in the
      function's globals is read and written in the module map; any other name is local,
      falling back to the module map on read.
    - Loops keep their progress on a per-frame stack keyed by the LoopStart index.
    - Values are Java Objects: Long, Double, String, Boolean, List or null.
*/
public class IRExecutor {
    private static final int MAX_CALL_DEPTH = 1000;
    private static final int RETURN = -1;

    private final Map<String, FunctionIR> functions;
    private final Map<String, BranchResolver> resolvers = new HashMap<>();
    private final Map<String, Object> globals = new HashMap<>();
    private final BufferedReader reader;
    private final PrintStream out;
    private final String entryFunction;
    private int callDepth = 0;

    public IRExecutor(Map<String, FunctionIR> functions) {
        this(functions, new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out, CompilerOptions.DEFAULT);
    }

    public IRExecutor(Map<String, FunctionIR> functions, Reader input, PrintStream out) {
        this(functions, input, out, CompilerOptions.DEFAULT);
    }

    public IRExecutor(Map<String, FunctionIR> functions, Reader input, PrintStream out, CompilerOptions options) {
        this.functions = functions;
        this.reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
        this.out = out;
        this.entryFunction = options.entryFunction();
    }

    public void execute() {
        if (!functions.containsKey(entryFunction)) {
            throw new VyprRuntimeException("No entry function '" + entryFunction + "'");
        }
        try {
            call(entryFunction, List.of());
        } catch (StackOverflowError e) {
            throw new VyprRuntimeException("maximum recursion depth exceeded", e);
        } finally {
            out.flush();
        }
    }

    /** Module-level variables after execution, by target name. */
    public Map<String, Object> getGlobals() {
        return globals;
    }

    private Object call(String name, List<Object> args) {
        FunctionIR function = functions.get(name);
        if (function == null) {
            throw new VyprRuntimeException("Unknown function: " + name);
        }
        if (function.getParams().size() != args.size()) {
            throw new VyprRuntimeException(name + "() takes " + function.getParams().size()
                    + " arguments but " + args.size() + " were given");
        }
        if (callDepth >= MAX_CALL_DEPTH) {
            throw new VyprRuntimeException("maximum recursion depth exceeded");
        }
        callDepth++;
        try {
            Frame frame = new Frame(function, resolvers.computeIfAbsent(name, k -> new BranchResolver(function)));
            for (int i = 0; i < args.size(); i++) {
                frame.locals.put(function.getParams().get(i), args.get(i));
            }
            return frame.run();
        } finally {
            callDepth--;
        }
    }

    private static final class LoopState {
        final int start;
        long remaining;
        long counter;
        Iterator<?> items;

        LoopState(int start) {
            this.start = start;
        }
    }

    private final class Frame implements InstructionVisitor<Integer> {
        final List<Instruction> code;
        final BranchResolver resolver;
        final Map<String, Object> locals = new HashMap<>();
        final Set<String> globalNames;
        final Deque<LoopState> loops = new ArrayDeque<>();
        int pc;
        Object returnValue;

        Frame(FunctionIR function, BranchResolver resolver) {
            this.code = function.getInstructions();
            this.resolver = resolver;
            this.globalNames = new HashSet<>(function.getGlobals());
        }

        Object run() {
            pc = 0;
            while (pc >= 0 && pc < code.size()) {
                pc = code.get(pc).accept(this);
            }
            return returnValue;
        }

        private Object value(Operand operand) {
            if (operand instanceof Operand.Const) {
                return ((Operand.Const) operand).value();
            }
            if (operand instanceof Location.Temp) {
                return locals.get(operand.toString());
            }
            if (operand instanceof Location.Var) {
                String name = ((Location.Var) operand).name();
                if (!globalNames.contains(name) && locals.containsKey(name)) {
                    return locals.get(name);
                }
                if (globals.containsKey(name)) {
                    return globals.get(name);
                }
                throw new VyprRuntimeException("name '" + name + "' is not defined");
            }
            if (operand instanceof Operand.ListValue) {
                List<Object> items = new ArrayList<>();
                for (Operand element : ((Operand.ListValue) operand).elements()) {
                    items.add(value(element));
                }
                return items;
            }
            Operand.FieldRef ref = (Operand.FieldRef) operand;
            throw new VyprRuntimeException("'" + Values.typeName(value(ref.object())) + "' object has no attribute '"
                    + ref.field() + "'");
        }

        private void store(Location location, Object value) {
            String name = location.toString();
            if (globalNames.contains(name)) {
                globals.put(name, value);
            } else {
                locals.put(name, value);
            }
        }

        @Override
        public Integer visitLabel(Instruction.Label instruction) {
            return pc + 1;
        }

        @Override
        public Integer visitBinaryOp(Instruction.BinaryOp instruction) {
            store(instruction.dest(), Values.binary(instruction.op(), value(instruction.left()), value(instruction.right())));
            return pc + 1;
        }

        @Override
        public Integer visitUnaryOp(Instruction.UnaryOp instruction) {
            store(instruction.dest(), Values.unary(instruction.op(), value(instruction.operand())));
            return pc + 1;
        }

        @Override
        public Integer visitAssign(Instruction.Assign instruction) {
            store(instruction.dest(), value(instruction.value()));
            return pc + 1;
        }

        @Override
        public Integer visitJump(Instruction.Jump instruction) {
            return resolver.labelIndex(instruction.label()) + 1;
        }

        @Override
        public Integer visitConditionalJump(Instruction.ConditionalJump instruction) {
            BranchResolver.Branch branch = resolver.branchAt(pc);
            if (Values.truthy(value(instruction.condition()))) {
                return branch.trueLabel() + 1;
            }
            return branch.hasElse() ? branch.falseLabel() + 1 : branch.end() + 1;
        }

        @Override
        public Integer visitCall(Instruction.Call instruction) {
            List<Object> args = new ArrayList<>();
            for (Operand arg : instruction.args()) {
                args.add(value(arg));
            }
            Object result = call(instruction.function(), args);
            if (instruction.dest() != null) {
                store(instruction.dest(), result);
            }
            return pc + 1;
        }

        @Override
        public Integer visitReturn(Instruction.Return instruction) {
            returnValue = instruction.value() == null ? null : value(instruction.value());
            return RETURN;
        }

        @Override
        public Integer visitPrint(Instruction.Print instruction) {
            out.print(Values.format(value(instruction.value())));
            out.print('\n');
            return pc + 1;
        }

        @Override
        public Integer visitInput(Instruction.Input instruction) {
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                throw new VyprRuntimeException("Input failed: " + e.getMessage(), e);
            }
            if (line == null) {
                throw new VyprRuntimeException("EOF when reading a line");
            }
            store(instruction.dest(), line);
            return pc + 1;
        }

        @Override
        public Integer visitLoopStart(Instruction.LoopStart instruction) {
            LoopState state = loops.peek();
            if (state == null || state.start != pc) {
                state = new LoopState(pc);
                switch (instruction.kind()) {
                    case TIMES:
                        state.remaining = Values.toCount(value(instruction.operand()));
                        break;
                    case FOR:
                        state.items = Values.toIterable(value(instruction.operand())).iterator();
                        break;
                    default:
                        break;
                }
                loops.push(state);
            }
            boolean proceed;
            switch (instruction.kind()) {
                case WHILE:
                    int at = pc;
                    for (Instruction step : instruction.header()) {
                        step.accept(this);
                    }
                    pc = at;
                    proceed = Values.truthy(value(instruction.operand()));
                    break;
                case TIMES:
                    proceed = state.counter < state.remaining;
                    if (proceed) {
                        store(instruction.variable(), state.counter++);
                    }
                    break;
                default:
                    proceed = state.items.hasNext();
                    if (proceed) {
                        store(instruction.variable(), state.items.next());
                    }
                    break;
            }
            if (!proceed) {
                loops.pop();
                return resolver.loopEndOf(pc) + 1;
            }
            return pc + 1;
        }

        @Override
        public Integer visitLoopEnd(Instruction.LoopEnd instruction) {
            return resolver.loopStartOf(pc);
        }
    }
}
