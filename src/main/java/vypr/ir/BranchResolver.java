package vypr.ir;

import vypr.exception.InternalCompilerError;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovers the structure of one function's instruction list: the layout of every
 * conditional jump and the pairing of loop markers. Construction validates the whole list.
 */
public class BranchResolver {

    /**
     * Indices into the instruction list. falseLabel is -1 for an if without else; end is the
     * index of the label where both paths join.
     */
    public record Branch(int condition, int trueLabel, int falseLabel, int end) {
        public boolean hasElse() {
            return falseLabel >= 0;
        }

        /** Exclusive end of the true path. */
        public int trueEnd() {
            return hasElse() ? falseLabel : end;
        }
    }

    private final String function;
    private final List<Instruction> code;
    private final Map<String, Integer> labels = new HashMap<>();
    private final Map<Integer, Branch> branches = new HashMap<>();
    private final Map<Integer, Integer> loopEnds = new HashMap<>();
    private final Map<Integer, Integer> loopStarts = new HashMap<>();

    public BranchResolver(FunctionIR function) {
        this(function.getName(), function.getInstructions());
    }

    public BranchResolver(String function, List<Instruction> code) {
        this.function = function;
        this.code = code;
        indexLabels();
        pairLoops();
        for (int i = 0; i < code.size(); i++) {
            Instruction instruction = code.get(i);
            if (instruction instanceof Instruction.ConditionalJump) {
                branchAt(i);
            } else if (instruction instanceof Instruction.Jump) {
                labelIndex(((Instruction.Jump) instruction).label());
            }
        }
    }

    public Branch branchAt(int index) {
        Branch cached = branches.get(index);
        if (cached != null) {
            return cached;
        }
        if (!(code.get(index) instanceof Instruction.ConditionalJump)) {
            throw fail("instruction " + index + " is not a conditional jump");
        }
        Instruction.ConditionalJump jump = (Instruction.ConditionalJump) code.get(index);
        int trueLabel = labelIndex(jump.trueLabel());
        if (trueLabel <= index) {
            throw fail("branch at " + index + " jumps backwards to " + jump.trueLabel());
        }
        Branch branch;
        if (jump.hasFalseLabel()) {
            int falseLabel = labelIndex(jump.falseLabel());
            if (falseLabel <= trueLabel) {
                throw fail("false label " + jump.falseLabel() + " precedes true label " + jump.trueLabel());
            }
            branch = new Branch(index, trueLabel, falseLabel, endOfElse(trueLabel, falseLabel));
        } else {
            branch = new Branch(index, trueLabel, -1, endOfThen(trueLabel));
        }
        branches.put(index, branch);
        return branch;
    }

    public int loopEndOf(int start) {
        Integer end = loopEnds.get(start);
        if (end == null) {
            throw fail("no loop starts at " + start);
        }
        return end;
    }

    public int loopStartOf(int end) {
        Integer start = loopStarts.get(end);
        if (start == null) {
            throw fail("no loop ends at " + end);
        }
        return start;
    }

    public int labelIndex(String label) {
        Integer index = labels.get(label);
        if (index == null) {
            throw fail("jump to undefined label " + label);
        }
        return index;
    }

    // The true path ends with a jump over the false path; its target is the join label.
    private int endOfElse(int trueLabel, int falseLabel) {
        for (int i = falseLabel - 1; i > trueLabel; i--) {
            Instruction instruction = code.get(i);
            if (instruction instanceof Instruction.Jump) {
                int end = labelIndex(((Instruction.Jump) instruction).label());
                if (end <= falseLabel) {
                    throw fail("join label of branch at " + trueLabel + " is not after its false path");
                }
                return end;
            }
            if (!(instruction instanceof Instruction.Label)) {
                break;
            }
        }
        throw fail("missing jump to the end of the branch labelled " + ((Instruction.Label) code.get(trueLabel)).name());
    }

    // First label after the true label that does not belong to a nested branch.
    private int endOfThen(int trueLabel) {
        int i = trueLabel + 1;
        while (i < code.size()) {
            Instruction instruction = code.get(i);
            if (instruction instanceof Instruction.ConditionalJump) {
                i = branchAt(i).end() + 1;
            } else if (instruction instanceof Instruction.Label) {
                return i;
            } else {
                i++;
            }
        }
        throw fail("branch labelled " + ((Instruction.Label) code.get(trueLabel)).name() + " never rejoins");
    }

    private void indexLabels() {
        for (int i = 0; i < code.size(); i++) {
            if (code.get(i) instanceof Instruction.Label) {
                String name = ((Instruction.Label) code.get(i)).name();
                if (labels.put(name, i) != null) {
                    throw fail("duplicate label " + name);
                }
            }
        }
    }

    private void pairLoops() {
        Deque<Integer> open = new ArrayDeque<>();
        for (int i = 0; i < code.size(); i++) {
            Instruction instruction = code.get(i);
            if (instruction instanceof Instruction.LoopStart) {
                open.push(i);
            } else if (instruction instanceof Instruction.LoopEnd) {
                if (open.isEmpty()) {
                    throw fail("loop end at " + i + " has no matching start");
                }
                int start = open.pop();
                loopEnds.put(start, i);
                loopStarts.put(i, start);
            }
        }
        if (!open.isEmpty()) {
            throw fail("loop start at " + open.peek() + " is never closed");
        }
    }

    private InternalCompilerError fail(String message) {
        return new InternalCompilerError("Malformed IR in function '" + function + "': " + message);
    }
}
