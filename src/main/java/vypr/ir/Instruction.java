package vypr.ir;

import vypr.ast.BinaryOperator;
import vypr.ast.UnaryOperator;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Three-address instructions. Labels and jumps only ever describe if/else; every loop is a
 * LoopStart/LoopEnd pair that carries its header as data.
 */
public sealed interface Instruction {

    <R> R accept(InstructionVisitor<R> visitor);

    record Label(String name) implements Instruction {
        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitLabel(this);
        }

        @Override
        public String toString() {
            return name + ":";
        }
    }

    record BinaryOp(BinaryOperator op, Location dest, Operand left, Operand right) implements Instruction {
        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }

        @Override
        public String toString() {
            return dest + " = " + left + " " + op.symbol() + " " + right;
        }
    }

    record UnaryOp(UnaryOperator op, Location dest, Operand operand) implements Instruction {
        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }

        @Override
        public String toString() {
            return dest + " = " + op.symbol() + operand;
        }
    }

    record Assign(Location dest, Operand value) implements Instruction {
        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitAssign(this);
        }

        @Override
        public String toString() {
            return dest + " = " + value;
        }
    }

    record Jump(String label) implements Instruction {
        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitJump(this);
        }

        @Override
        public String toString() {
            return "JUMP " + label;
        }
    }

    /** falseLabel is null for an if without else. */
    record ConditionalJump(Operand condition, String trueLabel, String falseLabel) implements Instruction {
        public boolean hasFalseLabel() {
            return falseLabel != null;
        }

        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitConditionalJump(this);
        }

        @Override
        public String toString() {
            if (falseLabel != null) {
                return "IF " + condition + " THEN JUMP " + trueLabel + " ELSE JUMP " + falseLabel;
            }
            return "IF " + condition + " THEN JUMP " + trueLabel;
        }
    }

    /** dest is null when the result is discarded. */
    record Call(String function, List<Operand> args, Location dest) implements Instruction {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            String call = "CALL " + function + args.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
            return dest == null ? call : dest + " = " + call;
        }
    }

    /** value is null for a bare return. */
    record Return(Operand value) implements Instruction {
        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public String toString() {
            return value == null ? "RETURN" : "RETURN " + value;
        }
    }

    record Print(Operand value) implements Instruction {
        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitPrint(this);
        }

        @Override
        public String toString() {
            return "PRINT " + value;
        }
    }

    record Input(Location dest) implements Instruction {
        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitInput(this);
        }

        @Override
        public String toString() {
            return dest + " = INPUT";
        }
    }

    /**
     * Opens a loop body that runs until the matching LoopEnd.
     * <ul>
     *   <li>WHILE: header recomputes the condition before each iteration, operand is the condition.</li>
     *   <li>TIMES: variable is the counter temporary, operand the iteration count.</li>
     *   <li>FOR: variable is the loop variable, operand the iterable.</li>
     * </ul>
     * variable is null for WHILE; header is empty for TIMES and FOR.
     */
    record LoopStart(LoopKind kind, Location variable, Operand operand, List<Instruction> header) implements Instruction {
        public LoopStart {
            header = List.copyOf(header);
        }

        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitLoopStart(this);
        }

        @Override
        public String toString() {
            switch (kind) {
                case WHILE:
                    String header = this.header.stream().map(Object::toString).collect(Collectors.joining("; "));
                    return "LOOP WHILE " + operand + (header.isEmpty() ? "" : " {" + header + "}");
                case TIMES:
                    return "LOOP " + variable + " TIMES " + operand;
                default:
                    return "LOOP " + variable + " IN " + operand;
            }
        }
    }

    record LoopEnd() implements Instruction {
        @Override
        public <R> R accept(InstructionVisitor<R> visitor) {
            return visitor.visitLoopEnd(this);
        }

        @Override
        public String toString() {
            return "END LOOP";
        }
    }
}
