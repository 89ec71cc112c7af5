package vypr.ir;

public interface InstructionVisitor<R> {
    R visitLabel(Instruction.Label instruction);

    R visitBinaryOp(Instruction.BinaryOp instruction);

    R visitUnaryOp(Instruction.UnaryOp instruction);

    R visitAssign(Instruction.Assign instruction);

    R visitJump(Instruction.Jump instruction);

    R visitConditionalJump(Instruction.ConditionalJump instruction);

    R visitCall(Instruction.Call instruction);

    R visitReturn(Instruction.Return instruction);

    R visitPrint(Instruction.Print instruction);

    R visitInput(Instruction.Input instruction);

    R visitLoopStart(Instruction.LoopStart instruction);

    R visitLoopEnd(Instruction.LoopEnd instruction);
}
