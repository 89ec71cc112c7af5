package vypr.ir;

import org.junit.jupiter.api.Test;
import vypr.exception.InternalCompilerError;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BranchResolverTest {
    private static final Location.Var C = new Location.Var("c");
    private static final Location.Var D = new Location.Var("d");

    private static Instruction label(String name) {
        return new Instruction.Label(name);
    }

    @Test
    void ifElseEndsAtJumpTarget() {
        List<Instruction> code = List.of(
                new Instruction.ConditionalJump(C, "L0", "L2"),
                label("L0"),
                new Instruction.Print(C),
                new Instruction.Jump("L1"),
                label("L2"),
                new Instruction.Print(D),
                label("L1"),
                new Instruction.Return(null));
        BranchResolver.Branch branch = new BranchResolver("f", code).branchAt(0);
        assertTrue(branch.hasElse());
        assertEquals(1, branch.trueLabel());
        assertEquals(4, branch.falseLabel());
        assertEquals(6, branch.end());
        assertEquals(4, branch.trueEnd());
    }

    @Test
    void ifWithoutElseSkipsNestedBranches() {
        List<Instruction> code = List.of(
                new Instruction.ConditionalJump(C, "L0", null),
                label("L0"),
                new Instruction.ConditionalJump(D, "L2", null),
                label("L2"),
                new Instruction.Print(D),
                label("L3"),
                label("L1"),
                new Instruction.Return(null));
        BranchResolver resolver = new BranchResolver("f", code);
        BranchResolver.Branch outer = resolver.branchAt(0);
        assertFalse(outer.hasElse());
        assertEquals(6, outer.end());
        assertEquals(5, resolver.branchAt(2).end());
    }

    @Test
    void nestedLoopsArePaired() {
        List<Instruction> code = List.of(
                new Instruction.LoopStart(LoopKind.TIMES, new Location.Temp(0), new Operand.Const(2L), List.of()),
                new Instruction.LoopStart(LoopKind.FOR, new Location.Var("x"), D, List.of()),
                new Instruction.Print(new Location.Var("x")),
                new Instruction.LoopEnd(),
                new Instruction.LoopEnd(),
                new Instruction.Return(null));
        BranchResolver resolver = new BranchResolver("f", code);
        assertEquals(4, resolver.loopEndOf(0));
        assertEquals(3, resolver.loopEndOf(1));
        assertEquals(0, resolver.loopStartOf(4));
    }

    @Test
    void danglingLabelIsAnInternalError() {
        List<Instruction> code = List.of(new Instruction.Jump("nowhere"), new Instruction.Return(null));
        InternalCompilerError e = assertThrows(InternalCompilerError.class, () -> new BranchResolver("f", code));
        assertTrue(e.getMessage().contains("undefined label nowhere"), e.getMessage());
    }

    @Test
    void duplicateLabelIsAnInternalError() {
        List<Instruction> code = List.of(label("L0"), label("L0"));
        assertThrows(InternalCompilerError.class, () -> new BranchResolver("f", code));
    }

    @Test
    void elseWithoutJumpToEndIsAnInternalError() {
        List<Instruction> code = List.of(
                new Instruction.ConditionalJump(C, "L0", "L1"),
                label("L0"),
                new Instruction.Print(C),
                label("L1"),
                new Instruction.Return(null));
        assertThrows(InternalCompilerError.class, () -> new BranchResolver("f", code));
    }

    @Test
    void unbalancedLoopMarkersAreInternalErrors() {
        assertThrows(InternalCompilerError.class,
                () -> new BranchResolver("f", List.of(new Instruction.LoopEnd())));
        assertThrows(InternalCompilerError.class, () -> new BranchResolver("f", List.of(
                new Instruction.LoopStart(LoopKind.WHILE, null, C, List.of()))));
    }
}
