package tbasic.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Straight-line instruction sequence with a single entry, closed by exactly
 * one {@link Instruction.Terminator}. Nothing may be appended after it.
 */
public final class BasicBlock {
    private final String label;
    private final Function parent;
    private final List<Instruction> instructions = new ArrayList<>();

    BasicBlock(String label, Function parent) {
        this.label = label;
        this.parent = parent;
    }

    public String label() { return label; }

    public Function parent() { return parent; }

    public List<Instruction> instructions() { return Collections.unmodifiableList(instructions); }

    public boolean isTerminated() {
        return !instructions.isEmpty()
                && instructions.get(instructions.size() - 1) instanceof Instruction.Terminator;
    }

    /** The closing branch or return, or null while the block is still open. */
    public Instruction.Terminator terminator() {
        return isTerminated() ? (Instruction.Terminator) instructions.get(instructions.size() - 1) : null;
    }

    public List<BasicBlock> successors() {
        Instruction.Terminator t = terminator();
        return t == null ? List.of() : t.successors();
    }

    void append(Instruction insn) {
        if (isTerminated()) throw new IllegalStateException("Block already terminated: " + label);
        instructions.add(insn);
    }

    // stack slots live at the head of the block so they dominate every use
    void insertAlloca(Instruction.Alloca alloca) {
        int at = 0;
        while (at < instructions.size() && instructions.get(at) instanceof Instruction.Alloca) at++;
        instructions.add(at, alloca);
    }

    @Override
    public String toString() {
        return "%" + label;
    }
}
