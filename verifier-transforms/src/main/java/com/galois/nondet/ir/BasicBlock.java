package com.galois.nondet.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A straight-line sequence of instructions ending in a terminator.
 */
public final class BasicBlock extends Value {
    private final Function parent;
    private final List<Instruction> instructions = new ArrayList<Instruction>();

    BasicBlock(Function parent, String name) {
        super(Type.LABEL, name);
        this.parent = parent;
    }

    /**
     * Get function that this block is part of.
     */
    public Function getParent() {
        return parent;
    }

    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    /**
     * The terminator of this block or <code>null</code> if it is unterminated.
     */
    public Instruction getTerminator() {
        if (instructions.isEmpty()) {
            return null;
        }
        Instruction last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? last : null;
    }

    /**
     * Append an instruction that is not yet part of any block.
     */
    public void append(Instruction inst) {
        checkDetached(inst);
        if (getTerminator() != null) {
            throw new IllegalStateException("Block " + getReference() + " has already been terminated.");
        }
        instructions.add(inst);
        inst.setParent(this);
    }

    void insertAt(int index, Instruction inst) {
        checkDetached(inst);
        instructions.add(index, inst);
        inst.setParent(this);
    }

    int indexOf(Instruction inst) {
        for (int i = 0; i != instructions.size(); ++i) {
            if (instructions.get(i) == inst) return i;
        }
        return -1;
    }

    Instruction get(int index) {
        if (index < 0 || index >= instructions.size()) {
            return null;
        }
        return instructions.get(index);
    }

    void remove(Instruction inst) {
        int i = indexOf(inst);
        if (i < 0) {
            throw new IllegalStateException("Instruction is not part of block " + getReference());
        }
        instructions.remove(i);
        inst.setParent(null);
    }

    private static void checkDetached(Instruction inst) {
        if (inst == null) throw new NullPointerException("inst");
        if (inst.getParent() != null) {
            throw new IllegalStateException("Instruction is already inserted in a block.");
        }
    }
}
