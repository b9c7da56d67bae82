package com.galois.nondet.ir;

/** Reads the value stored at a pointer. */
public final class LoadInst extends Instruction {
    public LoadInst(Value ptr, String name) {
        super(pointeeOf(ptr), name);
        addOperand(ptr);
    }

    private static Type pointeeOf(Value ptr) {
        if (ptr == null) throw new NullPointerException("ptr");
        if (!ptr.type().isPointer()) {
            throw new IllegalArgumentException("Load address must be a pointer, not " + ptr.type());
        }
        return ptr.type().getPointeeType();
    }

    public Value getPointerOperand() {
        return getOperand(0);
    }

    public String getOpcodeName() {
        return "load";
    }
}
