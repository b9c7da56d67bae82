package com.galois.nondet.ir;

/** Returns from the function, with an optional value. */
public final class ReturnInst extends Instruction {
    public ReturnInst(Value v) {
        super(Type.VOID, null);
        if (v != null) {
            addOperand(v);
        }
    }

    /** Returns the returned value, or <code>null</code> for <code>ret void</code>. */
    public Value getReturnValue() {
        return getNumOperands() == 0 ? null : getOperand(0);
    }

    public boolean isTerminator() {
        return true;
    }

    public String getOpcodeName() {
        return "ret";
    }
}
