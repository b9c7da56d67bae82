package com.galois.nondet.ir;

/**
 * Unconditional or conditional branch.  A conditional branch has the
 * condition as operand 0 followed by the true and false targets.
 */
public final class BranchInst extends Instruction {
    public BranchInst(BasicBlock dest) {
        super(Type.VOID, null);
        if (dest == null) throw new NullPointerException("dest");
        addOperand(dest);
    }

    public BranchInst(Value cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        super(Type.VOID, null);
        if (cond == null) throw new NullPointerException("cond");
        if (ifTrue == null) throw new NullPointerException("ifTrue");
        if (ifFalse == null) throw new NullPointerException("ifFalse");
        if (!cond.type().equals(Type.I1)) {
            throw new IllegalArgumentException("Branch condition must be i1.");
        }
        addOperand(cond);
        addOperand(ifTrue);
        addOperand(ifFalse);
    }

    public boolean isConditional() {
        return getNumOperands() == 3;
    }

    public Value getCondition() {
        if (!isConditional()) {
            throw new IllegalStateException("Unconditional branch has no condition.");
        }
        return getOperand(0);
    }

    public int getNumSuccessors() {
        return isConditional() ? 2 : 1;
    }

    public BasicBlock getSuccessor(int i) {
        if (!(0 <= i && i < getNumSuccessors())) {
            throw new IllegalArgumentException("Bad successor index.");
        }
        return (BasicBlock) getOperand(isConditional() ? i + 1 : i);
    }

    public boolean isTerminator() {
        return true;
    }

    public String getOpcodeName() {
        return "br";
    }
}
