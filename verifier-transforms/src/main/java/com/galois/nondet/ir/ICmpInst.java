package com.galois.nondet.ir;

/** Integer or pointer comparison producing an <code>i1</code>. */
public final class ICmpInst extends Instruction {
    public enum Predicate { EQ, NE, UGT, UGE, ULT, ULE, SGT, SGE, SLT, SLE }

    private final Predicate predicate;

    public ICmpInst(Predicate predicate, Value lhs, Value rhs, String name) {
        super(Type.I1, name);
        if (predicate == null) throw new NullPointerException("predicate");
        if (lhs == null) throw new NullPointerException("lhs");
        if (rhs == null) throw new NullPointerException("rhs");
        if (!lhs.type().equals(rhs.type())
            || !(lhs.type().isInteger() || lhs.type().isPointer())) {
            String msg = String.format("Cannot compare %s with %s", lhs.type(), rhs.type());
            throw new IllegalArgumentException(msg);
        }
        this.predicate = predicate;
        addOperand(lhs);
        addOperand(rhs);
    }

    public Predicate getPredicate() {
        return predicate;
    }

    public String getOpcodeName() {
        return "icmp";
    }
}
