package com.galois.nondet.ir;

/**
 * A cast applied to a constant, such as the <code>i8*</code> view of a
 * global string.
 */
public final class ConstantCast extends Constant {
    private final CastInst.Op op;

    public ConstantCast(CastInst.Op op, Constant c, Type destType) {
        super(destType, null);
        CastInst.checkCast(op, c.type(), destType);
        this.op = op;
        addOperand(c);
    }

    /**
     * Returns <code>c</code> viewed as <code>destType</code>, or
     * <code>c</code> itself if it already has that type.
     */
    public static Constant getPointerCast(Constant c, Type destType) {
        if (c.type().equals(destType)) {
            return c;
        }
        return new ConstantCast(CastInst.pointerCastOp(c.type(), destType), c, destType);
    }

    public CastInst.Op getOp() {
        return op;
    }

    public Constant getCastOperand() {
        return (Constant) getOperand(0);
    }

    public String getReference() {
        return String.format("%s (%s to %s)", op.getMnemonic(), getOperand(0), type());
    }
}
