package com.galois.nondet.ir;

/**
 * Converts a value to another type.
 */
public final class CastInst extends Instruction {
    public enum Op {
        BITCAST("bitcast"),
        PTR_TO_INT("ptrtoint"),
        INT_TO_PTR("inttoptr"),
        TRUNC("trunc"),
        ZEXT("zext"),
        SEXT("sext");

        private final String mnemonic;

        Op(String mnemonic) {
            this.mnemonic = mnemonic;
        }

        public String getMnemonic() {
            return mnemonic;
        }
    }

    private final Op op;

    public CastInst(Op op, Value v, Type destType, String name) {
        super(destType, name);
        if (v == null) throw new NullPointerException("v");
        checkCast(op, v.type(), destType);
        this.op = op;
        addOperand(v);
    }

    /**
     * Create the cast that reinterprets a pointer or integer <code>v</code>
     * as <code>destType</code>, where at least one side is a pointer.
     */
    public static CastInst createPointerCast(Value v, Type destType, String name) {
        return new CastInst(pointerCastOp(v.type(), destType), v, destType, name);
    }

    static Op pointerCastOp(Type src, Type dest) {
        if (src.isPointer() && dest.isPointer()) {
            return Op.BITCAST;
        }
        if (src.isPointer() && dest.isInteger()) {
            return Op.PTR_TO_INT;
        }
        if (src.isInteger() && dest.isPointer()) {
            return Op.INT_TO_PTR;
        }
        throw new IllegalArgumentException(String.format("No pointer cast from %s to %s", src, dest));
    }

    static void checkCast(Op op, Type src, Type dest) {
        if (op == null) throw new NullPointerException("op");
        if (dest == null) throw new NullPointerException("destType");
        boolean ok;
        switch (op) {
        case BITCAST:
            ok = src.isPointer() && dest.isPointer();
            break;
        case PTR_TO_INT:
            ok = src.isPointer() && dest.isInteger();
            break;
        case INT_TO_PTR:
            ok = src.isInteger() && dest.isPointer();
            break;
        case TRUNC:
            ok = src.isInteger() && dest.isInteger()
                && src.getIntegerWidth() > dest.getIntegerWidth();
            break;
        default:
            ok = src.isInteger() && dest.isInteger()
                && src.getIntegerWidth() < dest.getIntegerWidth();
            break;
        }
        if (!ok) {
            String msg = String.format("Invalid %s from %s to %s", op.getMnemonic(), src, dest);
            throw new IllegalArgumentException(msg);
        }
    }

    public Op getOp() {
        return op;
    }

    public Type getDestType() {
        return type();
    }

    public String getOpcodeName() {
        return op.getMnemonic();
    }
}
