package com.galois.nondet.ir;

/** Writes a value to memory. Operand 0 is the value, operand 1 the address. */
public final class StoreInst extends Instruction {
    public StoreInst(Value val, Value ptr) {
        super(Type.VOID, null);
        if (val == null) throw new NullPointerException("val");
        if (ptr == null) throw new NullPointerException("ptr");
        if (!ptr.type().equals(Type.pointer(val.type()))) {
            String msg = String.format("Cannot store %s through %s", val.type(), ptr.type());
            throw new IllegalArgumentException(msg);
        }
        addOperand(val);
        addOperand(ptr);
    }

    public Value getValueOperand() {
        return getOperand(0);
    }

    public Value getPointerOperand() {
        return getOperand(1);
    }

    public String getOpcodeName() {
        return "store";
    }
}
