package com.galois.nondet.ir;

/**
 * Two-operand integer arithmetic.
 */
public final class BinaryOperator extends Instruction {
    public enum Op {
        ADD("add"), SUB("sub"), MUL("mul"),
        UDIV("udiv"), SDIV("sdiv"), UREM("urem"), SREM("srem"),
        AND("and"), OR("or"), XOR("xor"),
        SHL("shl"), LSHR("lshr"), ASHR("ashr");

        private final String mnemonic;

        Op(String mnemonic) {
            this.mnemonic = mnemonic;
        }

        public String getMnemonic() {
            return mnemonic;
        }
    }

    private final Op op;

    public BinaryOperator(Op op, Value lhs, Value rhs, String name) {
        super(checkOperands(lhs, rhs), name);
        if (op == null) throw new NullPointerException("op");
        this.op = op;
        addOperand(lhs);
        addOperand(rhs);
    }

    private static Type checkOperands(Value lhs, Value rhs) {
        if (lhs == null) throw new NullPointerException("lhs");
        if (rhs == null) throw new NullPointerException("rhs");
        if (!lhs.type().isInteger() || !lhs.type().equals(rhs.type())) {
            String msg = String.format("Binary operands must be integers of one type, got %s and %s",
                                       lhs.type(), rhs.type());
            throw new IllegalArgumentException(msg);
        }
        return lhs.type();
    }

    public Op getOp() {
        return op;
    }

    public String getOpcodeName() {
        return op.getMnemonic();
    }
}
