package com.galois.nondet.ir;
import java.math.BigInteger;

/** An integer literal. */
public final class ConstantInt extends Constant {
    private final BigInteger v;

    public ConstantInt(Type type, BigInteger v) {
        super(type, null);
        if (v == null) throw new NullPointerException("v");
        if (!type.isInteger()) {
            throw new IllegalArgumentException("Integer constant must have integer type, not " + type);
        }
        this.v = v;
    }

    public static ConstantInt get(Type type, long v) {
        return new ConstantInt(type, BigInteger.valueOf(v));
    }

    public BigInteger getValue() {
        return v;
    }

    public String getReference() {
        return v.toString();
    }

    public boolean equals(Object o) {
        if (!(o instanceof ConstantInt)) return false;
        ConstantInt r = (ConstantInt) o;
        return type().equals(r.type()) && v.equals(r.v);
    }

    public int hashCode() {
        return type().hashCode() ^ v.hashCode();
    }
}
