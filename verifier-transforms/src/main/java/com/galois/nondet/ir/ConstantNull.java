package com.galois.nondet.ir;

/** The null pointer of a given pointer type. */
public final class ConstantNull extends Constant {
    public ConstantNull(Type type) {
        super(type, null);
        if (!type.isPointer()) {
            throw new IllegalArgumentException("null must have pointer type, not " + type);
        }
    }

    public String getReference() {
        return "null";
    }
}
