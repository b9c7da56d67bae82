package com.galois.nondet.ir;

/** An unspecified value of a given type. */
public final class UndefValue extends Constant {
    public UndefValue(Type type) {
        super(type, null);
    }

    public String getReference() {
        return "undef";
    }
}
