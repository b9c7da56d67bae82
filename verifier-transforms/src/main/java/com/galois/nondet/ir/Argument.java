package com.galois.nondet.ir;

/**
 * A formal argument of a function.
 */
public final class Argument extends Value {
    private final Function parent;
    private final int index;

    Argument(Function parent, int index, Type type, String name) {
        super(type, name);
        this.parent = parent;
        this.index = index;
    }

    public Function getParent() {
        return parent;
    }

    public int getArgNo() {
        return index;
    }
}
