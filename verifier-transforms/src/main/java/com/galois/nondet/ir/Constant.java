package com.galois.nondet.ir;

/**
 * Values that are fixed before the program runs.
 */
public abstract class Constant extends User {
    protected Constant(Type type, String name) {
        super(type, name);
    }
}
