package com.galois.nondet.ir;

/** Linkage of global values. */
public enum Linkage {
    EXTERNAL,
    INTERNAL,
    /** Not visible outside the module and not present in its symbol table. */
    PRIVATE
}
