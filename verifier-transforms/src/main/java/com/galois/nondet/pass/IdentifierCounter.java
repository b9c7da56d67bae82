package com.galois.nondet.pass;

/**
 * Source of registration identifiers: 1, 2, 3, ...
 */
final class IdentifierCounter {
    private int last;

    int next() {
        if (last == Integer.MAX_VALUE) {
            throw new InstrumentationException("Ran out of 32-bit registration identifiers.");
        }
        return ++last;
    }

    /** The most recently issued identifier, or 0. */
    int current() {
        return last;
    }
}
