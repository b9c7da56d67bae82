package com.galois.nondet.pass;

/**
 * How a recognized call is instrumented.
 */
public enum CallSiteKind {
    /** Replace the call with a registered stack slot. */
    REWRITE_PRODUCER(CallSite.Category.PRODUCER, 0),
    /** Register <code>arg0</code> bytes of the returned memory. */
    AUGMENT_MALLOC(CallSite.Category.ALLOCATOR, 1),
    /** Register <code>arg0 * arg1</code> bytes of the returned memory. */
    AUGMENT_CALLOC(CallSite.Category.ALLOCATOR, 2);

    private final CallSite.Category category;
    private final int sizeArgCount;

    CallSiteKind(CallSite.Category category, int sizeArgCount) {
        this.category = category;
        this.sizeArgCount = sizeArgCount;
    }

    public CallSite.Category getCategory() {
        return category;
    }

    /** Number of leading call arguments that form the byte count. */
    int getSizeArgCount() {
        return sizeArgCount;
    }
}
