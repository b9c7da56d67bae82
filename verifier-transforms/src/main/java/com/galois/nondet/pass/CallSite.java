package com.galois.nondet.pass;

import com.galois.nondet.ir.CallInst;

/**
 * One call to a recognized external function, recorded during scanning.
 */
public final class CallSite {
    /**
     * Whether the callee returns a nondeterministic value or allocates memory.
     */
    public enum Category { PRODUCER, ALLOCATOR }

    /** Line recorded for calls without a usable debug location. */
    public static final int UNKNOWN_LINE = 0;

    private final CallSiteKind kind;
    private final int line;
    private final CallInst call;

    CallSite(CallSiteKind kind, int line, CallInst call) {
        if (kind == null) throw new NullPointerException("kind");
        if (call == null) throw new NullPointerException("call");
        this.kind = kind;
        this.line = line;
        this.call = call;
    }

    public CallSiteKind getKind() {
        return kind;
    }

    public Category getCategory() {
        return kind.getCategory();
    }

    /**
     * One-based source line, or {@link #UNKNOWN_LINE}.
     */
    public int getLine() {
        return line;
    }

    public boolean hasKnownLine() {
        return line != UNKNOWN_LINE;
    }

    public CallInst getCall() {
        return call;
    }

    public String toString() {
        return String.format("%s call to %s at line %d", kind, call.getCalledFunction().getName(), line);
    }
}
