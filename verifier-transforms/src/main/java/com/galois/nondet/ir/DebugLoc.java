package com.galois.nondet.ir;

/**
 * Source location attached to an instruction by the front end.
 */
public final class DebugLoc {
    private final int line;
    private final int col;

    public DebugLoc(int line, int col) {
        if (line < 0 || col < 0) {
            throw new IllegalArgumentException("Debug locations must not be negative.");
        }
        this.line = line;
        this.col = col;
    }

    public DebugLoc(int line) {
        this(line, 0);
    }

    /** One-based line, or <code>0</code> if the front end did not know it. */
    public int getLine() {
        return line;
    }

    public int getCol() {
        return col;
    }

    public boolean equals(Object o) {
        if (!(o instanceof DebugLoc)) return false;
        DebugLoc r = (DebugLoc) o;
        return line == r.line && col == r.col;
    }

    public int hashCode() {
        return 31 * line + col;
    }

    public String toString() {
        return line + ":" + col;
    }
}
