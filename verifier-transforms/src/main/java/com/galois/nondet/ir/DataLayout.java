package com.galois.nondet.ir;
import java.util.Map;
import java.util.TreeMap;

/**
 * Target data layout: endianness, pointer width, and the ABI alignment of
 * primitive types.
 *
 * <p>
 * Parsed from an LLVM data layout string such as
 * <code>e-m:e-p:32:32-i64:64-n32-S128</code>.  Specifications that do not
 * affect type sizes (mangling, native widths, stack alignment) are
 * accepted and ignored.
 */
public final class DataLayout {
    private final String rep;
    private final boolean bigEndian;
    private final long pointerSizeInBits;
    private final long pointerAbiAlignInBits;
    /** ABI alignment in bits, keyed by integer width. */
    private final TreeMap<Long, Long> intAlignments;
    private final long floatAlignInBits;
    private final long doubleAlignInBits;

    /** The layout used when a module does not specify one. */
    public static final DataLayout DEFAULT = parse("");

    private DataLayout(String rep, boolean bigEndian, long pointerSizeInBits,
                       long pointerAbiAlignInBits, TreeMap<Long, Long> intAlignments,
                       long floatAlignInBits, long doubleAlignInBits) {
        this.rep = rep;
        this.bigEndian = bigEndian;
        this.pointerSizeInBits = pointerSizeInBits;
        this.pointerAbiAlignInBits = pointerAbiAlignInBits;
        this.intAlignments = intAlignments;
        this.floatAlignInBits = floatAlignInBits;
        this.doubleAlignInBits = doubleAlignInBits;
    }

    /**
     * Parse a data layout string.
     * @param s the layout, possibly empty
     * @return the layout
     * @throws IllegalArgumentException if a size specification is malformed
     */
    public static DataLayout parse(String s) {
        if (s == null) throw new NullPointerException("s");
        boolean bigEndian = false;
        long ptrSize = 64;
        long ptrAlign = 64;
        long floatAlign = 32;
        long doubleAlign = 64;
        TreeMap<Long, Long> ints = new TreeMap<Long, Long>();
        ints.put(1L, 8L);
        ints.put(8L, 8L);
        ints.put(16L, 16L);
        ints.put(32L, 32L);
        ints.put(64L, 32L);

        for (String spec : s.split("-")) {
            if (spec.isEmpty()) continue;
            String[] f = spec.split(":");
            char c = spec.charAt(0);
            if (spec.equals("e")) {
                bigEndian = false;
            } else if (spec.equals("E")) {
                bigEndian = true;
            } else if (c == 'p') {
                // Only the default address space determines the size type.
                String as = f[0].substring(1);
                if (!as.isEmpty() && parseBits(spec, as) != 0) continue;
                if (f.length < 3) throw malformed(spec);
                ptrSize = parseBits(spec, f[1]);
                ptrAlign = parseBits(spec, f[2]);
            } else if (c == 'i') {
                if (f.length < 2) throw malformed(spec);
                ints.put(parseBits(spec, f[0].substring(1)), parseBits(spec, f[1]));
            } else if (c == 'f') {
                if (f.length < 2) throw malformed(spec);
                long w = parseBits(spec, f[0].substring(1));
                if (w == 32) {
                    floatAlign = parseBits(spec, f[1]);
                } else if (w == 64) {
                    doubleAlign = parseBits(spec, f[1]);
                }
            }
        }
        if (ptrSize <= 0 || ptrSize % 8 != 0) {
            throw new IllegalArgumentException("Invalid pointer size in data layout: " + ptrSize);
        }
        return new DataLayout(s, bigEndian, ptrSize, ptrAlign, ints, floatAlign, doubleAlign);
    }

    private static long parseBits(String spec, String v) {
        try {
            long r = Long.parseLong(v);
            if (r < 0) throw malformed(spec);
            return r;
        } catch (NumberFormatException e) {
            throw malformed(spec);
        }
    }

    private static IllegalArgumentException malformed(String spec) {
        return new IllegalArgumentException("Malformed data layout specification: " + spec);
    }

    /** The string this layout was parsed from. */
    public String getStringRepresentation() {
        return rep;
    }

    public boolean isBigEndian() {
        return bigEndian;
    }

    public long getPointerSizeInBits() {
        return pointerSizeInBits;
    }

    /**
     * The unsigned integer type as wide as a pointer.
     */
    public Type getIntPtrType() {
        return Type.integer(pointerSizeInBits);
    }

    /**
     * Number of bytes written by a store of type <code>t</code>.
     */
    public long getTypeStoreSize(Type t) {
        if (t.isInteger()) {
            return (t.getIntegerWidth() + 7) / 8;
        }
        if (t.isPointer()) {
            return pointerSizeInBits / 8;
        }
        if (t.equals(Type.FLOAT)) {
            return 4;
        }
        if (t.equals(Type.DOUBLE)) {
            return 8;
        }
        return getTypeAllocSize(t);
    }

    /**
     * Offset in bytes between successive objects of type <code>t</code>,
     * including alignment padding.
     */
    public long getTypeAllocSize(Type t) {
        if (!t.isSized()) {
            throw new IllegalArgumentException("Type " + t + " has no size.");
        }
        if (t.isArray()) {
            return t.getArrayLength() * getTypeAllocSize(t.getArrayElementType());
        }
        if (t.isStruct()) {
            long offset = 0;
            for (int i = 0; i != t.getStructFieldCount(); ++i) {
                Type f = t.getStructFieldType(i);
                offset = alignTo(offset, getABITypeAlignment(f));
                offset += getTypeAllocSize(f);
            }
            return alignTo(offset, getABITypeAlignment(t));
        }
        return alignTo(getTypeStoreSize(t), getABITypeAlignment(t));
    }

    /**
     * ABI alignment of <code>t</code> in bytes.
     */
    public long getABITypeAlignment(Type t) {
        if (t.isInteger()) {
            // Use the alignment of the smallest listed width that fits,
            // or of the largest one if none does.
            Map.Entry<Long, Long> e = intAlignments.ceilingEntry(t.getIntegerWidth());
            if (e == null) {
                e = intAlignments.lastEntry();
            }
            return Math.max(1, e.getValue() / 8);
        }
        if (t.isPointer()) {
            return Math.max(1, pointerAbiAlignInBits / 8);
        }
        if (t.equals(Type.FLOAT)) {
            return Math.max(1, floatAlignInBits / 8);
        }
        if (t.equals(Type.DOUBLE)) {
            return Math.max(1, doubleAlignInBits / 8);
        }
        if (t.isArray()) {
            return getABITypeAlignment(t.getArrayElementType());
        }
        if (t.isStruct()) {
            long a = 1;
            for (int i = 0; i != t.getStructFieldCount(); ++i) {
                a = Math.max(a, getABITypeAlignment(t.getStructFieldType(i)));
            }
            return a;
        }
        throw new IllegalArgumentException("Type " + t + " has no alignment.");
    }

    private static long alignTo(long v, long align) {
        return (v + align - 1) / align * align;
    }

    public String toString() {
        return rep;
    }
}
