package com.galois.nondet.ir;
import java.nio.charset.StandardCharsets;

/**
 * A null-terminated byte string, typed as an <code>i8</code> array whose
 * length includes the terminator.
 */
public final class ConstantString extends Constant {
    private final String v;

    public ConstantString(String v) {
        super(Type.array(Type.I8, v.getBytes(StandardCharsets.UTF_8).length + 1), null);
        this.v = v;
    }

    /** Returns the string without its terminator. */
    public String getString() {
        return v;
    }

    public String getReference() {
        StringBuilder b = new StringBuilder("c\"");
        for (byte c : v.getBytes(StandardCharsets.UTF_8)) {
            int ch = c & 0xff;
            if (ch >= 0x20 && ch < 0x7f && ch != '"' && ch != '\\') {
                b.append((char) ch);
            } else {
                b.append(String.format("\\%02X", ch));
            }
        }
        return b.append("\\00\"").toString();
    }
}
