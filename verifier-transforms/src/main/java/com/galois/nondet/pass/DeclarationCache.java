package com.galois.nondet.pass;

import com.galois.nondet.ir.Function;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.Type;

/**
 * Resolves, once per pass run, the registration function and the size type.
 */
public final class DeclarationCache {
    private final String entryPointName;
    private Function entryPoint;
    private Type sizeType;

    public DeclarationCache(String entryPointName) {
        if (entryPointName == null) throw new NullPointerException("entryPointName");
        this.entryPointName = entryPointName;
    }

    /**
     * Return the registration function
     * <code>void (i8* addr, size_t nbytes, i8* name, i32 id)</code>,
     * declaring it in <code>m</code> on first use if necessary.
     *
     * @throws InstrumentationException if <code>m</code> already uses the
     *   name for something else
     */
    public Function getRegistrationEntryPoint(Module m) {
        if (entryPoint != null) {
            return entryPoint;
        }
        Type fnType = Type.function(Type.VOID, Type.I8_PTR, getSizeType(m), Type.I8_PTR, Type.I32);
        Function existing = m.getFunction(entryPointName);
        if (existing != null && !existing.getFunctionType().equals(fnType)) {
            String msg = String.format("%s is declared as %s, expected %s",
                                       entryPointName, existing.getFunctionType(), fnType);
            throw new InstrumentationException(msg);
        }
        if (existing == null && m.getGlobalVariable(entryPointName) != null) {
            throw new InstrumentationException(entryPointName + " is a global variable in " + m.getName());
        }
        entryPoint = m.getOrInsertFunction(entryPointName, fnType);
        return entryPoint;
    }

    /**
     * Return <code>i64</code> for targets with pointers wider than 32 bits
     * and <code>i32</code> otherwise.
     */
    public Type getSizeType(Module m) {
        if (sizeType == null) {
            if (m.getDataLayout().getPointerSizeInBits() > 32) {
                sizeType = Type.I64;
            } else {
                sizeType = Type.I32;
            }
        }
        return sizeType;
    }
}
