package com.galois.nondet.pass;

import com.galois.nondet.ir.Constant;
import com.galois.nondet.ir.ConstantCast;
import com.galois.nondet.ir.ConstantString;
import com.galois.nondet.ir.GlobalVariable;
import com.galois.nondet.ir.Linkage;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.Type;

/**
 * Names given to registered objects: <code>function:variable:line</code>.
 */
final class DiagnosticName {
    /** Base symbol name of the emitted string globals. */
    static final String GLOBAL_BASE_NAME = ".nondet.name";

    private DiagnosticName() {}

    static String format(String function, String variable, int line) {
        return function + ":" + variable + ":" + line;
    }

    /**
     * Add a fresh private constant holding <code>text</code>.  Globals are
     * never shared between sites, even for equal text.
     *
     * @return the global viewed as an <code>i8*</code>
     */
    static Constant emit(Module m, String text) {
        ConstantString init = new ConstantString(text);
        GlobalVariable g = m.addGlobalVariable(m.getUniqueGlobalName(GLOBAL_BASE_NAME),
                                               init.type(), true, Linkage.PRIVATE, init);
        return ConstantCast.getPointerCast(g, Type.I8_PTR);
    }
}
