package com.galois.nondet.pass;

import org.junit.Assert;
import org.junit.Test;

import com.galois.nondet.ir.DataLayout;
import com.galois.nondet.ir.Function;
import com.galois.nondet.ir.Linkage;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.Type;

public class TestDeclarationCache {

    @Test
    public void declaresEntryPointOnce() {
        Module m = new Module("m");
        DeclarationCache cache = new DeclarationCache(PassOptions.DEFAULT_ENTRY_POINT);
        Function f = cache.getRegistrationEntryPoint(m);
        Assert.assertEquals("klee_make_nondet", f.getName());
        Assert.assertTrue(f.isDeclaration());
        Assert.assertEquals(Type.function(Type.VOID, Type.I8_PTR, Type.I64, Type.I8_PTR, Type.I32),
                            f.getFunctionType());
        Assert.assertSame(f, cache.getRegistrationEntryPoint(m));
        Assert.assertEquals(1, m.getFunctions().size());
    }

    @Test
    public void reusesExistingDeclaration() {
        Module m = new Module("m");
        Function existing = m.addFunction("klee_make_nondet",
            Type.function(Type.VOID, Type.I8_PTR, Type.I64, Type.I8_PTR, Type.I32));
        DeclarationCache cache = new DeclarationCache(PassOptions.DEFAULT_ENTRY_POINT);
        Assert.assertSame(existing, cache.getRegistrationEntryPoint(m));
    }

    @Test
    public void sizeTypeFollowsPointerWidth() {
        Module m32 = new Module("m32");
        m32.setDataLayout(DataLayout.parse("e-p:32:32"));
        Assert.assertEquals(Type.I32, new DeclarationCache("f").getSizeType(m32));

        Module m64 = new Module("m64");
        Assert.assertEquals(Type.I64, new DeclarationCache("f").getSizeType(m64));

        DeclarationCache cache = new DeclarationCache("register_symbolic");
        Function f = cache.getRegistrationEntryPoint(m32);
        Assert.assertEquals(Type.I32, f.getFunctionType().getFunctionParamType(1));
    }

    @Test(expected=InstrumentationException.class)
    public void conflictingSignature() {
        Module m = new Module("m");
        m.addFunction("klee_make_nondet", Type.function(Type.VOID, Type.I8_PTR));
        new DeclarationCache(PassOptions.DEFAULT_ENTRY_POINT).getRegistrationEntryPoint(m);
    }

    @Test(expected=InstrumentationException.class)
    public void conflictingGlobal() {
        Module m = new Module("m");
        m.addGlobalVariable("klee_make_nondet", Type.I32, false, Linkage.EXTERNAL, null);
        new DeclarationCache(PassOptions.DEFAULT_ENTRY_POINT).getRegistrationEntryPoint(m);
    }
}
