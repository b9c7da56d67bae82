package com.galois.nondet.ir;

import org.junit.Assert;
import org.junit.Test;

public class TestDataLayout {

    @Test
    public void defaultLayoutIs64Bit() {
        DataLayout dl = DataLayout.DEFAULT;
        Assert.assertFalse(dl.isBigEndian());
        Assert.assertEquals(64, dl.getPointerSizeInBits());
        Assert.assertEquals(Type.I64, dl.getIntPtrType());
        Assert.assertEquals(8, dl.getTypeAllocSize(Type.I8_PTR));
        Assert.assertEquals(4, dl.getTypeAllocSize(Type.I32));
        Assert.assertEquals(1, dl.getTypeAllocSize(Type.I1));
        Assert.assertEquals(8, dl.getTypeAllocSize(Type.DOUBLE));
    }

    @Test
    public void parsesPointerAndIntegerSpecs() {
        DataLayout dl = DataLayout.parse("e-m:e-p:32:32-i64:64-n32-S128");
        Assert.assertEquals(32, dl.getPointerSizeInBits());
        Assert.assertEquals(Type.I32, dl.getIntPtrType());
        Assert.assertEquals(4, dl.getTypeAllocSize(Type.pointer(Type.I32)));
        Assert.assertEquals(8, dl.getABITypeAlignment(Type.I64));
        Assert.assertEquals("e-m:e-p:32:32-i64:64-n32-S128", dl.getStringRepresentation());
    }

    @Test
    public void bigEndian() {
        Assert.assertTrue(DataLayout.parse("E-p:64:64").isBigEndian());
    }

    @Test
    public void otherAddressSpacesDoNotChangePointerSize() {
        DataLayout dl = DataLayout.parse("p1:32:32");
        Assert.assertEquals(64, dl.getPointerSizeInBits());
    }

    @Test
    public void structSizesIncludePadding() {
        Type s = Type.struct(Type.I8, Type.I64);
        // i64 is 4-byte aligned unless the layout says otherwise.
        Assert.assertEquals(12, DataLayout.DEFAULT.getTypeAllocSize(s));
        Assert.assertEquals(16, DataLayout.parse("i64:64").getTypeAllocSize(s));
        Assert.assertEquals(40, DataLayout.DEFAULT.getTypeAllocSize(Type.array(Type.I32, 10)));
    }

    @Test
    public void oddIntegerWidthsRoundUp() {
        Assert.assertEquals(2, DataLayout.DEFAULT.getTypeStoreSize(Type.integer(9)));
        Assert.assertEquals(2, DataLayout.DEFAULT.getTypeAllocSize(Type.integer(9)));
    }

    @Test(expected=IllegalArgumentException.class)
    public void malformedPointerSpec() {
        DataLayout.parse("p:abc:32");
    }

    @Test(expected=IllegalArgumentException.class)
    public void voidHasNoSize() {
        DataLayout.DEFAULT.getTypeAllocSize(Type.VOID);
    }
}
