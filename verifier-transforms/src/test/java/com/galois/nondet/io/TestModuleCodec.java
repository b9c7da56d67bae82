package com.galois.nondet.io;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import com.google.protobuf.ByteString;
import org.junit.Assert;
import org.junit.Test;

import com.galois.nondet.ModuleFixtures;
import com.galois.nondet.ir.AttributeList;
import com.galois.nondet.ir.BasicBlock;
import com.galois.nondet.ir.BranchInst;
import com.galois.nondet.ir.CallInst;
import com.galois.nondet.ir.ConstantCast;
import com.galois.nondet.ir.ConstantInt;
import com.galois.nondet.ir.DataLayout;
import com.galois.nondet.ir.DebugLoc;
import com.galois.nondet.ir.Function;
import com.galois.nondet.ir.ICmpInst;
import com.galois.nondet.ir.IRBuilder;
import com.galois.nondet.ir.Instruction;
import com.galois.nondet.ir.LoadInst;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.Type;
import com.galois.nondet.pass.PassOptions;
import com.galois.nondet.pass.ReplaceVerifierFuns;
import com.galois.nondet.proto.Protos;

public class TestModuleCodec {

    /**
     * <pre>
     * int clamp(int x) {
     *   int *p = malloc(4);
     *   if (x &lt; 0) return 0;
     *   *p = x;
     *   return *p;
     * }
     * </pre>
     */
    private static Module clampModule() {
        Module m = new Module("clamp.c");
        m.setSourceFileName("clamp.c");
        m.setDataLayout(DataLayout.parse("e-m:e-i64:64-n8:16:32:64-S128"));
        Function malloc = m.addFunction("malloc", ModuleFixtures.MALLOC);
        Function clamp = m.addFunction("clamp", Type.function(Type.I32, Type.I32));
        clamp.getArg(0).setName("x");

        BasicBlock entry = clamp.appendBlock("entry");
        BasicBlock neg = clamp.appendBlock("neg");
        BasicBlock pos = clamp.appendBlock("pos");

        IRBuilder b = new IRBuilder(entry);
        b.setCurrentLine(2);
        CallInst raw = b.call(malloc, "raw", ConstantInt.get(Type.I64, 4));
        raw.setAttributes(AttributeList.EMPTY.addReturnAttribute("noalias").addFunctionAttribute("nounwind"));
        raw.setMetadata("heapallocsite", "!12");
        Instruction p = b.pointerCast(raw, Type.pointer(Type.I32), "p");
        b.setCurrentDebugLocation(new DebugLoc(3, 9));
        ICmpInst isNeg = b.icmp(ICmpInst.Predicate.SLT, clamp.getArg(0), ConstantInt.get(Type.I32, 0), "isneg");
        b.condBr(isNeg, neg, pos);

        b.setInsertPoint(neg);
        b.ret(ConstantInt.get(Type.I32, 0));

        b.setInsertPoint(pos);
        b.setCurrentLine(4);
        b.store(clamp.getArg(0), p);
        b.setCurrentLine(5);
        b.ret(b.load(p, "v"));
        return m;
    }

    private static Module reread(Module m) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ModuleWriter.writeModule(m, out);
        return ModuleReader.readModule(new ByteArrayInputStream(out.toByteArray()));
    }

    @Test
    public void readBackPreservesStructure() throws IOException {
        Module m = reread(clampModule());
        Assert.assertEquals("clamp.c", m.getName());
        Assert.assertEquals("clamp.c", m.getSourceFileName());
        Assert.assertEquals(64, m.getDataLayout().getPointerSizeInBits());

        Function clamp = m.getFunction("clamp");
        Assert.assertEquals("x", clamp.getArg(0).getName());
        Assert.assertEquals(3, clamp.getBlocks().size());
        Assert.assertTrue(m.getFunction("malloc").isDeclaration());

        List<Instruction> entry = clamp.getEntryBlock().getInstructions();
        CallInst raw = (CallInst) entry.get(0);
        Assert.assertSame(m.getFunction("malloc"), raw.getCalledFunction());
        Assert.assertEquals(new DebugLoc(2), raw.getDebugLoc());
        Assert.assertEquals("!12", raw.getMetadata("heapallocsite"));
        Assert.assertTrue(raw.getAttributes().getReturnAttributes().contains("noalias"));
        Assert.assertSame(raw, entry.get(1).getOperand(0));

        BranchInst br = (BranchInst) entry.get(3);
        Assert.assertSame(entry.get(2), br.getCondition());
        Assert.assertSame(clamp.getBlocks().get(1), br.getSuccessor(0));
        Assert.assertSame(clamp.getBlocks().get(2), br.getSuccessor(1));
        Assert.assertEquals(new DebugLoc(3, 9), br.getDebugLoc());

        LoadInst v = (LoadInst) clamp.getBlocks().get(2).getInstructions().get(1);
        Assert.assertSame(entry.get(1), v.getPointerOperand());
        Assert.assertEquals(2, entry.get(1).getNumUses());
    }

    @Test
    public void writingIsDeterministic() throws IOException {
        Module m = clampModule();
        Assert.assertArrayEquals(ModuleFixtures.bytes(m), ModuleFixtures.bytes(m));
        Assert.assertArrayEquals(ModuleFixtures.bytes(m), ModuleFixtures.bytes(reread(m)));
    }

    @Test
    public void instrumentedModuleSurvivesReading() throws IOException {
        Module m = ModuleFixtures.nondetModule(0);
        new ReplaceVerifierFuns(new PassOptions()).runOnModule(m);
        Module copy = reread(m);
        Assert.assertArrayEquals(ModuleFixtures.bytes(m), ModuleFixtures.bytes(copy));

        CallInst reg = ModuleFixtures.callsTo(copy.getFunction("main"), "klee_make_nondet").get(0);
        Assert.assertEquals("main:--:0", ModuleFixtures.stringOf(reg.getArgOperand(2)));
        Assert.assertSame(copy.getGlobals().get(0),
                          ((ConstantCast) reg.getArgOperand(2)).getCastOperand());
    }

    @Test(expected=InvalidModuleException.class)
    public void forwardInstructionReferenceIsRejected() throws IOException {
        Protos.Module.Builder b = ModuleWriter.getModuleRep(clampModule()).toBuilder();
        // Make the first instruction of clamp refer to the cast that follows it.
        Protos.Function.Builder f = b.getFunctionBuilder(1);
        Protos.Instruction.Builder call = f.getBlockBuilder(0).getInstructionBuilder(0);
        call.setOperand(1, Protos.ValueRef.newBuilder()
                        .setCode(Protos.ValueCode.InstructionRef)
                        .setIndex(1));
        ModuleReader.fromModuleRep(b.build());
    }

    @Test(expected=InvalidModuleException.class)
    public void typeErrorsAreReportedAsInvalidModules() throws IOException {
        Protos.Module.Builder b = ModuleWriter.getModuleRep(clampModule()).toBuilder();
        // Pass an i32 to malloc.
        b.getFunctionBuilder(1).getBlockBuilder(0).getInstructionBuilder(0)
            .setOperand(1, Protos.ValueRef.newBuilder()
                        .setCode(Protos.ValueCode.ConstantIntValue)
                        .setType(Type.I32.getTypeRep())
                        .setData(ByteString.copyFrom(new byte[] { 4 })));
        ModuleReader.fromModuleRep(b.build());
    }

    private static void assertRejected(Protos.Module rep) {
        try {
            ModuleReader.fromModuleRep(rep);
            Assert.fail("expected InvalidModuleException");
        } catch (InvalidModuleException e) {
            // expected
        }
    }

    private static Protos.ValueRef ref(Protos.ValueCode code, long index) {
        return Protos.ValueRef.newBuilder().setCode(code).setIndex(index).build();
    }

    @Test
    public void indicesAboveSignedRangeAreRejected() {
        Protos.Module rep = ModuleWriter.getModuleRep(clampModule());

        // ret of the pos block returns the load; point it past the signed range.
        Protos.Module.Builder b = rep.toBuilder();
        b.getFunctionBuilder(1).getBlockBuilder(2).getInstructionBuilder(2)
            .setOperand(0, ref(Protos.ValueCode.InstructionRef, -1L));
        assertRejected(b.build());

        // icmp compares argument x.
        b = rep.toBuilder();
        b.getFunctionBuilder(1).getBlockBuilder(0).getInstructionBuilder(2)
            .setOperand(0, ref(Protos.ValueCode.ArgumentRef, Long.MIN_VALUE));
        assertRejected(b.build());

        // The call of malloc.
        b = rep.toBuilder();
        b.getFunctionBuilder(1).getBlockBuilder(0).getInstructionBuilder(0)
            .setOperand(0, ref(Protos.ValueCode.FunctionRef, -1L));
        assertRejected(b.build());

        b = rep.toBuilder();
        b.getFunctionBuilder(1).getBlockBuilder(0).getInstructionBuilder(0)
            .setOperand(0, ref(Protos.ValueCode.GlobalVariableRef, -2L));
        assertRejected(b.build());

        // Conditional branch at the end of entry.
        b = rep.toBuilder();
        b.getFunctionBuilder(1).getBlockBuilder(0).getInstructionBuilder(3)
            .setSuccessor(1, -1);
        assertRejected(b.build());
    }

    @Test
    public void instructionAfterTerminatorIsRejected() {
        Protos.Module.Builder b = ModuleWriter.getModuleRep(clampModule()).toBuilder();
        Protos.Block.Builder neg = b.getFunctionBuilder(1).getBlockBuilder(1);
        neg.addInstruction(neg.getInstruction(0));
        try {
            ModuleReader.fromModuleRep(b.build());
            Assert.fail("expected InvalidModuleException");
        } catch (InvalidModuleException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("%neg"));
        }
    }

    @Test(expected=InvalidModuleException.class)
    public void garbageIsRejected() throws IOException {
        ModuleReader.readModule(new ByteArrayInputStream(new byte[] { 0x0a, 0x7f, 0x01 }));
    }
}
