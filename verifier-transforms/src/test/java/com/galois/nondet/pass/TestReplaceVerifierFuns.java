package com.galois.nondet.pass;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.galois.nondet.ModuleFixtures;
import com.galois.nondet.ir.BinaryOperator;
import com.galois.nondet.ir.CallInst;
import com.galois.nondet.ir.CastInst;
import com.galois.nondet.ir.ConstantInt;
import com.galois.nondet.ir.DebugLoc;
import com.galois.nondet.ir.Function;
import com.galois.nondet.ir.GlobalVariable;
import com.galois.nondet.ir.IRBuilder;
import com.galois.nondet.ir.Linkage;
import com.galois.nondet.ir.LoadInst;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.ReturnInst;
import com.galois.nondet.ir.Type;

public class TestReplaceVerifierFuns {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    /** A source file whose line 10 assigns a nondet value to x. */
    private String source() throws IOException {
        List<String> lines = new ArrayList<String>();
        lines.add("#include <stdlib.h>");
        lines.add("extern int __VERIFIER_nondet_int(void);");
        for (int i = 3; i != 9; ++i) {
            lines.add("");
        }
        lines.add("int main() {");
        lines.add("  int x = __VERIFIER_nondet_int();");
        lines.add("  char *p = malloc(x);");
        lines.add("  return x;");
        lines.add("}");
        File f = tmp.newFile("nondet.c");
        Files.write(f.toPath(), lines, StandardCharsets.UTF_8);
        return f.getPath();
    }

    private static ReplaceVerifierFuns pass(String sourcePath) {
        PassOptions options = new PassOptions();
        options.setSourcePath(sourcePath);
        return new ReplaceVerifierFuns(options);
    }

    private static int id(CallInst registration) {
        return ((ConstantInt) registration.getArgOperand(3)).getValue().intValue();
    }

    @Test
    public void replacesNondetCallInMain() throws IOException {
        Module m = ModuleFixtures.nondetModule(10);
        ReplaceVerifierFuns p = pass(source());
        Assert.assertTrue(p.runOnModule(m));

        Function main = ModuleFixtures.getFunction(m, "main");
        Assert.assertTrue(ModuleFixtures.callsTo(main, "__VERIFIER_nondet_int").isEmpty());
        Assert.assertEquals(1, m.getGlobals().size());
        Assert.assertEquals("main:x:10", ModuleFixtures.stringOf(m.getGlobals().get(0)));
        Assert.assertEquals(Linkage.PRIVATE, m.getGlobals().get(0).getLinkage());
        Assert.assertTrue(m.getGlobals().get(0).isConstant());

        List<CallInst> regs = ModuleFixtures.callsTo(main, "klee_make_nondet");
        Assert.assertEquals(1, regs.size());
        Assert.assertEquals(BigInteger.valueOf(4), ((ConstantInt) regs.get(0).getArgOperand(1)).getValue());

        ReturnInst ret = (ReturnInst) main.getEntryBlock().getTerminator();
        LoadInst value = (LoadInst) ret.getReturnValue();
        CastInst addr = (CastInst) regs.get(0).getArgOperand(0);
        Assert.assertSame(addr.getOperand(0), value.getPointerOperand());
        Assert.assertEquals(1, p.getProducerCount());
        Assert.assertEquals(0, p.getAllocationCount());
    }

    @Test
    public void moduleWithoutMatchesIsUntouched() {
        Module m = new Module("plain.c");
        Function free = m.addFunction("free", Type.function(Type.VOID, Type.I8_PTR));
        Function main = m.addFunction("main", Type.function(Type.VOID, Type.I8_PTR));
        IRBuilder b = new IRBuilder(main.appendBlock("entry"));
        b.setCurrentLine(3);
        b.call(free, main.getArg(0));
        b.retVoid();
        byte[] before = ModuleFixtures.bytes(m);

        Assert.assertFalse(pass(null).runOnModule(m));
        Assert.assertArrayEquals(before, ModuleFixtures.bytes(m));
        Assert.assertNull(m.getFunction("klee_make_nondet"));
    }

    @Test
    public void secondRunIsNoOp() throws IOException {
        Module m = ModuleFixtures.nondetModule(10);
        Function malloc = m.addFunction("malloc", ModuleFixtures.MALLOC);
        Function main = ModuleFixtures.getFunction(m, "main");
        CallInst alloc = new CallInst(malloc, new ConstantInt[] { ConstantInt.get(Type.I64, 16) }, "p");
        alloc.setDebugLoc(new DebugLoc(11));
        alloc.insertBefore(main.getEntryBlock().getTerminator());

        String src = source();
        Assert.assertTrue(pass(src).runOnModule(m));
        byte[] once = ModuleFixtures.bytes(m);

        ReplaceVerifierFuns again = pass(src);
        Assert.assertFalse(again.runOnModule(m));
        Assert.assertArrayEquals(once, ModuleFixtures.bytes(m));
        Assert.assertEquals(0, again.getProducerCount());
        Assert.assertEquals(0, again.getAllocationCount());
    }

    @Test
    public void identicalNamesGetDistinctGlobalsAndIds() throws IOException {
        Module m = ModuleFixtures.nondetModule(10);
        Function nondet = m.getFunction("__VERIFIER_nondet_int");
        Function main = ModuleFixtures.getFunction(m, "main");
        CallInst second = new CallInst(nondet, new ConstantInt[0], "again");
        second.setDebugLoc(new DebugLoc(10));
        second.insertBefore(main.getEntryBlock().getTerminator());

        Assert.assertTrue(pass(source()).runOnModule(m));

        List<CallInst> regs = ModuleFixtures.callsTo(main, "klee_make_nondet");
        Assert.assertEquals(2, regs.size());
        Assert.assertEquals(1, id(regs.get(0)));
        Assert.assertEquals(2, id(regs.get(1)));
        Assert.assertEquals("main:x:10", ModuleFixtures.stringOf(regs.get(0).getArgOperand(2)));
        Assert.assertEquals("main:x:10", ModuleFixtures.stringOf(regs.get(1).getArgOperand(2)));

        Assert.assertEquals(2, m.getGlobals().size());
        GlobalVariable g0 = m.getGlobals().get(0);
        GlobalVariable g1 = m.getGlobals().get(1);
        Assert.assertNotSame(g0, g1);
        Assert.assertEquals(".nondet.name", g0.getName());
        Assert.assertEquals(".nondet.name.1", g1.getName());
    }

    @Test
    public void producerAndAllocatorIdsAreIndependent() throws IOException {
        Module m = ModuleFixtures.nondetModule(10);
        Function malloc = m.addFunction("malloc", ModuleFixtures.MALLOC);
        Function main = ModuleFixtures.getFunction(m, "main");
        CallInst alloc = new CallInst(malloc, new ConstantInt[] { ConstantInt.get(Type.I64, 16) }, "p");
        alloc.setDebugLoc(new DebugLoc(11));
        alloc.insertBefore(main.getEntryBlock().getTerminator());

        ReplaceVerifierFuns p = pass(source());
        Assert.assertTrue(p.runOnModule(m));

        List<CallInst> regs = ModuleFixtures.callsTo(main, "klee_make_nondet");
        Assert.assertEquals(2, regs.size());
        Assert.assertEquals(1, id(regs.get(0)));
        Assert.assertEquals(1, id(regs.get(1)));
        Assert.assertEquals("main:dynalloc:11", ModuleFixtures.stringOf(regs.get(1).getArgOperand(2)));
        Assert.assertEquals(1, p.getProducerCount());
        Assert.assertEquals(1, p.getAllocationCount());
    }

    @Test
    public void callocRegistersElementCountTimesSize() throws IOException {
        Module m = new Module("calloc.c");
        Function calloc = m.addFunction("calloc", ModuleFixtures.CALLOC);
        Function main = m.addFunction("main", Type.function(Type.I8_PTR));
        IRBuilder b = new IRBuilder(main.appendBlock("entry"));
        b.setCurrentLine(11);
        CallInst call = b.call(calloc, "q", ConstantInt.get(Type.I64, 3), ConstantInt.get(Type.I64, 8));
        b.ret(call);

        Assert.assertTrue(pass(source()).runOnModule(m));

        CallInst reg = ModuleFixtures.callsTo(main, "klee_make_nondet").get(0);
        BinaryOperator mul = (BinaryOperator) reg.getArgOperand(1);
        Assert.assertEquals(BinaryOperator.Op.MUL, mul.getOp());
        Assert.assertEquals(BigInteger.valueOf(3), ((ConstantInt) mul.getOperand(0)).getValue());
        Assert.assertEquals(BigInteger.valueOf(8), ((ConstantInt) mul.getOperand(1)).getValue());
        Assert.assertSame(call, mul.getNextNode());
    }

    @Test
    public void missingSourceLeavesModuleUnchanged() {
        Module m = ModuleFixtures.nondetModule(10);
        byte[] before = ModuleFixtures.bytes(m);
        String path = new File(tmp.getRoot(), "gone.c").getPath();
        try {
            pass(path).runOnModule(m);
            Assert.fail("expected SourceUnavailableException");
        } catch (SourceUnavailableException e) {
            Assert.assertEquals(path, e.getPath());
        }
        Assert.assertArrayEquals(before, ModuleFixtures.bytes(m));
    }

    @Test
    public void unknownLinesNeedNoSource() {
        Module m = ModuleFixtures.nondetModule(0);
        Assert.assertTrue(pass(null).runOnModule(m));
        CallInst reg = ModuleFixtures.callsTo(ModuleFixtures.getFunction(m, "main"), "klee_make_nondet").get(0);
        Assert.assertEquals("main:--:0", ModuleFixtures.stringOf(reg.getArgOperand(2)));
    }

    @Test
    public void unmatchedLineUsesPlaceholder() throws IOException {
        Module m = ModuleFixtures.nondetModule(9);
        Assert.assertTrue(pass(source()).runOnModule(m));
        CallInst reg = ModuleFixtures.callsTo(ModuleFixtures.getFunction(m, "main"), "klee_make_nondet").get(0);
        Assert.assertEquals("main:--:9", ModuleFixtures.stringOf(reg.getArgOperand(2)));
    }

    @Test(expected=SourceMismatchException.class)
    public void sourceShorterThanDebugInfo() throws IOException {
        pass(source()).runOnModule(ModuleFixtures.nondetModule(400));
    }

    @Test
    public void conflictingEntryPointIsReportedBeforeRewriting() {
        Module m = ModuleFixtures.nondetModule(0);
        m.addGlobalVariable("klee_make_nondet", Type.I32, false, Linkage.EXTERNAL, null);
        byte[] before = ModuleFixtures.bytes(m);
        try {
            pass(null).runOnModule(m);
            Assert.fail("expected InstrumentationException");
        } catch (InstrumentationException e) {
            Assert.assertTrue(e.getMessage().contains("klee_make_nondet"));
        }
        Assert.assertArrayEquals(before, ModuleFixtures.bytes(m));
    }

    @Test
    public void configurableEntryPointAndStatusStream() {
        ByteArrayOutputStream log = new ByteArrayOutputStream();
        PassOptions options = new PassOptions();
        options.setEntryPointName("register_symbolic");
        options.setStatusStream(new PrintStream(log, true));

        Module m = ModuleFixtures.nondetModule(0);
        Assert.assertTrue(new ReplaceVerifierFuns(options).runOnModule(m));
        Assert.assertNull(m.getFunction("klee_make_nondet"));
        Assert.assertEquals(1, ModuleFixtures.callsTo(ModuleFixtures.getFunction(m, "main"),
                                                      "register_symbolic").size());
        Assert.assertTrue(log.toString().startsWith(ReplaceVerifierFuns.NAME + ": "));
    }

    @Test
    public void eachRunStartsFromFreshIdentifiers() {
        ReplaceVerifierFuns p = pass(null);
        Module a = ModuleFixtures.nondetModule(0);
        Module b = ModuleFixtures.nondetModule(0);
        p.runOnModule(a);
        p.runOnModule(b);
        CallInst reg = ModuleFixtures.callsTo(ModuleFixtures.getFunction(b, "main"), "klee_make_nondet").get(0);
        Assert.assertEquals(1, id(reg));
        Assert.assertSame(b.getFunction("klee_make_nondet"), reg.getCalledFunction());
    }
}
