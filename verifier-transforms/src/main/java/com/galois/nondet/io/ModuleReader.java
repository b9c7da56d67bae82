package com.galois.nondet.io;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.protobuf.InvalidProtocolBufferException;

import com.galois.nondet.ir.AllocaInst;
import com.galois.nondet.ir.AttributeList;
import com.galois.nondet.ir.BasicBlock;
import com.galois.nondet.ir.BinaryOperator;
import com.galois.nondet.ir.BranchInst;
import com.galois.nondet.ir.CallInst;
import com.galois.nondet.ir.CastInst;
import com.galois.nondet.ir.Constant;
import com.galois.nondet.ir.ConstantCast;
import com.galois.nondet.ir.ConstantInt;
import com.galois.nondet.ir.ConstantNull;
import com.galois.nondet.ir.ConstantString;
import com.galois.nondet.ir.DataLayout;
import com.galois.nondet.ir.DebugLoc;
import com.galois.nondet.ir.Function;
import com.galois.nondet.ir.GlobalVariable;
import com.galois.nondet.ir.ICmpInst;
import com.galois.nondet.ir.Instruction;
import com.galois.nondet.ir.LoadInst;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.ReturnInst;
import com.galois.nondet.ir.StoreInst;
import com.galois.nondet.ir.Type;
import com.galois.nondet.ir.UndefValue;
import com.galois.nondet.ir.Value;
import com.galois.nondet.proto.Protos;

/**
 * Rebuilds modules from their protocol buffer representation.
 *
 * <p>
 * Globals and function declarations are created first, so initializers
 * and instructions may refer to any of them.  Within a function an
 * instruction may only refer to instructions that precede it in layout
 * order.
 */
public final class ModuleReader {
    private final Protos.Module rep;
    private Module module;

    // Values of the function being read.
    private Function currentFunction;
    private final List<Instruction> insts = new ArrayList<Instruction>();

    private ModuleReader(Protos.Module rep) {
        this.rep = rep;
    }

    /**
     * Read a module from <code>s</code>, which must contain exactly one
     * serialized module.
     */
    public static Module readModule(InputStream s) throws IOException {
        Protos.Module rep;
        try {
            rep = Protos.Module.parseFrom(s);
        } catch (InvalidProtocolBufferException e) {
            throw new InvalidModuleException("Could not parse module: " + e.getMessage(), e);
        }
        return fromModuleRep(rep);
    }

    /**
     * Build a module from its representation.
     *
     * @throws InvalidModuleException if the representation is not well formed
     */
    public static Module fromModuleRep(Protos.Module rep) throws InvalidModuleException {
        try {
            return new ModuleReader(rep).build();
        } catch (IllegalArgumentException e) {
            throw new InvalidModuleException(e.getMessage(), e);
        } catch (UnsupportedOperationException e) {
            throw new InvalidModuleException(e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new InvalidModuleException(e.getMessage(), e);
        }
    }

    private Module build() throws InvalidModuleException {
        module = new Module(rep.getName());
        module.setSourceFileName(rep.getSourceFileName());
        module.setDataLayout(DataLayout.parse(rep.getDataLayout()));

        for (Protos.GlobalVariable g : rep.getGlobalList()) {
            module.addGlobalVariable(g.getName(), Type.fromTypeRep(g.getValueType()),
                                     g.getConstant(), Codes.linkage(g.getLinkage()), null);
        }
        for (Protos.Function f : rep.getFunctionList()) {
            Type t = Type.fromTypeRep(f.getType());
            if (!t.isFunction()) {
                throw new InvalidModuleException("Function " + f.getName() + " has type " + t);
            }
            Function fn = module.addFunction(f.getName(), t, Codes.linkage(f.getLinkage()));
            if (f.getArgNameCount() > fn.getArgCount()) {
                throw new InvalidModuleException("Too many argument names for " + f.getName());
            }
            for (int i = 0; i != f.getArgNameCount(); ++i) {
                fn.getArg(i).setName(f.getArgName(i));
            }
        }

        for (int i = 0; i != rep.getGlobalCount(); ++i) {
            Protos.GlobalVariable g = rep.getGlobal(i);
            if (g.hasInitializer()) {
                module.getGlobals().get(i).setInitializer(readConstant(g.getInitializer()));
            }
        }
        for (int i = 0; i != rep.getFunctionCount(); ++i) {
            readBody(module.getFunctions().get(i), rep.getFunction(i));
        }
        return module;
    }

    private void readBody(Function fn, Protos.Function f) throws InvalidModuleException {
        currentFunction = fn;
        insts.clear();

        List<BasicBlock> blocks = new ArrayList<BasicBlock>();
        for (Protos.Block b : f.getBlockList()) {
            blocks.add(fn.appendBlock(b.getName()));
        }
        for (int i = 0; i != blocks.size(); ++i) {
            BasicBlock bb = blocks.get(i);
            for (Protos.Instruction ir : f.getBlock(i).getInstructionList()) {
                if (bb.getTerminator() != null) {
                    throw new InvalidModuleException(
                        "Block " + bb.getReference() + " has instructions after its terminator.");
                }
                Instruction inst = readInstruction(ir, blocks);
                bb.append(inst);
                insts.add(inst);
            }
        }
        currentFunction = null;
    }

    private Instruction readInstruction(Protos.Instruction ir, List<BasicBlock> blocks)
        throws InvalidModuleException {

        Instruction inst;
        String name = ir.getName();
        switch (ir.getCode()) {
        case AllocaInst:
            expectOperands(ir, 0);
            inst = new AllocaInst(Type.fromTypeRep(ir.getType()), name);
            break;
        case LoadInst:
            expectOperands(ir, 1);
            inst = new LoadInst(operand(ir, 0), name);
            break;
        case StoreInst:
            expectOperands(ir, 2);
            inst = new StoreInst(operand(ir, 0), operand(ir, 1));
            break;
        case CastInst:
            expectOperands(ir, 1);
            inst = new CastInst(Codes.cast(ir.getCastOp()), operand(ir, 0),
                                Type.fromTypeRep(ir.getType()), name);
            break;
        case BinaryInst:
            expectOperands(ir, 2);
            inst = new BinaryOperator(Codes.binary(ir.getBinaryOp()),
                                      operand(ir, 0), operand(ir, 1), name);
            break;
        case ICmpInst:
            expectOperands(ir, 2);
            inst = new ICmpInst(Codes.predicate(ir.getPredicate()),
                                operand(ir, 0), operand(ir, 1), name);
            break;
        case CallInst: {
            if (ir.getOperandCount() == 0) {
                throw new InvalidModuleException("Call without callee.");
            }
            Value[] args = new Value[ir.getOperandCount() - 1];
            for (int i = 0; i != args.length; ++i) {
                args[i] = operand(ir, i + 1);
            }
            CallInst call = new CallInst(operand(ir, 0), args, name);
            if (ir.hasAttributes()) {
                call.setAttributes(readAttributes(ir.getAttributes()));
            }
            inst = call;
            break;
        }
        case BranchInst:
            if (ir.getSuccessorCount() == 1 && ir.getOperandCount() == 0) {
                inst = new BranchInst(block(blocks, ir.getSuccessor(0)));
            } else if (ir.getSuccessorCount() == 2 && ir.getOperandCount() == 1) {
                inst = new BranchInst(operand(ir, 0),
                                      block(blocks, ir.getSuccessor(0)),
                                      block(blocks, ir.getSuccessor(1)));
            } else {
                throw new InvalidModuleException("Malformed branch.");
            }
            break;
        case ReturnInst:
            if (ir.getOperandCount() > 1) {
                throw new InvalidModuleException("Return with more than one value.");
            }
            inst = new ReturnInst(ir.getOperandCount() == 0 ? null : operand(ir, 0));
            break;
        default:
            throw new InvalidModuleException("Unknown instruction code " + ir.getCode());
        }

        if (ir.hasLoc()) {
            inst.setDebugLoc(new DebugLoc(ir.getLoc().getLine(), ir.getLoc().getCol()));
        }
        for (Protos.MetadataEntry md : ir.getMetadataList()) {
            inst.setMetadata(md.getKind(), md.getValue());
        }
        return inst;
    }

    private static void expectOperands(Protos.Instruction ir, int cnt) throws InvalidModuleException {
        if (ir.getOperandCount() != cnt) {
            throw new InvalidModuleException(
                String.format("%s expects %d operands, got %d", ir.getCode(), cnt, ir.getOperandCount()));
        }
    }

    private static BasicBlock block(List<BasicBlock> blocks, int i) throws InvalidModuleException {
        if (Integer.compareUnsigned(i, blocks.size()) >= 0) {
            throw new InvalidModuleException("Branch to unknown block " + Integer.toUnsignedString(i));
        }
        return blocks.get(i);
    }

    /**
     * Check an unsigned <code>uint64</code> index against a list size.
     */
    private static boolean inRange(long idx, int size) {
        return Long.compareUnsigned(idx, size) < 0;
    }

    private static AttributeList readAttributes(Protos.AttributeList a) {
        List<Set<String>> params = new ArrayList<Set<String>>();
        for (Protos.AttributeSet s : a.getParamAttrsList()) {
            params.add(readAttributeSet(s));
        }
        return AttributeList.of(readAttributeSet(a.getFunctionAttrs()),
                                readAttributeSet(a.getReturnAttrs()),
                                params);
    }

    private static Set<String> readAttributeSet(Protos.AttributeSet s) {
        return new LinkedHashSet<String>(s.getAttributeList());
    }

    private Value operand(Protos.Instruction ir, int i) throws InvalidModuleException {
        return readValue(ir.getOperand(i));
    }

    private Value readValue(Protos.ValueRef v) throws InvalidModuleException {
        switch (v.getCode()) {
        case ArgumentRef: {
            long idx = v.getIndex();
            if (currentFunction == null || !inRange(idx, currentFunction.getArgCount())) {
                throw new InvalidModuleException("Invalid argument reference " + Long.toUnsignedString(idx));
            }
            return currentFunction.getArg((int) idx);
        }
        case InstructionRef: {
            long idx = v.getIndex();
            if (currentFunction == null || !inRange(idx, insts.size())) {
                throw new InvalidModuleException("Reference to undefined instruction " + Long.toUnsignedString(idx));
            }
            return insts.get((int) idx);
        }
        default:
            return readConstant(v);
        }
    }

    private Constant readConstant(Protos.ValueRef v) throws InvalidModuleException {
        switch (v.getCode()) {
        case ConstantIntValue: {
            Type t = Type.fromTypeRep(v.getType());
            if (v.getData().isEmpty()) {
                throw new InvalidModuleException("Integer constant without value.");
            }
            return new ConstantInt(t, new BigInteger(v.getData().toByteArray()));
        }
        case ConstantStringValue:
            return new ConstantString(v.getStringLit());
        case ConstantNullValue:
            return new ConstantNull(Type.fromTypeRep(v.getType()));
        case UndefValue:
            return new UndefValue(Type.fromTypeRep(v.getType()));
        case ConstantCastValue:
            if (!v.hasOperand()) {
                throw new InvalidModuleException("Constant cast without operand.");
            }
            return new ConstantCast(Codes.cast(v.getCastOp()), readConstant(v.getOperand()),
                                    Type.fromTypeRep(v.getType()));
        case GlobalVariableRef: {
            List<GlobalVariable> globals = module.getGlobals();
            if (!inRange(v.getIndex(), globals.size())) {
                throw new InvalidModuleException("Invalid global reference " + Long.toUnsignedString(v.getIndex()));
            }
            return globals.get((int) v.getIndex());
        }
        case FunctionRef: {
            List<Function> functions = module.getFunctions();
            if (!inRange(v.getIndex(), functions.size())) {
                throw new InvalidModuleException("Invalid function reference " + Long.toUnsignedString(v.getIndex()));
            }
            return functions.get((int) v.getIndex());
        }
        default:
            throw new InvalidModuleException(v.getCode() + " is not a constant.");
        }
    }
}
