package com.galois.nondet.io;

import java.io.IOException;
import java.io.OutputStream;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.protobuf.ByteString;

import com.galois.nondet.ir.AllocaInst;
import com.galois.nondet.ir.Argument;
import com.galois.nondet.ir.AttributeList;
import com.galois.nondet.ir.BasicBlock;
import com.galois.nondet.ir.BinaryOperator;
import com.galois.nondet.ir.BranchInst;
import com.galois.nondet.ir.CallInst;
import com.galois.nondet.ir.CastInst;
import com.galois.nondet.ir.ConstantCast;
import com.galois.nondet.ir.ConstantInt;
import com.galois.nondet.ir.ConstantNull;
import com.galois.nondet.ir.ConstantString;
import com.galois.nondet.ir.DebugLoc;
import com.galois.nondet.ir.Function;
import com.galois.nondet.ir.GlobalVariable;
import com.galois.nondet.ir.ICmpInst;
import com.galois.nondet.ir.Instruction;
import com.galois.nondet.ir.LoadInst;
import com.galois.nondet.ir.Module;
import com.galois.nondet.ir.ReturnInst;
import com.galois.nondet.ir.StoreInst;
import com.galois.nondet.ir.UndefValue;
import com.galois.nondet.ir.Value;
import com.galois.nondet.proto.Protos;

/**
 * Builds the protocol buffer representation of a module.
 *
 * <p>
 * The representation is deterministic: writing the same module twice
 * yields the same bytes.
 */
public final class ModuleWriter {
    private final Module module;
    private final Map<Value, Integer> globalIndex = new IdentityHashMap<Value, Integer>();
    private final Map<Value, Integer> functionIndex = new IdentityHashMap<Value, Integer>();

    // Indices local to the function being written.
    private Function currentFunction;
    private final Map<Value, Integer> instIndex = new IdentityHashMap<Value, Integer>();
    private final Map<BasicBlock, Integer> blockIndex = new IdentityHashMap<BasicBlock, Integer>();

    private ModuleWriter(Module module) {
        this.module = module;
        int i = 0;
        for (GlobalVariable g : module.getGlobals()) {
            globalIndex.put(g, i++);
        }
        i = 0;
        for (Function f : module.getFunctions()) {
            functionIndex.put(f, i++);
        }
    }

    /**
     * Get the Protocol buffer representation.
     * @param m the module
     * @return the representation object.
     */
    public static Protos.Module getModuleRep(Module m) {
        return new ModuleWriter(m).build();
    }

    /**
     * Write the representation of <code>m</code> to a stream.
     */
    public static void writeModule(Module m, OutputStream s) throws IOException {
        getModuleRep(m).writeTo(s);
        s.flush();
    }

    private Protos.Module build() {
        Protos.Module.Builder b
            = Protos.Module.newBuilder()
            .setName(module.getName())
            .setSourceFileName(module.getSourceFileName())
            .setDataLayout(module.getDataLayout().getStringRepresentation());
        for (GlobalVariable g : module.getGlobals()) {
            b.addGlobal(getGlobalRep(g));
        }
        for (Function f : module.getFunctions()) {
            b.addFunction(getFunctionRep(f));
        }
        return b.build();
    }

    private Protos.GlobalVariable getGlobalRep(GlobalVariable g) {
        Protos.GlobalVariable.Builder b
            = Protos.GlobalVariable.newBuilder()
            .setName(g.getName())
            .setValueType(g.getValueType().getTypeRep())
            .setConstant(g.isConstant())
            .setLinkage(Codes.linkageRep(g.getLinkage()));
        if (g.hasInitializer()) {
            b.setInitializer(getValueRef(g.getInitializer()));
        }
        return b.build();
    }

    private Protos.Function getFunctionRep(Function f) {
        Protos.Function.Builder b
            = Protos.Function.newBuilder()
            .setName(f.getName())
            .setType(f.getFunctionType().getTypeRep())
            .setLinkage(Codes.linkageRep(f.getLinkage()));
        for (Argument a : f.getArgs()) {
            b.addArgName(a.getName());
        }

        currentFunction = f;
        instIndex.clear();
        blockIndex.clear();
        List<BasicBlock> blocks = f.getBlocks();
        for (int i = 0; i != blocks.size(); ++i) {
            blockIndex.put(blocks.get(i), i);
        }
        int n = 0;
        for (BasicBlock block : blocks) {
            for (Instruction inst : block.getInstructions()) {
                instIndex.put(inst, n++);
            }
        }

        for (BasicBlock block : blocks) {
            Protos.Block.Builder bb = Protos.Block.newBuilder().setName(block.getName());
            for (Instruction inst : block.getInstructions()) {
                bb.addInstruction(getInstructionRep(inst));
            }
            b.addBlock(bb);
        }
        currentFunction = null;
        return b.build();
    }

    private Protos.Instruction getInstructionRep(Instruction inst) {
        Protos.Instruction.Builder b
            = Protos.Instruction.newBuilder()
            .setName(inst.getName());

        if (inst instanceof AllocaInst) {
            b.setCode(Protos.InstructionCode.AllocaInst)
             .setType(((AllocaInst) inst).getAllocatedType().getTypeRep());
        } else if (inst instanceof LoadInst) {
            b.setCode(Protos.InstructionCode.LoadInst);
        } else if (inst instanceof StoreInst) {
            b.setCode(Protos.InstructionCode.StoreInst);
        } else if (inst instanceof CastInst) {
            b.setCode(Protos.InstructionCode.CastInst)
             .setCastOp(Codes.castRep(((CastInst) inst).getOp()))
             .setType(inst.type().getTypeRep());
        } else if (inst instanceof BinaryOperator) {
            b.setCode(Protos.InstructionCode.BinaryInst)
             .setBinaryOp(Codes.binaryRep(((BinaryOperator) inst).getOp()));
        } else if (inst instanceof ICmpInst) {
            b.setCode(Protos.InstructionCode.ICmpInst)
             .setPredicate(Codes.predicateRep(((ICmpInst) inst).getPredicate()));
        } else if (inst instanceof CallInst) {
            b.setCode(Protos.InstructionCode.CallInst);
            AttributeList attrs = ((CallInst) inst).getAttributes();
            if (!attrs.isEmpty()) {
                b.setAttributes(getAttributesRep(attrs));
            }
        } else if (inst instanceof BranchInst) {
            BranchInst br = (BranchInst) inst;
            b.setCode(Protos.InstructionCode.BranchInst);
            if (br.isConditional()) {
                b.addOperand(getValueRef(br.getCondition()));
            }
            for (int i = 0; i != br.getNumSuccessors(); ++i) {
                b.addSuccessor(blockIndexOf(br.getSuccessor(i)));
            }
        } else if (inst instanceof ReturnInst) {
            b.setCode(Protos.InstructionCode.ReturnInst);
        } else {
            throw new IllegalArgumentException("Unsupported instruction: " + inst.getOpcodeName());
        }

        if (!(inst instanceof BranchInst)) {
            for (Value op : inst.getOperands()) {
                b.addOperand(getValueRef(op));
            }
        }

        DebugLoc loc = inst.getDebugLoc();
        if (loc != null) {
            b.setLoc(Protos.DebugLoc.newBuilder()
                     .setLine(loc.getLine())
                     .setCol(loc.getCol()));
        }
        for (Map.Entry<String, String> md : inst.getAllMetadata().entrySet()) {
            b.addMetadata(Protos.MetadataEntry.newBuilder()
                          .setKind(md.getKey())
                          .setValue(md.getValue()));
        }
        return b.build();
    }

    private static Protos.AttributeList getAttributesRep(AttributeList attrs) {
        Protos.AttributeList.Builder b
            = Protos.AttributeList.newBuilder()
            .setFunctionAttrs(getAttributeSetRep(attrs.getFunctionAttributes()))
            .setReturnAttrs(getAttributeSetRep(attrs.getReturnAttributes()));
        for (int i = 0; i != attrs.getNumParamSets(); ++i) {
            b.addParamAttrs(getAttributeSetRep(attrs.getParamAttributes(i)));
        }
        return b.build();
    }

    private static Protos.AttributeSet getAttributeSetRep(Set<String> s) {
        return Protos.AttributeSet.newBuilder().addAllAttribute(s).build();
    }

    private int blockIndexOf(BasicBlock b) {
        Integer i = blockIndex.get(b);
        if (i == null) {
            throw new IllegalArgumentException("Branch to a block of another function: " + b.getReference());
        }
        return i;
    }

    private Protos.ValueRef getValueRef(Value v) {
        Protos.ValueRef.Builder b = Protos.ValueRef.newBuilder();
        if (v instanceof ConstantInt) {
            b.setCode(Protos.ValueCode.ConstantIntValue)
             .setType(v.type().getTypeRep())
             .setData(ByteString.copyFrom(((ConstantInt) v).getValue().toByteArray()));
        } else if (v instanceof ConstantString) {
            b.setCode(Protos.ValueCode.ConstantStringValue)
             .setStringLit(((ConstantString) v).getString());
        } else if (v instanceof ConstantNull) {
            b.setCode(Protos.ValueCode.ConstantNullValue)
             .setType(v.type().getTypeRep());
        } else if (v instanceof UndefValue) {
            b.setCode(Protos.ValueCode.UndefValue)
             .setType(v.type().getTypeRep());
        } else if (v instanceof ConstantCast) {
            ConstantCast c = (ConstantCast) v;
            b.setCode(Protos.ValueCode.ConstantCastValue)
             .setType(v.type().getTypeRep())
             .setCastOp(Codes.castRep(c.getOp()))
             .setOperand(getValueRef(c.getCastOperand()));
        } else if (v instanceof GlobalVariable) {
            b.setCode(Protos.ValueCode.GlobalVariableRef)
             .setIndex(lookup(globalIndex, v));
        } else if (v instanceof Function) {
            b.setCode(Protos.ValueCode.FunctionRef)
             .setIndex(lookup(functionIndex, v));
        } else if (v instanceof Argument) {
            Argument a = (Argument) v;
            if (a.getParent() != currentFunction) {
                throw new IllegalArgumentException("Argument " + a + " used outside its function.");
            }
            b.setCode(Protos.ValueCode.ArgumentRef)
             .setIndex(a.getArgNo());
        } else if (v instanceof Instruction) {
            b.setCode(Protos.ValueCode.InstructionRef)
             .setIndex(lookup(instIndex, v));
        } else {
            throw new IllegalArgumentException("Cannot reference " + v);
        }
        return b.build();
    }

    private static int lookup(Map<Value, Integer> index, Value v) {
        Integer i = index.get(v);
        if (i == null) {
            throw new IllegalArgumentException(v + " is not part of the module being written.");
        }
        return i;
    }
}
