package com.galois.nondet.ir;

/**
 * Appends instructions to the end of a block, attaching the current debug
 * location to each of them.
 */
public final class IRBuilder {
    private BasicBlock block;
    private DebugLoc currentLoc;

    public IRBuilder(BasicBlock block) {
        setInsertPoint(block);
    }

    public void setInsertPoint(BasicBlock block) {
        if (block == null) throw new NullPointerException("block");
        this.block = block;
    }

    public BasicBlock getInsertBlock() {
        return block;
    }

    /**
     * Set the location attached to subsequently created instructions;
     * <code>null</code> clears it.
     */
    public void setCurrentDebugLocation(DebugLoc loc) {
        this.currentLoc = loc;
    }

    public void setCurrentLine(int line) {
        setCurrentDebugLocation(new DebugLoc(line));
    }

    private <T extends Instruction> T insert(T inst) {
        if (currentLoc != null) {
            inst.setDebugLoc(currentLoc);
        }
        block.append(inst);
        return inst;
    }

    public AllocaInst alloca(Type t, String name) {
        return insert(new AllocaInst(t, name));
    }

    public LoadInst load(Value ptr, String name) {
        return insert(new LoadInst(ptr, name));
    }

    public StoreInst store(Value v, Value ptr) {
        return insert(new StoreInst(v, ptr));
    }

    public CastInst cast(CastInst.Op op, Value v, Type destType, String name) {
        return insert(new CastInst(op, v, destType, name));
    }

    public CastInst pointerCast(Value v, Type destType, String name) {
        return insert(CastInst.createPointerCast(v, destType, name));
    }

    public BinaryOperator binary(BinaryOperator.Op op, Value lhs, Value rhs, String name) {
        return insert(new BinaryOperator(op, lhs, rhs, name));
    }

    public ICmpInst icmp(ICmpInst.Predicate p, Value lhs, Value rhs, String name) {
        return insert(new ICmpInst(p, lhs, rhs, name));
    }

    /**
     * Call a function with the given arguments.
     */
    public CallInst call(Value f, String name, Value ... args) {
        return insert(new CallInst(f, args, name));
    }

    public CallInst call(Value f, Value ... args) {
        return call(f, null, args);
    }

    /**
     * End block with jump.
     */
    public BranchInst br(BasicBlock dest) {
        return insert(new BranchInst(dest));
    }

    /**
     * End block with branch.
     */
    public BranchInst condBr(Value c, BasicBlock t, BasicBlock f) {
        return insert(new BranchInst(c, t, f));
    }

    /**
     * Return from the function with the given value.
     * @param v Return value
     */
    public ReturnInst ret(Value v) {
        Type returnType = block.getParent().getReturnType();
        if (v == null ? !returnType.isVoid() : !v.type().equals(returnType)) {
            String msg = String.format("Return value has incorrect type. Expected %s", returnType);
            throw new IllegalArgumentException(msg);
        }
        return insert(new ReturnInst(v));
    }

    public ReturnInst retVoid() {
        return ret(null);
    }
}
