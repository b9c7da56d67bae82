package com.galois.nondet.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function in a module.  A function without basic blocks is a
 * declaration of an external symbol.
 */
public final class Function extends GlobalValue {
    /** List of formal arguments. */
    private final List<Argument> arguments;

    /** List of all blocks, entry block first. */
    private final List<BasicBlock> blocks = new ArrayList<BasicBlock>();

    Function(Module parent, Type functionType, String name, Linkage linkage) {
        super(parent, checkFunctionType(functionType), name, linkage);
        int argCount = functionType.getFunctionParamCount();
        this.arguments = new ArrayList<Argument>(argCount);
        // Populate argument list.
        for (int i = 0; i != argCount; ++i) {
            arguments.add(new Argument(this, i, functionType.getFunctionParamType(i), null));
        }
    }

    private static Type checkFunctionType(Type t) {
        if (t == null) throw new NullPointerException("functionType");
        if (!t.isFunction()) {
            throw new IllegalArgumentException("Expected function type, got " + t);
        }
        return t;
    }

    public Type getFunctionType() {
        return getValueType();
    }

    public Type getReturnType() {
        return getFunctionType().getFunctionReturnType();
    }

    /**
     * Whether the body of this function is defined outside the module.
     */
    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    /**
     * Return number of arguments expected by the function.
     * @return the number of arguments
     */
    public int getArgCount() {
        return arguments.size();
    }

    /**
     * Returns the formal argument at index <code>i</code>.
     * @param i the index of the argument.
     * @return the argument.
     */
    public Argument getArg(int i) {
        if (!(0 <= i && i < arguments.size())) {
            throw new IllegalArgumentException("Bad argument index.");
        }
        return arguments.get(i);
    }

    public List<Argument> getArgs() {
        return Collections.unmodifiableList(arguments);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * Get first block.
     * @return the block, or <code>null</code> for a declaration
     */
    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /**
     * Create a new basic block at the end of the function.
     * @param name label of the block
     * @return the block
     */
    public BasicBlock appendBlock(String name) {
        BasicBlock b = new BasicBlock(this, name);
        blocks.add(b);
        return b;
    }

    /**
     * Position of a block in layout order, or <code>-1</code>.
     */
    public int indexOf(BasicBlock b) {
        return blocks.indexOf(b);
    }

    /**
     * Return all instructions in layout order.
     */
    public List<Instruction> getInstructions() {
        List<Instruction> r = new ArrayList<Instruction>();
        for (BasicBlock b : blocks) {
            r.addAll(b.getInstructions());
        }
        return r;
    }
}
