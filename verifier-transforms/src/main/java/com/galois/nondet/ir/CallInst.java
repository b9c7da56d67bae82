package com.galois.nondet.ir;

/**
 * A call.  Operand 0 is the callee; the arguments follow.
 */
public final class CallInst extends Instruction {
    private AttributeList attributes = AttributeList.EMPTY;

    public CallInst(Value callee, Value[] args, String name) {
        super(checkFunctionArgs(callee, args), name);
        addOperand(callee);
        for (Value a : args) {
            addOperand(a);
        }
    }

    public CallInst(Value callee, Value ... args) {
        this(callee, args, null);
    }

    // Check that f is a function that expects the given arguments.
    // Returns type of result of f.
    private static Type checkFunctionArgs(Value f, Value[] args) {
        if (f == null) throw new NullPointerException("f");
        if (args == null) throw new NullPointerException("args");

        Type f_type = f.type();
        if (!f_type.isPointer() || !f_type.getPointeeType().isFunction()) {
            throw new IllegalArgumentException("callee does not have function pointer type.");
        }
        f_type = f_type.getPointeeType();

        int cnt = f_type.getFunctionParamCount();
        if (f_type.isVarArg() ? args.length < cnt : args.length != cnt) {
            throw new IllegalArgumentException("Incorrect number of arguments.");
        }

        for (int i = 0; i != args.length; ++i) {
            Value arg = args[i];
            if (arg == null) {
                throw new NullPointerException(String.format("argument %d must not be null.", i));
            }
            if (i < cnt && !arg.type().equals(f_type.getFunctionParamType(i))) {
                String msg = String.format("argument %d has incorrect type. Expected %s, but got %s",
                                           i, f_type.getFunctionParamType(i), arg.type());
                throw new IllegalArgumentException(msg);
            }
        }
        return f_type.getFunctionReturnType();
    }

    public Value getCalledValue() {
        return getOperand(0);
    }

    /**
     * Return the callee if it is a function, or <code>null</code> for an
     * indirect call.
     */
    public Function getCalledFunction() {
        Value v = getCalledValue();
        return v instanceof Function ? (Function) v : null;
    }

    public int getNumArgOperands() {
        return getNumOperands() - 1;
    }

    public Value getArgOperand(int i) {
        if (!(0 <= i && i < getNumArgOperands())) {
            throw new IllegalArgumentException("Bad argument index.");
        }
        return getOperand(i + 1);
    }

    /**
     * Returns whether <code>u</code> is the callee slot of a call.
     */
    public static boolean isCallee(Use u) {
        return u.getUser() instanceof CallInst && u.getOperandIndex() == 0;
    }

    public AttributeList getAttributes() {
        return attributes;
    }

    public void setAttributes(AttributeList attributes) {
        if (attributes == null) throw new NullPointerException("attributes");
        this.attributes = attributes;
    }

    public String getOpcodeName() {
        return "call";
    }
}
