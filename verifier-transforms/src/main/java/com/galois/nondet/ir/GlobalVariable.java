package com.galois.nondet.ir;

/**
 * A module-level variable.  The initializer, when present, is operand 0.
 */
public final class GlobalVariable extends GlobalValue {
    private final boolean constant;

    GlobalVariable(Module parent, Type valueType, boolean constant,
                   Linkage linkage, Constant initializer, String name) {
        super(parent, valueType, name, linkage);
        this.constant = constant;
        if (initializer != null) {
            setInitializer(initializer);
        }
    }

    /** Whether the global is read-only. */
    public boolean isConstant() {
        return constant;
    }

    public boolean hasInitializer() {
        return getNumOperands() > 0;
    }

    /**
     * Set the initial value of the global.
     */
    public void setInitializer(Constant initializer) {
        if (initializer == null) throw new NullPointerException("initializer");
        if (!initializer.type().equals(getValueType())) {
            String msg = String.format("Initializer has incorrect type. Expected %s, but got %s",
                                       getValueType(), initializer.type());
            throw new IllegalArgumentException(msg);
        }
        if (hasInitializer()) {
            setOperand(0, initializer);
        } else {
            addOperand(initializer);
        }
    }

    /**
     * Return the initializer or <code>null</code> for an external global.
     */
    public Constant getInitializer() {
        return hasInitializer() ? (Constant) getOperand(0) : null;
    }
}
