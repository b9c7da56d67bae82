package com.galois.nondet.ir;

/**
 * A function or global variable.  The value of a global is its address,
 * so its type is a pointer to the stored type.
 */
public abstract class GlobalValue extends Constant {
    private final Module parent;
    private final Type valueType;
    private Linkage linkage;

    GlobalValue(Module parent, Type valueType, String name, Linkage linkage) {
        super(Type.pointer(valueType), name);
        if (linkage == null) throw new NullPointerException("linkage");
        this.parent = parent;
        this.valueType = valueType;
        this.linkage = linkage;
    }

    public Module getParent() {
        return parent;
    }

    /** Type of the object the global refers to. */
    public Type getValueType() {
        return valueType;
    }

    public Linkage getLinkage() {
        return linkage;
    }

    public void setLinkage(Linkage linkage) {
        if (linkage == null) throw new NullPointerException("linkage");
        this.linkage = linkage;
    }

    public String getReference() {
        return "@" + getName();
    }
}
