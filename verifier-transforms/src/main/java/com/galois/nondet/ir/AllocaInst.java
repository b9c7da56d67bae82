package com.galois.nondet.ir;

/**
 * Allocates a stack slot for one value of the allocated type.
 */
public final class AllocaInst extends Instruction {
    private final Type allocatedType;

    public AllocaInst(Type allocatedType, String name) {
        super(Type.pointer(allocatedType), name);
        if (!allocatedType.isSized()) {
            throw new IllegalArgumentException("Cannot allocate a value of type " + allocatedType);
        }
        this.allocatedType = allocatedType;
    }

    public Type getAllocatedType() {
        return allocatedType;
    }

    public String getOpcodeName() {
        return "alloca";
    }
}
