package com.galois.nondet.ir;

/**
 * A single reference from an operand slot of a {@link User} to a value.
 */
public final class Use {
    private final User user;
    private final int operandIndex;

    Use(User user, int operandIndex) {
        this.user = user;
        this.operandIndex = operandIndex;
    }

    /** The user holding the reference. */
    public User getUser() {
        return user;
    }

    /** The operand slot of the user. */
    public int getOperandIndex() {
        return operandIndex;
    }

    public Value get() {
        return user.getOperand(operandIndex);
    }

    public String toString() {
        return "use #" + operandIndex + " of " + user;
    }
}
