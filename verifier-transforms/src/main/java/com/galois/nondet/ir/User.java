package com.galois.nondet.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A value that refers to other values through operands.
 */
public abstract class User extends Value {
    private final List<Value> operands = new ArrayList<Value>();

    protected User(Type type, String name) {
        super(type, name);
    }

    protected void addOperand(Value v) {
        if (v == null) throw new NullPointerException("operand");
        operands.add(v);
        v.addUse(new Use(this, operands.size() - 1));
    }

    public Value getOperand(int i) {
        if (!(0 <= i && i < operands.size())) {
            throw new IllegalArgumentException("Bad operand index.");
        }
        return operands.get(i);
    }

    public int getNumOperands() {
        return operands.size();
    }

    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    /**
     * Replace an operand, keeping the use lists of both values up to date.
     */
    public void setOperand(int i, Value v) {
        if (v == null) throw new NullPointerException("v");
        Value old = getOperand(i);
        if (old == v) {
            return;
        }
        old.removeUse(this, i);
        operands.set(i, v);
        v.addUse(new Use(this, i));
    }

    /**
     * Remove every operand, releasing the uses held by this user.
     */
    public void dropAllReferences() {
        for (int i = 0; i != operands.size(); ++i) {
            operands.get(i).removeUse(this, i);
        }
        operands.clear();
    }
}
