package com.galois.nondet.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Base class of everything that can appear as an operand.
 *
 * <p>
 * Every value keeps its use list in the order the uses were created.
 * The list is maintained by {@link User}; it must not be modified while
 * it is being iterated, so clients that rewrite users should first copy
 * the uses they care about.
 */
public abstract class Value implements Typed {
    private final Type type;
    private String name;
    private final List<Use> uses = new ArrayList<Use>();

    protected Value(Type type, String name) {
        if (type == null) throw new NullPointerException("type");
        this.type = type;
        this.name = name == null ? "" : name;
    }

    public Type type() {
        return type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    /**
     * Return the uses of this value.
     * @return an unmodifiable view of the use list
     */
    public List<Use> getUses() {
        return Collections.unmodifiableList(uses);
    }

    /**
     * Return the users of this value, one entry per use.
     */
    public List<User> getUsers() {
        List<User> r = new ArrayList<User>(uses.size());
        for (Use u : uses) {
            r.add(u.getUser());
        }
        return r;
    }

    public boolean hasUses() {
        return !uses.isEmpty();
    }

    public int getNumUses() {
        return uses.size();
    }

    void addUse(Use u) {
        uses.add(u);
    }

    void removeUse(User user, int operandIndex) {
        Iterator<Use> i = uses.iterator();
        while (i.hasNext()) {
            Use u = i.next();
            if (u.getUser() == user && u.getOperandIndex() == operandIndex) {
                i.remove();
                return;
            }
        }
        throw new IllegalStateException("Use list of " + this + " is inconsistent.");
    }

    /**
     * Redirect every use of this value to <code>v</code>.
     * @param v the replacement, which must have the same type
     */
    public void replaceAllUsesWith(Value v) {
        if (v == null) throw new NullPointerException("v");
        if (v == this) {
            throw new IllegalArgumentException("Cannot replace a value with itself.");
        }
        if (!v.type().equals(type)) {
            String msg = String.format("Replacement has incorrect type. Expected %s, but got %s",
                                       type, v.type());
            throw new IllegalArgumentException(msg);
        }
        for (Use u : new ArrayList<Use>(uses)) {
            u.getUser().setOperand(u.getOperandIndex(), v);
        }
    }

    /**
     * Returns the operand spelling of this value, e.g. <code>%x</code>.
     */
    public String getReference() {
        return "%" + name;
    }

    public String toString() {
        return type + " " + getReference();
    }
}
