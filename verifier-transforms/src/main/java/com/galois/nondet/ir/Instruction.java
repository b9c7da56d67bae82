package com.galois.nondet.ir;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of instructions.
 *
 * <p>
 * An instruction is created detached and then placed with
 * {@link BasicBlock#append}, {@link #insertBefore} or {@link #insertAfter}.
 * Besides its operands it carries an optional debug location and named
 * metadata attachments.
 */
public abstract class Instruction extends User {
    private BasicBlock parent;
    private DebugLoc debugLoc;
    private final Map<String, String> metadata = new LinkedHashMap<String, String>();

    protected Instruction(Type type, String name) {
        super(type, name);
    }

    /** Mnemonic used in LLVM assembly. */
    public abstract String getOpcodeName();

    public boolean isTerminator() {
        return false;
    }

    public BasicBlock getParent() {
        return parent;
    }

    void setParent(BasicBlock parent) {
        this.parent = parent;
    }

    /**
     * Get the function containing this instruction.
     */
    public Function getFunction() {
        return parent == null ? null : parent.getParent();
    }

    /**
     * Insert this detached instruction immediately before <code>pos</code>.
     */
    public void insertBefore(Instruction pos) {
        BasicBlock b = checkAnchor(pos);
        b.insertAt(b.indexOf(pos), this);
    }

    /**
     * Insert this detached instruction immediately after <code>pos</code>.
     */
    public void insertAfter(Instruction pos) {
        BasicBlock b = checkAnchor(pos);
        if (pos.isTerminator()) {
            throw new IllegalArgumentException("Cannot insert after a terminator.");
        }
        b.insertAt(b.indexOf(pos) + 1, this);
    }

    private static BasicBlock checkAnchor(Instruction pos) {
        if (pos == null) throw new NullPointerException("pos");
        if (pos.getParent() == null) {
            throw new IllegalArgumentException("Anchor instruction is not inserted in a block.");
        }
        return pos.getParent();
    }

    /** The next instruction in the same block, or <code>null</code>. */
    public Instruction getNextNode() {
        return parent == null ? null : parent.get(parent.indexOf(this) + 1);
    }

    /** The previous instruction in the same block, or <code>null</code>. */
    public Instruction getPrevNode() {
        return parent == null ? null : parent.get(parent.indexOf(this) - 1);
    }

    /**
     * Unlink this instruction from its block without touching its operands.
     */
    public void removeFromParent() {
        if (parent == null) {
            throw new IllegalStateException("Instruction is not inserted in a block.");
        }
        parent.remove(this);
    }

    /**
     * Unlink this instruction and release its operands.  The instruction
     * must not have remaining uses.
     */
    public void eraseFromParent() {
        if (hasUses()) {
            throw new IllegalStateException(
                String.format("Cannot erase %s; it still has %d uses.", getReference(), getNumUses()));
        }
        removeFromParent();
        dropAllReferences();
    }

    public DebugLoc getDebugLoc() {
        return debugLoc;
    }

    public void setDebugLoc(DebugLoc loc) {
        this.debugLoc = loc;
    }

    public String getMetadata(String kind) {
        return metadata.get(kind);
    }

    public void setMetadata(String kind, String node) {
        if (kind == null) throw new NullPointerException("kind");
        if (node == null) {
            metadata.remove(kind);
        } else {
            metadata.put(kind, node);
        }
    }

    /**
     * Return all metadata attachments in attachment order.
     */
    public Map<String, String> getAllMetadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<String, String>(metadata));
    }

    public String getReference() {
        if (type().isVoid()) {
            return getOpcodeName();
        }
        return super.getReference();
    }
}
