package com.galois.nondet.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A translation unit: global variables and functions, in definition order,
 * together with the target data layout.
 */
public final class Module {
    private final String name;
    private String sourceFileName = "";
    private DataLayout dataLayout = DataLayout.DEFAULT;

    private final List<GlobalVariable> globals = new ArrayList<GlobalVariable>();
    private final List<Function> functions = new ArrayList<Function>();

    /** Names in use by globals and functions. */
    private final Set<String> symbolNames = new HashSet<String>();

    public Module(String name) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public String getSourceFileName() {
        return sourceFileName;
    }

    public void setSourceFileName(String sourceFileName) {
        this.sourceFileName = sourceFileName == null ? "" : sourceFileName;
    }

    public DataLayout getDataLayout() {
        return dataLayout;
    }

    public void setDataLayout(DataLayout dataLayout) {
        if (dataLayout == null) throw new NullPointerException("dataLayout");
        this.dataLayout = dataLayout;
    }

    public List<GlobalVariable> getGlobals() {
        return Collections.unmodifiableList(globals);
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    /**
     * Return the function with the given name or <code>null</code>.
     */
    public Function getFunction(String fname) {
        for (Function f : functions) {
            if (f.getName().equals(fname)) return f;
        }
        return null;
    }

    /**
     * Return the global variable with the given name or <code>null</code>.
     */
    public GlobalVariable getGlobalVariable(String gname) {
        for (GlobalVariable g : globals) {
            if (g.getName().equals(gname)) return g;
        }
        return null;
    }

    /**
     * Add a function.  It is a declaration until blocks are appended.
     * @param fname symbol name, which must not be in use
     * @param functionType the signature
     * @return the function
     */
    public Function addFunction(String fname, Type functionType) {
        return addFunction(fname, functionType, Linkage.EXTERNAL);
    }

    public Function addFunction(String fname, Type functionType, Linkage linkage) {
        claimName(fname);
        Function f = new Function(this, functionType, fname, linkage);
        functions.add(f);
        return f;
    }

    /**
     * Return the function named <code>fname</code>, declaring it with
     * <code>functionType</code> first if the module has no such symbol.
     *
     * @throws IllegalArgumentException if the name is used by a global
     *   variable or by a function with a different signature
     */
    public Function getOrInsertFunction(String fname, Type functionType) {
        Function f = getFunction(fname);
        if (f == null) {
            return addFunction(fname, functionType);
        }
        if (!f.getFunctionType().equals(functionType)) {
            String msg = String.format("Function %s has type %s, expected %s",
                                       fname, f.getFunctionType(), functionType);
            throw new IllegalArgumentException(msg);
        }
        return f;
    }

    /**
     * Add a global variable.
     * @param gname symbol name, which must not be in use
     * @param valueType type of the stored value
     * @param constant whether the global is read-only
     * @param linkage linkage of the symbol
     * @param initializer the initial value or <code>null</code>
     * @return the global
     */
    public GlobalVariable addGlobalVariable(String gname, Type valueType, boolean constant,
                                            Linkage linkage, Constant initializer) {
        claimName(gname);
        GlobalVariable g = new GlobalVariable(this, valueType, constant, linkage, initializer, gname);
        globals.add(g);
        return g;
    }

    /**
     * Return <code>base</code> if no symbol uses it, or else the first of
     * <code>base.1</code>, <code>base.2</code>, ... that is free.
     */
    public String getUniqueGlobalName(String base) {
        if (!symbolNames.contains(base)) {
            return base;
        }
        for (int i = 1; ; ++i) {
            String candidate = base + "." + i;
            if (!symbolNames.contains(candidate)) {
                return candidate;
            }
        }
    }

    private void claimName(String sname) {
        if (sname == null || sname.isEmpty()) {
            throw new IllegalArgumentException("Global symbols must be named.");
        }
        if (!symbolNames.add(sname)) {
            throw new IllegalArgumentException("Symbol " + sname + " is already defined.");
        }
    }

    public String toString() {
        return "module " + name;
    }
}
