package com.galois.nondet.pass;

import com.galois.nondet.ir.Module;

/**
 * A transformation applied to a whole module at once.
 */
public interface ModulePass {
    /**
     * Name used to select the pass on the command line.
     * @return the name
     */
    String getName();

    /**
     * Run the pass.
     * @param m the module, rewritten in place
     * @return whether the module was changed
     */
    boolean runOnModule(Module m);
}
