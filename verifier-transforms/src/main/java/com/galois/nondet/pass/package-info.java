/**
 * The <code>replace-verifier-funs</code> instrumentation pass.
 *
 * <p>
 * To instrument a module, configure a {@link com.galois.nondet.pass.PassOptions}
 * object with the original source file and run
 * {@link com.galois.nondet.pass.ReplaceVerifierFuns#runOnModule}.
 */
package com.galois.nondet.pass;
