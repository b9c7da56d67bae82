/**
 * This package contains the in-memory intermediate representation
 * rewritten by the verifier transforms.
 *
 * <p>
 * The representation follows LLVM: a {@link com.galois.nondet.ir.Module}
 * holds global variables and functions, functions hold basic blocks of
 * instructions, and every {@link com.galois.nondet.ir.Value} tracks its
 * uses so that it can be replaced with
 * {@link com.galois.nondet.ir.Value#replaceAllUsesWith}.  Instructions are
 * built with {@link com.galois.nondet.ir.IRBuilder} or created directly and
 * placed with {@link com.galois.nondet.ir.Instruction#insertBefore}.
 */
package com.galois.nondet.ir;
