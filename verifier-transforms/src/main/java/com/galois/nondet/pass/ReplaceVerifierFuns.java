package com.galois.nondet.pass;

import java.io.PrintStream;
import java.util.Map;

import com.galois.nondet.ir.Module;

/**
 * Replaces calls to verifier functions with code that registers new
 * symbolic objects with KLEE.
 *
 * <p>
 * Calls to undefined <code>__VERIFIER_nondet_*</code> functions become a
 * registered stack slot that is loaded in place of the call result.  Calls
 * to undefined <code>malloc*</code> and <code>calloc*</code> functions
 * are kept and followed by a registration of the returned memory.  Each
 * registered object is named <code>function:variable:line</code>, where the
 * variable is recovered from the original source file given in the
 * options.
 *
 * <p>
 * All call sites are collected before the module is modified.  A pass
 * object keeps per-run state and must not be used by several threads at
 * once; every call to {@link #runOnModule} starts from fresh identifiers.
 */
public final class ReplaceVerifierFuns implements ModulePass {
    /** Name used to select the pass. */
    public static final String NAME = "replace-verifier-funs";

    private final PassOptions options;
    private final SymbolPatternRegistry registry;

    // State of the current run.
    private DeclarationCache declarations;
    private IdentifierCounter producerIds;
    private IdentifierCounter allocatorIds;

    public ReplaceVerifierFuns(PassOptions options) {
        this(options, SymbolPatternRegistry.createDefault());
    }

    public ReplaceVerifierFuns(PassOptions options, SymbolPatternRegistry registry) {
        if (options == null) throw new NullPointerException("options");
        if (registry == null) throw new NullPointerException("registry");
        this.options = options;
        this.registry = registry;
    }

    public String getName() {
        return NAME;
    }

    /**
     * Instrument <code>m</code>.
     *
     * @return whether at least one call site was instrumented
     * @throws SourceUnavailableException if the source file is needed and
     *   cannot be read; the module is left unchanged
     * @throws SourceMismatchException if the source file is shorter than the
     *   debug locations require
     */
    public boolean runOnModule(Module m) {
        declarations = new DeclarationCache(options.getEntryPointName());
        producerIds = new IdentifierCounter();
        allocatorIds = new IdentifierCounter();

        CallSiteSnapshot sites =
            new CallSiteScanner(registry, options.getEntryPointName(), options.getStatusStream())
            .scan(m);
        if (sites.isEmpty()) {
            logStatus("no calls to instrument in " + m.getName());
            return false;
        }

        Map<Integer, String> lines =
            new SourceLineIndexer().index(options.getSourcePath(), sites.getRequiredLines());
        // Fails on a conflicting symbol before anything is rewritten.
        declarations.getRegistrationEntryPoint(m);

        VariableNameExtractor names =
            new VariableNameExtractor(registry.getPrefixes(CallSite.Category.PRODUCER));
        StubCallRewriter rewriter = new StubCallRewriter(declarations, producerIds);
        for (CallSite site : sites.getProducers()) {
            String text = lines.get(site.getLine());
            rewriter.rewrite(m, site, text == null ? VariableNameExtractor.SENTINEL : names.extract(text));
        }

        AllocationCallAugmenter augmenter = new AllocationCallAugmenter(declarations, allocatorIds);
        for (CallSite site : sites.getAllocators()) {
            augmenter.augment(m, site);
        }

        logStatus(String.format("replaced %d nondet calls and registered %d allocations in %s",
                                sites.getProducers().size(), sites.getAllocators().size(), m.getName()));
        return true;
    }

    /** Identifiers issued to producer sites by the last run. */
    public int getProducerCount() {
        return producerIds == null ? 0 : producerIds.current();
    }

    /** Identifiers issued to allocation sites by the last run. */
    public int getAllocationCount() {
        return allocatorIds == null ? 0 : allocatorIds.current();
    }

    private void logStatus(String msg) {
        PrintStream statusStream = options.getStatusStream();
        if (statusStream != null) {
            statusStream.printf("%s: %s%n", NAME, msg);
            statusStream.flush();
        }
    }
}
