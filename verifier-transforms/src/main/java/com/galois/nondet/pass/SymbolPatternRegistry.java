package com.galois.nondet.pass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps prefixes of external function names to the instrumentation they
 * receive.
 */
public final class SymbolPatternRegistry {
    /** Prefix of the verifier functions returning unconstrained values. */
    public static final String PRODUCER_PREFIX = "__VERIFIER_nondet_";

    private final Map<String, CallSiteKind> patterns = new LinkedHashMap<String, CallSiteKind>();

    /**
     * The registry used by the pass: verifier nondet functions, and the
     * <code>malloc</code> and <code>calloc</code> families.
     */
    public static SymbolPatternRegistry createDefault() {
        return new SymbolPatternRegistry()
            .register(PRODUCER_PREFIX, CallSiteKind.REWRITE_PRODUCER)
            .register("malloc", CallSiteKind.AUGMENT_MALLOC)
            .register("calloc", CallSiteKind.AUGMENT_CALLOC);
    }

    /**
     * Register a prefix.
     * @return this registry
     * @throws IllegalArgumentException if the prefix is empty or already registered
     */
    public SymbolPatternRegistry register(String prefix, CallSiteKind kind) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Pattern prefix must not be empty.");
        }
        if (kind == null) throw new NullPointerException("kind");
        if (patterns.containsKey(prefix)) {
            throw new IllegalArgumentException("Pattern " + prefix + " is already registered.");
        }
        patterns.put(prefix, kind);
        return this;
    }

    /**
     * Return the kind registered for the longest prefix of <code>name</code>,
     * or <code>null</code> if no prefix matches.
     */
    public CallSiteKind lookup(String name) {
        String best = null;
        for (String prefix : patterns.keySet()) {
            if (name.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best == null ? null : patterns.get(best);
    }

    /**
     * Return the registered prefixes of the given category, in registration order.
     */
    public List<String> getPrefixes(CallSite.Category category) {
        List<String> r = new ArrayList<String>();
        for (Map.Entry<String, CallSiteKind> e : patterns.entrySet()) {
            if (e.getValue().getCategory() == category) {
                r.add(e.getKey());
            }
        }
        return Collections.unmodifiableList(r);
    }
}
