package com.galois.nondet.pass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The call sites found in a module, materialized before any rewriting.
 */
public final class CallSiteSnapshot {
    private final List<CallSite> producers;
    private final List<CallSite> allocators;
    private final SortedSet<Integer> requiredLines;

    CallSiteSnapshot(List<CallSite> producers, List<CallSite> allocators) {
        this.producers = Collections.unmodifiableList(new ArrayList<CallSite>(producers));
        this.allocators = Collections.unmodifiableList(new ArrayList<CallSite>(allocators));
        TreeSet<Integer> lines = new TreeSet<Integer>();
        collectLines(lines, producers);
        collectLines(lines, allocators);
        this.requiredLines = Collections.unmodifiableSortedSet(lines);
    }

    private static void collectLines(TreeSet<Integer> lines, List<CallSite> sites) {
        for (CallSite s : sites) {
            if (s.hasKnownLine()) {
                lines.add(s.getLine());
            }
        }
    }

    /** Calls to value producers, in declaration then use-list order. */
    public List<CallSite> getProducers() {
        return producers;
    }

    /** Calls to allocators, in declaration then use-list order. */
    public List<CallSite> getAllocators() {
        return allocators;
    }

    /** Distinct known source lines of all sites. */
    public SortedSet<Integer> getRequiredLines() {
        return requiredLines;
    }

    public boolean isEmpty() {
        return producers.isEmpty() && allocators.isEmpty();
    }
}
