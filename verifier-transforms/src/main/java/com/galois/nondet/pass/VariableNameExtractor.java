package com.galois.nondet.pass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Recovers the variable assigned on a source line of the form
 * <code>[type] var = __VERIFIER_nondet_xxx(...)</code>.
 *
 * <p>
 * This is a whitespace tokenizer, not a parser.  The token before the
 * first <code>=</code> token is the candidate, and it is accepted only if
 * the token after <code>=</code> starts with a producer prefix.  Casts,
 * compact spacing (<code>x=f()</code>) and nested calls yield no name.
 */
public final class VariableNameExtractor {
    /** Name used when no variable can be recovered. */
    public static final String SENTINEL = "--";

    private final List<String> producerPrefixes;

    public VariableNameExtractor(Collection<String> producerPrefixes) {
        if (producerPrefixes.isEmpty()) {
            throw new IllegalArgumentException("At least one producer prefix is required.");
        }
        this.producerPrefixes = new ArrayList<String>(producerPrefixes);
    }

    /**
     * @param line one line of source text
     * @return the assigned variable, if the line has the expected shape
     */
    public Optional<String> find(String line) {
        String[] tokens = line.trim().split("\\s+");
        String var = null;
        int i = 0;
        for (; i != tokens.length; ++i) {
            if (tokens[i].equals("=")) {
                break;
            }
            var = tokens[i];
        }
        if (var == null || var.isEmpty() || i + 1 >= tokens.length) {
            return Optional.empty();
        }
        String rhs = tokens[i + 1];
        for (String prefix : producerPrefixes) {
            if (rhs.startsWith(prefix)) {
                return Optional.of(var);
            }
        }
        return Optional.empty();
    }

    /**
     * @param line one line of source text
     * @return the assigned variable or {@link #SENTINEL}
     */
    public String extract(String line) {
        return find(line).orElse(SENTINEL);
    }
}
