package com.galois.nondet.ir;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable attributes of a call site: function attributes, return value
 * attributes (e.g. <code>zeroext</code>) and one set per parameter.
 */
public final class AttributeList {
    private final Set<String> fnAttrs;
    private final Set<String> retAttrs;
    private final List<Set<String>> paramAttrs;

    public static final AttributeList EMPTY =
        new AttributeList(Collections.<String>emptySet(),
                          Collections.<String>emptySet(),
                          Collections.<Set<String>>emptyList());

    private AttributeList(Set<String> fnAttrs, Set<String> retAttrs, List<Set<String>> paramAttrs) {
        this.fnAttrs = fnAttrs;
        this.retAttrs = retAttrs;
        this.paramAttrs = paramAttrs;
    }

    public static AttributeList of(Set<String> fnAttrs, Set<String> retAttrs, List<Set<String>> paramAttrs) {
        List<Set<String>> params = new ArrayList<Set<String>>(paramAttrs.size());
        for (Set<String> s : paramAttrs) {
            params.add(freeze(s));
        }
        trim(params);
        return new AttributeList(freeze(fnAttrs), freeze(retAttrs),
                                 Collections.unmodifiableList(params));
    }

    private static Set<String> freeze(Set<String> s) {
        return Collections.unmodifiableSet(new LinkedHashSet<String>(s));
    }

    // Trailing empty parameter sets carry no information.
    private static void trim(List<Set<String>> params) {
        while (!params.isEmpty() && params.get(params.size() - 1).isEmpty()) {
            params.remove(params.size() - 1);
        }
    }

    public Set<String> getFunctionAttributes() {
        return fnAttrs;
    }

    public Set<String> getReturnAttributes() {
        return retAttrs;
    }

    /** Attributes of parameter <code>i</code>; empty if none were set. */
    public Set<String> getParamAttributes(int i) {
        if (i < 0) throw new IllegalArgumentException("Bad parameter index.");
        if (i >= paramAttrs.size()) {
            return Collections.emptySet();
        }
        return paramAttrs.get(i);
    }

    /** One more than the highest parameter index with attributes. */
    public int getNumParamSets() {
        return paramAttrs.size();
    }

    public boolean isEmpty() {
        return fnAttrs.isEmpty() && retAttrs.isEmpty() && paramAttrs.isEmpty();
    }

    public AttributeList addFunctionAttribute(String a) {
        Set<String> s = new LinkedHashSet<String>(fnAttrs);
        s.add(a);
        return of(s, retAttrs, paramAttrs);
    }

    public AttributeList addReturnAttribute(String a) {
        Set<String> s = new LinkedHashSet<String>(retAttrs);
        s.add(a);
        return of(fnAttrs, s, paramAttrs);
    }

    public AttributeList addParamAttribute(int i, String a) {
        if (i < 0) throw new IllegalArgumentException("Bad parameter index.");
        List<Set<String>> params = new ArrayList<Set<String>>(paramAttrs);
        while (params.size() <= i) {
            params.add(Collections.<String>emptySet());
        }
        Set<String> s = new LinkedHashSet<String>(params.get(i));
        s.add(a);
        params.set(i, s);
        return of(fnAttrs, retAttrs, params);
    }

    public boolean equals(Object o) {
        if (!(o instanceof AttributeList)) return false;
        AttributeList r = (AttributeList) o;
        return fnAttrs.equals(r.fnAttrs)
            && retAttrs.equals(r.retAttrs)
            && paramAttrs.equals(r.paramAttrs);
    }

    public int hashCode() {
        return fnAttrs.hashCode() ^ 31 * retAttrs.hashCode() ^ 17 * paramAttrs.hashCode();
    }

    public String toString() {
        return "fn" + fnAttrs + " ret" + retAttrs + " params" + paramAttrs;
    }
}
