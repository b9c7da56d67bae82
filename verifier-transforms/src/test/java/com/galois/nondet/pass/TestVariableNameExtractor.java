package com.galois.nondet.pass;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Test;

public class TestVariableNameExtractor {
    VariableNameExtractor names =
        new VariableNameExtractor(Collections.singletonList(SymbolPatternRegistry.PRODUCER_PREFIX));

    @Test
    public void declarationWithInitializer() {
        Assert.assertEquals("y", names.extract("int y = __VERIFIER_nondet_int();"));
    }

    @Test
    public void plainAssignment() {
        Assert.assertEquals("x", names.extract("    x = __VERIFIER_nondet_uint();"));
        Assert.assertEquals("x", names.extract("\tx\t=\t__VERIFIER_nondet_char();"));
    }

    @Test
    public void producerNotAssigned() {
        Assert.assertEquals(VariableNameExtractor.SENTINEL, names.extract("foo(__VERIFIER_nondet_int());"));
    }

    @Test
    public void otherRightHandSide() {
        Assert.assertEquals(VariableNameExtractor.SENTINEL, names.extract("x = bar();"));
    }

    @Test
    public void patternsThatDefeatTheTokenizer() {
        Assert.assertFalse(names.find("x=__VERIFIER_nondet_int();").isPresent());
        Assert.assertFalse(names.find("x = (int) __VERIFIER_nondet_long();").isPresent());
        Assert.assertFalse(names.find("= __VERIFIER_nondet_int();").isPresent());
        Assert.assertFalse(names.find("x =").isPresent());
        Assert.assertFalse(names.find("").isPresent());
        Assert.assertFalse(names.find("   ").isPresent());
    }

    @Test
    public void firstAssignmentWins() {
        Assert.assertEquals("a", names.extract("a = __VERIFIER_nondet_int(); b = __VERIFIER_nondet_int();"));
        Assert.assertEquals(VariableNameExtractor.SENTINEL,
                            names.extract("a = 1; b = __VERIFIER_nondet_int();"));
    }

    @Test
    public void anyConfiguredPrefixMatches() {
        VariableNameExtractor custom =
            new VariableNameExtractor(Arrays.asList("__VERIFIER_nondet_", "nondet_"));
        Assert.assertEquals("n", custom.extract("unsigned n = nondet_uint();"));
    }

    @Test(expected=IllegalArgumentException.class)
    public void needsAPrefix() {
        new VariableNameExtractor(Collections.<String>emptyList());
    }
}
