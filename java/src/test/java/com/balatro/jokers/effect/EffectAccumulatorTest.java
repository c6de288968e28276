package com.balatro.jokers.effect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EffectAccumulator folding and numeric bounds.
 */
class EffectAccumulatorTest {

    private static final double MAX = 1_000_000.0;

    @Test
    void testIdentityEffectChangesNothing() {
        EffectAccumulator acc = new EffectAccumulator(MAX);
        assertTrue(acc.accumulate(JokerEffect.none(), "none").isEmpty());
        assertTrue(acc.toEffect().isIdentity());
    }

    @Test
    void testAdditiveThenMultiplicative() {
        EffectAccumulator acc = new EffectAccumulator(MAX);
        acc.accumulate(JokerEffect.mult(4), "a");
        acc.accumulate(JokerEffect.mult(4), "b");
        acc.accumulate(JokerEffect.xMult(2), "c");
        acc.accumulate(JokerEffect.xMult(1.5), "d");

        assertEquals(8.0, acc.mult());
        assertEquals(3.0, acc.multMultiplier());
        assertTrue(acc.violations().isEmpty());
    }

    @Test
    void testMultAboveMaximumIsClamped() {
        EffectAccumulator acc = new EffectAccumulator(MAX);
        List<NumericViolation> violations = acc.accumulate(JokerEffect.mult(2_000_000), "big");

        assertEquals(MAX, acc.mult());
        assertEquals(1, violations.size());
        NumericViolation v = violations.get(0);
        assertEquals(NumericViolation.Kind.CLAMPED, v.kind());
        assertEquals("mult", v.field());
        assertEquals("big", v.source());
        assertEquals(2_000_000.0, v.attempted());
        assertEquals(MAX, v.retained());
    }

    @Test
    void testNonFiniteMultKeepsPreviousValue() {
        EffectAccumulator acc = new EffectAccumulator(MAX);
        acc.accumulate(JokerEffect.mult(10), "ok");
        List<NumericViolation> violations = acc.accumulate(JokerEffect.mult(Double.NaN), "nan");

        assertEquals(10.0, acc.mult());
        assertEquals(1, violations.size());
        assertEquals(NumericViolation.Kind.NON_FINITE, violations.get(0).kind());

        acc.accumulate(JokerEffect.xMult(Double.POSITIVE_INFINITY), "inf");
        assertEquals(1.0, acc.multMultiplier());
        assertEquals(2, acc.violations().size());
        assertEquals("mult_multiplier", acc.violations().get(1).field());
    }

    @Test
    void testNegativeMultiplierClampsToZero() {
        EffectAccumulator acc = new EffectAccumulator(MAX);
        List<NumericViolation> violations = acc.accumulate(JokerEffect.xMult(-3), "neg");

        assertEquals(0.0, acc.multMultiplier());
        assertEquals(NumericViolation.Kind.CLAMPED, violations.get(0).kind());
    }

    @Test
    void testIntegerFieldsSaturate() {
        EffectAccumulator acc = new EffectAccumulator(MAX);
        acc.accumulate(JokerEffect.chips(Integer.MAX_VALUE), "a");
        acc.accumulate(JokerEffect.chips(100), "b");
        acc.accumulate(JokerEffect.money(Integer.MIN_VALUE), "c");
        acc.accumulate(JokerEffect.money(-5), "d");

        assertEquals(Integer.MAX_VALUE, acc.chips());
        assertEquals(Integer.MIN_VALUE, acc.money());
    }

    @Test
    void testCollectionsAndFlagsAreCarried() {
        EffectAccumulator acc = new EffectAccumulator(MAX);
        acc.accumulate(JokerEffect.builder().destroyJokerAt(2).sellValueIncrease(1).build(), "a");
        acc.accumulate(JokerEffect.destroySelf(), "b");

        JokerEffect total = acc.toEffect();
        assertEquals(List.of(2), total.getDestroyedJokerPositions());
        assertEquals(1, total.getSellValueIncrease());
        assertTrue(total.isDestroySelf());
    }

    @Test
    void testRejectsInvalidMaximum() {
        assertThrows(IllegalArgumentException.class, () -> new EffectAccumulator(0));
        assertThrows(IllegalArgumentException.class, () -> new EffectAccumulator(Double.POSITIVE_INFINITY));
    }
}
