package com.balatro.jokers.effect;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EffectApplier: final mult bounds, wallet floor and score saturation.
 */
class EffectApplierTest {

    private final EffectApplier applier = new EffectApplier(1_000_000);

    @Test
    void testIdentityLeavesBaseValues() {
        AppliedScore score = applier.apply(32, 2, 4, JokerEffect.none());
        assertEquals(32, score.chips());
        assertEquals(2.0, score.mult());
        assertEquals(64, score.score());
        assertEquals(4, score.wallet());
    }

    @Test
    void testAdditiveAppliedBeforeMultiplier() {
        JokerEffect aggregate = JokerEffect.builder().chips(10).mult(8).multMultiplier(2).build();
        AppliedScore score = applier.apply(10, 2, 0, aggregate);

        assertEquals(20, score.chips());
        assertEquals(20.0, score.mult());
        assertEquals(400, score.score());
    }

    @Test
    void testMultIsNeverNegative() {
        assertEquals(0.0, applier.applyMult(2, JokerEffect.mult(-50)));
        assertEquals(0.0, applier.applyMult(2, JokerEffect.xMult(-1)));
    }

    @Test
    void testMultIsCappedAtMaximum() {
        JokerEffect aggregate = JokerEffect.builder().mult(900_000).multMultiplier(1000).build();
        assertEquals(1_000_000.0, applier.applyMult(1, aggregate));
    }

    @Test
    void testNonFiniteAggregateFallsBack() {
        assertEquals(3.0, applier.applyMult(3, JokerEffect.mult(Double.NaN)));
        assertEquals(3.0, applier.applyMult(3, JokerEffect.xMult(Double.NaN)));
    }

    @Test
    void testWalletNeverDropsBelowZero() {
        assertEquals(0, EffectApplier.applyMoney(3, -10));
        assertEquals(0, EffectApplier.applyMoney(0, Integer.MIN_VALUE));
        assertEquals(13, EffectApplier.applyMoney(3, 10));
        assertEquals(Integer.MAX_VALUE, EffectApplier.applyMoney(Integer.MAX_VALUE, 5));
    }

    @Test
    void testAppliedWalletIsNeverNegative() {
        AppliedScore score = applier.apply(10, 1, 3, JokerEffect.money(-10));
        assertEquals(0, score.wallet());
    }

    @Test
    void testScoreSaturates() {
        AppliedScore score = applier.apply(Long.MAX_VALUE - 1, 1_000_000, 0, JokerEffect.chips(50));
        assertEquals(Long.MAX_VALUE, score.chips());
        assertEquals(Long.MAX_VALUE, score.score());
    }
}
