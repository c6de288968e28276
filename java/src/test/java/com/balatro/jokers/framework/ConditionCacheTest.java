package com.balatro.jokers.framework;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.HandEvaluator;
import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.card.HandRules;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.RunState;
import com.balatro.jokers.framework.condition.Condition;
import com.balatro.jokers.framework.condition.Conditions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConditionCache memoization and invalidation.
 */
class ConditionCacheTest {

    private final AtomicInteger evaluations = new AtomicInteger();
    private final Condition counting = Conditions.hand("counting pair", ctx -> {
        evaluations.incrementAndGet();
        return ctx.handContains(HandRank.PAIR);
    });

    private static GameContext context(String cards) {
        return GameContext.builder(RunState.initial(5))
            .hand(HandEvaluator.evaluate(Card.parseList(cards)))
            .build();
    }

    @Test
    void testRepeatedQueryHitsCache() {
        ConditionCache cache = new ConditionCache(16);
        GameContext ctx = context("KS KH 3D");

        assertTrue(cache.test(counting, ctx, null));
        assertTrue(cache.test(counting, ctx, null));
        assertTrue(cache.test(counting, context("KS KH 3D"), null));

        assertEquals(1, evaluations.get());
        assertEquals(2, cache.hits());
        assertEquals(1, cache.misses());
        assertEquals(2.0 / 3.0, cache.hitRate(), 1e-9);
    }

    @Test
    void testDifferentContextMisses() {
        ConditionCache cache = new ConditionCache(16);

        assertTrue(cache.test(counting, context("KS KH 3D"), null));
        assertFalse(cache.test(counting, context("KS QH 3D"), null));

        assertEquals(2, evaluations.get());
        assertEquals(2, cache.size());
    }

    @Test
    void testPrimitiveConditionsIgnoreUnrelatedContext() {
        ConditionCache cache = new ConditionCache(16);
        Condition pair = Conditions.handContains(HandRank.PAIR);
        GameContext first = context("KS KH 3D");
        GameContext later = GameContext.builder(RunState.initial(5).toBuilder()
                .money(40)
                .handsRemaining(1)
                .handsPlayedThisRound(3)
                .build())
            .hand(HandEvaluator.evaluate(Card.parseList("9C 9D"), Card.parseList("AS 2H"), HandRules.STANDARD))
            .build();

        assertTrue(cache.test(pair, first, null));
        assertTrue(cache.test(pair, later, null));
        assertFalse(cache.test(pair, context("KS QH 3D"), null));

        assertEquals(1, cache.hits());
        assertEquals(2, cache.misses());
        assertNotEquals(first.fingerprint(), later.fingerprint());
    }

    @Test
    void testMoneyConditionKeysOnMoneyOnly() {
        ConditionCache cache = new ConditionCache(16);
        Condition rich = Conditions.moneyAtLeast(10);

        assertFalse(cache.test(rich, context("KS KH 3D"), null));
        assertFalse(cache.test(rich, context("2C 5D 9H"), null));
        GameContext wealthy = GameContext.builder(RunState.initial(5).toBuilder().money(25).build()).build();
        assertTrue(cache.test(rich, wealthy, null));

        assertEquals(1, cache.hits());
        assertEquals(2, cache.misses());
    }

    @Test
    void testEpochInvalidatesEntries() {
        ConditionCache cache = new ConditionCache(16);
        GameContext ctx = context("KS KH 3D");

        cache.test(counting, ctx, null);
        cache.advanceEpoch();
        cache.test(counting, ctx, null);

        assertEquals(1, cache.epoch());
        assertEquals(2, evaluations.get());
        assertEquals(0, cache.hits());
    }

    @Test
    void testRandomConditionsBypassCache() {
        ConditionCache cache = new ConditionCache(16);
        Condition random = Conditions.and(counting, Conditions.chance(1, 2));
        GameContext ctx = context("KS KH 3D");

        assertFalse(random.isCacheable());
        cache.test(random, ctx, null);
        cache.test(random, ctx, null);

        assertEquals(2, evaluations.get());
        assertEquals(0, cache.size());
    }

    @Test
    void testDisabledCacheAlwaysEvaluates() {
        ConditionCache cache = new ConditionCache(16, false);
        GameContext ctx = context("KS KH 3D");

        cache.test(counting, ctx, null);
        cache.test(counting, ctx, null);

        assertEquals(2, evaluations.get());
        assertEquals(0, cache.hits() + cache.misses());
    }

    @Test
    void testShrinkingEvictsEntries() {
        ConditionCache cache = new ConditionCache(8);
        GameContext ctx = context("KS KH 3D");
        for (Card card : Card.parseList("2S 3S 4S 5S 6S")) {
            cache.test(Conditions.cardSuit(card.suit()), ctx, card);
        }
        assertEquals(5, cache.size());

        cache.setMaxEntries(2);
        assertEquals(2, cache.size());
        assertEquals(2, cache.maxEntries());
        assertThrows(IllegalArgumentException.class, () -> cache.setMaxEntries(0));
    }
}
