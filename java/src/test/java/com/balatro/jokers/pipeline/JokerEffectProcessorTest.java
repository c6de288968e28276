package com.balatro.jokers.pipeline;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.HandEvaluator;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.RunState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JokerEffectProcessor: ordering, isolation, deferred removal and retriggers.
 */
class JokerEffectProcessorTest {

    private static final RunState RUN = RunState.initial(42);

    private final JokerEffectProcessor processor = new JokerEffectProcessor();

    private static GameContext context(String played, List<? extends Joker> jokers) {
        return GameContext.builder(RUN)
            .hand(HandEvaluator.evaluate(Card.parseList(played)))
            .jokers(jokers)
            .build();
    }

    @Test
    void testNoJokersYieldsIdentity() {
        ProcessingResult result = processor.process(context("KS KH", List.of()));

        assertTrue(result.aggregate().isIdentity());
        assertTrue(result.removals().isEmpty());
        assertFalse(result.hasErrors());
        assertEquals(2, result.scoringCards().size());
        assertEquals(1, result.timesScored(0));
    }

    @Test
    void testEffectsFoldInRunOrder() {
        List<Joker> jokers = List.of(
            ScriptedJoker.onHand(JokerId.JOKER, JokerEffect.mult(4)),
            ScriptedJoker.onHand(JokerId.JOKER, JokerEffect.mult(4)),
            ScriptedJoker.onHand(JokerId.CAVENDISH, JokerEffect.xMult(2)));

        JokerEffect aggregate = processor.process(context("KS KH", jokers)).aggregate();

        assertEquals(8.0, aggregate.getMult());
        assertEquals(2.0, aggregate.getMultMultiplier());
    }

    @Test
    void testCardHooksRunOncePerScoringCard() {
        ScriptedJoker perCard = ScriptedJoker.onCard(JokerId.GREEDY_JOKER, JokerEffect.chips(10));
        ProcessingResult result = processor.process(context("KS KH 3D", List.of(perCard)));

        assertEquals(2, perCard.cardCalls);
        assertEquals(1, perCard.handCalls);
        assertEquals(20, result.aggregate().getChips());
    }

    @Test
    void testEmptyHandStillRunsHandPass() {
        ScriptedJoker joker = ScriptedJoker.onHand(JokerId.JOKER, JokerEffect.mult(4));
        ProcessingResult result = processor.process(context("", List.of(joker)));

        assertEquals(1, joker.handCalls);
        assertEquals(0, joker.cardCalls);
        assertEquals(4.0, result.aggregate().getMult());
        assertTrue(result.scoringCards().isEmpty());
    }

    @Test
    void testSameSeedSameResult() {
        ScriptedJoker random = new ScriptedJoker(JokerId.MISPRINT,
            ctx -> JokerEffect.mult(ctx.rng().nextIntInclusive(0, 23)),
            (ctx, card) -> JokerEffect.chips(ctx.rng().nextInt(50)),
            ctx -> JokerEffect.none());

        JokerEffect first = processor.process(context("AS AH 7C 7D", List.of(random))).aggregate();
        JokerEffect second = processor.process(context("AS AH 7C 7D", List.of(random))).aggregate();

        assertEquals(first, second);
    }

    @Test
    void testSelfDestroyIsDeferred() {
        ScriptedJoker doomed = ScriptedJoker.onHand(JokerId.ICE_CREAM,
            JokerEffect.builder().chips(5).destroySelf(true).build());
        ScriptedJoker second = ScriptedJoker.onCard(JokerId.JOKER, JokerEffect.mult(1));
        ScriptedJoker third = ScriptedJoker.onHand(JokerId.JOKER, JokerEffect.mult(1));
        GameContext ctx = context("KS KH", List.of(doomed, second, third));

        ProcessingResult result = processor.process(ctx);

        assertEquals(1, result.removals().size());
        RemovalDirective removal = result.removals().get(0);
        assertSame(doomed, removal.joker());
        assertEquals(0, removal.position());
        assertEquals(RemovalDirective.Reason.SELF_DESTROY, removal.reason());
        assertTrue(second.siblingsSeen.stream().allMatch(n -> n == 3));
        assertTrue(third.siblingsSeen.stream().allMatch(n -> n == 3));
        assertEquals(3, ctx.jokerCount());
        assertEquals(5, result.aggregate().getChips());
    }

    @Test
    void testDestroyByPositionSchedulesSibling() {
        ScriptedJoker dagger = ScriptedJoker.onHand(JokerId.CEREMONIAL_DAGGER,
            JokerEffect.builder().destroyJokerAt(1).build());
        ScriptedJoker victim = ScriptedJoker.onHand(JokerId.JOKER, JokerEffect.mult(4));

        ProcessingResult result = processor.process(context("KS", List.of(dagger, victim)));

        assertEquals(1, result.removals().size());
        assertSame(victim, result.removals().get(0).joker());
        assertEquals(RemovalDirective.Reason.DESTROYED_BY_SIBLING, result.removals().get(0).reason());
        assertEquals(4.0, result.aggregate().getMult());
    }

    @Test
    void testOutOfRangeDestroyIsIgnored() {
        ScriptedJoker dagger = ScriptedJoker.onHand(JokerId.CEREMONIAL_DAGGER,
            JokerEffect.builder().destroyJokerAt(7).build());

        ProcessingResult result = processor.process(context("KS", List.of(dagger)));

        assertTrue(result.removals().isEmpty());
        assertFalse(result.hasErrors());
    }

    @Test
    void testFailingHookIsIsolated() {
        ScriptedJoker before = ScriptedJoker.onHand(JokerId.JOKER, JokerEffect.mult(4));
        ScriptedJoker broken = new ScriptedJoker(JokerId.MISPRINT,
            ctx -> { throw new IllegalStateException("boom"); },
            (ctx, card) -> JokerEffect.none(),
            ctx -> JokerEffect.none());
        ScriptedJoker after = ScriptedJoker.onHand(JokerId.JOKER, JokerEffect.mult(4));

        ProcessingResult result = processor.process(context("KS KH", List.of(before, broken, after)));

        assertEquals(8.0, result.aggregate().getMult());
        assertEquals(1, result.errors().size());
        HookError error = result.errors().get(0);
        assertEquals(JokerId.MISPRINT, error.jokerId());
        assertEquals("onHandPlayed", error.hook());
        assertEquals("boom", error.message());
        assertEquals(1, after.handCalls);
    }

    @Test
    void testRetriggersAreCapped() {
        JokerEffectProcessor capped = new JokerEffectProcessor(3, joker -> joker.id().wireName());
        ScriptedJoker mime = ScriptedJoker.onCard(JokerId.HACK, JokerEffect.retrigger(50));
        ScriptedJoker chips = ScriptedJoker.onCard(JokerId.GREEDY_JOKER, JokerEffect.chips(10));

        ProcessingResult result = capped.process(context("AS", List.of(mime, chips)));

        assertEquals(List.of(3), result.cardRetriggers());
        assertEquals(4, result.timesScored(0));
        assertEquals(40, result.aggregate().getChips());
        assertEquals(4, chips.cardCalls);
    }

    @Test
    void testLifecyclePassAccumulatesMoney() {
        List<Joker> jokers = List.of(
            ScriptedJoker.onRoundEnd(JokerId.GOLDEN_JOKER, JokerEffect.money(4)),
            ScriptedJoker.onRoundEnd(JokerId.GOLDEN_JOKER, JokerEffect.money(4)));
        GameContext ctx = GameContext.builder(RUN).jokers(jokers).build();

        ProcessingResult result = processor.processLifecycle(ctx, "onRoundEnd",
            (joker, c) -> joker.onRoundEnd(c));

        assertEquals(8, result.aggregate().getMoney());
        assertTrue(result.scoringCards().isEmpty());
    }

    @Test
    void testSingleHookTargetsOneJoker() {
        ScriptedJoker a = ScriptedJoker.onRoundEnd(JokerId.GOLDEN_JOKER, JokerEffect.money(4));
        ScriptedJoker b = ScriptedJoker.onRoundEnd(JokerId.GOLDEN_JOKER, JokerEffect.money(6));
        GameContext ctx = GameContext.builder(RUN).jokers(List.of(a, b)).build();

        ProcessingResult result = processor.processSingle(ctx, b, "onRoundEnd", (joker, c) -> joker.onRoundEnd(c));

        assertEquals(6, result.aggregate().getMoney());
    }

    @Test
    void testNegativeRetriggerLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> new JokerEffectProcessor(-1, j -> "x"));
    }
}
