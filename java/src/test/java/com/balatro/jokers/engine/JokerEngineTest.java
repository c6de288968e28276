package com.balatro.jokers.engine;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.catalog.CeremonialDaggerJoker;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.RunState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.factory.ConstructionArgs;
import com.balatro.jokers.factory.ConstructionException;
import com.balatro.jokers.framework.ModifierJoker;
import com.balatro.jokers.framework.ScalingJoker;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.JokerState;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.persistence.EntryFailure;
import com.balatro.jokers.persistence.JokerSaveCodec;
import com.balatro.jokers.persistence.SaveFormatException;
import com.balatro.jokers.persistence.UnsupportedSaveVersionException;
import com.balatro.jokers.registry.JokerRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JokerEngine: acquisition, scoring, removal resolution and save/load.
 */
class JokerEngineTest {

    private static final RunState RUN = RunState.initial(42);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JokerEngine engine = new JokerEngine(JokerRegistry.global());

    private static byte[] utf8(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    // ==================== ACQUIRE / SELL ====================

    @Test
    void testAcquireAssignsIncreasingSlots() throws ConstructionException {
        InstanceHandle first = engine.acquire(JokerId.JOKER);
        InstanceHandle second = engine.acquire("green_joker", ConstructionArgs.EMPTY);

        assertEquals(List.of(first, second), engine.active());
        assertEquals(1, first.slot());
        assertEquals(2, second.slot());
        assertEquals("joker#1", first.toString());
        assertTrue(engine.find(second).isPresent());
    }

    @Test
    void testAcquireUnknownIdentifierFails() {
        ConstructionException e = assertThrows(ConstructionException.class,
            () -> engine.acquire("not_a_joker", ConstructionArgs.EMPTY));
        assertEquals(ConstructionException.Reason.UNKNOWN_IDENTIFIER, e.getReason());
        assertEquals(0, engine.size());
    }

    @Test
    void testSellRemovesJokerAndNotifiesOthers() throws ConstructionException {
        InstanceHandle campfire = engine.acquire(JokerId.CAMPFIRE);
        InstanceHandle joker = engine.acquire(JokerId.JOKER);

        SaleOutcome outcome = engine.sell(joker);

        assertEquals(1, outcome.value());
        assertEquals(List.of(campfire), engine.active());
        assertEquals(1.25, ((ScalingJoker) engine.find(campfire).orElseThrow()).value());
        assertThrows(IllegalArgumentException.class, () -> engine.sell(joker));
    }

    @Test
    void testRoundEndSellValueIncrease() throws ConstructionException {
        InstanceHandle egg = engine.acquire(JokerId.EGG);
        InstanceHandle joker = engine.acquire(JokerId.JOKER);

        engine.roundEnded(RUN);
        engine.roundEnded(RUN);

        assertEquals(1 + 6, engine.sellValue(egg));
        assertEquals(1, engine.sellValue(joker));
    }

    // ==================== SCORING ====================

    @Test
    void testScoresPairWithAdditiveAndMultiplicativeJokers() throws ConstructionException {
        engine.acquire(JokerId.JOKER);
        engine.acquire(JokerId.JOKER);
        engine.acquire(JokerId.CAVENDISH);

        HandResult result = engine.process(Card.parseList("KS KH 3D"), List.of(), RUN);

        // 10 base + 10 + 10 chips; (2 + 8) x 3 mult
        assertEquals(30, result.score().chips());
        assertEquals(30.0, result.score().mult());
        assertEquals(900, result.score().score());
        assertEquals(RUN.getMoney(), result.score().wallet());
        assertFalse(result.result().hasErrors());
    }

    @Test
    void testNoJokersScoresBaseHand() {
        HandResult result = engine.process(Card.parseList("AS"), List.of(), RUN);

        assertEquals(16, result.score().chips());
        assertEquals(1.0, result.score().mult());
        assertEquals(16, result.score().score());
    }

    @Test
    void testEnhancedCardsAddToBase() {
        HandResult result = engine.process(List.of(Card.parse("AS:mult"), Card.parse("AH")), List.of(), RUN);

        assertEquals(10 + 11 + 11, result.score().chips());
        assertEquals(2.0 + 4.0, result.score().mult());
    }

    @Test
    void testSameSeedSameScore() throws ConstructionException {
        JokerEngine other = new JokerEngine(JokerRegistry.global());
        engine.acquire(JokerId.MISPRINT);
        other.acquire(JokerId.MISPRINT);

        HandResult a = engine.process(Card.parseList("QS QH"), List.of(), RUN);
        HandResult b = other.process(Card.parseList("QS QH"), List.of(), RUN);

        assertEquals(a.score(), b.score());
    }

    @Test
    void testSelfDestroyingJokerIsRemovedAfterTheHand() throws Exception {
        InstanceHandle iceCream = engine.acquire(JokerId.ICE_CREAM);
        InstanceHandle joker = engine.acquire(JokerId.JOKER);
        ((JokerState) engine.find(iceCream).orElseThrow())
            .deserializeState(1, MAPPER.readTree("{\"values\":{\"value\":5}}"));

        HandResult result = engine.process(Card.parseList("AS"), List.of(), RUN);

        assertEquals(16 + 5, result.score().chips());
        assertEquals(1.0 + 4.0, result.score().mult());
        assertEquals(1, result.result().removals().size());
        assertEquals(List.of(joker), engine.active());
        assertTrue(engine.store().find(iceCream.toKey()).isEmpty());
    }

    @Test
    void testCeremonialDaggerDestroysNeighbourAtRoundStart() throws ConstructionException {
        InstanceHandle dagger = engine.acquire(JokerId.CEREMONIAL_DAGGER);
        engine.acquire(JokerId.JOKER);

        engine.roundStarted(RUN);

        assertEquals(List.of(dagger), engine.active());
        assertEquals(2.0, ((CeremonialDaggerJoker) engine.find(dagger).orElseThrow()).mult());
    }

    @Test
    void testCeremonialDaggerUsesAccruedSellValue() throws ConstructionException {
        InstanceHandle dagger = engine.acquire(JokerId.CEREMONIAL_DAGGER);
        InstanceHandle egg = engine.acquire(JokerId.EGG);
        engine.roundEnded(RUN);
        engine.roundEnded(RUN);
        int eggValue = engine.sellValue(egg);
        assertEquals(7, eggValue);

        engine.roundStarted(RUN);

        assertEquals(List.of(dagger), engine.active());
        assertEquals(2.0 * eggValue, ((CeremonialDaggerJoker) engine.find(dagger).orElseThrow()).mult());
    }

    @Test
    void testFailingJokerDoesNotAbortScoring() throws ConstructionException {
        JokerMetadata meta = JokerMetadata.of("Broken", "Always throws", Rarity.COMMON);
        JokerRegistry registry = JokerRegistry.builder()
            .register(JokerId.MISPRINT, meta, args -> new JokerGameplay() {
                @Override
                public JokerId id() {
                    return JokerId.MISPRINT;
                }

                @Override
                public JokerEffect onHandPlayed(GameContext context) {
                    throw new IllegalStateException("broken on purpose");
                }
            })
            .register(JokerId.JOKER, JokerMetadata.of("Joker", "+4 Mult", Rarity.COMMON),
                args -> new JokerGameplay() {
                    @Override
                    public JokerId id() {
                        return JokerId.JOKER;
                    }

                    @Override
                    public JokerEffect onHandPlayed(GameContext context) {
                        return JokerEffect.mult(4);
                    }
                })
            .build();
        JokerEngine local = new JokerEngine(registry);
        local.acquire(JokerId.MISPRINT);
        local.acquire(JokerId.JOKER);

        HandResult result = local.process(Card.parseList("AS"), List.of(), RUN);

        assertEquals(1, result.result().errors().size());
        assertEquals("misprint#1", result.result().errors().get(0).source());
        assertEquals(5.0, result.score().mult());
        assertEquals(2, local.size());
    }

    @Test
    void testCreditCardDoesNotLetTheWalletGoNegative() throws ConstructionException {
        JokerRegistry registry = JokerRegistry.builder()
            .register(JokerId.CREDIT_CARD, JokerMetadata.of("Credit Card", "Go up to -$20 in debt", Rarity.COMMON),
                args -> ModifierJoker.builder(JokerId.CREDIT_CARD,
                    JokerMetadata.of("Credit Card", "Go up to -$20 in debt", Rarity.COMMON)).debtLimit(20).build())
            .register(JokerId.MISPRINT, JokerMetadata.of("Tax", "-$10 per hand", Rarity.COMMON),
                args -> new JokerGameplay() {
                    @Override
                    public JokerId id() {
                        return JokerId.MISPRINT;
                    }

                    @Override
                    public JokerEffect onHandPlayed(GameContext context) {
                        return JokerEffect.money(-10);
                    }
                })
            .build();
        JokerEngine local = new JokerEngine(registry);
        local.acquire(JokerId.CREDIT_CARD);
        local.acquire(JokerId.MISPRINT);

        HandResult result = local.process(Card.parseList("AS"), List.of(), RUN.toBuilder().money(3).build());

        assertEquals(0, result.score().wallet());
        assertEquals(20, local.modifiers().debtLimit());
        assertEquals(20, local.modifiers().spendable(result.score().wallet()));
        assertTrue(local.modifiers().canAfford(0, 6));
        assertFalse(local.modifiers().canAfford(0, 21));
    }

    @Test
    void testConditionCacheAnswersLaterHandsOfTheRound() throws ConstructionException {
        InstanceHandle bus = engine.acquire(JokerId.RIDE_THE_BUS);
        engine.roundStarted(RUN);

        String[] hands = {"AS", "AH", "AD", "AC"};
        HandResult last = null;
        for (int i = 0; i < hands.length; i++) {
            RunState run = RUN.toBuilder()
                .handsRemaining(4 - i)
                .handsPlayedThisRound(i)
                .handIndex(i)
                .money(4 + i)
                .build();
            last = engine.process(Card.parseList(hands[i]), Card.parseList("2C 3D"), run);
        }

        ScalingJoker joker = (ScalingJoker) engine.find(bus).orElseThrow();
        assertEquals(4.0, joker.value());
        assertEquals(1 + 4.0, last.score().mult());
        assertEquals(3, joker.conditionCache().misses());
        assertEquals(9, joker.conditionCache().hits());
        assertTrue(joker.conditionCache().hitRate() > 0.5);
    }

    // ==================== SAVE / LOAD ====================

    @Test
    void testSaveAndLoadPreservesOrderStateAndSellValue() throws Exception {
        engine.acquire(JokerId.JOKER);
        InstanceHandle green = engine.acquire(JokerId.GREEN_JOKER);
        InstanceHandle egg = engine.acquire(JokerId.EGG);
        for (int i = 0; i < 3; i++) {
            engine.process(Card.parseList("KS KH"), List.of(), RUN);
        }
        engine.roundEnded(RUN);
        byte[] blob = engine.serializeAll();

        JokerEngine restored = new JokerEngine(JokerRegistry.global());
        LoadReport report = restored.deserializeAll(blob);

        assertTrue(report.isComplete());
        assertEquals(JokerSaveCodec.FORMAT_VERSION, report.formatVersion());
        assertEquals(engine.active(), restored.active());
        assertEquals(3.0, ((ScalingJoker) restored.find(green).orElseThrow()).value());
        assertEquals(4, restored.sellValue(egg));

        HandResult next = restored.process(Card.parseList("KS KH"), List.of(), RUN);
        assertEquals(2.0 + 4.0 + 4.0, next.score().mult());
        assertEquals(4, restored.acquire(JokerId.JOKER).slot());
    }

    @Test
    void testLostEntriesDoNotBlockTheRest() throws Exception {
        LoadReport report = engine.deserializeAll(utf8("{\"format_version\":2,\"jokers\":["
            + "{\"id\":\"joker\",\"slot\":1,\"schema_version\":1,\"state\":null},"
            + "{\"id\":\"not_a_joker\",\"slot\":2,\"schema_version\":1,\"state\":null},"
            + "{\"id\":\"green_joker\",\"slot\":3,\"schema_version\":1,\"state\":{\"values\":{\"value\":\"abc\"}}},"
            + "{\"id\":\"green_joker\",\"slot\":4,\"schema_version\":9,\"state\":{}},"
            + "{\"id\":\"egg\",\"slot\":1,\"schema_version\":1,\"state\":null},"
            + "{\"id\":\"egg\",\"slot\":6,\"schema_version\":1,\"state\":null}"
            + "]}"));

        assertFalse(report.isComplete());
        assertEquals(List.of(new InstanceHandle(JokerId.JOKER, 1), new InstanceHandle(JokerId.EGG, 6)),
            report.loaded());
        assertEquals(engine.active(), report.loaded());

        Map<Integer, EntryFailure.Reason> reasons = new TreeMap<>();
        for (EntryFailure failure : report.failures()) {
            reasons.put(failure.position(), failure.reason());
        }
        assertEquals(Map.of(
            1, EntryFailure.Reason.UNKNOWN_IDENTIFIER,
            2, EntryFailure.Reason.STATE_REJECTED,
            3, EntryFailure.Reason.UNSUPPORTED_STATE_VERSION,
            4, EntryFailure.Reason.MALFORMED_ENTRY), reasons);
        assertEquals(0, engine.store().size());
    }

    @Test
    void testUnreadableSaveLeavesJokersUntouched() throws ConstructionException {
        InstanceHandle joker = engine.acquire(JokerId.JOKER);

        assertThrows(UnsupportedSaveVersionException.class,
            () -> engine.deserializeAll(utf8("{\"format_version\":3,\"jokers\":[]}")));
        assertThrows(SaveFormatException.class, () -> engine.deserializeAll(utf8("{oops")));

        assertEquals(List.of(joker), engine.active());
    }

    @Test
    void testFormatOneSaveLoads() throws Exception {
        LoadReport report = engine.deserializeAll(utf8("{\"format_version\":1,\"jokers\":["
            + "{\"id\":\"joker\",\"state\":null},"
            + "{\"id\":\"green_joker\",\"state\":{\"version\":1,\"values\":{\"value\":7}}}]}"));

        assertTrue(report.isComplete());
        assertEquals(1, report.formatVersion());
        InstanceHandle green = report.loaded().get(1);
        assertEquals(2, green.slot());
        assertEquals(7.0, ((ScalingJoker) engine.find(green).orElseThrow()).value());
    }
}
