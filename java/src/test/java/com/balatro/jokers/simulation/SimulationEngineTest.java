package com.balatro.jokers.simulation;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.HandRules;
import com.balatro.jokers.config.EngineConfig;
import com.balatro.jokers.registry.JokerRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SimulationEngine run logic and batch determinism.
 */
class SimulationEngineTest {

    private static final List<Card> DECK = Deck.standard().getCards();
    private static final List<JokerLoadout> LOADOUT = List.of(
        JokerLoadout.parse("joker"),
        JokerLoadout.parse("green_joker"),
        JokerLoadout.parse("to_do_list:hand=pair"));

    private final JokerRegistry registry = JokerRegistry.global();

    @Test
    void testBlindTargets() {
        assertEquals(300, SimulationEngine.blindTarget(1, 0));
        assertEquals(450, SimulationEngine.blindTarget(1, 1));
        assertEquals(600, SimulationEngine.blindTarget(1, 2));
        assertEquals(100_000, SimulationEngine.blindTarget(8, 2));
        assertEquals(100_000, SimulationEngine.blindTarget(12, 2), "antes past the last reuse its target");
    }

    @Test
    void testInterestIsCapped() {
        assertEquals(0, SimulationEngine.interest(4));
        assertEquals(2, SimulationEngine.interest(12));
        assertEquals(5, SimulationEngine.interest(400));
        assertEquals(0, SimulationEngine.interest(-10));
    }

    @Test
    void testChooseBestHandPrefersStrongerHand() {
        List<Card> hand = Card.parseList("2S 7H KD KC 9S 3D 4H QS");
        List<Card> chosen = SimulationEngine.chooseBestHand(hand, HandRules.STANDARD);

        assertTrue(chosen.containsAll(Card.parseList("KD KC")));
        assertTrue(chosen.size() <= 5);
    }

    @Test
    void testChooseDiscardsKeepsChosenCards() {
        List<Card> hand = Card.parseList("2S 7H KD KC 9S 3D 4H QS");
        List<Card> keep = Card.parseList("KD KC");

        List<Card> thrown = SimulationEngine.chooseDiscards(hand, keep);

        assertEquals(5, thrown.size());
        assertFalse(thrown.contains(Card.parse("KD")));
        assertTrue(thrown.contains(Card.parse("2S")));
    }

    @Test
    void testRunGameIsDeterministic() {
        EngineConfig config = EngineConfig.defaults();
        SimulationResult a = SimulationEngine.runGame(DECK, LOADOUT, 1234, registry, config, false);
        SimulationResult b = SimulationEngine.runGame(DECK, LOADOUT, 1234, registry, config, false);

        assertEquals(a, b);
        assertTrue(a.handsPlayed() > 0);
        assertTrue(a.antesCleared() >= 0 && a.antesCleared() <= SimulationEngine.FINAL_ANTE);
        assertEquals(0, a.hookErrors());
    }

    @Test
    void testUnknownLoadoutJokerIsSkipped() {
        SimulationResult result = SimulationEngine.runGame(DECK, List.of(JokerLoadout.parse("not_a_joker")),
            5, registry, EngineConfig.defaults(), false);
        assertEquals(0, result.finalJokers());
    }

    @Test
    void testBatchResultsAreInSeedOrderAndRepeatable() throws Exception {
        EngineConfig pooled = EngineConfig.defaults().withSimulationThreads(2);
        List<SimulationResult> first = SimulationEngine.runBatch(DECK, LOADOUT, 6, 100, registry, pooled);
        List<SimulationResult> second = SimulationEngine.runBatch(DECK, LOADOUT, 6, 100, registry,
            EngineConfig.defaults());

        assertEquals(6, first.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(100 + i, first.get(i).seed());
        }
        assertEquals(first, second);
    }

    @Test
    void testLoadoutParsing() {
        JokerLoadout plain = JokerLoadout.parse(" joker ");
        assertEquals("joker", plain.wireName());
        assertTrue(plain.args().isEmpty());

        JokerLoadout withArgs = JokerLoadout.parse("castle:suit=hearts");
        assertEquals("castle", withArgs.wireName());
        assertEquals("hearts", withArgs.args().getString("suit", null));
        assertEquals("castle:{suit=hearts}", withArgs.toString());
        assertThrows(IllegalArgumentException.class, () -> JokerLoadout.parse(" "));
    }
}
