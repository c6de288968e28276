package com.balatro.jokers.compat;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.HandEvaluator;
import com.balatro.jokers.card.PlayedHand;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.RunState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.factory.JokerFactory;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.registry.JokerRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that legacy jokers behave identically whether called directly or through the adapter.
 */
class LegacyBridgeTest {

    private static final RunState RUN = RunState.builder()
        .seed(77)
        .money(10)
        .discardsRemaining(2)
        .build();

    private static final PlayedHand HAND = HandEvaluator.evaluate(Card.parseList("KS KH QD 9C 9S"));
    private static final List<Card> DISCARDED = Card.parseList("JS QH KC 2D");

    private static GameContext freshContext() {
        return GameContext.builder(RUN).hand(HAND).build();
    }

    @Test
    void testAdapterMatchesLegacyOutputs() {
        List<LegacyJoker> direct = LegacyJokers.all();
        List<LegacyJoker> wrapped = LegacyJokers.all();
        assertEquals(direct.size(), wrapped.size());

        for (int i = 0; i < direct.size(); i++) {
            LegacyJoker legacy = direct.get(i);
            LegacyJokerAdapter adapter = new LegacyJokerAdapter(wrapped.get(i));
            String label = legacy.id().wireName();

            assertEquals(legacy.id(), adapter.id(), label);
            assertEquals(legacy.onHandPlayed(freshContext()), adapter.onHandPlayed(freshContext()), label);

            GameContext legacyCtx = freshContext();
            GameContext adapterCtx = freshContext();
            for (Card card : HAND.getScoring()) {
                assertEquals(legacy.onCardScored(legacyCtx, card), adapter.onCardScored(adapterCtx, card), label);
            }

            assertEquals(legacy.onBlindStart(freshContext()), adapter.onRoundStart(freshContext()), label);
            assertEquals(legacy.onRoundEnd(freshContext()), adapter.onRoundEnd(freshContext()), label);
            assertEquals(legacy.onDiscard(freshContext(), DISCARDED),
                adapter.onDiscard(freshContext(), DISCARDED), label);

            assertEquals(legacy.handSizeBonus(), adapter.handSizeDelta(), label);
            assertEquals(legacy.discardBonus(), adapter.discardsDelta(), label);
            assertEquals(legacy.handBonus(), adapter.handsDelta(), label);
        }
    }

    @Test
    void testAdapterMetadataComesFromLegacyJoker() {
        LegacyJokers.Stuntman stuntman = new LegacyJokers.Stuntman();
        LegacyJokerAdapter adapter = new LegacyJokerAdapter(stuntman);

        assertEquals("Stuntman", adapter.metadata().name());
        assertEquals(stuntman.rarity(), adapter.metadata().rarity());
        assertEquals(stuntman.cost(), adapter.metadata().baseCost());
        assertSame(stuntman, adapter.unwrap());
    }

    @Test
    void testRegistryBuildsLegacyJokersBehindAdapter() throws Exception {
        Joker joker = new JokerFactory(JokerRegistry.global()).create(JokerId.SCARY_FACE);
        assertInstanceOf(LegacyJokerAdapter.class, joker);
        assertEquals(JokerEffect.chips(30), ((LegacyJokerAdapter) joker).onCardScored(freshContext(), Card.parse("KS")));
    }

    @Test
    void testCollectionCountsLegacyEntries() {
        JokerCollection collection = new JokerCollection();
        Joker adapted = collection.addLegacy(new LegacyJokers.GoldenJoker());
        collection.add(() -> JokerId.JOKER);

        assertEquals(2, collection.size());
        assertEquals(1, collection.legacyCount());
        assertEquals(0, collection.indexOf(adapted));
        assertTrue(collection.remove(adapted));
        assertEquals(-1, collection.indexOf(adapted));
    }
}
