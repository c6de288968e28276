package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.HandEvaluator;
import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.InstanceKey;
import com.balatro.jokers.context.JokerStateStore;
import com.balatro.jokers.context.RunState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.factory.ConstructionArgs;
import com.balatro.jokers.factory.JokerFactory;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerStateException;
import com.balatro.jokers.joker.StateDeserializeException;
import com.balatro.jokers.joker.UnsupportedStateVersionException;
import com.balatro.jokers.registry.JokerRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the hand-written catalog jokers.
 */
class SpecialJokersTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JokerFactory factory = new JokerFactory(JokerRegistry.global());

    private static GameContext context(String played, List<? extends Joker> jokers) {
        return GameContext.builder(RunState.initial(11))
            .hand(HandEvaluator.evaluate(Card.parseList(played)))
            .jokers(jokers)
            .build();
    }

    @Test
    void testToDoListPaysOnTargetHand() throws Exception {
        ToDoListJoker toDo = (ToDoListJoker) factory.create(JokerId.TO_DO_LIST, ConstructionArgs.of("hand", "pair"));

        assertEquals(JokerEffect.money(4), toDo.onHandPlayed(context("KS KH", List.of(toDo))));
        assertTrue(toDo.onHandPlayed(context("2H 5H 9H JH KH", List.of(toDo))).isIdentity());
        assertTrue(toDo.onHandPlayed(context("", List.of(toDo))).isIdentity());
    }

    @Test
    void testToDoListPicksNewTargetAtRoundEnd() throws Exception {
        ToDoListJoker toDo = (ToDoListJoker) factory.create(JokerId.TO_DO_LIST);
        toDo.onRoundEnd(context("", List.of(toDo)));

        Set<HandRank> allowed = Set.of(HandRank.HIGH_CARD, HandRank.PAIR, HandRank.TWO_PAIR,
            HandRank.THREE_OF_A_KIND, HandRank.STRAIGHT, HandRank.FLUSH, HandRank.FULL_HOUSE,
            HandRank.FOUR_OF_A_KIND, HandRank.STRAIGHT_FLUSH);
        assertTrue(allowed.contains(toDo.target()));

        assertThrows(StateDeserializeException.class,
            () -> toDo.deserializeState(1, MAPPER.readTree("{\"data\":{\"target\":\"seven_card_stud\"}}")));
    }

    @Test
    void testToDoListWithCorruptedStoreFailsTheHook() throws Exception {
        ToDoListJoker toDo = (ToDoListJoker) factory.create(JokerId.TO_DO_LIST);
        JokerStateStore store = new JokerStateStore();
        InstanceKey key = new InstanceKey(JokerId.TO_DO_LIST, 1);
        toDo.attach(key, store);

        store.get(key).data().put("target", "seven_card_stud");

        JokerStateException e = assertThrows(JokerStateException.class,
            () -> toDo.onHandPlayed(context("KS KH", List.of(toDo))));
        assertTrue(e.getMessage().contains("seven_card_stud"));
    }

    @Test
    void testLoyaltyCardFiresEverySixthHand() throws Exception {
        LoyaltyCardJoker loyalty = (LoyaltyCardJoker) factory.create(JokerId.LOYALTY_CARD);
        GameContext ctx = context("AS", List.of(loyalty));

        for (int i = 1; i <= 5; i++) {
            assertTrue(loyalty.onHandPlayed(ctx).isIdentity(), "hand " + i);
        }
        assertEquals(1, loyalty.handsUntilReady());
        assertEquals(JokerEffect.xMult(4), loyalty.onHandPlayed(ctx));
        assertEquals(0, loyalty.handsUntilReady());
    }

    @Test
    void testTurtleBeanShrinksEachRound() throws Exception {
        TurtleBeanJoker bean = (TurtleBeanJoker) factory.create(JokerId.TURTLE_BEAN);
        GameContext ctx = context("", List.of(bean));

        assertEquals(5, bean.handSizeDelta());
        for (int i = 0; i < 4; i++) {
            assertFalse(bean.onRoundEnd(ctx).isDestroySelf());
        }
        assertEquals(1, bean.handSizeDelta());
        assertTrue(bean.onRoundEnd(ctx).isDestroySelf());
    }

    @Test
    void testTurtleBeanRejectsOutOfRangeState() throws Exception {
        TurtleBeanJoker bean = (TurtleBeanJoker) factory.create(JokerId.TURTLE_BEAN);

        assertThrows(StateDeserializeException.class,
            () -> bean.deserializeState(1, MAPPER.readTree("{\"counters\":{\"hand_size\":9}}")));
        assertEquals(5, bean.handSizeDelta());

        UnsupportedStateVersionException e = assertThrows(UnsupportedStateVersionException.class,
            () -> bean.deserializeState(2, MAPPER.readTree("{\"counters\":{\"hand_size\":3}}")));
        assertEquals(5, bean.handSizeDelta());
        assertNotNull(e.getMessage());

        bean.deserializeState(1, MAPPER.readTree("{\"counters\":{\"hand_size\":3}}"));
        assertEquals(3, bean.handSizeDelta());
    }

    @Test
    void testBlueprintCopiesStatelessRightNeighbour() throws Exception {
        JokerGameplay blueprint = (JokerGameplay) factory.create(JokerId.BLUEPRINT);
        Joker joker = factory.create(JokerId.JOKER);
        Joker green = factory.create(JokerId.GREEN_JOKER);

        assertEquals(JokerEffect.mult(4), blueprint.onHandPlayed(context("AS", List.of(blueprint, joker))));
        assertTrue(blueprint.onHandPlayed(context("AS", List.of(joker, blueprint))).isIdentity());
        assertTrue(blueprint.onHandPlayed(context("AS", List.of(blueprint, green))).isIdentity());
    }

    @Test
    void testBrainstormNeverCopiesACopy() throws Exception {
        JokerGameplay brainstorm = (JokerGameplay) factory.create(JokerId.BRAINSTORM);
        Joker blueprint = factory.create(JokerId.BLUEPRINT);
        Joker joker = factory.create(JokerId.JOKER);

        assertEquals(JokerEffect.mult(4), brainstorm.onHandPlayed(context("AS", List.of(joker, brainstorm))));
        assertTrue(brainstorm.onHandPlayed(context("AS", List.of(blueprint, brainstorm, joker))).isIdentity());
    }

    @Test
    void testCeremonialDaggerEatsRightNeighbour() throws Exception {
        CeremonialDaggerJoker dagger = (CeremonialDaggerJoker) factory.create(JokerId.CEREMONIAL_DAGGER);
        Joker victim = factory.create(JokerId.JOKER);

        JokerEffect effect = dagger.onRoundStart(context("", List.of(dagger, victim)));

        assertEquals(List.of(1), effect.getDestroyedJokerPositions());
        assertEquals(2.0, dagger.mult());
        assertEquals(JokerEffect.mult(2), dagger.onHandPlayed(context("AS", List.of(dagger))));
        assertTrue(dagger.onRoundStart(context("", List.of(dagger))).isIdentity());
    }
}
