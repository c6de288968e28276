package com.balatro.jokers.factory;

import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.catalog.ToDoListJoker;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.registry.JokerRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JokerFactory construction and its failure reasons.
 */
class JokerFactoryTest {

    private final JokerFactory factory = new JokerFactory(JokerRegistry.global());

    @Test
    void testCreateByIdentifier() throws ConstructionException {
        Joker joker = factory.create(JokerId.JOKER);
        assertEquals(JokerId.JOKER, joker.id());
    }

    @Test
    void testCreateByWireName() throws ConstructionException {
        Joker joker = factory.create("green_joker", ConstructionArgs.EMPTY);
        assertEquals(JokerId.GREEN_JOKER, joker.id());
    }

    @Test
    void testInstancesAreIndependent() throws ConstructionException {
        assertNotSame(factory.create(JokerId.GREEN_JOKER), factory.create(JokerId.GREEN_JOKER));
    }

    @Test
    void testUnknownWireName() {
        ConstructionException e = assertThrows(ConstructionException.class,
            () -> factory.create("not_a_joker", ConstructionArgs.EMPTY));
        assertEquals(ConstructionException.Reason.UNKNOWN_IDENTIFIER, e.getReason());
        assertEquals("not_a_joker", e.getIdentifier());
    }

    @Test
    void testUnregisteredIdentifier() {
        JokerFactory empty = new JokerFactory(JokerRegistry.builder().build());
        ConstructionException e = assertThrows(ConstructionException.class, () -> empty.create(JokerId.JOKER));
        assertEquals(ConstructionException.Reason.NOT_IMPLEMENTED, e.getReason());
    }

    @Test
    void testUnknownArgumentKey() {
        ConstructionException e = assertThrows(ConstructionException.class,
            () -> factory.create(JokerId.JOKER, ConstructionArgs.of("mult", "8")));
        assertEquals(ConstructionException.Reason.INVALID_ARGUMENT, e.getReason());
    }

    @Test
    void testMalformedArgumentValue() {
        ConstructionException e = assertThrows(ConstructionException.class,
            () -> factory.create(JokerId.TO_DO_LIST, ConstructionArgs.of("hand", "royal_pair")));
        assertEquals(ConstructionException.Reason.INVALID_ARGUMENT, e.getReason());
    }

    @Test
    void testArgumentsReachTheConstructor() throws ConstructionException {
        Joker joker = factory.create(JokerId.TO_DO_LIST, ConstructionArgs.parse("hand=flush"));
        assertEquals(HandRank.FLUSH, ((ToDoListJoker) joker).target());
    }

    @Test
    void testParseArguments() {
        ConstructionArgs args = ConstructionArgs.parse("suit=hearts, rank=K");
        assertEquals(Map.of("suit", "hearts", "rank", "K"), args.asMap());
        assertTrue(ConstructionArgs.parse("").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ConstructionArgs.parse("novalue"));
    }
}
