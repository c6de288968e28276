package com.balatro.jokers.simulation;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Enhancement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Deck construction and deck file parsing.
 */
class DeckTest {

    @Test
    void testStandardDeck() {
        Deck deck = Deck.standard();
        assertEquals(52, deck.size());
        assertEquals(52, new HashSet<>(deck.getCards()).size());
        assertEquals("standard", deck.getName());
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("steel.txt");
        Files.writeString(file, "# steel kings\nKS:steel KH:steel\n// filler\n4x7D\n");

        Deck deck = Deck.loadFromFile(file.toString());

        assertEquals(6, deck.size());
        assertEquals("steel", deck.getName());
        assertEquals(Enhancement.STEEL, deck.getCards().get(0).enhancement());
        assertEquals(Card.parse("7D"), deck.getCards().get(5));
    }

    @Test
    void testInvalidDeckFiles(@TempDir Path dir) throws Exception {
        Path empty = dir.resolve("empty.txt");
        Files.writeString(empty, "# nothing here\n");
        Path bad = dir.resolve("bad.txt");
        Files.writeString(bad, "AS ZZ\n");

        assertThrows(Deck.DeckException.class, () -> Deck.loadFromFile(empty.toString()));
        assertThrows(Deck.DeckException.class, () -> Deck.loadFromFile(bad.toString()));
        assertThrows(Deck.DeckException.class, () -> Deck.loadFromFile(dir.resolve("missing.txt").toString()));
    }
}
