package com.balatro.jokers.simulation;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.card.Suit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Deck representation and parsing.
 */
public class Deck {
    private final List<Card> cards;
    private final String name;

    public Deck(List<Card> cards, String name) {
        this.cards = new ArrayList<>(cards);
        this.name = name;
    }

    /**
     * The standard 52-card deck.
     */
    public static Deck standard() {
        List<Card> cards = new ArrayList<>(52);
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(Card.of(rank, suit));
            }
        }
        return new Deck(cards, "standard");
    }

    /**
     * Load a deck from a file.
     * Format: whitespace separated cards ("AS KD TH:steel"), optionally prefixed
     * with a count ("4x7H:mult"); comments start with # or //.
     *
     * @param path Path to the deck file
     * @return Parsed deck
     * @throws DeckException if parsing fails
     */
    public static Deck loadFromFile(String path) throws DeckException {
        String content;
        try {
            content = Files.readString(Path.of(path));
        } catch (IOException e) {
            throw new DeckException("Failed to read deck file: " + e.getMessage());
        }

        List<Card> cards = new ArrayList<>();
        String[] lines = content.split("\n");
        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();

            // Skip empty lines and comments
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }

            for (String token : line.split("\\s+")) {
                int count = 1;
                String cardText = token;
                int x = token.indexOf('x');
                if (x > 0 && token.substring(0, x).chars().allMatch(Character::isDigit)) {
                    count = Integer.parseInt(token.substring(0, x));
                    cardText = token.substring(x + 1);
                }
                Card card;
                try {
                    card = Card.parse(cardText);
                } catch (IllegalArgumentException e) {
                    throw new DeckException("Invalid card at line " + (lineNum + 1) + ": " + e.getMessage());
                }
                for (int i = 0; i < count; i++) {
                    cards.add(card);
                }
            }
        }

        if (cards.isEmpty()) {
            throw new DeckException("Deck file '" + path + "' has no cards");
        }

        // Extract deck name from path
        String fileName = Path.of(path).getFileName().toString();
        String deckName = fileName.endsWith(".txt")
                ? fileName.substring(0, fileName.length() - 4)
                : fileName;

        return new Deck(cards, deckName);
    }

    public List<Card> getCards() {
        return new ArrayList<>(cards);
    }

    public int size() {
        return cards.size();
    }

    public String getName() {
        return name;
    }

    /**
     * Exception thrown when deck parsing fails.
     */
    public static class DeckException extends Exception {
        public DeckException(String message) {
            super(message);
        }
    }
}
