package com.balatro.jokers.context;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Enhancement;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.card.Suit;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts over the full deck plus the number of cards left to draw.
 */
public record DeckComposition(
    int fullSize,
    int remaining,
    Map<Rank, Integer> ranks,
    Map<Suit, Integer> suits,
    Map<Enhancement, Integer> enhancements
) {
    private static final DeckComposition STANDARD = standardDeck();

    public DeckComposition {
        ranks = Map.copyOf(ranks);
        suits = Map.copyOf(suits);
        enhancements = Map.copyOf(enhancements);
    }

    /**
     * A fresh 52-card deck with nothing drawn.
     */
    public static DeckComposition standard() {
        return STANDARD;
    }

    public static DeckComposition of(Collection<Card> fullDeck, int remaining) {
        Map<Rank, Integer> ranks = new EnumMap<>(Rank.class);
        Map<Suit, Integer> suits = new EnumMap<>(Suit.class);
        Map<Enhancement, Integer> enhancements = new EnumMap<>(Enhancement.class);
        for (Card card : fullDeck) {
            ranks.merge(card.rank(), 1, Integer::sum);
            suits.merge(card.suit(), 1, Integer::sum);
            if (card.enhancement() != Enhancement.NONE) {
                enhancements.merge(card.enhancement(), 1, Integer::sum);
            }
        }
        return new DeckComposition(fullDeck.size(), remaining, ranks, suits, enhancements);
    }

    public DeckComposition withRemaining(int newRemaining) {
        return new DeckComposition(fullSize, newRemaining, ranks, suits, enhancements);
    }

    public int count(Rank rank) {
        return ranks.getOrDefault(rank, 0);
    }

    public int count(Suit suit) {
        return suits.getOrDefault(suit, 0);
    }

    public int count(Enhancement enhancement) {
        return enhancements.getOrDefault(enhancement, 0);
    }

    public int enhancedCount() {
        int total = 0;
        for (int n : enhancements.values()) {
            total += n;
        }
        return total;
    }

    private static DeckComposition standardDeck() {
        Map<Rank, Integer> ranks = new EnumMap<>(Rank.class);
        Map<Suit, Integer> suits = new EnumMap<>(Suit.class);
        for (Rank rank : Rank.values()) {
            ranks.put(rank, Suit.values().length);
        }
        for (Suit suit : Suit.values()) {
            suits.put(suit, Rank.values().length);
        }
        return new DeckComposition(52, 52, ranks, suits, Map.of());
    }
}
