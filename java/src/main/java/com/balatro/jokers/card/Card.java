package com.balatro.jokers.card;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A playing card with its modifiers.
 * Cards are values: two cards with the same rank, suit and modifiers are equal.
 */
public record Card(
    @JsonProperty("rank") Rank rank,
    @JsonProperty("suit") Suit suit,
    @JsonProperty("enhancement") Enhancement enhancement,
    @JsonProperty("edition") Edition edition,
    @JsonProperty("seal") Seal seal
) {
    public Card {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(suit, "suit");
        enhancement = enhancement != null ? enhancement : Enhancement.NONE;
        edition = edition != null ? edition : Edition.BASE;
        seal = seal != null ? seal : Seal.NONE;
    }

    public static Card of(Rank rank, Suit suit) {
        return new Card(rank, suit, Enhancement.NONE, Edition.BASE, Seal.NONE);
    }

    public Card withEnhancement(Enhancement newEnhancement) {
        return new Card(rank, suit, newEnhancement, edition, seal);
    }

    public Card withEdition(Edition newEdition) {
        return new Card(rank, suit, enhancement, newEdition, seal);
    }

    public Card withSeal(Seal newSeal) {
        return new Card(rank, suit, enhancement, edition, newSeal);
    }

    /**
     * Stone cards have no rank or suit for hand and joker purposes.
     */
    public boolean isStone() {
        return enhancement == Enhancement.STONE;
    }

    public boolean isWild() {
        return enhancement == Enhancement.WILD;
    }

    /**
     * Face check. With {@code allFace} (Pareidolia) every ranked card counts.
     */
    public boolean isFace(boolean allFace) {
        if (isStone()) {
            return false;
        }
        return allFace || rank.isFace();
    }

    /**
     * Suit check that honors Wild cards and merged suits.
     */
    public boolean hasSuit(Suit target, boolean mergeColors) {
        if (isStone()) {
            return false;
        }
        return isWild() || suit.matches(target, mergeColors);
    }

    /**
     * Chips this card adds when it scores.
     */
    public int chipValue() {
        if (isStone()) {
            return 50;
        }
        int chips = rank.getChips();
        if (enhancement == Enhancement.BONUS) {
            chips += 30;
        }
        return chips;
    }

    /**
     * Parse a card like "AS", "TH" or "KD:steel".
     */
    public static Card parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Card text cannot be empty");
        }
        String trimmed = text.trim();
        String[] parts = trimmed.split(":", 2);
        String face = parts[0];
        if (face.length() != 2) {
            throw new IllegalArgumentException("Invalid card '" + text + "': expected RANK+SUIT like 'AS'");
        }
        Card card = Card.of(Rank.fromChar(face.charAt(0)), Suit.fromChar(face.charAt(1)));
        if (parts.length == 2) {
            card = card.withEnhancement(Enhancement.fromString(parts[1]));
        }
        return card;
    }

    /**
     * Parse a whitespace or comma separated list of cards.
     */
    public static List<Card> parseList(String text) {
        List<Card> cards = new ArrayList<>();
        if (text == null) {
            return cards;
        }
        for (String token : text.trim().split("[\\s,]+")) {
            if (!token.isEmpty()) {
                cards.add(parse(token));
            }
        }
        return cards;
    }

    @Override
    public String toString() {
        String base = "" + rank.getSymbol() + suit.getSymbol();
        return enhancement == Enhancement.NONE ? base : base + ":" + enhancement.getJsonValue();
    }
}
