package com.balatro.jokers.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Poker hand classes, weakest to strongest, with level-one base scores.
 */
public enum HandRank {
    HIGH_CARD("high_card", "High Card", 5, 1),
    PAIR("pair", "Pair", 10, 2),
    TWO_PAIR("two_pair", "Two Pair", 20, 2),
    THREE_OF_A_KIND("three_of_a_kind", "Three of a Kind", 30, 3),
    STRAIGHT("straight", "Straight", 30, 4),
    FLUSH("flush", "Flush", 35, 4),
    FULL_HOUSE("full_house", "Full House", 40, 4),
    FOUR_OF_A_KIND("four_of_a_kind", "Four of a Kind", 60, 7),
    STRAIGHT_FLUSH("straight_flush", "Straight Flush", 100, 8),
    ROYAL_FLUSH("royal_flush", "Royal Flush", 100, 8),
    FIVE_OF_A_KIND("five_of_a_kind", "Five of a Kind", 120, 12),
    FLUSH_HOUSE("flush_house", "Flush House", 140, 14),
    FLUSH_FIVE("flush_five", "Flush Five", 160, 16);

    private final String jsonValue;
    private final String displayName;
    private final int baseChips;
    private final int baseMult;

    HandRank(String jsonValue, String displayName, int baseChips, int baseMult) {
        this.jsonValue = jsonValue;
        this.displayName = displayName;
        this.baseChips = baseChips;
        this.baseMult = baseMult;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getBaseChips() {
        return baseChips;
    }

    public int getBaseMult() {
        return baseMult;
    }

    public static HandRank fromString(String value) {
        for (HandRank rank : values()) {
            if (rank.jsonValue.equalsIgnoreCase(value) || rank.name().equalsIgnoreCase(value)) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown hand rank: " + value);
    }
}
