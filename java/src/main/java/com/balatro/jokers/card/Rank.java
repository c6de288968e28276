package com.balatro.jokers.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card ranks, lowest to highest.
 */
public enum Rank {
    TWO('2', 2, 2),
    THREE('3', 3, 3),
    FOUR('4', 4, 4),
    FIVE('5', 5, 5),
    SIX('6', 6, 6),
    SEVEN('7', 7, 7),
    EIGHT('8', 8, 8),
    NINE('9', 9, 9),
    TEN('T', 10, 10),
    JACK('J', 11, 10),
    QUEEN('Q', 12, 10),
    KING('K', 13, 10),
    ACE('A', 14, 11);

    private final char symbol;
    private final int value;
    private final int chips;

    Rank(char symbol, int value, int chips) {
        this.symbol = symbol;
        this.value = value;
        this.chips = chips;
    }

    @JsonValue
    public char getSymbol() {
        return symbol;
    }

    /**
     * Ordering value, 2 through 14 (Ace high).
     */
    public int getValue() {
        return value;
    }

    /**
     * Chips this rank contributes when the card scores.
     */
    public int getChips() {
        return chips;
    }

    public boolean isFace() {
        return this == JACK || this == QUEEN || this == KING;
    }

    /**
     * Even-numbered ranks: 10, 8, 6, 4, 2.
     */
    public boolean isEven() {
        return value <= 10 && value % 2 == 0;
    }

    /**
     * Odd-numbered ranks: A, 9, 7, 5, 3.
     */
    public boolean isOdd() {
        return this == ACE || (value <= 10 && value % 2 == 1);
    }

    /**
     * Ranks that appear in the Fibonacci sequence: A, 2, 3, 5, 8.
     */
    public boolean isFibonacci() {
        return this == ACE || this == TWO || this == THREE || this == FIVE || this == EIGHT;
    }

    public static Rank fromChar(char c) {
        char upper = Character.toUpperCase(c);
        for (Rank rank : values()) {
            if (rank.symbol == upper) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Invalid rank character: " + c);
    }
}
