package com.balatro.jokers.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four French suits.
 */
public enum Suit {
    SPADES('S', false),
    HEARTS('H', true),
    CLUBS('C', false),
    DIAMONDS('D', true);

    private final char symbol;
    private final boolean red;

    Suit(char symbol, boolean red) {
        this.symbol = symbol;
        this.red = red;
    }

    /**
     * Get the single character representation (S/H/C/D).
     */
    @JsonValue
    public char getSymbol() {
        return symbol;
    }

    public boolean isRed() {
        return red;
    }

    /**
     * Check suit equality, optionally treating same-colored suits as one
     * (Hearts with Diamonds, Spades with Clubs).
     */
    public boolean matches(Suit other, boolean mergeColors) {
        if (this == other) {
            return true;
        }
        return mergeColors && other != null && this.red == other.red;
    }

    /**
     * Parse a Suit from a single character.
     * @param c The character (S/H/C/D, case-insensitive)
     * @return The corresponding Suit
     * @throws IllegalArgumentException if the character is not a valid suit
     */
    public static Suit fromChar(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'S' -> SPADES;
            case 'H' -> HEARTS;
            case 'C' -> CLUBS;
            case 'D' -> DIAMONDS;
            default -> throw new IllegalArgumentException("Invalid suit character: " + c);
        };
    }
}
