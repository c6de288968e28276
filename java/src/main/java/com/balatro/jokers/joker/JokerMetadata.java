package com.balatro.jokers.joker;

import java.util.Objects;

/**
 * Display and shop metadata for one joker kind.
 */
public record JokerMetadata(
    String name,
    String description,
    Rarity rarity,
    int baseCost,
    UnlockCondition unlock,
    boolean unique
) {
    public JokerMetadata {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(rarity, "rarity");
        Objects.requireNonNull(unlock, "unlock");
        if (baseCost < 0) {
            throw new IllegalArgumentException("baseCost must be >= 0: " + baseCost);
        }
    }

    /**
     * Metadata with the rarity's default cost, always unlocked.
     */
    public static JokerMetadata of(String name, String description, Rarity rarity) {
        return new JokerMetadata(name, description, rarity, rarity.getDefaultCost(),
            rarity == Rarity.LEGENDARY ? UnlockCondition.SOUL : UnlockCondition.ALWAYS,
            rarity == Rarity.LEGENDARY);
    }

    public JokerMetadata withCost(int cost) {
        return new JokerMetadata(name, description, rarity, cost, unlock, unique);
    }

    public JokerMetadata withUnlock(UnlockCondition condition) {
        return new JokerMetadata(name, description, rarity, baseCost, condition, unique);
    }

    /**
     * Sell value before any accrued increases: half the cost, at least 1.
     */
    public int baseSellValue() {
        return Math.max(1, baseCost / 2);
    }
}
