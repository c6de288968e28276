package com.balatro.jokers.joker;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rarity tiers, with their default base cost and shop weight.
 */
public enum Rarity {
    COMMON("common", 3, 70),
    UNCOMMON("uncommon", 6, 25),
    RARE("rare", 8, 5),
    LEGENDARY("legendary", 20, 0);

    private final String jsonValue;
    private final int defaultCost;
    private final int shopWeight;

    Rarity(String jsonValue, int defaultCost, int shopWeight) {
        this.jsonValue = jsonValue;
        this.defaultCost = defaultCost;
        this.shopWeight = shopWeight;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public int getDefaultCost() {
        return defaultCost;
    }

    /**
     * Relative shop weight. Legendary jokers never appear in the shop.
     */
    public int getShopWeight() {
        return shopWeight;
    }

    public static Rarity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rarity cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "common" -> COMMON;
            case "uncommon" -> UNCOMMON;
            case "rare" -> RARE;
            case "legendary" -> LEGENDARY;
            default -> throw new IllegalArgumentException("Unknown rarity: " + value);
        };
    }
}
