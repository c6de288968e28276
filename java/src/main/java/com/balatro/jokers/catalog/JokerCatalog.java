package com.balatro.jokers.catalog;

import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.registry.JokerRegistry;

/**
 * Every built-in joker kind, grouped by the framework that implements it.
 */
public final class JokerCatalog {

    private JokerCatalog() {
        // Utility class - prevent instantiation
    }

    /**
     * Register every built-in joker.
     * @throws IllegalStateException if two families register the same kind
     */
    public static void registerAll(JokerRegistry.Builder registry) {
        ScoringJokers.register(registry);
        ScalingJokers.register(registry);
        EconomyJokers.register(registry);
        RuleJokers.register(registry);
        SpecialJokers.register(registry);
        LegacyBridgeJokers.register(registry);
    }

    static JokerMetadata meta(String name, String description, Rarity rarity) {
        return JokerMetadata.of(name, description, rarity);
    }
}
