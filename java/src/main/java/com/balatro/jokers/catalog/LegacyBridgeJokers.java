package com.balatro.jokers.catalog;

import com.balatro.jokers.compat.LegacyJoker;
import com.balatro.jokers.compat.LegacyJokerAdapter;
import com.balatro.jokers.compat.LegacyJokers;
import com.balatro.jokers.registry.JokerRegistry;

import java.util.List;
import java.util.function.Supplier;

/**
 * Registers the monolithic jokers behind {@link LegacyJokerAdapter}.
 */
final class LegacyBridgeJokers {

    private static final List<Supplier<LegacyJoker>> LEGACY = List.of(
        LegacyJokers.ScaryFace::new,
        LegacyJokers.BusinessCard::new,
        LegacyJokers.DelayedGratification::new,
        LegacyJokers.Egg::new,
        LegacyJokers.FacelessJoker::new,
        LegacyJokers.Juggler::new,
        LegacyJokers.Drunkard::new,
        LegacyJokers.GoldenJoker::new,
        LegacyJokers.Burglar::new,
        LegacyJokers.Cloud9::new,
        LegacyJokers.Troubadour::new,
        LegacyJokers.MerryAndy::new,
        LegacyJokers.Stuntman::new
    );

    private LegacyBridgeJokers() {
        // Utility class - prevent instantiation
    }

    static void register(JokerRegistry.Builder r) {
        for (Supplier<LegacyJoker> supplier : LEGACY) {
            LegacyJokerAdapter sample = new LegacyJokerAdapter(supplier.get());
            r.register(sample.id(), sample.metadata(), args -> new LegacyJokerAdapter(supplier.get()));
        }
    }
}
