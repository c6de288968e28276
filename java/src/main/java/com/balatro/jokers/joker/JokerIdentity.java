package com.balatro.jokers.joker;

/**
 * Static metadata accessors. Implementations return stored references only, so these
 * calls never allocate and never need mutable access.
 */
public interface JokerIdentity extends Joker {

    JokerMetadata metadata();

    default String name() {
        return metadata().name();
    }

    default String description() {
        return metadata().description();
    }

    default Rarity rarity() {
        return metadata().rarity();
    }

    default int baseCost() {
        return metadata().baseCost();
    }
}
