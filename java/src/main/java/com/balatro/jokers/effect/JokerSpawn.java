package com.balatro.jokers.effect;

import com.balatro.jokers.joker.Rarity;

import java.util.Objects;

/**
 * Request to add a joker to the run, if a slot is free.
 *
 * @param kind   How the new joker is chosen
 * @param rarity Rarity to draw from for {@link Kind#RANDOM_OF_RARITY}, otherwise null
 */
public record JokerSpawn(Kind kind, Rarity rarity) {

    public enum Kind {
        RANDOM_OF_RARITY,
        /** Copy of a random owned joker other than the requester. */
        DUPLICATE_RANDOM_OWNED
    }

    public JokerSpawn {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.RANDOM_OF_RARITY) {
            Objects.requireNonNull(rarity, "rarity");
        }
    }

    public static JokerSpawn ofRarity(Rarity rarity) {
        return new JokerSpawn(Kind.RANDOM_OF_RARITY, rarity);
    }

    public static JokerSpawn duplicateRandomOwned() {
        return new JokerSpawn(Kind.DUPLICATE_RANDOM_OWNED, null);
    }
}
