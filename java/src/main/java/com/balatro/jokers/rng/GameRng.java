package com.balatro.jokers.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator for reproducible runs and scoring passes.
 * Uses the Mulberry32 PRNG so that a replay with the same seed draws the
 * same sequence on every platform.
 */
public class GameRng {
    private long state;

    /**
     * Create a new GameRng with the specified seed.
     * Only the lower 32 bits of the seed are used.
     */
    public GameRng(long seed) {
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a new GameRng with a random seed from SecureRandom.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Derive a generator for one evaluation scope (a hand, a round-end pass...).
     * The parent sequence is not advanced, so deriving the same scope twice
     * yields identical draws.
     */
    public static GameRng scoped(long runSeed, int ante, int round, int handIndex) {
        long mixed = runSeed;
        mixed = mixed * 31 + ante;
        mixed = mixed * 31 + round;
        mixed = mixed * 31 + handIndex;
        // fold the high bits in so long seeds do not collapse onto the same lower word
        return new GameRng(mixed ^ (mixed >>> 32));
    }

    /**
     * Generate next random number in [0, 1).
     */
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;

        return result / 4294967296.0;
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        return (int) (next() * bound);
    }

    /**
     * Generate a random integer in range [min, max] (both inclusive).
     */
    public int nextIntInclusive(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max < min: " + max + " < " + min);
        }
        return min + nextInt(max - min + 1);
    }

    /**
     * Roll a "numerator in denominator" chance, e.g. 1 in 4.
     * The numerator is scaled by probability modifiers before the roll.
     */
    public boolean chance(double numerator, int denominator) {
        if (denominator <= 0) {
            return false;
        }
        return next() < numerator / denominator;
    }

    /**
     * Pick a uniformly random element of a non-empty list.
     */
    public <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(nextInt(items.size()));
    }

    /**
     * Fisher-Yates shuffle for a list.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
