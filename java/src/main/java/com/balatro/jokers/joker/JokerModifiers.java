package com.balatro.jokers.joker;

import java.util.Set;

/**
 * Passive, always-on adjustments. Queried once per game-state recomputation,
 * never per scoring event.
 */
public interface JokerModifiers extends Joker {

    default int handSizeDelta() {
        return 0;
    }

    default int discardsDelta() {
        return 0;
    }

    default int handsDelta() {
        return 0;
    }

    default Set<RuleFlag> ruleFlags() {
        return Set.of();
    }

    /**
     * Multiplier applied to every listed probability numerator (Oops! All 6s doubles them).
     */
    default double probabilityMultiplier() {
        return 1.0;
    }

    /**
     * Dollars the shop lets the player spend beyond an empty wallet.
     * The wallet itself never drops below zero.
     */
    default int debtLimit() {
        return 0;
    }
}
