package com.balatro.jokers.simulation;

import com.balatro.jokers.factory.ConstructionArgs;

import java.util.Objects;

/**
 * One joker to acquire at the start of a simulated run, written as
 * {@code wire_name} or {@code wire_name:key=value,key=value}.
 */
public record JokerLoadout(String wireName, ConstructionArgs args) {
    public JokerLoadout {
        Objects.requireNonNull(wireName, "wireName");
        args = args != null ? args : ConstructionArgs.EMPTY;
    }

    public static JokerLoadout parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Joker text cannot be empty");
        }
        String trimmed = text.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            return new JokerLoadout(trimmed, ConstructionArgs.EMPTY);
        }
        return new JokerLoadout(trimmed.substring(0, colon).trim(),
            ConstructionArgs.parse(trimmed.substring(colon + 1)));
    }

    @Override
    public String toString() {
        return args.isEmpty() ? wireName : wireName + ":" + args;
    }
}
