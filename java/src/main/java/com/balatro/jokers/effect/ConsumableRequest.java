package com.balatro.jokers.effect;

import java.util.Objects;

/**
 * Request to create one consumable.
 *
 * @param kind         Family to draw from; null only for a negative copy
 * @param name         Specific card, or null for a random one of {@code kind}
 * @param negativeCopy Copy a random held consumable as Negative instead of drawing
 */
public record ConsumableRequest(ConsumableKind kind, String name, boolean negativeCopy) {
    public ConsumableRequest {
        if (!negativeCopy) {
            Objects.requireNonNull(kind, "kind");
        }
    }

    public static ConsumableRequest random(ConsumableKind kind) {
        return new ConsumableRequest(kind, null, false);
    }

    public static ConsumableRequest named(ConsumableKind kind, String name) {
        return new ConsumableRequest(kind, Objects.requireNonNull(name, "name"), false);
    }

    public static ConsumableRequest negativeCopyOfHeld() {
        return new ConsumableRequest(null, null, true);
    }
}
