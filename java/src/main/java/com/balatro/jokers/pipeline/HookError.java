package com.balatro.jokers.pipeline;

import com.balatro.jokers.joker.JokerId;

/**
 * A hook that failed during a pass. Its effect was treated as identity.
 *
 * @param source   Instance label (wire name and slot)
 * @param jokerId  Kind of the failing joker
 * @param hook     Hook name, e.g. {@code onCardScored}
 * @param message  Failure message
 * @param cause    The exception raised by the hook
 */
public record HookError(String source, JokerId jokerId, String hook, String message, RuntimeException cause) {

    @Override
    public String toString() {
        return source + "." + hook + " failed: " + message;
    }
}
