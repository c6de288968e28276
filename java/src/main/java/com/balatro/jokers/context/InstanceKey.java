package com.balatro.jokers.context;

import com.balatro.jokers.joker.JokerId;

import java.util.Objects;

/**
 * Address of one instance's persistent data: joker kind plus run-local slot.
 * Slots are handed out once per run and never reused.
 */
public record InstanceKey(JokerId id, int slot) {
    public InstanceKey {
        Objects.requireNonNull(id, "id");
        if (slot < 0) {
            throw new IllegalArgumentException("slot must be >= 0: " + slot);
        }
    }

    @Override
    public String toString() {
        return id.wireName() + "#" + slot;
    }
}
