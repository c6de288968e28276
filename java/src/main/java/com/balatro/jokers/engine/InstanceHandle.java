package com.balatro.jokers.engine;

import com.balatro.jokers.context.InstanceKey;
import com.balatro.jokers.joker.JokerId;

/**
 * Caller-facing reference to one active joker. Slots are unique within a run and
 * never reused, so a handle to a sold or destroyed joker never aliases a newer one.
 */
public record InstanceHandle(JokerId id, int slot) {

    public InstanceKey toKey() {
        return new InstanceKey(id, slot);
    }

    @Override
    public String toString() {
        return id.wireName() + "#" + slot;
    }
}
