package com.balatro.jokers.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyed storage of per-instance joker data for one game instance.
 * Owned by exactly one game; never shared across threads.
 */
public final class JokerStateStore {
    private final Map<InstanceKey, InternalJokerState> states = new LinkedHashMap<>();

    /**
     * State for a key, created empty on first access.
     */
    public InternalJokerState get(InstanceKey key) {
        return states.computeIfAbsent(key, k -> new InternalJokerState());
    }

    public Optional<InternalJokerState> find(InstanceKey key) {
        return Optional.ofNullable(states.get(key));
    }

    /**
     * Replace a key's state wholesale.
     */
    public void put(InstanceKey key, InternalJokerState state) {
        states.put(key, state);
    }

    public void remove(InstanceKey key) {
        states.remove(key);
    }

    public Set<InstanceKey> keys() {
        return Set.copyOf(states.keySet());
    }

    public int size() {
        return states.size();
    }

    public void clear() {
        states.clear();
    }
}
