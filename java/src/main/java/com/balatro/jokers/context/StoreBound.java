package com.balatro.jokers.context;

/**
 * Implemented by jokers that keep their persistent data in a {@link JokerStateStore}
 * rather than in fields. The owning engine attaches the instance to its key on acquire.
 */
public interface StoreBound {

    void attach(InstanceKey key, JokerStateStore store);
}
