package com.balatro.jokers.factory;

import com.balatro.jokers.joker.Joker;

/**
 * Builds one fresh instance. Must be pure: no process-wide state is touched.
 */
@FunctionalInterface
public interface JokerConstructor {

    Joker construct(ConstructionArgs args) throws ConstructionException;
}
