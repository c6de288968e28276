package com.balatro.jokers.registry;

import com.balatro.jokers.factory.JokerConstructor;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;

import java.util.Objects;
import java.util.Set;

/**
 * Registry entry: metadata, constructor and the construction argument keys it accepts.
 */
public record JokerDefinition(JokerId id, JokerMetadata metadata, JokerConstructor constructor, Set<String> argumentKeys) {
    public JokerDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(constructor, "constructor");
        argumentKeys = Set.copyOf(argumentKeys);
    }
}
