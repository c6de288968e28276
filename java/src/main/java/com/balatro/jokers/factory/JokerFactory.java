package com.balatro.jokers.factory;

import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.registry.JokerDefinition;
import com.balatro.jokers.registry.JokerRegistry;

import java.util.Objects;

/**
 * Builds joker instances from identifiers using a registry's constructors.
 * Unknown or unregistered identifiers fail; there is no fallback instance.
 */
public final class JokerFactory {
    private final JokerRegistry registry;

    public JokerFactory(JokerRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Joker create(JokerId id) throws ConstructionException {
        return create(id, ConstructionArgs.EMPTY);
    }

    public Joker create(JokerId id, ConstructionArgs args) throws ConstructionException {
        JokerDefinition definition = registry.definition(id).orElseThrow(() -> new ConstructionException(
            ConstructionException.Reason.NOT_IMPLEMENTED, id.wireName(), "no constructor registered"));
        for (String key : args.keys()) {
            if (!definition.argumentKeys().contains(key)) {
                throw new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT, id.wireName(),
                    "unknown argument '" + key + "' (accepted: " + definition.argumentKeys() + ")");
            }
        }
        Joker joker = definition.constructor().construct(args.forOwner(id.wireName()));
        if (joker == null || joker.id() != id) {
            throw new IllegalStateException("Constructor for " + id + " returned " + joker);
        }
        return joker;
    }

    /**
     * Resolve a persisted or user-typed wire name, then build.
     */
    public Joker create(String wireName, ConstructionArgs args) throws ConstructionException {
        JokerId id;
        try {
            id = JokerId.fromWireName(wireName);
        } catch (IllegalArgumentException e) {
            throw new ConstructionException(ConstructionException.Reason.UNKNOWN_IDENTIFIER,
                String.valueOf(wireName), "unknown joker identifier", e);
        }
        return create(id, args);
    }

    public JokerRegistry getRegistry() {
        return registry;
    }
}
