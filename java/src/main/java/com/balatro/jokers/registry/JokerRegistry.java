package com.balatro.jokers.registry;

import com.balatro.jokers.catalog.JokerCatalog;
import com.balatro.jokers.factory.JokerConstructor;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.joker.UnlockCondition;
import com.balatro.jokers.joker.UnlockProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Immutable index of joker definitions.
 * <p>
 * The process-wide instance is published once through {@link #initialize()}: the table
 * is fully built before the reference is set, so concurrent readers see either nothing
 * or the complete table. Repeated initialization is a no-op. Code that can take a
 * registry as a parameter should; {@link #global()} is for entry points.
 */
public final class JokerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(JokerRegistry.class);
    private static final AtomicReference<JokerRegistry> GLOBAL = new AtomicReference<>();
    private static final Object INIT_LOCK = new Object();

    private final Map<JokerId, JokerDefinition> definitions;
    private final Map<Rarity, List<JokerId>> byRarity;

    private JokerRegistry(Map<JokerId, JokerDefinition> definitions) {
        Map<JokerId, JokerDefinition> copy = new EnumMap<>(JokerId.class);
        copy.putAll(definitions);
        this.definitions = Collections.unmodifiableMap(copy);

        Map<Rarity, List<JokerId>> index = new EnumMap<>(Rarity.class);
        for (Rarity rarity : Rarity.values()) {
            index.put(rarity, new ArrayList<>());
        }
        for (JokerDefinition def : copy.values()) {
            index.get(def.metadata().rarity()).add(def.id());
        }
        index.replaceAll((rarity, ids) -> List.copyOf(ids));
        this.byRarity = Collections.unmodifiableMap(index);
    }

    // ==================== GLOBAL INSTANCE ====================

    /**
     * Build and publish the process-wide registry if it is not already published.
     * @return the published registry
     */
    public static JokerRegistry initialize() {
        JokerRegistry existing = GLOBAL.get();
        if (existing != null) {
            return existing;
        }
        synchronized (INIT_LOCK) {
            existing = GLOBAL.get();
            if (existing != null) {
                return existing;
            }
            Builder builder = builder();
            JokerCatalog.registerAll(builder);
            JokerRegistry built = builder.build();
            GLOBAL.set(built);
            logger.info("Joker registry initialized with {} definitions", built.size());
            return built;
        }
    }

    /**
     * The process-wide registry, initializing it on first use.
     */
    public static JokerRegistry global() {
        JokerRegistry registry = GLOBAL.get();
        return registry != null ? registry : initialize();
    }

    public static boolean isInitialized() {
        return GLOBAL.get() != null;
    }

    /**
     * Drop the process-wide registry so a test can observe initialization again.
     */
    public static void resetForTesting() {
        synchronized (INIT_LOCK) {
            GLOBAL.set(null);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== QUERIES ====================

    public Optional<JokerDefinition> definition(JokerId id) {
        return Optional.ofNullable(definitions.get(id));
    }

    public Optional<JokerMetadata> metadata(JokerId id) {
        return definition(id).map(JokerDefinition::metadata);
    }

    public boolean contains(JokerId id) {
        return definitions.containsKey(id);
    }

    /**
     * Registered kinds of one rarity, in identifier order.
     */
    public List<JokerId> byRarity(Rarity rarity) {
        return byRarity.get(rarity);
    }

    /**
     * Registered kinds whose unlock condition passes the predicate, in identifier order.
     */
    public List<JokerId> eligibleFor(Predicate<UnlockCondition> unlocked) {
        List<JokerId> result = new ArrayList<>();
        for (JokerDefinition def : definitions.values()) {
            if (unlocked.test(def.metadata().unlock())) {
                result.add(def.id());
            }
        }
        return result;
    }

    public List<JokerId> eligibleFor(UnlockProfile profile) {
        return eligibleFor(condition -> condition.isSatisfiedBy(profile));
    }

    public Set<JokerId> ids() {
        return definitions.keySet();
    }

    public int size() {
        return definitions.size();
    }

    /**
     * Collects definitions before publication. Not thread-safe.
     */
    public static final class Builder {
        private final Map<JokerId, JokerDefinition> definitions = new EnumMap<>(JokerId.class);

        private Builder() {
        }

        public Builder register(JokerId id, JokerMetadata metadata, JokerConstructor constructor, String... argumentKeys) {
            return register(new JokerDefinition(id, metadata, constructor, Set.of(argumentKeys)));
        }

        /**
         * @throws IllegalStateException if the identifier is already registered in this builder
         */
        public Builder register(JokerDefinition definition) {
            if (definitions.putIfAbsent(definition.id(), definition) != null) {
                throw new IllegalStateException("Duplicate registration for " + definition.id());
            }
            return this;
        }

        public JokerRegistry build() {
            return new JokerRegistry(definitions);
        }
    }
}
