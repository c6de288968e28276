package com.balatro.jokers.framework;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.InstanceKey;
import com.balatro.jokers.context.InternalJokerState;
import com.balatro.jokers.context.JokerStateStore;
import com.balatro.jokers.context.StoreBound;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.condition.Condition;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerLifecycle;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.JokerState;
import com.balatro.jokers.joker.StateDeserializeException;
import com.balatro.jokers.joker.UnsupportedStateVersionException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Base for jokers that need counters, flags or temporal conditions.
 * <p>
 * Persistent data lives in a {@link JokerStateStore} under this instance's {@link InstanceKey}.
 * Until an engine attaches the instance it uses a private store, so a freshly built
 * instance works on its own. Deterministic condition results are memoized in an
 * instance-local {@link ConditionCache} whose epoch advances at every round start.
 */
public abstract class AdvancedJoker
        implements JokerIdentity, JokerLifecycle, JokerGameplay, JokerState, StoreBound {
    public static final int DEFAULT_CACHE_ENTRIES = 256;

    private final JokerId id;
    private final JokerMetadata metadata;
    private final ConditionCache cache;
    private InstanceKey key;
    private JokerStateStore store;

    protected AdvancedJoker(JokerId id, JokerMetadata metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.cache = new ConditionCache(DEFAULT_CACHE_ENTRIES);
        this.key = new InstanceKey(id, 0);
        this.store = new JokerStateStore();
    }

    @Override
    public final JokerId id() {
        return id;
    }

    @Override
    public final JokerMetadata metadata() {
        return metadata;
    }

    /**
     * Move this instance's data into an engine-owned store. Data already present under
     * the new key (a save being loaded) wins over the private copy.
     */
    @Override
    public void attach(InstanceKey newKey, JokerStateStore newStore) {
        if (newKey.id() != id) {
            throw new IllegalArgumentException("Key " + newKey + " does not belong to " + id);
        }
        if (newStore.find(newKey).isEmpty()) {
            newStore.put(newKey, state());
        }
        this.key = newKey;
        this.store = newStore;
    }

    /**
     * This instance's persistent data, created from {@link #initialState()} on first use.
     */
    protected final InternalJokerState state() {
        return store.find(key).orElseGet(() -> {
            InternalJokerState fresh = initialState();
            store.put(key, fresh);
            return fresh;
        });
    }

    protected InternalJokerState initialState() {
        return new InternalJokerState(stateVersion());
    }

    public InstanceKey key() {
        return key;
    }

    // ==================== CONDITIONS ====================

    /**
     * Test a condition through the instance cache.
     */
    protected final boolean test(Condition condition, GameContext context, Card card) {
        return cache.test(condition, context, card);
    }

    public ConditionCache conditionCache() {
        return cache;
    }

    /**
     * Subclasses overriding this must call {@code super.onRoundStart} to keep the cache epoch current.
     */
    @Override
    public JokerEffect onRoundStart(GameContext context) {
        cache.advanceEpoch();
        return JokerEffect.none();
    }

    // ==================== STATE ====================

    @Override
    public int stateVersion() {
        return 1;
    }

    @Override
    public JsonNode serializeState() {
        return state().toJson();
    }

    @Override
    public final void deserializeState(int schemaVersion, JsonNode payload) throws StateDeserializeException {
        if (schemaVersion > stateVersion()) {
            throw new UnsupportedStateVersionException(id, schemaVersion, stateVersion());
        }
        InternalJokerState parsed = InternalJokerState.fromJson(id, payload);
        if (parsed.version() > stateVersion()) {
            throw new UnsupportedStateVersionException(id, parsed.version(), stateVersion());
        }
        InternalJokerState migrated = migrate(schemaVersion, parsed);
        validate(migrated);
        // only replace once the payload is fully accepted
        store.put(key, migrated);
    }

    /**
     * Upgrade a payload written by an older schema. Default: unchanged.
     */
    protected InternalJokerState migrate(int fromVersion, InternalJokerState parsed) {
        return parsed;
    }

    /**
     * Reject payloads that parse but violate this joker's invariants.
     */
    protected void validate(InternalJokerState candidate) throws StateDeserializeException {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + key + ", " + state() + "}";
    }
}
