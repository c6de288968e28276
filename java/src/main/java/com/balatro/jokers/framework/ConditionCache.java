package com.balatro.jokers.framework;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.framework.condition.Condition;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Instance-local memo of condition results, keyed by (condition, fingerprint of the
 * context slice the condition reads, card, epoch). Bumping the epoch at a round boundary invalidates every entry without
 * scanning; stale entries age out through LRU eviction.
 * <p>
 * Not thread-safe: each cache belongs to one joker instance of one game.
 */
public final class ConditionCache {
    private record Key(Condition condition, long fingerprint, Card card, long epoch) {
    }

    private final Map<Key, Boolean> entries;
    private int maxEntries;
    private boolean enabled;
    private long epoch;
    private long hits;
    private long misses;

    public ConditionCache(int maxEntries) {
        this(maxEntries, true);
    }

    public ConditionCache(int maxEntries, boolean enabled) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.enabled = enabled;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, Boolean> eldest) {
                return size() > ConditionCache.this.maxEntries;
            }
        };
    }

    /**
     * Evaluate a condition, reusing a cached answer when the inputs are unchanged.
     */
    public boolean test(Condition condition, GameContext context, Card card) {
        if (!enabled || !condition.isCacheable()) {
            return condition.test(context, card);
        }
        Key key = new Key(condition, condition.fingerprint(context), card, epoch);
        Boolean cached = entries.get(key);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        boolean result = condition.test(context, card);
        entries.put(key, result);
        return result;
    }

    /**
     * Invalidate everything cached so far.
     */
    public void advanceEpoch() {
        epoch++;
    }

    /**
     * Change the capacity, evicting least recently used entries if it shrinks.
     */
    public void setMaxEntries(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        Iterator<Key> eldest = entries.keySet().iterator();
        while (entries.size() > maxEntries && eldest.hasNext()) {
            eldest.next();
            eldest.remove();
        }
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long epoch() {
        return epoch;
    }

    public long hits() {
        return hits;
    }

    public long misses() {
        return misses;
    }

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public int size() {
        return entries.size();
    }

    public int maxEntries() {
        return maxEntries;
    }
}
