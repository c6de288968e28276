package com.balatro.jokers.factory;

import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.card.Suit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * String-keyed, string-valued arguments for parameterized joker variants,
 * e.g. {@code suit=H} or {@code value=60}. Typed getters raise
 * {@link ConstructionException.Reason#INVALID_ARGUMENT} on malformed values.
 */
public final class ConstructionArgs {
    public static final ConstructionArgs EMPTY = new ConstructionArgs(Map.of());

    private final Map<String, String> values;
    private String owner = "joker";

    private ConstructionArgs(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ConstructionArgs of(Map<String, String> values) {
        return values.isEmpty() ? EMPTY : new ConstructionArgs(values);
    }

    public static ConstructionArgs of(String key, String value) {
        return new ConstructionArgs(Map.of(key, value));
    }

    /**
     * Parse {@code key=value} pairs separated by commas.
     * @throws IllegalArgumentException if a pair has no '='
     */
    public static ConstructionArgs parse(String text) {
        if (text == null || text.isBlank()) {
            return EMPTY;
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (String pair : text.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected key=value, got '" + trimmed + "'");
            }
            values.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
        }
        return of(values);
    }

    /**
     * Same arguments, reported against the given identifier in errors.
     */
    ConstructionArgs forOwner(String identifier) {
        ConstructionArgs copy = new ConstructionArgs(values);
        copy.owner = identifier;
        return copy;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, String> asMap() {
        return values;
    }

    public String getString(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) throws ConstructionException {
        String raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw invalid(key, raw, "an integer", e);
        }
    }

    public double getDouble(String key, double defaultValue) throws ConstructionException {
        String raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            double value = Double.parseDouble(raw);
            if (!Double.isFinite(value)) {
                throw invalid(key, raw, "a finite number", null);
            }
            return value;
        } catch (NumberFormatException e) {
            throw invalid(key, raw, "a number", e);
        }
    }

    public Suit getSuit(String key, Suit defaultValue) throws ConstructionException {
        String raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            if (raw.length() == 1) {
                return Suit.fromChar(raw.charAt(0));
            }
            return Suit.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw invalid(key, raw, "a suit", e);
        }
    }

    public Rank getRank(String key, Rank defaultValue) throws ConstructionException {
        String raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            if (raw.length() == 1) {
                return Rank.fromChar(raw.charAt(0));
            }
            return Rank.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw invalid(key, raw, "a rank", e);
        }
    }

    public HandRank getHandRank(String key, HandRank defaultValue) throws ConstructionException {
        String raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return HandRank.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            throw invalid(key, raw, "a poker hand", e);
        }
    }

    private ConstructionException invalid(String key, String raw, String expected, Throwable cause) {
        String message = "argument '" + key + "' must be " + expected + ", got '" + raw + "'";
        return new ConstructionException(ConstructionException.Reason.INVALID_ARGUMENT, owner, message, cause);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
