package com.balatro.jokers.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card enhancements applied by tarot cards.
 */
public enum Enhancement {
    NONE("none"),
    BONUS("bonus"),
    MULT("mult"),
    WILD("wild"),
    GLASS("glass"),
    STEEL("steel"),
    STONE("stone"),
    GOLD("gold"),
    LUCKY("lucky");

    private final String jsonValue;

    Enhancement(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public static Enhancement fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Enhancement cannot be null");
        }
        for (Enhancement e : values()) {
            if (e.jsonValue.equalsIgnoreCase(value)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown enhancement: " + value);
    }
}
