package com.balatro.jokers.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card editions.
 */
public enum Edition {
    BASE("base"),
    FOIL("foil"),
    HOLOGRAPHIC("holographic"),
    POLYCHROME("polychrome"),
    NEGATIVE("negative");

    private final String jsonValue;

    Edition(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
