package com.balatro.jokers.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card seals.
 */
public enum Seal {
    NONE("none"),
    GOLD("gold"),
    RED("red"),
    BLUE("blue"),
    PURPLE("purple");

    private final String jsonValue;

    Seal(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
