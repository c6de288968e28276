package com.balatro.jokers.effect;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Consumable card families a joker may ask the engine to create.
 */
public enum ConsumableKind {
    TAROT("tarot"),
    PLANET("planet"),
    SPECTRAL("spectral");

    private final String jsonValue;

    ConsumableKind(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
