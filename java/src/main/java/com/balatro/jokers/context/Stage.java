package com.balatro.jokers.context;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the run currently is.
 */
public enum Stage {
    PRE_BLIND("pre_blind"),
    SMALL_BLIND("small_blind"),
    BIG_BLIND("big_blind"),
    BOSS_BLIND("boss_blind"),
    POST_BLIND("post_blind"),
    SHOP("shop"),
    END("end");

    private final String jsonValue;

    Stage(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public boolean isBlind() {
        return this == SMALL_BLIND || this == BIG_BLIND || this == BOSS_BLIND;
    }
}
