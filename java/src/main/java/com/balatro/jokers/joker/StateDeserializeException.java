package com.balatro.jokers.joker;

/**
 * Thrown when a persisted joker payload cannot be applied.
 */
public class StateDeserializeException extends Exception {
    private final JokerId jokerId;

    public StateDeserializeException(JokerId jokerId, String message) {
        super(jokerId + ": " + message);
        this.jokerId = jokerId;
    }

    public StateDeserializeException(JokerId jokerId, String message, Throwable cause) {
        super(jokerId + ": " + message, cause);
        this.jokerId = jokerId;
    }

    public JokerId getJokerId() {
        return jokerId;
    }
}
