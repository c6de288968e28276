package com.balatro.jokers.factory;

/**
 * Thrown when a joker instance cannot be built. Fatal to the acquire call, not to the run.
 */
public class ConstructionException extends Exception {

    public enum Reason {
        /** The identifier names no known joker kind. */
        UNKNOWN_IDENTIFIER,
        /** The kind exists but has no registered constructor. */
        NOT_IMPLEMENTED,
        /** A construction argument is unknown or malformed. */
        INVALID_ARGUMENT
    }

    private final Reason reason;
    private final String identifier;

    public ConstructionException(Reason reason, String identifier, String message) {
        super(identifier + ": " + message);
        this.reason = reason;
        this.identifier = identifier;
    }

    public ConstructionException(Reason reason, String identifier, String message, Throwable cause) {
        super(identifier + ": " + message, cause);
        this.reason = reason;
        this.identifier = identifier;
    }

    public Reason getReason() {
        return reason;
    }

    public String getIdentifier() {
        return identifier;
    }
}
