package com.balatro.jokers.persistence;

/**
 * A saved joker that could not be restored. The rest of the save still loads.
 *
 * @param position   Index of the entry in the saved run order
 * @param identifier Wire name as written, or "?" when the entry had none
 * @param reason     Failure category
 * @param message    Detail for logs and the player-facing marker
 */
public record EntryFailure(int position, String identifier, Reason reason, String message) {

    public enum Reason {
        MALFORMED_ENTRY,
        UNKNOWN_IDENTIFIER,
        NOT_CONSTRUCTIBLE,
        UNSUPPORTED_STATE_VERSION,
        STATE_REJECTED
    }

    @Override
    public String toString() {
        return "#" + position + " " + identifier + " lost (" + reason + "): " + message;
    }
}
