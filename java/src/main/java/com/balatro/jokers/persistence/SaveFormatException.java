package com.balatro.jokers.persistence;

/**
 * Exception thrown when a save blob cannot be read as a whole.
 * Problems confined to one entry are reported as {@link EntryFailure}s instead.
 */
public class SaveFormatException extends Exception {
    public SaveFormatException(String message) {
        super(message);
    }

    public SaveFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
