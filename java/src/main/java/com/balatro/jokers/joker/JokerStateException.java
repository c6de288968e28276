package com.balatro.jokers.joker;

/**
 * Raised by a hook whose instance state is inconsistent. The pipeline skips the
 * hook (identity effect) and reports the error instead of aborting the hand.
 */
public class JokerStateException extends RuntimeException {

    public JokerStateException(String message) {
        super(message);
    }

    public JokerStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
