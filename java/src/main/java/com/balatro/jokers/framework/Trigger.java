package com.balatro.jokers.framework;

/**
 * Which gameplay hook a framework effect fires from.
 */
public enum Trigger {
    /** Once per played hand. */
    PER_HAND,
    /** Once per scoring card, including retriggers. */
    PER_CARD
}
