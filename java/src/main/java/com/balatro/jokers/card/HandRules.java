package com.balatro.jokers.card;

/**
 * Rule switches that change how a played selection is classified.
 * Supplied by modifier behaviors (Four Fingers, Shortcut, Smeared Joker, Splash, Pareidolia).
 */
public record HandRules(
    boolean fourFingers,
    boolean shortcut,
    boolean smearedSuits,
    boolean allCardsScore,
    boolean allFace
) {
    public static final HandRules STANDARD = new HandRules(false, false, false, false, false);

    /**
     * Minimum number of cards for a flush or straight.
     */
    public int runLength() {
        return fourFingers ? 4 : 5;
    }
}
