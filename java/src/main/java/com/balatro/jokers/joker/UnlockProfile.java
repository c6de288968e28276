package com.balatro.jokers.joker;

/**
 * Cross-run player progress, as tracked by the profile collaborator.
 */
public record UnlockProfile(
    int runsWon,
    int highestAnte,
    int highestMoney,
    long handsPlayed,
    long cardsDiscarded
) {
    public static final UnlockProfile FRESH = new UnlockProfile(0, 0, 0, 0, 0);
}
