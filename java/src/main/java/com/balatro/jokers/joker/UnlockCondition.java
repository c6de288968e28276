package com.balatro.jokers.joker;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Unlock requirement for one joker.
 */
public record UnlockCondition(
    @JsonProperty("kind") UnlockKind kind,
    @JsonProperty("threshold") int threshold
) {
    public static final UnlockCondition ALWAYS = new UnlockCondition(UnlockKind.ALWAYS, 0);
    public static final UnlockCondition SOUL = new UnlockCondition(UnlockKind.SOUL_CARD, 0);

    public static UnlockCondition of(UnlockKind kind, int threshold) {
        return new UnlockCondition(kind, threshold);
    }

    /**
     * Check this requirement against a player's progress.
     */
    public boolean isSatisfiedBy(UnlockProfile profile) {
        return switch (kind) {
            case ALWAYS -> true;
            case WIN_RUNS -> profile.runsWon() >= threshold;
            case REACH_ANTE -> profile.highestAnte() >= threshold;
            case HAVE_MONEY -> profile.highestMoney() >= threshold;
            case PLAY_HANDS -> profile.handsPlayed() >= threshold;
            case DISCARD_CARDS -> profile.cardsDiscarded() >= threshold;
            case SOUL_CARD -> false;
        };
    }
}
