package com.balatro.jokers.joker;

/**
 * What a player must have done before a joker can appear in the shop.
 */
public enum UnlockKind {
    /**
     * Available from the start.
     */
    ALWAYS,

    /**
     * Win a number of runs.
     */
    WIN_RUNS,

    /**
     * Reach a given ante in any run.
     */
    REACH_ANTE,

    /**
     * Hold at least this much money at once.
     */
    HAVE_MONEY,

    /**
     * Play a given number of hands across all runs.
     */
    PLAY_HANDS,

    /**
     * Discard a given number of cards across all runs.
     */
    DISCARD_CARDS,

    /**
     * Only obtainable through a Soul card; never sampled by the shop.
     */
    SOUL_CARD
}
