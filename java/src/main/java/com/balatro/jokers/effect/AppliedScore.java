package com.balatro.jokers.effect;

/**
 * Result of applying an aggregate effect to a hand's base values and the wallet.
 *
 * @param chips  Final chips (never negative)
 * @param mult   Final mult, within [0, max mult]
 * @param score  chips x mult, floored, saturating at {@link Long#MAX_VALUE}
 * @param wallet Wallet after the money delta, never negative
 */
public record AppliedScore(long chips, double mult, long score, int wallet) {
}
