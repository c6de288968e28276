package com.balatro.jokers.effect;

/**
 * A numeric bound hit while accumulating an effect.
 *
 * @param source    Who produced the offending effect (joker wire name and slot)
 * @param field     Accumulator field name
 * @param kind      What went wrong
 * @param attempted The value the accumulation would have produced
 * @param retained  The value kept instead
 */
public record NumericViolation(String source, String field, Kind kind, double attempted, double retained) {

    public enum Kind {
        /** NaN or infinity; the pre-accumulation value was kept. */
        NON_FINITE,
        /** Outside the allowed range; pinned to the nearest bound. */
        CLAMPED
    }

    @Override
    public String toString() {
        return source + ": " + field + " " + kind + " (attempted " + attempted + ", kept " + retained + ")";
    }
}
