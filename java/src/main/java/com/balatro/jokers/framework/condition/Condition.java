package com.balatro.jokers.framework.condition;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;

/**
 * A predicate over the evaluation context and, for card-level checks, the card
 * being scored. Hand-level evaluation passes a null card; card predicates are
 * false for a null card.
 */
public interface Condition {

    boolean test(GameContext context, Card card);

    /**
     * Hash of the context inputs this condition reads; the card being scored is keyed
     * separately. Equal fingerprints must mean equal answers for the same card.
     */
    default long fingerprint(GameContext context) {
        return context.fingerprint();
    }

    /**
     * False for conditions whose answer is not a function of the fingerprint and
     * the card value (random draws, card identity). Such results are never cached.
     */
    default boolean isCacheable() {
        return true;
    }

    default String describe() {
        return getClass().getSimpleName();
    }

    default Condition and(Condition other) {
        return Conditions.and(this, other);
    }

    default Condition or(Condition other) {
        return Conditions.or(this, other);
    }

    default Condition negate() {
        return Conditions.not(this);
    }
}
