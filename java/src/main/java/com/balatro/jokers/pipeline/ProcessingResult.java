package com.balatro.jokers.pipeline;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.effect.CardTransform;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.effect.NumericViolation;
import com.balatro.jokers.joker.Joker;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one pass produced: the aggregate effect, the deferred removals and card
 * transforms, and the per-joker failures that were isolated along the way.
 *
 * @param aggregate       Sum of every accepted effect, clamped
 * @param removals        Jokers to remove, in the order the requests were made
 * @param transforms      Card transforms in request order
 * @param scoringCards    Scoring cards in hand order
 * @param cardRetriggers  Extra evaluations per scoring card, aligned with {@code scoringCards}
 * @param errors          Hooks that failed
 * @param violations      Numeric bounds hit while accumulating
 * @param sellValueIncreases Sell value each joker added to itself, by instance
 */
public record ProcessingResult(
    JokerEffect aggregate,
    List<RemovalDirective> removals,
    List<CardTransform> transforms,
    List<Card> scoringCards,
    List<Integer> cardRetriggers,
    List<HookError> errors,
    List<NumericViolation> violations,
    Map<Joker, Integer> sellValueIncreases
) {
    public ProcessingResult {
        removals = List.copyOf(removals);
        transforms = List.copyOf(transforms);
        scoringCards = List.copyOf(scoringCards);
        cardRetriggers = List.copyOf(cardRetriggers);
        errors = List.copyOf(errors);
        violations = List.copyOf(violations);
        sellValueIncreases = Collections.unmodifiableMap(new IdentityHashMap<>(sellValueIncreases));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Times a scoring card is evaluated in total: once plus its retriggers.
     */
    public int timesScored(int scoringIndex) {
        return 1 + cardRetriggers.get(scoringIndex);
    }
}
