package com.balatro.jokers.framework;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;

/**
 * Computes an effect from the context. {@code card} is null for hand-level triggers.
 */
@FunctionalInterface
public interface EffectFormula {

    JokerEffect apply(GameContext context, Card card);

    static EffectFormula constant(JokerEffect effect) {
        return (context, card) -> effect;
    }
}
