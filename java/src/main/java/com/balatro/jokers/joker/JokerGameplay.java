package com.balatro.jokers.joker;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;

/**
 * Scoring hooks, driven by the effect pipeline.
 */
public interface JokerGameplay extends Joker {

    /**
     * Called once per played hand, in run order.
     */
    JokerEffect onHandPlayed(GameContext context);

    /**
     * Called once per scoring card (and again per retrigger), in card order.
     */
    default JokerEffect onCardScored(GameContext context, Card card) {
        return JokerEffect.none();
    }
}
