package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Enhancement;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.CardTransform;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;

/**
 * Gains X0.1 Mult per scoring Enhanced card played and removes the enhancement.
 */
public final class VampireJoker extends AdvancedJoker {
    static final String X_MULT = "x_mult";
    static final double GAIN = 0.1;

    public VampireJoker(JokerMetadata metadata) {
        super(JokerId.VAMPIRE, metadata);
    }

    public double multiplier() {
        return state().value(X_MULT, 1.0);
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        JokerEffect.Builder effect = JokerEffect.builder();
        int drained = 0;
        for (Card card : context.scoringCards()) {
            if (card.enhancement() != Enhancement.NONE) {
                drained++;
                effect.transform(CardTransform.enhance(card, Enhancement.NONE));
            }
        }
        if (drained > 0) {
            state().setValue(X_MULT, multiplier() + GAIN * drained);
        }
        return effect.multMultiplier(multiplier()).build();
    }
}
