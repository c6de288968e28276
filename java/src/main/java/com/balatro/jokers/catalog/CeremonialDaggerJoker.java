package com.balatro.jokers.catalog;

import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;

import java.util.Optional;

/**
 * When the blind is selected, destroys the joker to its right and permanently adds
 * double that joker's sell value to its Mult.
 */
public final class CeremonialDaggerJoker extends AdvancedJoker {
    static final String MULT = "mult";

    public CeremonialDaggerJoker(JokerMetadata metadata) {
        super(JokerId.CEREMONIAL_DAGGER, metadata);
    }

    public double mult() {
        return state().value(MULT, 0);
    }

    @Override
    public JokerEffect onRoundStart(GameContext context) {
        super.onRoundStart(context);
        Optional<Joker> victim = context.rightNeighbour(this);
        if (victim.isEmpty()) {
            return JokerEffect.none();
        }
        state().setValue(MULT, mult() + 2.0 * context.sellValue(victim.get()));
        return JokerEffect.builder()
            .destroyJokerAt(context.indexOf(this) + 1)
            .build();
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.mult(mult());
    }
}
