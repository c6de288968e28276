package com.balatro.jokers.catalog;

import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.Stage;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * When a Small or Big Blind is selected, gains X0.5 Mult and destroys a random other joker.
 */
public final class MadnessJoker extends AdvancedJoker {
    static final String X_MULT = "x_mult";
    static final double GAIN = 0.5;

    public MadnessJoker(JokerMetadata metadata) {
        super(JokerId.MADNESS, metadata);
    }

    public double multiplier() {
        return state().value(X_MULT, 1.0);
    }

    @Override
    public JokerEffect onRoundStart(GameContext context) {
        super.onRoundStart(context);
        if (context.stage() == Stage.BOSS_BLIND) {
            return JokerEffect.none();
        }
        state().setValue(X_MULT, multiplier() + GAIN);

        int self = context.indexOf(this);
        List<Integer> others = new ArrayList<>();
        for (int i = 0; i < context.jokerCount(); i++) {
            if (i != self) {
                others.add(i);
            }
        }
        if (others.isEmpty()) {
            return JokerEffect.none();
        }
        return JokerEffect.builder().destroyJokerAt(context.rng().pick(others)).build();
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.xMult(multiplier());
    }
}
