package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;

import java.util.List;

/**
 * Gains X1 Mult every 23 cards discarded.
 */
public final class YorickJoker extends AdvancedJoker {
    static final String DISCARDED = "discarded";
    static final int PER_STEP = 23;

    public YorickJoker(JokerMetadata metadata) {
        super(JokerId.YORICK, metadata);
    }

    public double multiplier() {
        return 1.0 + state().counter(DISCARDED) / PER_STEP;
    }

    @Override
    public JokerEffect onDiscard(GameContext context, List<Card> discarded) {
        state().increment(DISCARDED, discarded.size());
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.xMult(multiplier());
    }
}
