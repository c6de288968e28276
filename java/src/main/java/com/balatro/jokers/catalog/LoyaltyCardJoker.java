package com.balatro.jokers.catalog;

import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;

/**
 * X4 Mult on every sixth hand played while owned.
 */
public final class LoyaltyCardJoker extends AdvancedJoker {
    static final String HANDS = "hands";
    static final int EVERY = 6;

    public LoyaltyCardJoker(JokerMetadata metadata) {
        super(JokerId.LOYALTY_CARD, metadata);
    }

    public int handsUntilReady() {
        long played = state().counter(HANDS);
        return (int) ((EVERY - played % EVERY) % EVERY);
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        long played = state().increment(HANDS, 1);
        return played % EVERY == 0 ? JokerEffect.xMult(4) : JokerEffect.none();
    }
}
