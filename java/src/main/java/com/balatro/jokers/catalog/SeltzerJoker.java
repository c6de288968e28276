package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.InternalJokerState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;

/**
 * Retriggers every played card for the next 10 hands, then is used up.
 */
public final class SeltzerJoker extends AdvancedJoker {
    static final String HANDS_LEFT = "hands_left";
    static final String ACTIVE = "active";
    static final int HANDS = 10;

    public SeltzerJoker(JokerMetadata metadata) {
        super(JokerId.SELTZER, metadata);
    }

    public long handsLeft() {
        return state().counter(HANDS_LEFT);
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        if (handsLeft() <= 0) {
            state().setFlag(ACTIVE, false);
            return JokerEffect.none();
        }
        // the card pass of this hand still sees the joker as active
        state().setFlag(ACTIVE, true);
        long left = state().increment(HANDS_LEFT, -1);
        return left <= 0 ? JokerEffect.destroySelf() : JokerEffect.none();
    }

    @Override
    public JokerEffect onCardScored(GameContext context, Card card) {
        return state().flag(ACTIVE) ? JokerEffect.retrigger(1) : JokerEffect.none();
    }

    @Override
    protected InternalJokerState initialState() {
        InternalJokerState state = super.initialState();
        state.setCounter(HANDS_LEFT, HANDS);
        return state;
    }
}
