package com.balatro.jokers.catalog;

import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.InternalJokerState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.JokerModifiers;
import com.balatro.jokers.joker.StateDeserializeException;

/**
 * +5 hand size, reduced by 1 every round. Eaten when it reaches zero.
 */
public final class TurtleBeanJoker extends AdvancedJoker implements JokerModifiers {
    static final String HAND_SIZE = "hand_size";
    static final int INITIAL = 5;

    public TurtleBeanJoker(JokerMetadata metadata) {
        super(JokerId.TURTLE_BEAN, metadata);
    }

    @Override
    public int handSizeDelta() {
        return (int) state().counter(HAND_SIZE);
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        long remaining = state().increment(HAND_SIZE, -1);
        return remaining <= 0 ? JokerEffect.destroySelf() : JokerEffect.none();
    }

    @Override
    protected InternalJokerState initialState() {
        InternalJokerState state = super.initialState();
        state.setCounter(HAND_SIZE, INITIAL);
        return state;
    }

    @Override
    protected void validate(InternalJokerState candidate) throws StateDeserializeException {
        long size = candidate.counter(HAND_SIZE);
        if (size < 0 || size > INITIAL) {
            throw new StateDeserializeException(id(), "hand size bonus out of range: " + size);
        }
    }
}
