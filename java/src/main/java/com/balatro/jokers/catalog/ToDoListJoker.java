package com.balatro.jokers.catalog;

import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.InternalJokerState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.JokerStateException;
import com.balatro.jokers.joker.StateDeserializeException;

import java.util.List;

/**
 * Earns $4 when the target poker hand is played; the target changes at end of round.
 */
public final class ToDoListJoker extends AdvancedJoker {
    static final String TARGET = "target";
    static final int PAYOUT = 4;

    private static final List<HandRank> TARGETS = List.of(HandRank.HIGH_CARD, HandRank.PAIR, HandRank.TWO_PAIR,
        HandRank.THREE_OF_A_KIND, HandRank.STRAIGHT, HandRank.FLUSH, HandRank.FULL_HOUSE,
        HandRank.FOUR_OF_A_KIND, HandRank.STRAIGHT_FLUSH);

    private final HandRank initialTarget;

    public ToDoListJoker(JokerMetadata metadata, HandRank initialTarget) {
        super(JokerId.TO_DO_LIST, metadata);
        this.initialTarget = initialTarget;
    }

    public HandRank target() {
        String raw = state().data().path(TARGET).asText(initialTarget.getJsonValue());
        try {
            return HandRank.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new JokerStateException(id() + " holds unknown target hand '" + raw + "'", e);
        }
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        if (!context.hand().isEmpty() && context.handRank() == target()) {
            return JokerEffect.money(PAYOUT);
        }
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        state().data().put(TARGET, context.rng().pick(TARGETS).getJsonValue());
        return JokerEffect.none();
    }

    @Override
    protected InternalJokerState initialState() {
        InternalJokerState state = super.initialState();
        state.data().put(TARGET, initialTarget.getJsonValue());
        return state;
    }

    @Override
    protected void validate(InternalJokerState candidate) throws StateDeserializeException {
        String raw = candidate.data().path(TARGET).asText(initialTarget.getJsonValue());
        try {
            HandRank.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new StateDeserializeException(id(), "unknown target hand '" + raw + "'", e);
        }
    }
}
