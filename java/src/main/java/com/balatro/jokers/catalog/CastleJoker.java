package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Suit;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.InternalJokerState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.StateDeserializeException;

import java.util.Arrays;
import java.util.List;

/**
 * Gains +3 Chips per discarded card of the target suit; the suit changes every round.
 */
public final class CastleJoker extends AdvancedJoker {
    static final String SUIT = "suit";
    static final String CHIPS = "chips";
    static final int GAIN = 3;

    private final Suit initialSuit;

    public CastleJoker(JokerMetadata metadata, Suit initialSuit) {
        super(JokerId.CASTLE, metadata);
        this.initialSuit = initialSuit;
    }

    public Suit target() {
        return Suit.valueOf(state().data().path(SUIT).asText(initialSuit.name()));
    }

    public long chips() {
        return state().counter(CHIPS);
    }

    @Override
    public JokerEffect onDiscard(GameContext context, List<Card> discarded) {
        Suit target = target();
        for (Card card : discarded) {
            if (context.hasSuit(card, target)) {
                state().increment(CHIPS, GAIN);
            }
        }
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.chips((int) Math.min(Integer.MAX_VALUE, chips()));
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        state().data().put(SUIT, context.rng().pick(Arrays.asList(Suit.values())).name());
        return JokerEffect.none();
    }

    @Override
    protected InternalJokerState initialState() {
        InternalJokerState state = super.initialState();
        state.data().put(SUIT, initialSuit.name());
        return state;
    }

    @Override
    protected void validate(InternalJokerState candidate) throws StateDeserializeException {
        String raw = candidate.data().path(SUIT).asText(initialSuit.name());
        try {
            Suit.valueOf(raw);
        } catch (IllegalArgumentException e) {
            throw new StateDeserializeException(id(), "unknown suit '" + raw + "'", e);
        }
        if (candidate.counter(CHIPS) < 0) {
            throw new StateDeserializeException(id(), "chips must be >= 0: " + candidate.counter(CHIPS));
        }
    }
}
