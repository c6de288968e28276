package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.card.Suit;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.InternalJokerState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.StateDeserializeException;

import java.util.Arrays;

/**
 * Each played card of the target rank and suit gives X2 Mult when scored.
 * The target card changes every round.
 */
public final class TheIdolJoker extends AdvancedJoker {
    static final String RANK = "rank";
    static final String SUIT = "suit";

    private final Rank initialRank;
    private final Suit initialSuit;

    public TheIdolJoker(JokerMetadata metadata, Rank initialRank, Suit initialSuit) {
        super(JokerId.THE_IDOL, metadata);
        this.initialRank = initialRank;
        this.initialSuit = initialSuit;
    }

    public Rank targetRank() {
        return Rank.valueOf(state().data().path(RANK).asText(initialRank.name()));
    }

    public Suit targetSuit() {
        return Suit.valueOf(state().data().path(SUIT).asText(initialSuit.name()));
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onCardScored(GameContext context, Card card) {
        if (!card.isStone() && card.rank() == targetRank() && context.hasSuit(card, targetSuit())) {
            return JokerEffect.xMult(2);
        }
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        state().data().put(RANK, context.rng().pick(Arrays.asList(Rank.values())).name());
        state().data().put(SUIT, context.rng().pick(Arrays.asList(Suit.values())).name());
        return JokerEffect.none();
    }

    @Override
    protected InternalJokerState initialState() {
        InternalJokerState state = super.initialState();
        state.data().put(RANK, initialRank.name());
        state.data().put(SUIT, initialSuit.name());
        return state;
    }

    @Override
    protected void validate(InternalJokerState candidate) throws StateDeserializeException {
        try {
            Rank.valueOf(candidate.data().path(RANK).asText(initialRank.name()));
            Suit.valueOf(candidate.data().path(SUIT).asText(initialSuit.name()));
        } catch (IllegalArgumentException e) {
            throw new StateDeserializeException(id(), "invalid target card: " + candidate.data(), e);
        }
    }
}
