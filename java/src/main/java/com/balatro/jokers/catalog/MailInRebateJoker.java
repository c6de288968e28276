package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Rank;
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
 * Earns $5 for each discarded card of the target rank; the rank changes every round.
 */
public final class MailInRebateJoker extends AdvancedJoker {
    static final String RANK = "rank";
    static final int PAYOUT = 5;

    private final Rank initialRank;

    public MailInRebateJoker(JokerMetadata metadata, Rank initialRank) {
        super(JokerId.MAIL_IN_REBATE, metadata);
        this.initialRank = initialRank;
    }

    public Rank target() {
        return Rank.valueOf(state().data().path(RANK).asText(initialRank.name()));
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onDiscard(GameContext context, List<Card> discarded) {
        Rank target = target();
        int matches = 0;
        for (Card card : discarded) {
            if (!card.isStone() && card.rank() == target) {
                matches++;
            }
        }
        return JokerEffect.money(PAYOUT * matches);
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        state().data().put(RANK, context.rng().pick(Arrays.asList(Rank.values())).name());
        return JokerEffect.none();
    }

    @Override
    protected InternalJokerState initialState() {
        InternalJokerState state = super.initialState();
        state.data().put(RANK, initialRank.name());
        return state;
    }

    @Override
    protected void validate(InternalJokerState candidate) throws StateDeserializeException {
        String raw = candidate.data().path(RANK).asText(initialRank.name());
        try {
            Rank.valueOf(raw);
        } catch (IllegalArgumentException e) {
            throw new StateDeserializeException(id(), "unknown rank '" + raw + "'", e);
        }
    }
}
