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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Each played card of the target suit gives X1.5 Mult when scored. The suit changes
 * at end of round and never repeats twice in a row.
 */
public final class AncientJoker extends AdvancedJoker {
    static final String SUIT = "suit";

    private final Suit initialSuit;

    public AncientJoker(JokerMetadata metadata, Suit initialSuit) {
        super(JokerId.ANCIENT_JOKER, metadata);
        this.initialSuit = initialSuit;
    }

    public Suit target() {
        return Suit.valueOf(state().data().path(SUIT).asText(initialSuit.name()));
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onCardScored(GameContext context, Card card) {
        return context.hasSuit(card, target()) ? JokerEffect.xMult(1.5) : JokerEffect.none();
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        List<Suit> choices = new ArrayList<>(Arrays.asList(Suit.values()));
        choices.remove(target());
        state().data().put(SUIT, context.rng().pick(choices).name());
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
    }
}
