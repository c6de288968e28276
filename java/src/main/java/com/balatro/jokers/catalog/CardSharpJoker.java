package com.balatro.jokers.catalog;

import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;

/**
 * X3 Mult if the poker hand has already been played this round.
 */
public final class CardSharpJoker extends AdvancedJoker {
    private static final String PLAYED_PREFIX = "played_";

    public CardSharpJoker(JokerMetadata metadata) {
        super(JokerId.CARD_SHARP, metadata);
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        if (context.hand().isEmpty()) {
            return JokerEffect.none();
        }
        String flag = PLAYED_PREFIX + context.handRank().getJsonValue();
        boolean repeat = state().flag(flag);
        state().setFlag(flag, true);
        return repeat ? JokerEffect.xMult(3) : JokerEffect.none();
    }

    @Override
    public JokerEffect onRoundStart(GameContext context) {
        super.onRoundStart(context);
        for (HandRank rank : HandRank.values()) {
            state().setFlag(PLAYED_PREFIX + rank.getJsonValue(), false);
        }
        return JokerEffect.none();
    }
}
