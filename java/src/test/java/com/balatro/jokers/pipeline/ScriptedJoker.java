package com.balatro.jokers.pipeline;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerLifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Test joker whose hooks are supplied as functions. Records the sibling count seen by each call.
 */
final class ScriptedJoker implements JokerGameplay, JokerLifecycle {
    private final JokerId id;
    private final Function<GameContext, JokerEffect> onHand;
    private final BiFunction<GameContext, Card, JokerEffect> onCard;
    private final Function<GameContext, JokerEffect> onRoundEnd;

    final List<Integer> siblingsSeen = new ArrayList<>();
    int handCalls;
    int cardCalls;

    ScriptedJoker(JokerId id,
                  Function<GameContext, JokerEffect> onHand,
                  BiFunction<GameContext, Card, JokerEffect> onCard,
                  Function<GameContext, JokerEffect> onRoundEnd) {
        this.id = id;
        this.onHand = onHand;
        this.onCard = onCard;
        this.onRoundEnd = onRoundEnd;
    }

    static ScriptedJoker onHand(JokerId id, JokerEffect effect) {
        return new ScriptedJoker(id, ctx -> effect, (ctx, card) -> JokerEffect.none(), ctx -> JokerEffect.none());
    }

    static ScriptedJoker onCard(JokerId id, JokerEffect effect) {
        return new ScriptedJoker(id, ctx -> JokerEffect.none(), (ctx, card) -> effect, ctx -> JokerEffect.none());
    }

    static ScriptedJoker onRoundEnd(JokerId id, JokerEffect effect) {
        return new ScriptedJoker(id, ctx -> JokerEffect.none(), (ctx, card) -> JokerEffect.none(), ctx -> effect);
    }

    @Override
    public JokerId id() {
        return id;
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        handCalls++;
        siblingsSeen.add(context.jokerCount());
        return onHand.apply(context);
    }

    @Override
    public JokerEffect onCardScored(GameContext context, Card card) {
        cardCalls++;
        siblingsSeen.add(context.jokerCount());
        return onCard.apply(context, card);
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        return onRoundEnd.apply(context);
    }
}
