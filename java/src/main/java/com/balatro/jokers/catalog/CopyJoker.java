package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.JokerState;

import java.util.Optional;

/**
 * Copies the scoring ability of another joker: the one to its right (Blueprint) or the
 * leftmost one (Brainstorm). Only stateless scoring jokers are copied, so a copy never
 * advances another instance's counters. Copies never copy copies.
 */
public final class CopyJoker implements JokerIdentity, JokerGameplay {

    public enum Target {
        RIGHT_NEIGHBOUR,
        LEFTMOST
    }

    private final JokerId id;
    private final JokerMetadata metadata;
    private final Target target;

    public CopyJoker(JokerId id, JokerMetadata metadata, Target target) {
        this.id = id;
        this.metadata = metadata;
        this.target = target;
    }

    @Override
    public JokerId id() {
        return id;
    }

    @Override
    public JokerMetadata metadata() {
        return metadata;
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return copied(context).map(source -> source.onHandPlayed(context)).orElse(JokerEffect.none());
    }

    @Override
    public JokerEffect onCardScored(GameContext context, Card card) {
        return copied(context).map(source -> source.onCardScored(context, card)).orElse(JokerEffect.none());
    }

    /**
     * The joker whose ability is copied in this context, if it can be copied.
     */
    public Optional<JokerGameplay> copied(GameContext context) {
        Optional<Joker> candidate = target == Target.RIGHT_NEIGHBOUR
            ? context.rightNeighbour(this)
            : context.leftmost();
        return candidate
            .filter(joker -> joker != this)
            .filter(joker -> !(joker instanceof CopyJoker))
            .filter(joker -> !(joker instanceof JokerState))
            .filter(joker -> joker instanceof JokerGameplay)
            .map(joker -> (JokerGameplay) joker);
    }
}
