package com.balatro.jokers.framework;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.joker.GameEvent;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerLifecycle;
import com.balatro.jokers.joker.JokerMetadata;

import java.util.List;
import java.util.Objects;

/**
 * A stateless joker that only reacts to lifecycle moments: blind selection, round end,
 * discards, sale or external events. Economy and card-generation jokers use this.
 */
public final class EventJoker implements JokerIdentity, JokerLifecycle {

    @FunctionalInterface
    public interface ContextFormula {
        JokerEffect apply(GameContext context);
    }

    @FunctionalInterface
    public interface DiscardFormula {
        JokerEffect apply(GameContext context, List<Card> discarded);
    }

    @FunctionalInterface
    public interface EventFormula {
        JokerEffect apply(GameContext context, GameEvent event);
    }

    private static final ContextFormula NOTHING = context -> JokerEffect.none();

    private final JokerId id;
    private final JokerMetadata metadata;
    private final ContextFormula roundStart;
    private final ContextFormula roundEnd;
    private final ContextFormula sell;
    private final DiscardFormula discard;
    private final EventFormula event;

    private EventJoker(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.metadata = Objects.requireNonNull(b.metadata, "metadata");
        this.roundStart = b.roundStart;
        this.roundEnd = b.roundEnd;
        this.sell = b.sell;
        this.discard = b.discard;
        this.event = b.event;
    }

    public static Builder builder(JokerId id, JokerMetadata metadata) {
        return new Builder(id, metadata);
    }

    @Override
    public JokerId id() {
        return id;
    }

    @Override
    public JokerMetadata metadata() {
        return metadata;
    }

    @Override
    public JokerEffect onRoundStart(GameContext context) {
        return roundStart.apply(context);
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        return roundEnd.apply(context);
    }

    @Override
    public JokerEffect onSell(GameContext context) {
        return sell.apply(context);
    }

    @Override
    public JokerEffect onDiscard(GameContext context, List<Card> discarded) {
        return discard.apply(context, discarded);
    }

    @Override
    public JokerEffect onGameEvent(GameContext context, GameEvent gameEvent) {
        return event.apply(context, gameEvent);
    }

    public static final class Builder {
        private final JokerId id;
        private final JokerMetadata metadata;
        private ContextFormula roundStart = NOTHING;
        private ContextFormula roundEnd = NOTHING;
        private ContextFormula sell = NOTHING;
        private DiscardFormula discard = (context, cards) -> JokerEffect.none();
        private EventFormula event = (context, gameEvent) -> JokerEffect.none();

        private Builder(JokerId id, JokerMetadata metadata) {
            this.id = id;
            this.metadata = metadata;
        }

        public Builder onRoundStart(ContextFormula formula) {
            this.roundStart = Objects.requireNonNull(formula);
            return this;
        }

        public Builder onRoundEnd(ContextFormula formula) {
            this.roundEnd = Objects.requireNonNull(formula);
            return this;
        }

        public Builder onSell(ContextFormula formula) {
            this.sell = Objects.requireNonNull(formula);
            return this;
        }

        public Builder onDiscard(DiscardFormula formula) {
            this.discard = Objects.requireNonNull(formula);
            return this;
        }

        public Builder onEvent(EventFormula formula) {
            this.event = Objects.requireNonNull(formula);
            return this;
        }

        public EventJoker build() {
            return new EventJoker(this);
        }
    }
}
