package com.balatro.jokers.framework;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.condition.Condition;
import com.balatro.jokers.framework.condition.Conditions;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerMetadata;

import java.util.Objects;

/**
 * A stateless joker whose effect is one formula behind one filter.
 * Covers the flat bonuses ("+4 Mult", "+3 Mult per Diamond scored").
 */
public final class StaticJoker implements JokerIdentity, JokerGameplay {
    private final JokerId id;
    private final JokerMetadata metadata;
    private final Trigger trigger;
    private final Condition filter;
    private final EffectFormula formula;

    private StaticJoker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.metadata = Objects.requireNonNull(builder.metadata, "metadata");
        this.trigger = builder.trigger;
        this.filter = builder.filter;
        this.formula = Objects.requireNonNull(builder.formula, id + ": formula");
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
    public JokerEffect onHandPlayed(GameContext context) {
        if (trigger != Trigger.PER_HAND || !filter.test(context, null)) {
            return JokerEffect.none();
        }
        return formula.apply(context, null);
    }

    @Override
    public JokerEffect onCardScored(GameContext context, Card card) {
        if (trigger != Trigger.PER_CARD || !filter.test(context, card)) {
            return JokerEffect.none();
        }
        return formula.apply(context, card);
    }

    public Trigger getTrigger() {
        return trigger;
    }

    @Override
    public String toString() {
        return "StaticJoker{" + id.wireName() + ", " + trigger + ", when " + filter.describe() + "}";
    }

    public static final class Builder {
        private final JokerId id;
        private final JokerMetadata metadata;
        private Trigger trigger = Trigger.PER_HAND;
        private Condition filter = Conditions.always();
        private EffectFormula formula;

        private Builder(JokerId id, JokerMetadata metadata) {
            this.id = id;
            this.metadata = metadata;
        }

        public Builder perHand() {
            this.trigger = Trigger.PER_HAND;
            return this;
        }

        public Builder perCard() {
            this.trigger = Trigger.PER_CARD;
            return this;
        }

        public Builder when(Condition filter) {
            this.filter = Objects.requireNonNull(filter, "filter");
            return this;
        }

        public Builder effect(JokerEffect effect) {
            this.formula = EffectFormula.constant(effect);
            return this;
        }

        public Builder formula(EffectFormula formula) {
            this.formula = formula;
            return this;
        }

        public StaticJoker build() {
            return new StaticJoker(this);
        }
    }
}
