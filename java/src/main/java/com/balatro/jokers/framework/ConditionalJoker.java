package com.balatro.jokers.framework;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.condition.Condition;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A stateless joker made of ordered condition/effect rules.
 * Every rule whose trigger and condition match contributes; contributions combine in rule order.
 */
public final class ConditionalJoker implements JokerIdentity, JokerGameplay {
    private final JokerId id;
    private final JokerMetadata metadata;
    private final List<Rule> rules;

    /**
     * One trigger-condition-effect triple.
     */
    public record Rule(Trigger trigger, Condition condition, EffectFormula effect) {
        public Rule {
            Objects.requireNonNull(trigger, "trigger");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(effect, "effect");
        }

        public static Rule onHand(Condition condition, JokerEffect effect) {
            return new Rule(Trigger.PER_HAND, condition, EffectFormula.constant(effect));
        }

        public static Rule onCard(Condition condition, JokerEffect effect) {
            return new Rule(Trigger.PER_CARD, condition, EffectFormula.constant(effect));
        }
    }

    private ConditionalJoker(JokerId id, JokerMetadata metadata, List<Rule> rules) {
        this.id = Objects.requireNonNull(id, "id");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException(id + ": at least one rule is required");
        }
        this.rules = List.copyOf(rules);
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
        return evaluate(Trigger.PER_HAND, context, null);
    }

    @Override
    public JokerEffect onCardScored(GameContext context, Card card) {
        return evaluate(Trigger.PER_CARD, context, card);
    }

    private JokerEffect evaluate(Trigger trigger, GameContext context, Card card) {
        JokerEffect total = JokerEffect.none();
        for (Rule rule : rules) {
            if (rule.trigger() == trigger && rule.condition().test(context, card)) {
                total = total.combine(rule.effect().apply(context, card));
            }
        }
        return total;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public static final class Builder {
        private final JokerId id;
        private final JokerMetadata metadata;
        private final List<Rule> rules = new ArrayList<>();

        private Builder(JokerId id, JokerMetadata metadata) {
            this.id = id;
            this.metadata = metadata;
        }

        public Builder rule(Rule rule) {
            rules.add(rule);
            return this;
        }

        public Builder onHand(Condition condition, JokerEffect effect) {
            return rule(Rule.onHand(condition, effect));
        }

        public Builder onHand(Condition condition, EffectFormula formula) {
            return rule(new Rule(Trigger.PER_HAND, condition, formula));
        }

        public Builder onCard(Condition condition, JokerEffect effect) {
            return rule(Rule.onCard(condition, effect));
        }

        public Builder onCard(Condition condition, EffectFormula formula) {
            return rule(new Rule(Trigger.PER_CARD, condition, formula));
        }

        public ConditionalJoker build() {
            return new ConditionalJoker(id, metadata, rules);
        }
    }
}
