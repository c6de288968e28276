package com.balatro.jokers.framework;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.InternalJokerState;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.condition.Condition;
import com.balatro.jokers.framework.condition.Conditions;
import com.balatro.jokers.joker.GameEvent;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.StateDeserializeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A joker with one stored value that grows, shrinks or resets on events and turns
 * into chips, mult, a mult multiplier or round-end money.
 * <p>
 * Step conditions receive the event's card where there is one (scored, discarded,
 * added or destroyed card) and null otherwise.
 */
public final class ScalingJoker extends AdvancedJoker {
    static final String VALUE = "value";

    public enum Output {
        CHIPS,
        MULT,
        X_MULT,
        /** Paid at round end. */
        MONEY
    }

    public enum Event {
        /** Before this joker scores a hand. */
        HAND_PLAYED,
        /** Once per scoring card, before this joker scores the hand. */
        CARD_SCORED,
        /** After this joker scores a hand. */
        HAND_SCORED,
        DISCARD,
        CARD_DISCARDED,
        /** Blind selected. */
        ROUND_START,
        ROUND_END,
        BLIND_SKIPPED,
        BOSS_DEFEATED,
        PACK_SKIPPED,
        SHOP_REROLLED,
        TAROT_USED,
        PLANET_USED,
        SPECTRAL_USED,
        CARD_ADDED,
        CARD_DESTROYED,
        JOKER_SOLD
    }

    public enum Mode {
        ADD,
        RESET
    }

    /**
     * One value change, applied when its event fires and its condition holds.
     */
    public record Step(Event event, Condition condition, Mode mode, double amount) {
        public Step {
            Objects.requireNonNull(event, "event");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(mode, "mode");
        }
    }

    private final Output output;
    private final double initial;
    private final double start;
    private final List<Step> steps;
    private final Condition outputWhen;
    private final Double destroyAtOrBelow;
    private final double floor;

    private ScalingJoker(Builder b) {
        super(b.id, b.metadata);
        this.output = Objects.requireNonNull(b.output, "output");
        this.initial = b.initial;
        this.start = b.start != null ? b.start : b.initial;
        this.steps = List.copyOf(b.steps);
        this.outputWhen = b.outputWhen;
        this.destroyAtOrBelow = b.destroyAtOrBelow;
        this.floor = b.floor;
    }

    public static Builder builder(JokerId id, JokerMetadata metadata) {
        return new Builder(id, metadata);
    }

    public double value() {
        return state().value(VALUE, start);
    }

    private void setValue(double value) {
        state().setValue(VALUE, value);
    }

    // ==================== HOOKS ====================

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        apply(Event.HAND_PLAYED, context, null);
        for (Card card : context.scoringCards()) {
            apply(Event.CARD_SCORED, context, card);
        }
        JokerEffect effect = JokerEffect.none();
        if (output != Output.MONEY && test(outputWhen, context, null)) {
            effect = toEffect(value());
        }
        apply(Event.HAND_SCORED, context, null);
        return withDestroyCheck(effect);
    }

    @Override
    public JokerEffect onDiscard(GameContext context, List<Card> discarded) {
        apply(Event.DISCARD, context, null);
        for (Card card : discarded) {
            apply(Event.CARD_DISCARDED, context, card);
        }
        return withDestroyCheck(JokerEffect.none());
    }

    @Override
    public JokerEffect onRoundStart(GameContext context) {
        super.onRoundStart(context);
        apply(Event.ROUND_START, context, null);
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        JokerEffect effect = output == Output.MONEY ? toEffect(value()) : JokerEffect.none();
        apply(Event.ROUND_END, context, null);
        return withDestroyCheck(effect);
    }

    @Override
    public JokerEffect onGameEvent(GameContext context, GameEvent event) {
        if (event instanceof GameEvent.BlindSkipped) {
            apply(Event.BLIND_SKIPPED, context, null);
        } else if (event instanceof GameEvent.BossBlindDefeated) {
            apply(Event.BOSS_DEFEATED, context, null);
        } else if (event instanceof GameEvent.PackSkipped) {
            apply(Event.PACK_SKIPPED, context, null);
        } else if (event instanceof GameEvent.ShopRerolled) {
            apply(Event.SHOP_REROLLED, context, null);
        } else if (event instanceof GameEvent.ConsumableUsed used) {
            switch (used.kind()) {
                case TAROT -> apply(Event.TAROT_USED, context, null);
                case PLANET -> apply(Event.PLANET_USED, context, null);
                case SPECTRAL -> apply(Event.SPECTRAL_USED, context, null);
            }
        } else if (event instanceof GameEvent.CardAdded added) {
            apply(Event.CARD_ADDED, context, added.card());
        } else if (event instanceof GameEvent.CardDestroyed destroyed) {
            apply(Event.CARD_DESTROYED, context, destroyed.card());
        } else if (event instanceof GameEvent.JokerSold) {
            apply(Event.JOKER_SOLD, context, null);
        }
        return withDestroyCheck(JokerEffect.none());
    }

    // ==================== INTERNALS ====================

    private void apply(Event event, GameContext context, Card card) {
        for (Step step : steps) {
            if (step.event() != event) {
                continue;
            }
            if (!test(step.condition(), context, card)) {
                continue;
            }
            switch (step.mode()) {
                case ADD -> setValue(Math.max(floor, value() + step.amount()));
                case RESET -> setValue(initial);
            }
        }
    }

    private JokerEffect toEffect(double value) {
        switch (output) {
            case CHIPS:
                return JokerEffect.chips((int) Math.round(value));
            case MULT:
                return JokerEffect.mult(value);
            case X_MULT:
                return JokerEffect.xMult(value);
            case MONEY:
                return JokerEffect.money((int) Math.round(value));
            default:
                throw new IllegalStateException("Unhandled output: " + output);
        }
    }

    private JokerEffect withDestroyCheck(JokerEffect effect) {
        if (destroyAtOrBelow != null && value() <= destroyAtOrBelow) {
            return effect.combine(JokerEffect.destroySelf());
        }
        return effect;
    }

    @Override
    protected InternalJokerState initialState() {
        InternalJokerState state = super.initialState();
        state.setValue(VALUE, start);
        return state;
    }

    @Override
    protected void validate(InternalJokerState candidate) throws StateDeserializeException {
        double stored = candidate.value(VALUE, initial);
        if (output == Output.X_MULT && stored < 0) {
            throw new StateDeserializeException(id(), "multiplier value must be >= 0: " + stored);
        }
    }

    public Output getOutput() {
        return output;
    }

    public double getInitial() {
        return initial;
    }

    public static final class Builder {
        private final JokerId id;
        private final JokerMetadata metadata;
        private Output output;
        private double initial;
        private Double start;
        private final List<Step> steps = new ArrayList<>();
        private Condition outputWhen = Conditions.always();
        private Double destroyAtOrBelow;
        private double floor = -Double.MAX_VALUE;

        private Builder(JokerId id, JokerMetadata metadata) {
            this.id = id;
            this.metadata = metadata;
        }

        public Builder output(Output output, double initial) {
            this.output = output;
            this.initial = initial;
            return this;
        }

        /**
         * Value of a fresh instance when it differs from the reset value.
         */
        public Builder startAt(double start) {
            this.start = start;
            return this;
        }

        public Builder add(Event event, double amount) {
            return add(event, Conditions.always(), amount);
        }

        public Builder add(Event event, Condition condition, double amount) {
            steps.add(new Step(event, condition, Mode.ADD, amount));
            return this;
        }

        public Builder reset(Event event) {
            return reset(event, Conditions.always());
        }

        public Builder reset(Event event, Condition condition) {
            steps.add(new Step(event, condition, Mode.RESET, 0));
            return this;
        }

        public Builder outputWhen(Condition condition) {
            this.outputWhen = Objects.requireNonNull(condition, "condition");
            return this;
        }

        public Builder destroyAtOrBelow(double threshold) {
            this.destroyAtOrBelow = threshold;
            return this;
        }

        /**
         * Lowest value decrements may reach.
         */
        public Builder floor(double floor) {
            this.floor = floor;
            return this;
        }

        public ScalingJoker build() {
            return new ScalingJoker(this);
        }
    }
}
