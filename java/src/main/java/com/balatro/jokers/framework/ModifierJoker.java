package com.balatro.jokers.framework;

import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.JokerModifiers;
import com.balatro.jokers.joker.RuleFlag;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A stateless joker whose only behavior is a passive modifier.
 */
public final class ModifierJoker implements JokerIdentity, JokerModifiers {
    private final JokerId id;
    private final JokerMetadata metadata;
    private final int handSizeDelta;
    private final int discardsDelta;
    private final int handsDelta;
    private final Set<RuleFlag> ruleFlags;
    private final double probabilityMultiplier;
    private final int debtLimit;

    private ModifierJoker(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.metadata = Objects.requireNonNull(b.metadata, "metadata");
        this.handSizeDelta = b.handSizeDelta;
        this.discardsDelta = b.discardsDelta;
        this.handsDelta = b.handsDelta;
        this.ruleFlags = b.ruleFlags.isEmpty() ? Set.of() : Set.copyOf(b.ruleFlags);
        this.probabilityMultiplier = b.probabilityMultiplier;
        this.debtLimit = b.debtLimit;
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
    public int handSizeDelta() {
        return handSizeDelta;
    }

    @Override
    public int discardsDelta() {
        return discardsDelta;
    }

    @Override
    public int handsDelta() {
        return handsDelta;
    }

    @Override
    public Set<RuleFlag> ruleFlags() {
        return ruleFlags;
    }

    @Override
    public double probabilityMultiplier() {
        return probabilityMultiplier;
    }

    @Override
    public int debtLimit() {
        return debtLimit;
    }

    public static final class Builder {
        private final JokerId id;
        private final JokerMetadata metadata;
        private int handSizeDelta;
        private int discardsDelta;
        private int handsDelta;
        private final Set<RuleFlag> ruleFlags = EnumSet.noneOf(RuleFlag.class);
        private double probabilityMultiplier = 1.0;
        private int debtLimit;

        private Builder(JokerId id, JokerMetadata metadata) {
            this.id = id;
            this.metadata = metadata;
        }

        public Builder handSize(int delta) {
            this.handSizeDelta = delta;
            return this;
        }

        public Builder discards(int delta) {
            this.discardsDelta = delta;
            return this;
        }

        public Builder hands(int delta) {
            this.handsDelta = delta;
            return this;
        }

        public Builder flags(RuleFlag... flags) {
            this.ruleFlags.addAll(Arrays.asList(flags));
            return this;
        }

        public Builder probabilityMultiplier(double multiplier) {
            if (!(multiplier > 0) || Double.isInfinite(multiplier)) {
                throw new IllegalArgumentException("probability multiplier must be positive: " + multiplier);
            }
            this.probabilityMultiplier = multiplier;
            return this;
        }

        public Builder debtLimit(int limit) {
            this.debtLimit = limit;
            return this;
        }

        public ModifierJoker build() {
            return new ModifierJoker(this);
        }
    }
}
