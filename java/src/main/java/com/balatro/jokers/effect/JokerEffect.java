package com.balatro.jokers.effect;

import com.balatro.jokers.card.HandRank;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The net change one hook invocation produces. Immutable.
 * <p>
 * Effects combine field-wise: additive fields sum (saturating), the mult multiplier
 * multiplies, flags OR together and directive lists concatenate in order.
 * The default value ({@link #none()}) is the identity for {@link #combine(JokerEffect)}.
 */
public final class JokerEffect {
    private static final JokerEffect NONE = new Builder().build();

    private final int chips;
    private final double mult;
    private final double multMultiplier;
    private final int money;
    private final int interestBonus;
    private final int retriggers;
    private final boolean destroySelf;
    private final List<CardTransform> transforms;
    private final int handSizeMod;
    private final int discardMod;
    private final int sellValueIncrease;
    private final int sellValueIncreaseAll;
    private final List<ConsumableRequest> consumables;
    private final List<JokerSpawn> jokerSpawns;
    private final List<Integer> destroyedJokerPositions;
    private final List<HandRank> levelUps;
    private final boolean disableBossBlind;

    private JokerEffect(Builder builder) {
        this.chips = builder.chips;
        this.mult = builder.mult;
        this.multMultiplier = builder.multMultiplier;
        this.money = builder.money;
        this.interestBonus = builder.interestBonus;
        this.retriggers = builder.retriggers;
        this.destroySelf = builder.destroySelf;
        this.transforms = List.copyOf(builder.transforms);
        this.handSizeMod = builder.handSizeMod;
        this.discardMod = builder.discardMod;
        this.sellValueIncrease = builder.sellValueIncrease;
        this.sellValueIncreaseAll = builder.sellValueIncreaseAll;
        this.consumables = List.copyOf(builder.consumables);
        this.jokerSpawns = List.copyOf(builder.jokerSpawns);
        this.destroyedJokerPositions = List.copyOf(builder.destroyedJokerPositions);
        this.levelUps = List.copyOf(builder.levelUps);
        this.disableBossBlind = builder.disableBossBlind;
    }

    public static JokerEffect none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== SHORTHANDS ====================

    public static JokerEffect chips(int chips) {
        return builder().chips(chips).build();
    }

    public static JokerEffect mult(double mult) {
        return builder().mult(mult).build();
    }

    public static JokerEffect xMult(double multiplier) {
        return builder().multMultiplier(multiplier).build();
    }

    public static JokerEffect money(int money) {
        return builder().money(money).build();
    }

    public static JokerEffect retrigger(int times) {
        return builder().retriggers(times).build();
    }

    public static JokerEffect destroySelf() {
        return builder().destroySelf(true).build();
    }

    // ==================== COMBINATION ====================

    /**
     * Field-wise combination of this effect followed by {@code other}.
     */
    public JokerEffect combine(JokerEffect other) {
        if (other.isIdentity()) {
            return this;
        }
        if (isIdentity()) {
            return other;
        }
        Builder b = toBuilder();
        b.chips = SaturatingMath.add(chips, other.chips);
        b.mult = mult + other.mult;
        b.multMultiplier = multMultiplier * other.multMultiplier;
        b.money = SaturatingMath.add(money, other.money);
        b.interestBonus = SaturatingMath.add(interestBonus, other.interestBonus);
        b.retriggers = SaturatingMath.add(retriggers, other.retriggers);
        b.destroySelf = destroySelf || other.destroySelf;
        b.transforms.addAll(other.transforms);
        b.handSizeMod = SaturatingMath.add(handSizeMod, other.handSizeMod);
        b.discardMod = SaturatingMath.add(discardMod, other.discardMod);
        b.sellValueIncrease = SaturatingMath.add(sellValueIncrease, other.sellValueIncrease);
        b.sellValueIncreaseAll = SaturatingMath.add(sellValueIncreaseAll, other.sellValueIncreaseAll);
        b.consumables.addAll(other.consumables);
        b.jokerSpawns.addAll(other.jokerSpawns);
        b.destroyedJokerPositions.addAll(other.destroyedJokerPositions);
        b.levelUps.addAll(other.levelUps);
        b.disableBossBlind = disableBossBlind || other.disableBossBlind;
        return b.build();
    }

    public boolean isIdentity() {
        return this == NONE || equals(NONE);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.chips = chips;
        b.mult = mult;
        b.multMultiplier = multMultiplier;
        b.money = money;
        b.interestBonus = interestBonus;
        b.retriggers = retriggers;
        b.destroySelf = destroySelf;
        b.transforms.addAll(transforms);
        b.handSizeMod = handSizeMod;
        b.discardMod = discardMod;
        b.sellValueIncrease = sellValueIncrease;
        b.sellValueIncreaseAll = sellValueIncreaseAll;
        b.consumables.addAll(consumables);
        b.jokerSpawns.addAll(jokerSpawns);
        b.destroyedJokerPositions.addAll(destroyedJokerPositions);
        b.levelUps.addAll(levelUps);
        b.disableBossBlind = disableBossBlind;
        return b;
    }

    // ==================== ACCESSORS ====================

    public int getChips() {
        return chips;
    }

    public double getMult() {
        return mult;
    }

    public double getMultMultiplier() {
        return multMultiplier;
    }

    public int getMoney() {
        return money;
    }

    public int getInterestBonus() {
        return interestBonus;
    }

    public int getRetriggers() {
        return retriggers;
    }

    public boolean isDestroySelf() {
        return destroySelf;
    }

    public List<CardTransform> getTransforms() {
        return transforms;
    }

    public int getHandSizeMod() {
        return handSizeMod;
    }

    public int getDiscardMod() {
        return discardMod;
    }

    public int getSellValueIncrease() {
        return sellValueIncrease;
    }

    public int getSellValueIncreaseAll() {
        return sellValueIncreaseAll;
    }

    public List<ConsumableRequest> getConsumables() {
        return consumables;
    }

    public List<JokerSpawn> getJokerSpawns() {
        return jokerSpawns;
    }

    /**
     * Run-order positions (as of the evaluation) of sibling jokers to destroy.
     */
    public List<Integer> getDestroyedJokerPositions() {
        return destroyedJokerPositions;
    }

    /**
     * Hand classes to raise by one level.
     */
    public List<HandRank> getLevelUps() {
        return levelUps;
    }

    public boolean isDisableBossBlind() {
        return disableBossBlind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JokerEffect)) return false;
        JokerEffect that = (JokerEffect) o;
        return chips == that.chips
            && Double.compare(mult, that.mult) == 0
            && Double.compare(multMultiplier, that.multMultiplier) == 0
            && money == that.money
            && interestBonus == that.interestBonus
            && retriggers == that.retriggers
            && destroySelf == that.destroySelf
            && handSizeMod == that.handSizeMod
            && discardMod == that.discardMod
            && sellValueIncrease == that.sellValueIncrease
            && sellValueIncreaseAll == that.sellValueIncreaseAll
            && transforms.equals(that.transforms)
            && disableBossBlind == that.disableBossBlind
            && consumables.equals(that.consumables)
            && jokerSpawns.equals(that.jokerSpawns)
            && destroyedJokerPositions.equals(that.destroyedJokerPositions)
            && levelUps.equals(that.levelUps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chips, mult, multMultiplier, money, interestBonus, retriggers, destroySelf,
            transforms, handSizeMod, discardMod, sellValueIncrease, sellValueIncreaseAll, consumables,
            jokerSpawns, destroyedJokerPositions, levelUps, disableBossBlind);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("JokerEffect{");
        sb.append("chips=").append(chips)
            .append(", mult=").append(mult)
            .append(", x").append(multMultiplier)
            .append(", money=").append(money);
        if (retriggers != 0) sb.append(", retriggers=").append(retriggers);
        if (destroySelf) sb.append(", destroySelf");
        if (!transforms.isEmpty()) sb.append(", transforms=").append(transforms);
        if (!consumables.isEmpty()) sb.append(", consumables=").append(consumables);
        if (!jokerSpawns.isEmpty()) sb.append(", spawns=").append(jokerSpawns);
        if (!destroyedJokerPositions.isEmpty()) sb.append(", destroyJokers=").append(destroyedJokerPositions);
        if (!levelUps.isEmpty()) sb.append(", levelUps=").append(levelUps);
        if (disableBossBlind) sb.append(", disableBoss");
        return sb.append('}').toString();
    }

    /**
     * Mutable builder. Fields default to the identity values.
     */
    public static final class Builder {
        private int chips;
        private double mult;
        private double multMultiplier = 1.0;
        private int money;
        private int interestBonus;
        private int retriggers;
        private boolean destroySelf;
        private final List<CardTransform> transforms = new ArrayList<>();
        private int handSizeMod;
        private int discardMod;
        private int sellValueIncrease;
        private int sellValueIncreaseAll;
        private final List<ConsumableRequest> consumables = new ArrayList<>();
        private final List<JokerSpawn> jokerSpawns = new ArrayList<>();
        private final List<Integer> destroyedJokerPositions = new ArrayList<>();
        private final List<HandRank> levelUps = new ArrayList<>();
        private boolean disableBossBlind;

        private Builder() {
        }

        public Builder chips(int chips) {
            this.chips = chips;
            return this;
        }

        public Builder mult(double mult) {
            this.mult = mult;
            return this;
        }

        public Builder multMultiplier(double multMultiplier) {
            this.multMultiplier = multMultiplier;
            return this;
        }

        public Builder money(int money) {
            this.money = money;
            return this;
        }

        public Builder interestBonus(int interestBonus) {
            this.interestBonus = interestBonus;
            return this;
        }

        public Builder retriggers(int retriggers) {
            this.retriggers = retriggers;
            return this;
        }

        public Builder destroySelf(boolean destroySelf) {
            this.destroySelf = destroySelf;
            return this;
        }

        public Builder transform(CardTransform transform) {
            this.transforms.add(Objects.requireNonNull(transform, "transform"));
            return this;
        }

        public Builder handSizeMod(int handSizeMod) {
            this.handSizeMod = handSizeMod;
            return this;
        }

        public Builder discardMod(int discardMod) {
            this.discardMod = discardMod;
            return this;
        }

        public Builder sellValueIncrease(int sellValueIncrease) {
            this.sellValueIncrease = sellValueIncrease;
            return this;
        }

        public Builder sellValueIncreaseAll(int sellValueIncreaseAll) {
            this.sellValueIncreaseAll = sellValueIncreaseAll;
            return this;
        }

        public Builder consumable(ConsumableRequest request) {
            this.consumables.add(Objects.requireNonNull(request, "request"));
            return this;
        }

        public Builder spawn(JokerSpawn spawn) {
            this.jokerSpawns.add(Objects.requireNonNull(spawn, "spawn"));
            return this;
        }

        public Builder destroyJokerAt(int position) {
            if (position < 0) {
                throw new IllegalArgumentException("position must be >= 0: " + position);
            }
            this.destroyedJokerPositions.add(position);
            return this;
        }

        public Builder levelUp(HandRank rank) {
            this.levelUps.add(Objects.requireNonNull(rank, "rank"));
            return this;
        }

        public Builder disableBossBlind(boolean disableBossBlind) {
            this.disableBossBlind = disableBossBlind;
            return this;
        }

        public JokerEffect build() {
            return new JokerEffect(this);
        }
    }
}
