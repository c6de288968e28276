package com.balatro.jokers.effect;

import com.balatro.jokers.card.HandRank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running total of effects over one pass, with bounds enforced after every step.
 * <p>
 * Clamp order per accumulation:
 * <ol>
 *   <li>integer fields add with saturation;</li>
 *   <li>additive mult: sum, reject if non-finite, then pin to [-max, max];</li>
 *   <li>multiplier: product, reject if non-finite, then pin to [0, max].</li>
 * </ol>
 * Not thread-safe; one accumulator belongs to one evaluation.
 */
public final class EffectAccumulator {
    private final double maxMult;

    private int chips;
    private double mult;
    private double multMultiplier = 1.0;
    private int money;
    private int interestBonus;
    private int retriggers;
    private boolean destroySelf;
    private int handSizeMod;
    private int discardMod;
    private int sellValueIncrease;
    private int sellValueIncreaseAll;
    private final List<CardTransform> transforms = new ArrayList<>();
    private final List<ConsumableRequest> consumables = new ArrayList<>();
    private final List<JokerSpawn> jokerSpawns = new ArrayList<>();
    private final List<Integer> destroyedJokerPositions = new ArrayList<>();
    private final List<HandRank> levelUps = new ArrayList<>();
    private boolean disableBossBlind;
    private final List<NumericViolation> violations = new ArrayList<>();

    public EffectAccumulator(double maxMult) {
        if (!(maxMult > 0) || Double.isInfinite(maxMult)) {
            throw new IllegalArgumentException("maxMult must be positive and finite: " + maxMult);
        }
        this.maxMult = maxMult;
    }

    /**
     * Fold one effect into the running total.
     * @param effect The effect returned by a hook
     * @param source Label used in violation reports
     * @return violations raised by this step (empty in the normal case)
     */
    public List<NumericViolation> accumulate(JokerEffect effect, String source) {
        if (effect.isIdentity()) {
            return List.of();
        }
        int before = violations.size();

        chips = SaturatingMath.add(chips, effect.getChips());
        money = SaturatingMath.add(money, effect.getMoney());
        interestBonus = SaturatingMath.add(interestBonus, effect.getInterestBonus());
        retriggers = SaturatingMath.add(retriggers, effect.getRetriggers());
        handSizeMod = SaturatingMath.add(handSizeMod, effect.getHandSizeMod());
        discardMod = SaturatingMath.add(discardMod, effect.getDiscardMod());
        sellValueIncrease = SaturatingMath.add(sellValueIncrease, effect.getSellValueIncrease());
        sellValueIncreaseAll = SaturatingMath.add(sellValueIncreaseAll, effect.getSellValueIncreaseAll());
        destroySelf |= effect.isDestroySelf();
        transforms.addAll(effect.getTransforms());
        consumables.addAll(effect.getConsumables());
        jokerSpawns.addAll(effect.getJokerSpawns());
        destroyedJokerPositions.addAll(effect.getDestroyedJokerPositions());
        levelUps.addAll(effect.getLevelUps());
        disableBossBlind |= effect.isDisableBossBlind();

        mult = bounded(source, "mult", mult, mult + effect.getMult(), -maxMult);
        multMultiplier = bounded(source, "mult_multiplier", multMultiplier,
            multMultiplier * effect.getMultMultiplier(), 0.0);

        if (violations.size() == before) {
            return List.of();
        }
        return List.copyOf(violations.subList(before, violations.size()));
    }

    private double bounded(String source, String field, double previous, double candidate, double min) {
        if (!Double.isFinite(candidate)) {
            violations.add(new NumericViolation(source, field, NumericViolation.Kind.NON_FINITE, candidate, previous));
            return previous;
        }
        double clamped = SaturatingMath.clamp(candidate, min, maxMult);
        if (clamped != candidate) {
            violations.add(new NumericViolation(source, field, NumericViolation.Kind.CLAMPED, candidate, clamped));
        }
        return clamped;
    }

    /**
     * Snapshot of the running total as an effect.
     */
    public JokerEffect toEffect() {
        JokerEffect.Builder b = JokerEffect.builder()
            .chips(chips)
            .mult(mult)
            .multMultiplier(multMultiplier)
            .money(money)
            .interestBonus(interestBonus)
            .retriggers(retriggers)
            .destroySelf(destroySelf)
            .handSizeMod(handSizeMod)
            .discardMod(discardMod)
            .sellValueIncrease(sellValueIncrease)
            .sellValueIncreaseAll(sellValueIncreaseAll)
            .disableBossBlind(disableBossBlind);
        transforms.forEach(b::transform);
        consumables.forEach(b::consumable);
        jokerSpawns.forEach(b::spawn);
        destroyedJokerPositions.forEach(b::destroyJokerAt);
        levelUps.forEach(b::levelUp);
        return b.build();
    }

    public int chips() {
        return chips;
    }

    public double mult() {
        return mult;
    }

    public double multMultiplier() {
        return multMultiplier;
    }

    public int money() {
        return money;
    }

    public double maxMult() {
        return maxMult;
    }

    public List<NumericViolation> violations() {
        return Collections.unmodifiableList(violations);
    }
}
