package com.balatro.jokers.effect;

/**
 * Applies an aggregate effect with the final bounds: mult at most the configured
 * maximum, wallet never below zero, score saturating instead of overflowing.
 * <p>
 * Mult is applied as {@code clamp(base + additive) x multiplier}, clamped again.
 */
public final class EffectApplier {
    private final double maxMult;

    public EffectApplier(double maxMult) {
        if (!(maxMult > 0) || Double.isInfinite(maxMult)) {
            throw new IllegalArgumentException("maxMult must be positive and finite: " + maxMult);
        }
        this.maxMult = maxMult;
    }

    public AppliedScore apply(long baseChips, double baseMult, int wallet, JokerEffect aggregate) {
        long chips = Math.max(0, SaturatingMath.add(baseChips, aggregate.getChips()));
        double mult = applyMult(baseMult, aggregate);
        long score = SaturatingMath.toLong((double) chips * mult);
        int newWallet = applyMoney(wallet, aggregate.getMoney());
        return new AppliedScore(chips, mult, score, newWallet);
    }

    public double applyMult(double baseMult, JokerEffect aggregate) {
        double additive = finiteOr(baseMult + aggregate.getMult(), baseMult);
        double mult = SaturatingMath.clamp(additive, 0.0, maxMult);
        double multiplier = finiteOr(aggregate.getMultMultiplier(), 1.0);
        return SaturatingMath.clamp(mult * Math.max(0.0, multiplier), 0.0, maxMult);
    }

    /**
     * Add a money delta to the wallet. The result never drops below zero.
     */
    public static int applyMoney(int wallet, int delta) {
        return Math.max(0, SaturatingMath.add(wallet, delta));
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }

    public double getMaxMult() {
        return maxMult;
    }
}
