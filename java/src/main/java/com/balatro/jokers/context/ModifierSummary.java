package com.balatro.jokers.context;

import com.balatro.jokers.card.HandRules;
import com.balatro.jokers.effect.SaturatingMath;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerModifiers;
import com.balatro.jokers.joker.RuleFlag;

import java.util.EnumSet;
import java.util.Set;

/**
 * Combined passive modifiers of every active joker.
 * Deltas and debt limits sum; probability multipliers multiply; flags union.
 */
public record ModifierSummary(
    int handSizeDelta,
    int discardsDelta,
    int handsDelta,
    Set<RuleFlag> flags,
    double probabilityMultiplier,
    int debtLimit
) {
    public static final ModifierSummary NONE = new ModifierSummary(0, 0, 0, Set.of(), 1.0, 0);

    public ModifierSummary {
        flags = flags.isEmpty() ? Set.of() : Set.copyOf(flags);
    }

    public static ModifierSummary collect(Iterable<? extends Joker> jokers) {
        int handSize = 0;
        int discards = 0;
        int hands = 0;
        Set<RuleFlag> flags = EnumSet.noneOf(RuleFlag.class);
        double probability = 1.0;
        int debt = 0;
        for (Joker joker : jokers) {
            if (joker instanceof JokerModifiers) {
                JokerModifiers m = (JokerModifiers) joker;
                handSize += m.handSizeDelta();
                discards += m.discardsDelta();
                hands += m.handsDelta();
                flags.addAll(m.ruleFlags());
                probability *= m.probabilityMultiplier();
                debt += m.debtLimit();
            }
        }
        return new ModifierSummary(handSize, discards, hands, flags, probability, debt);
    }

    /**
     * Money available for shop purchases: the wallet plus any debt allowance.
     */
    public int spendable(int wallet) {
        return SaturatingMath.add(Math.max(0, wallet), Math.max(0, debtLimit));
    }

    public boolean canAfford(int wallet, int cost) {
        return cost <= spendable(wallet);
    }

    public boolean has(RuleFlag flag) {
        return flags.contains(flag);
    }

    /**
     * The hand-classification switches these modifiers turn on.
     */
    public HandRules handRules() {
        return new HandRules(
            has(RuleFlag.FOUR_FINGERS),
            has(RuleFlag.SHORTCUT),
            has(RuleFlag.SMEARED_SUITS),
            has(RuleFlag.ALL_CARDS_SCORE),
            has(RuleFlag.ALL_FACE));
    }
}
