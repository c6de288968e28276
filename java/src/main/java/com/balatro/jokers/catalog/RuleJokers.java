package com.balatro.jokers.catalog;

import com.balatro.jokers.framework.ModifierJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.joker.RuleFlag;
import com.balatro.jokers.registry.JokerRegistry;

import java.util.function.UnaryOperator;

import static com.balatro.jokers.catalog.JokerCatalog.meta;

/**
 * Jokers that only change game rules or resource limits while owned.
 */
final class RuleJokers {

    private RuleJokers() {
        // Utility class - prevent instantiation
    }

    static void register(JokerRegistry.Builder r) {
        rule(r, JokerId.CREDIT_CARD, meta("Credit Card", "Go up to -$20 in debt", Rarity.COMMON),
            b -> b.debtLimit(20));
        rule(r, JokerId.CHAOS_THE_CLOWN, meta("Chaos the Clown", "1 free Reroll per shop", Rarity.COMMON),
            b -> b.flags(RuleFlag.FREE_REROLL));
        rule(r, JokerId.SPLASH, meta("Splash", "Every played card counts in scoring", Rarity.COMMON),
            b -> b.flags(RuleFlag.ALL_CARDS_SCORE));

        rule(r, JokerId.FOUR_FINGERS, meta("Four Fingers", "All Flushes and Straights can be made with 4 cards",
            Rarity.UNCOMMON), b -> b.flags(RuleFlag.FOUR_FINGERS));
        rule(r, JokerId.MIME, meta("Mime", "Retrigger all card held in hand abilities", Rarity.UNCOMMON),
            b -> b.flags(RuleFlag.RETRIGGER_HELD_CARDS));
        rule(r, JokerId.PAREIDOLIA, meta("Pareidolia", "All cards are considered face cards", Rarity.UNCOMMON),
            b -> b.flags(RuleFlag.ALL_FACE));
        rule(r, JokerId.SHORTCUT, meta("Shortcut", "Allows Straights to be made with gaps of 1 rank",
            Rarity.UNCOMMON), b -> b.flags(RuleFlag.SHORTCUT));
        rule(r, JokerId.SMEARED_JOKER, meta("Smeared Joker",
            "Hearts and Diamonds count as the same suit, Spades and Clubs count as the same suit", Rarity.UNCOMMON),
            b -> b.flags(RuleFlag.SMEARED_SUITS));
        rule(r, JokerId.MR_BONES, meta("Mr. Bones",
            "Prevents Death if chips scored are at least 25% of required chips", Rarity.UNCOMMON),
            b -> b.flags(RuleFlag.PREVENT_DEATH));
        rule(r, JokerId.SHOWMAN, meta("Showman", "Joker, Tarot, Planet, and Spectral cards may appear multiple times",
            Rarity.UNCOMMON), b -> b.flags(RuleFlag.ALLOW_DUPLICATES));
        rule(r, JokerId.OOPS_ALL_SIXES, meta("Oops! All 6s", "Doubles all listed probabilities", Rarity.UNCOMMON),
            b -> b.probabilityMultiplier(2.0));
        rule(r, JokerId.ASTRONOMER, meta("Astronomer", "All Planet cards and Celestial Packs in the shop are free",
            Rarity.UNCOMMON), b -> b.flags(RuleFlag.FREE_PLANET_SHOP));

        rule(r, JokerId.CHICOT, meta("Chicot", "Disables effect of every Boss Blind", Rarity.LEGENDARY),
            b -> b.flags(RuleFlag.DISABLE_BOSS_BLIND));
    }

    private static void rule(JokerRegistry.Builder r, JokerId id, JokerMetadata metadata,
                             UnaryOperator<ModifierJoker.Builder> shape) {
        r.register(id, metadata, args -> shape.apply(ModifierJoker.builder(id, metadata)).build());
    }
}
