package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Enhancement;
import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.framework.ScalingJoker;
import com.balatro.jokers.framework.ScalingJoker.Event;
import com.balatro.jokers.framework.ScalingJoker.Output;
import com.balatro.jokers.framework.condition.Conditions;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.registry.JokerRegistry;

import java.util.function.Consumer;

import static com.balatro.jokers.catalog.JokerCatalog.meta;

/**
 * Jokers with one value that accumulates over the run.
 * Every entry accepts a {@code value} argument that overrides the starting value.
 */
final class ScalingJokers {
    static final String VALUE_ARG = "value";

    private ScalingJokers() {
        // Utility class - prevent instantiation
    }

    static void register(JokerRegistry.Builder r) {
        scaling(r, JokerId.RIDE_THE_BUS, meta("Ride the Bus",
            "This Joker gains +1 Mult per consecutive hand played without a scoring face card", Rarity.COMMON),
            b -> b.output(Output.MULT, 0)
                .reset(Event.HAND_PLAYED, Conditions.scoringHasFace())
                .add(Event.HAND_PLAYED, Conditions.noFaceScoring(), 1));
        scaling(r, JokerId.RUNNER, meta("Runner", "Gains +15 Chips if played hand contains a Straight", Rarity.COMMON),
            b -> b.output(Output.CHIPS, 0)
                .add(Event.HAND_PLAYED, Conditions.handContains(HandRank.STRAIGHT), 15));
        scaling(r, JokerId.ICE_CREAM, meta("Ice Cream", "+100 Chips. -5 Chips for every hand played", Rarity.COMMON),
            b -> b.output(Output.CHIPS, 100)
                .add(Event.HAND_SCORED, -5)
                .floor(0)
                .destroyAtOrBelow(0));
        scaling(r, JokerId.GREEN_JOKER, meta("Green Joker", "+1 Mult per hand played. -1 Mult per discard",
            Rarity.COMMON), b -> b.output(Output.MULT, 0)
                .add(Event.HAND_PLAYED, 1)
                .add(Event.DISCARD, -1)
                .floor(0));
        scaling(r, JokerId.RED_CARD, meta("Red Card", "This Joker gains +3 Mult when any Booster Pack is skipped",
            Rarity.COMMON), b -> b.output(Output.MULT, 0).add(Event.PACK_SKIPPED, 3));
        scaling(r, JokerId.SQUARE_JOKER, meta("Square Joker",
            "This Joker gains +4 Chips if played hand has exactly 4 cards", Rarity.COMMON),
            b -> b.output(Output.CHIPS, 0).add(Event.HAND_PLAYED, Conditions.playedExactly(4), 4));
        scaling(r, JokerId.FORTUNE_TELLER, meta("Fortune Teller", "+1 Mult per Tarot card used this run",
            Rarity.COMMON), b -> b.output(Output.MULT, 0).add(Event.TAROT_USED, 1));
        scaling(r, JokerId.POPCORN, meta("Popcorn", "+20 Mult. -4 Mult per round played", Rarity.COMMON),
            b -> b.output(Output.MULT, 20)
                .add(Event.ROUND_END, -4)
                .floor(0)
                .destroyAtOrBelow(0));

        scaling(r, JokerId.CONSTELLATION, meta("Constellation",
            "This Joker gains X0.1 Mult every time a Planet card is used", Rarity.UNCOMMON),
            b -> b.output(Output.X_MULT, 1).add(Event.PLANET_USED, 0.1));
        scaling(r, JokerId.HOLOGRAM, meta("Hologram",
            "This Joker gains X0.25 Mult every time a playing card is added to your deck", Rarity.UNCOMMON),
            b -> b.output(Output.X_MULT, 1).add(Event.CARD_ADDED, 0.25));
        scaling(r, JokerId.ROCKET, meta("Rocket",
            "Earn $1 at end of round. Payout increases by $2 when Boss Blind is defeated", Rarity.UNCOMMON),
            b -> b.output(Output.MONEY, 1).add(Event.BOSS_DEFEATED, 2));
        scaling(r, JokerId.LUCKY_CAT, meta("Lucky Cat",
            "This Joker gains X0.25 Mult every time a Lucky card successfully triggers", Rarity.UNCOMMON),
            b -> b.output(Output.X_MULT, 1)
                .add(Event.CARD_SCORED, Conditions.cardEnhancement(Enhancement.LUCKY), 0.25));
        scaling(r, JokerId.FLASH_CARD, meta("Flash Card", "This Joker gains +2 Mult per reroll in the shop",
            Rarity.UNCOMMON), b -> b.output(Output.MULT, 0).add(Event.SHOP_REROLLED, 2));
        scaling(r, JokerId.SPARE_TROUSERS, meta("Spare Trousers",
            "This Joker gains +2 Mult if played hand contains a Two Pair", Rarity.UNCOMMON),
            b -> b.output(Output.MULT, 0).add(Event.HAND_PLAYED, Conditions.handContains(HandRank.TWO_PAIR), 2));
        scaling(r, JokerId.RAMEN, meta("Ramen", "X2 Mult, loses X0.01 Mult per card discarded", Rarity.UNCOMMON),
            b -> b.output(Output.X_MULT, 2)
                .add(Event.CARD_DISCARDED, -0.01)
                .destroyAtOrBelow(1));
        scaling(r, JokerId.THROWBACK, meta("Throwback", "X0.25 Mult for each Blind skipped this run",
            Rarity.UNCOMMON), b -> b.output(Output.X_MULT, 1).add(Event.BLIND_SKIPPED, 0.25));
        scaling(r, JokerId.GLASS_JOKER, meta("Glass Joker",
            "This Joker gains X0.75 Mult for every Glass Card that is destroyed", Rarity.UNCOMMON),
            b -> b.output(Output.X_MULT, 1)
                .add(Event.CARD_DESTROYED, Conditions.cardEnhancement(Enhancement.GLASS), 0.75));
        scaling(r, JokerId.SATELLITE, meta("Satellite",
            "Earn $1 at end of round per Planet card used this run", Rarity.UNCOMMON),
            b -> b.output(Output.MONEY, 0).add(Event.PLANET_USED, 1));

        scaling(r, JokerId.OBELISK, meta("Obelisk",
            "This Joker gains X0.2 Mult per consecutive hand played without playing your most played poker hand",
            Rarity.RARE), b -> b.output(Output.X_MULT, 1)
                .reset(Event.HAND_PLAYED, Conditions.mostPlayedHand())
                .add(Event.HAND_PLAYED, Conditions.not(Conditions.mostPlayedHand()), 0.2));
        scaling(r, JokerId.CAMPFIRE, meta("Campfire",
            "This Joker gains X0.25 Mult for each card sold, resets when Boss Blind is defeated", Rarity.RARE),
            b -> b.output(Output.X_MULT, 1)
                .add(Event.JOKER_SOLD, 0.25)
                .reset(Event.BOSS_DEFEATED));
        scaling(r, JokerId.WEE_JOKER, meta("Wee Joker", "This Joker gains +8 Chips when each played 2 is scored",
            Rarity.RARE), b -> b.output(Output.CHIPS, 0)
                .add(Event.CARD_SCORED, Conditions.cardRank(Rank.TWO), 8));
        scaling(r, JokerId.HIT_THE_ROAD, meta("Hit the Road",
            "This Joker gains X0.5 Mult for every Jack discarded this round", Rarity.RARE),
            b -> b.output(Output.X_MULT, 1)
                .add(Event.CARD_DISCARDED, Conditions.cardRank(Rank.JACK), 0.5)
                .reset(Event.ROUND_END));

        scaling(r, JokerId.CANIO, meta("Canio", "This Joker gains X1 Mult when a face card is destroyed",
            Rarity.LEGENDARY), b -> b.output(Output.X_MULT, 1)
                .add(Event.CARD_DESTROYED, Conditions.cardFace(), 1));
    }

    private static void scaling(JokerRegistry.Builder r, JokerId id, JokerMetadata metadata,
                                Consumer<ScalingJoker.Builder> shape) {
        r.register(id, metadata, args -> {
            ScalingJoker.Builder builder = ScalingJoker.builder(id, metadata);
            shape.accept(builder);
            if (args.has(VALUE_ARG)) {
                builder.startAt(args.getDouble(VALUE_ARG, 0));
            }
            return builder.build();
        }, VALUE_ARG);
    }
}
