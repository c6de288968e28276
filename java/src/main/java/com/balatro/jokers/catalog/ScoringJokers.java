package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Enhancement;
import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.card.Suit;
import com.balatro.jokers.effect.CardTransform;
import com.balatro.jokers.effect.ConsumableKind;
import com.balatro.jokers.effect.ConsumableRequest;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.framework.ConditionalJoker;
import com.balatro.jokers.framework.EffectFormula;
import com.balatro.jokers.framework.StaticJoker;
import com.balatro.jokers.framework.condition.Condition;
import com.balatro.jokers.framework.condition.Conditions;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.registry.JokerRegistry;

import static com.balatro.jokers.catalog.JokerCatalog.meta;
import static com.balatro.jokers.framework.condition.Conditions.and;
import static com.balatro.jokers.framework.condition.Conditions.cardRank;
import static com.balatro.jokers.framework.condition.Conditions.cardSuit;
import static com.balatro.jokers.framework.condition.Conditions.handContains;

/**
 * Stateless scoring jokers built on the static and conditional frameworks.
 */
final class ScoringJokers {

    private ScoringJokers() {
        // Utility class - prevent instantiation
    }

    static void register(JokerRegistry.Builder registry) {
        registerCommon(registry);
        registerUncommon(registry);
        registerRare(registry);

        perCard(registry, JokerId.TRIBOULET, meta("Triboulet", "Played Kings and Queens each give X2 Mult when scored",
            Rarity.LEGENDARY), cardRank(Rank.KING, Rank.QUEEN), JokerEffect.xMult(2));
    }

    // ==================== COMMON ====================

    private static void registerCommon(JokerRegistry.Builder r) {
        flat(r, JokerId.JOKER, meta("Joker", "+4 Mult", Rarity.COMMON), JokerEffect.mult(4));

        perCard(r, JokerId.GREEDY_JOKER, meta("Greedy Joker", "Played cards with Diamond suit give +3 Mult when scored",
            Rarity.COMMON), cardSuit(Suit.DIAMONDS), JokerEffect.mult(3));
        perCard(r, JokerId.LUSTY_JOKER, meta("Lusty Joker", "Played cards with Heart suit give +3 Mult when scored",
            Rarity.COMMON), cardSuit(Suit.HEARTS), JokerEffect.mult(3));
        perCard(r, JokerId.WRATHFUL_JOKER, meta("Wrathful Joker", "Played cards with Spade suit give +3 Mult when scored",
            Rarity.COMMON), cardSuit(Suit.SPADES), JokerEffect.mult(3));
        perCard(r, JokerId.GLUTTONOUS_JOKER, meta("Gluttonous Joker", "Played cards with Club suit give +3 Mult when scored",
            Rarity.COMMON), cardSuit(Suit.CLUBS), JokerEffect.mult(3));

        whenHand(r, JokerId.JOLLY_JOKER, meta("Jolly Joker", "+8 Mult if played hand contains a Pair", Rarity.COMMON),
            handContains(HandRank.PAIR), JokerEffect.mult(8));
        whenHand(r, JokerId.ZANY_JOKER, meta("Zany Joker", "+12 Mult if played hand contains a Three of a Kind",
            Rarity.COMMON), handContains(HandRank.THREE_OF_A_KIND), JokerEffect.mult(12));
        whenHand(r, JokerId.MAD_JOKER, meta("Mad Joker", "+10 Mult if played hand contains a Two Pair", Rarity.COMMON),
            handContains(HandRank.TWO_PAIR), JokerEffect.mult(10));
        whenHand(r, JokerId.CRAZY_JOKER, meta("Crazy Joker", "+12 Mult if played hand contains a Straight",
            Rarity.COMMON), handContains(HandRank.STRAIGHT), JokerEffect.mult(12));
        whenHand(r, JokerId.DROLL_JOKER, meta("Droll Joker", "+10 Mult if played hand contains a Flush", Rarity.COMMON),
            handContains(HandRank.FLUSH), JokerEffect.mult(10));
        whenHand(r, JokerId.SLY_JOKER, meta("Sly Joker", "+50 Chips if played hand contains a Pair", Rarity.COMMON),
            handContains(HandRank.PAIR), JokerEffect.chips(50));
        whenHand(r, JokerId.WILY_JOKER, meta("Wily Joker", "+100 Chips if played hand contains a Three of a Kind",
            Rarity.COMMON), handContains(HandRank.THREE_OF_A_KIND), JokerEffect.chips(100));
        whenHand(r, JokerId.CLEVER_JOKER, meta("Clever Joker", "+80 Chips if played hand contains a Two Pair",
            Rarity.COMMON), handContains(HandRank.TWO_PAIR), JokerEffect.chips(80));
        whenHand(r, JokerId.DEVIOUS_JOKER, meta("Devious Joker", "+100 Chips if played hand contains a Straight",
            Rarity.COMMON), handContains(HandRank.STRAIGHT), JokerEffect.chips(100));
        whenHand(r, JokerId.CRAFTY_JOKER, meta("Crafty Joker", "+80 Chips if played hand contains a Flush",
            Rarity.COMMON), handContains(HandRank.FLUSH), JokerEffect.chips(80));

        whenHand(r, JokerId.HALF_JOKER, meta("Half Joker", "+20 Mult if played hand contains 3 or fewer cards",
            Rarity.COMMON), Conditions.playedAtMost(3), JokerEffect.mult(20));
        perHand(r, JokerId.BANNER, meta("Banner", "+30 Chips for each remaining discard", Rarity.COMMON),
            (ctx, card) -> JokerEffect.chips(30 * Math.max(0, ctx.discardsRemaining())));
        whenHand(r, JokerId.MYSTIC_SUMMIT, meta("Mystic Summit", "+15 Mult when 0 discards remaining", Rarity.COMMON),
            Conditions.discardsRemaining(0), JokerEffect.mult(15));
        perCard(r, JokerId.EIGHT_BALL, meta("8 Ball", "1 in 4 chance for each played 8 to create a Tarot card when scored",
            Rarity.COMMON), and(cardRank(Rank.EIGHT), Conditions.chance(1, 4)), tarot());
        perHand(r, JokerId.MISPRINT, meta("Misprint", "+0-23 Mult", Rarity.COMMON),
            (ctx, card) -> JokerEffect.mult(ctx.rng().nextIntInclusive(0, 23)));
        perHand(r, JokerId.RAISED_FIST, meta("Raised Fist", "Adds double the rank of lowest ranked card held in hand to Mult",
            Rarity.COMMON), (ctx, card) -> {
                Card lowest = null;
                for (Card held : ctx.heldCards()) {
                    if (!held.isStone() && (lowest == null || held.rank().getValue() <= lowest.rank().getValue())) {
                        lowest = held;
                    }
                }
                return lowest == null ? JokerEffect.none() : JokerEffect.mult(2 * lowest.rank().getChips());
            });
        perHand(r, JokerId.ABSTRACT_JOKER, meta("Abstract Joker", "+3 Mult for each Joker card", Rarity.COMMON),
            (ctx, card) -> JokerEffect.mult(3 * ctx.jokerCount()));
        perCard(r, JokerId.EVEN_STEVEN, meta("Even Steven", "Played cards with even rank give +4 Mult when scored",
            Rarity.COMMON), Conditions.cardEven(), JokerEffect.mult(4));
        perCard(r, JokerId.ODD_TODD, meta("Odd Todd", "Played cards with odd rank give +31 Chips when scored",
            Rarity.COMMON), Conditions.cardOdd(), JokerEffect.chips(31));
        perCard(r, JokerId.SCHOLAR, meta("Scholar", "Played Aces give +20 Chips and +4 Mult when scored", Rarity.COMMON),
            cardRank(Rank.ACE), JokerEffect.builder().chips(20).mult(4).build());
        perHand(r, JokerId.SUPERNOVA, meta("Supernova",
            "Adds the number of times poker hand has been played this run to Mult", Rarity.COMMON),
            (ctx, card) -> ctx.hand().isEmpty()
                ? JokerEffect.none()
                : JokerEffect.mult(ctx.run().timesPlayed(ctx.handRank()) + 1));
        perHand(r, JokerId.BLUE_JOKER, meta("Blue Joker", "+2 Chips for each remaining card in deck", Rarity.COMMON),
            (ctx, card) -> JokerEffect.chips(2 * Math.max(0, ctx.deck().remaining())));
        whenHand(r, JokerId.SUPERPOSITION, meta("Superposition",
            "Create a Tarot card if poker hand contains an Ace and a Straight", Rarity.COMMON),
            and(handContains(HandRank.STRAIGHT), Conditions.hand("scoring has ace",
                ctx -> ctx.scoringCards().stream().anyMatch(c -> !c.isStone() && c.rank() == Rank.ACE))),
            tarot());
        perCard(r, JokerId.PHOTOGRAPH, meta("Photograph", "First played face card gives X2 Mult when scored",
            Rarity.COMMON), Conditions.firstScoringFace(), JokerEffect.xMult(2));
        perHand(r, JokerId.RESERVED_PARKING, meta("Reserved Parking",
            "Each face card held in hand has a 1 in 2 chance to give $1", Rarity.COMMON), (ctx, card) -> {
                int money = 0;
                for (Card held : ctx.heldCards()) {
                    if (ctx.isFace(held) && ctx.chance(1, 2)) {
                        money++;
                    }
                }
                return JokerEffect.money(money);
            });
        perCard(r, JokerId.WALKIE_TALKIE, meta("Walkie Talkie", "Each played 10 or 4 gives +10 Chips and +4 Mult when scored",
            Rarity.COMMON), cardRank(Rank.TEN, Rank.FOUR), JokerEffect.builder().chips(10).mult(4).build());
        perCard(r, JokerId.SMILEY_FACE, meta("Smiley Face", "Played face cards give +5 Mult when scored", Rarity.COMMON),
            Conditions.cardFace(), JokerEffect.mult(5));
        perCard(r, JokerId.GOLDEN_TICKET, meta("Golden Ticket", "Played Gold cards earn $4 when scored", Rarity.COMMON),
            Conditions.cardEnhancement(Enhancement.GOLD), JokerEffect.money(4));
        perHand(r, JokerId.SWASHBUCKLER, meta("Swashbuckler", "Adds the sell value of all other owned Jokers to Mult",
            Rarity.COMMON), (ctx, card) -> {
                int total = 0;
                for (Joker sibling : ctx.jokers()) {
                    if (sibling.id() != JokerId.SWASHBUCKLER && sibling instanceof JokerIdentity) {
                        total += ((JokerIdentity) sibling).metadata().baseSellValue();
                    }
                }
                return JokerEffect.mult(total);
            });
        perCard(r, JokerId.HANGING_CHAD, meta("Hanging Chad", "Retrigger first played card used in scoring 2 additional times",
            Rarity.COMMON), Conditions.firstScoringCard(), JokerEffect.retrigger(2));
        perHand(r, JokerId.SHOOT_THE_MOON, meta("Shoot the Moon", "+13 Mult for each Queen held in hand", Rarity.COMMON),
            (ctx, card) -> JokerEffect.mult(13 * countHeld(ctx.heldCards(), Rank.QUEEN)));
    }

    // ==================== UNCOMMON ====================

    private static void registerUncommon(JokerRegistry.Builder r) {
        perHand(r, JokerId.JOKER_STENCIL, meta("Joker Stencil", "X1 Mult for each empty Joker slot. Joker Stencil included",
            Rarity.UNCOMMON), (ctx, card) -> {
                int empty = ctx.run().getJokerSlots() - ctx.jokerCount() + 1;
                return JokerEffect.xMult(Math.max(1, empty));
            });
        perCard(r, JokerId.DUSK, meta("Dusk", "Retrigger all played cards in final hand of round", Rarity.UNCOMMON),
            Conditions.finalHandOfRound(), JokerEffect.retrigger(1));
        perCard(r, JokerId.FIBONACCI, meta("Fibonacci", "Each played Ace, 2, 3, 5, or 8 gives +8 Mult when scored",
            Rarity.UNCOMMON), Conditions.cardFibonacci(), JokerEffect.mult(8));
        perHand(r, JokerId.STEEL_JOKER, meta("Steel Joker", "Gives X0.2 Mult for each Steel Card in your full deck",
            Rarity.UNCOMMON), (ctx, card) -> JokerEffect.xMult(1.0 + 0.2 * ctx.deck().count(Enhancement.STEEL)));
        perCard(r, JokerId.HACK, meta("Hack", "Retrigger each played 2, 3, 4, or 5", Rarity.UNCOMMON),
            cardRank(Rank.TWO, Rank.THREE, Rank.FOUR, Rank.FIVE), JokerEffect.retrigger(1));
        whenHand(r, JokerId.BLACKBOARD, meta("Blackboard", "X3 Mult if all cards held in hand are Spades or Clubs",
            Rarity.UNCOMMON), Conditions.hand("held all spades or clubs", ctx -> ctx.heldCards().stream()
                .allMatch(c -> ctx.hasSuit(c, Suit.SPADES) || ctx.hasSuit(c, Suit.CLUBS))),
            JokerEffect.xMult(3));
        perHand(r, JokerId.SIXTH_SENSE, meta("Sixth Sense",
            "If first hand of round is a single 6, destroy it and create a Spectral card", Rarity.UNCOMMON),
            (ctx, card) -> {
                if (ctx.run().getHandsPlayedThisRound() != 0 || ctx.playedCards().size() != 1) {
                    return JokerEffect.none();
                }
                Card six = ctx.playedCards().get(0);
                if (six.isStone() || six.rank() != Rank.SIX) {
                    return JokerEffect.none();
                }
                return JokerEffect.builder()
                    .transform(CardTransform.destroy(six))
                    .consumable(ConsumableRequest.random(ConsumableKind.SPECTRAL))
                    .build();
            });
        perCard(r, JokerId.HIKER, meta("Hiker", "Every played card permanently gains +5 Chips when scored",
            Rarity.UNCOMMON), Conditions.always(),
            (ctx, card) -> JokerEffect.builder().transform(CardTransform.addChips(card, 5)).build());
        whenHand(r, JokerId.SEANCE, meta("Seance", "If poker hand is a Straight Flush, create a random Spectral card",
            Rarity.UNCOMMON), handContains(HandRank.STRAIGHT_FLUSH),
            JokerEffect.builder().consumable(ConsumableRequest.random(ConsumableKind.SPECTRAL)).build());
        perHand(r, JokerId.MIDAS_MASK, meta("Midas Mask", "All played face cards become Gold cards when scored",
            Rarity.UNCOMMON), (ctx, card) -> {
                JokerEffect.Builder b = JokerEffect.builder();
                for (Card scoring : ctx.scoringCards()) {
                    if (ctx.isFace(scoring)) {
                        b.transform(CardTransform.enhance(scoring, Enhancement.GOLD));
                    }
                }
                return b.build();
            });
        perHand(r, JokerId.EROSION, meta("Erosion", "+4 Mult for each card below 52 in your full deck",
            Rarity.UNCOMMON), (ctx, card) -> JokerEffect.mult(4 * Math.max(0, 52 - ctx.deck().fullSize())));
        perHand(r, JokerId.STONE_JOKER, meta("Stone Joker", "Gives +25 Chips for each Stone Card in your full deck",
            Rarity.UNCOMMON), (ctx, card) -> JokerEffect.chips(25 * ctx.deck().count(Enhancement.STONE)));
        perHand(r, JokerId.BULL, meta("Bull", "+2 Chips for each $1 you have", Rarity.UNCOMMON),
            (ctx, card) -> JokerEffect.chips(2 * Math.max(0, ctx.money())));
        whenHand(r, JokerId.ACROBAT, meta("Acrobat", "X3 Mult on final hand of round", Rarity.UNCOMMON),
            Conditions.finalHandOfRound(), JokerEffect.xMult(3));
        perCard(r, JokerId.SOCK_AND_BUSKIN, meta("Sock and Buskin", "Retrigger all played face cards", Rarity.UNCOMMON),
            Conditions.cardFace(), JokerEffect.retrigger(1));
        perCard(r, JokerId.ROUGH_GEM, meta("Rough Gem", "Played cards with Diamond suit earn $1 when scored",
            Rarity.UNCOMMON), cardSuit(Suit.DIAMONDS), JokerEffect.money(1));
        perCard(r, JokerId.BLOODSTONE, meta("Bloodstone",
            "1 in 2 chance for played cards with Heart suit to give X1.5 Mult when scored", Rarity.UNCOMMON),
            and(cardSuit(Suit.HEARTS), Conditions.chance(1, 2)), JokerEffect.xMult(1.5));
        perCard(r, JokerId.ARROWHEAD, meta("Arrowhead", "Played cards with Spade suit give +50 Chips when scored",
            Rarity.UNCOMMON), cardSuit(Suit.SPADES), JokerEffect.chips(50));
        perCard(r, JokerId.ONYX_AGATE, meta("Onyx Agate", "Played cards with Club suit give +7 Mult when scored",
            Rarity.UNCOMMON), cardSuit(Suit.CLUBS), JokerEffect.mult(7));
        whenHand(r, JokerId.FLOWER_POT, meta("Flower Pot",
            "X3 Mult if poker hand contains a Diamond, Club, Heart, and Spade card", Rarity.UNCOMMON),
            and(Conditions.scoringHasSuit(Suit.DIAMONDS), Conditions.scoringHasSuit(Suit.CLUBS),
                Conditions.scoringHasSuit(Suit.HEARTS), Conditions.scoringHasSuit(Suit.SPADES)),
            JokerEffect.xMult(3));
        whenHand(r, JokerId.SEEING_DOUBLE, meta("Seeing Double",
            "X2 Mult if played hand has a scoring Club card and a scoring card of any other suit", Rarity.UNCOMMON),
            Conditions.hand("club and another suit scoring", ctx -> {
                boolean club = false;
                boolean other = false;
                for (Card c : ctx.scoringCards()) {
                    if (!club && ctx.hasSuit(c, Suit.CLUBS)) {
                        club = true;
                    } else if (ctx.hasSuit(c, Suit.HEARTS) || ctx.hasSuit(c, Suit.DIAMONDS)
                            || ctx.hasSuit(c, Suit.SPADES)) {
                        other = true;
                    }
                }
                return club && other;
            }), JokerEffect.xMult(2));
        whenHand(r, JokerId.MATADOR, meta("Matador", "Earn $8 if played hand triggers the Boss Blind ability",
            Rarity.UNCOMMON), Conditions.bossBlind(), JokerEffect.money(8));
        perHand(r, JokerId.BOOTSTRAPS, meta("Bootstraps", "+2 Mult for every $5 you have", Rarity.UNCOMMON),
            (ctx, card) -> JokerEffect.mult(2 * (Math.max(0, ctx.money()) / 5)));
        perHand(r, JokerId.SPACE_JOKER, meta("Space Joker", "1 in 4 chance to upgrade level of played poker hand",
            Rarity.UNCOMMON), (ctx, card) -> !ctx.hand().isEmpty() && ctx.chance(1, 4)
                ? JokerEffect.builder().levelUp(ctx.handRank()).build()
                : JokerEffect.none());
    }

    // ==================== RARE ====================

    private static void registerRare(JokerRegistry.Builder r) {
        perHand(r, JokerId.DNA, meta("DNA", "If first hand of round has only 1 card, add a permanent copy to deck",
            Rarity.RARE), (ctx, card) -> ctx.run().getHandsPlayedThisRound() == 0 && ctx.playedCards().size() == 1
                ? JokerEffect.builder().transform(CardTransform.duplicate(ctx.playedCards().get(0))).build()
                : JokerEffect.none());
        whenHand(r, JokerId.VAGABOND, meta("Vagabond", "Create a Tarot card if hand is played with $4 or less",
            Rarity.RARE), Conditions.moneyAtMost(4), tarot());
        perHand(r, JokerId.BARON, meta("Baron", "Each King held in hand gives X1.5 Mult", Rarity.RARE),
            (ctx, card) -> JokerEffect.xMult(Math.pow(1.5, countHeld(ctx.heldCards(), Rank.KING))));
        perHand(r, JokerId.BASEBALL_CARD, meta("Baseball Card", "Uncommon Jokers each give X1.5 Mult", Rarity.RARE),
            (ctx, card) -> {
                int uncommon = 0;
                for (Joker sibling : ctx.jokers()) {
                    if (sibling instanceof JokerIdentity && ((JokerIdentity) sibling).rarity() == Rarity.UNCOMMON) {
                        uncommon++;
                    }
                }
                return JokerEffect.xMult(Math.pow(1.5, uncommon));
            });
        whenHand(r, JokerId.THE_DUO, meta("The Duo", "X2 Mult if played hand contains a Pair", Rarity.RARE),
            handContains(HandRank.PAIR), JokerEffect.xMult(2));
        whenHand(r, JokerId.THE_TRIO, meta("The Trio", "X3 Mult if played hand contains a Three of a Kind", Rarity.RARE),
            handContains(HandRank.THREE_OF_A_KIND), JokerEffect.xMult(3));
        whenHand(r, JokerId.THE_FAMILY, meta("The Family", "X4 Mult if played hand contains a Four of a Kind",
            Rarity.RARE), handContains(HandRank.FOUR_OF_A_KIND), JokerEffect.xMult(4));
        whenHand(r, JokerId.THE_ORDER, meta("The Order", "X3 Mult if played hand contains a Straight", Rarity.RARE),
            handContains(HandRank.STRAIGHT), JokerEffect.xMult(3));
        whenHand(r, JokerId.THE_TRIBE, meta("The Tribe", "X2 Mult if played hand contains a Flush", Rarity.RARE),
            handContains(HandRank.FLUSH), JokerEffect.xMult(2));
        whenHand(r, JokerId.DRIVERS_LICENSE, meta("Driver's License",
            "X3 Mult if you have at least 16 Enhanced cards in your full deck", Rarity.RARE),
            Conditions.hand("16+ enhanced cards", ctx -> ctx.deck().enhancedCount() >= 16), JokerEffect.xMult(3));
    }

    // ==================== HELPERS ====================

    private static void flat(JokerRegistry.Builder r, JokerId id, JokerMetadata metadata, JokerEffect effect) {
        r.register(id, metadata, args -> StaticJoker.builder(id, metadata).perHand().effect(effect).build());
    }

    private static void perHand(JokerRegistry.Builder r, JokerId id, JokerMetadata metadata, EffectFormula formula) {
        r.register(id, metadata, args -> StaticJoker.builder(id, metadata).perHand().formula(formula).build());
    }

    private static void perCard(JokerRegistry.Builder r, JokerId id, JokerMetadata metadata, Condition filter,
                                JokerEffect effect) {
        r.register(id, metadata, args -> ConditionalJoker.builder(id, metadata).onCard(filter, effect).build());
    }

    private static void perCard(JokerRegistry.Builder r, JokerId id, JokerMetadata metadata, Condition filter,
                                EffectFormula formula) {
        r.register(id, metadata, args -> StaticJoker.builder(id, metadata).perCard().when(filter).formula(formula).build());
    }

    private static void whenHand(JokerRegistry.Builder r, JokerId id, JokerMetadata metadata, Condition condition,
                                 JokerEffect effect) {
        r.register(id, metadata, args -> ConditionalJoker.builder(id, metadata).onHand(condition, effect).build());
    }

    private static JokerEffect tarot() {
        return JokerEffect.builder().consumable(ConsumableRequest.random(ConsumableKind.TAROT)).build();
    }

    private static int countHeld(Iterable<Card> held, Rank rank) {
        int count = 0;
        for (Card card : held) {
            if (!card.isStone() && card.rank() == rank) {
                count++;
            }
        }
        return count;
    }
}
