package com.balatro.jokers.catalog;

import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.card.Suit;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.registry.JokerRegistry;

import static com.balatro.jokers.catalog.JokerCatalog.meta;

/**
 * Jokers with bespoke classes: rotating targets, neighbour interaction, copies and
 * self-limiting lifetimes.
 */
final class SpecialJokers {
    static final String SUIT_ARG = "suit";
    static final String RANK_ARG = "rank";
    static final String HAND_ARG = "hand";

    private SpecialJokers() {
        // Utility class - prevent instantiation
    }

    static void register(JokerRegistry.Builder r) {
        JokerMetadata grosMichel = meta("Gros Michel", "+15 Mult. 1 in 6 chance this is destroyed at end of round",
            Rarity.COMMON);
        r.register(JokerId.GROS_MICHEL, grosMichel,
            args -> new ExtinctionJoker(JokerId.GROS_MICHEL, grosMichel, JokerEffect.mult(15), 6));
        JokerMetadata cavendish = meta("Cavendish", "X3 Mult. 1 in 1000 chance this card is destroyed at end of round",
            Rarity.COMMON);
        r.register(JokerId.CAVENDISH, cavendish,
            args -> new ExtinctionJoker(JokerId.CAVENDISH, cavendish, JokerEffect.xMult(3), 1000));

        JokerMetadata toDo = meta("To Do List", "Earn $4 if poker hand is the target hand, hand changes at end of round",
            Rarity.COMMON);
        r.register(JokerId.TO_DO_LIST, toDo,
            args -> new ToDoListJoker(toDo, args.getHandRank(HAND_ARG, HandRank.PAIR)), HAND_ARG);
        JokerMetadata rebate = meta("Mail-In Rebate",
            "Earn $5 for each discarded card of the target rank, rank changes every round", Rarity.COMMON);
        r.register(JokerId.MAIL_IN_REBATE, rebate,
            args -> new MailInRebateJoker(rebate, args.getRank(RANK_ARG, Rank.ACE)), RANK_ARG);

        JokerMetadata dagger = meta("Ceremonial Dagger",
            "When Blind is selected, destroy Joker to the right and permanently add double its sell value to this Mult",
            Rarity.UNCOMMON);
        r.register(JokerId.CEREMONIAL_DAGGER, dagger, args -> new CeremonialDaggerJoker(dagger));
        JokerMetadata loyalty = meta("Loyalty Card", "X4 Mult every 6 hands played", Rarity.UNCOMMON);
        r.register(JokerId.LOYALTY_CARD, loyalty, args -> new LoyaltyCardJoker(loyalty));
        JokerMetadata cardSharp = meta("Card Sharp",
            "X3 Mult if played poker hand has already been played this round", Rarity.UNCOMMON);
        r.register(JokerId.CARD_SHARP, cardSharp, args -> new CardSharpJoker(cardSharp));
        JokerMetadata madness = meta("Madness",
            "When Small Blind or Big Blind is selected, gain X0.5 Mult and destroy a random Joker", Rarity.UNCOMMON);
        r.register(JokerId.MADNESS, madness, args -> new MadnessJoker(madness));
        JokerMetadata vampire = meta("Vampire",
            "This Joker gains X0.1 Mult per scoring Enhanced card played, removes card Enhancement", Rarity.UNCOMMON);
        r.register(JokerId.VAMPIRE, vampire, args -> new VampireJoker(vampire));
        JokerMetadata turtleBean = meta("Turtle Bean", "+5 hand size, reduces by 1 every round", Rarity.UNCOMMON);
        r.register(JokerId.TURTLE_BEAN, turtleBean, args -> new TurtleBeanJoker(turtleBean));
        JokerMetadata seltzer = meta("Seltzer", "Retrigger all cards played for the next 10 hands", Rarity.UNCOMMON);
        r.register(JokerId.SELTZER, seltzer, args -> new SeltzerJoker(seltzer));
        JokerMetadata castle = meta("Castle",
            "This Joker gains +3 Chips per discarded card of the target suit, suit changes every round",
            Rarity.UNCOMMON);
        r.register(JokerId.CASTLE, castle,
            args -> new CastleJoker(castle, args.getSuit(SUIT_ARG, Suit.SPADES)), SUIT_ARG);
        JokerMetadata idol = meta("The Idol",
            "Each played card of the target rank and suit gives X2 Mult when scored, card changes every round",
            Rarity.UNCOMMON);
        r.register(JokerId.THE_IDOL, idol,
            args -> new TheIdolJoker(idol, args.getRank(RANK_ARG, Rank.ACE), args.getSuit(SUIT_ARG, Suit.SPADES)),
            RANK_ARG, SUIT_ARG);

        JokerMetadata ancient = meta("Ancient Joker",
            "Each played card with the target suit gives X1.5 Mult when scored, suit changes at end of round",
            Rarity.RARE);
        r.register(JokerId.ANCIENT_JOKER, ancient,
            args -> new AncientJoker(ancient, args.getSuit(SUIT_ARG, Suit.HEARTS)), SUIT_ARG);
        JokerMetadata blueprint = meta("Blueprint", "Copies ability of Joker to the right", Rarity.RARE);
        r.register(JokerId.BLUEPRINT, blueprint,
            args -> new CopyJoker(JokerId.BLUEPRINT, blueprint, CopyJoker.Target.RIGHT_NEIGHBOUR));
        JokerMetadata brainstorm = meta("Brainstorm", "Copies the ability of leftmost Joker", Rarity.RARE);
        r.register(JokerId.BRAINSTORM, brainstorm,
            args -> new CopyJoker(JokerId.BRAINSTORM, brainstorm, CopyJoker.Target.LEFTMOST));
        JokerMetadata invisible = meta("Invisible Joker",
            "After 2 rounds, sell this card to Duplicate a random Joker", Rarity.RARE);
        r.register(JokerId.INVISIBLE_JOKER, invisible, args -> new InvisibleJoker(invisible));

        JokerMetadata yorick = meta("Yorick", "This Joker gains X1 Mult every 23 cards discarded", Rarity.LEGENDARY);
        r.register(JokerId.YORICK, yorick, args -> new YorickJoker(yorick));
    }
}
