package com.balatro.jokers.framework.condition;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Enhancement;
import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.card.Suit;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.Stage;
import com.balatro.jokers.joker.RuleFlag;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

/**
 * Primitive conditions and the AND/OR/NOT combinators.
 */
public final class Conditions {

    private Conditions() {
        // Utility class - prevent instantiation
    }

    private record Named(String description, boolean cacheable, ToLongFunction<GameContext> slice,
                         BiPredicate<GameContext, Card> predicate) implements Condition {

        @Override
        public boolean test(GameContext context, Card card) {
            return predicate.test(context, card);
        }

        @Override
        public long fingerprint(GameContext context) {
            return slice.applyAsLong(context);
        }

        @Override
        public boolean isCacheable() {
            return cacheable;
        }

        @Override
        public String describe() {
            return description;
        }

        @Override
        public String toString() {
            return description;
        }
    }

    /**
     * Hand-level condition from a context predicate. It may read anything, so its
     * cached answers are keyed on the whole context.
     */
    public static Condition hand(String description, Predicate<GameContext> predicate) {
        return hand(description, GameContext::fingerprint, predicate);
    }

    /**
     * Hand-level condition that reads only the slice {@code slice} hashes.
     */
    public static Condition hand(String description, ToLongFunction<GameContext> slice,
                                 Predicate<GameContext> predicate) {
        return new Named(description, true, slice, (ctx, card) -> predicate.test(ctx));
    }

    /**
     * Card-level condition; false when no card is being scored.
     */
    public static Condition card(String description, BiPredicate<GameContext, Card> predicate) {
        return card(description, GameContext::fingerprint, predicate);
    }

    /**
     * Card-level condition that reads the card plus the slice {@code slice} hashes.
     */
    public static Condition card(String description, ToLongFunction<GameContext> slice,
                                 BiPredicate<GameContext, Card> predicate) {
        return new Named(description, true, slice, (ctx, card) -> card != null && predicate.test(ctx, card));
    }

    // ==================== SLICES ====================

    private static long nothing(GameContext ctx) {
        return 0L;
    }

    private static long handShape(GameContext ctx) {
        return Objects.hash(ctx.hand().isEmpty(), ctx.handRank(), ctx.hand().getContained());
    }

    private static long scoringFaces(GameContext ctx) {
        long h = allFace(ctx) * 31L + (ctx.hand().isEmpty() ? 1 : 0);
        for (Card c : ctx.scoringCards()) {
            h = h * 31 + (c.isStone() ? -1 : c.rank().ordinal());
        }
        return h;
    }

    private static long scoringSuits(GameContext ctx) {
        long h = smeared(ctx);
        for (Card c : ctx.scoringCards()) {
            h = h * 31 + c.suit().ordinal();
            h = h * 31 + c.enhancement().ordinal();
        }
        return h;
    }

    private static long allFace(GameContext ctx) {
        return ctx.modifiers().has(RuleFlag.ALL_FACE) ? 1 : 0;
    }

    private static long smeared(GameContext ctx) {
        return ctx.modifiers().has(RuleFlag.SMEARED_SUITS) ? 1 : 0;
    }

    // ==================== COMBINATORS ====================

    public static Condition always() {
        return hand("always", Conditions::nothing, ctx -> true);
    }

    public static Condition and(Condition... conditions) {
        List<Condition> parts = List.of(conditions);
        return new Named(join(" AND ", parts), allCacheable(parts), ctx -> combined(parts, ctx), (ctx, card) -> {
            for (Condition c : parts) {
                if (!c.test(ctx, card)) {
                    return false;
                }
            }
            return true;
        });
    }

    public static Condition or(Condition... conditions) {
        List<Condition> parts = List.of(conditions);
        return new Named(join(" OR ", parts), allCacheable(parts), ctx -> combined(parts, ctx), (ctx, card) -> {
            for (Condition c : parts) {
                if (c.test(ctx, card)) {
                    return true;
                }
            }
            return false;
        });
    }

    public static Condition not(Condition condition) {
        return new Named("NOT (" + condition.describe() + ")", condition.isCacheable(), condition::fingerprint,
            (ctx, card) -> !condition.test(ctx, card));
    }

    private static String join(String separator, List<Condition> parts) {
        return parts.stream().map(c -> "(" + c.describe() + ")").collect(Collectors.joining(separator));
    }

    private static long combined(List<Condition> parts, GameContext ctx) {
        long h = 17;
        for (Condition c : parts) {
            h = h * 31 + c.fingerprint(ctx);
        }
        return h;
    }

    private static boolean allCacheable(List<Condition> parts) {
        return parts.stream().allMatch(Condition::isCacheable);
    }

    // ==================== HAND ====================

    public static Condition handContains(HandRank rank) {
        return hand("hand contains " + rank.getDisplayName(), Conditions::handShape, ctx -> ctx.handContains(rank));
    }

    public static Condition handIs(HandRank rank) {
        return hand("hand is " + rank.getDisplayName(), Conditions::handShape, ctx -> !ctx.hand().isEmpty() && ctx.handRank() == rank);
    }

    public static Condition playedAtMost(int cards) {
        return hand("played <= " + cards + " cards", ctx -> ctx.hand().size(), ctx -> !ctx.hand().isEmpty() && ctx.hand().size() <= cards);
    }

    public static Condition playedExactly(int cards) {
        return hand("played == " + cards + " cards", ctx -> ctx.hand().size(), ctx -> ctx.hand().size() == cards);
    }

    public static Condition scoringHasSuit(Suit suit) {
        return hand("scoring has " + suit, Conditions::scoringSuits, ctx -> ctx.scoringCards().stream().anyMatch(c -> ctx.hasSuit(c, suit)));
    }

    public static Condition scoringHasFace() {
        return hand("scoring has face", Conditions::scoringFaces, ctx -> ctx.scoringCards().stream().anyMatch(ctx::isFace));
    }

    public static Condition noFaceScoring() {
        return hand("no face scoring", Conditions::scoringFaces, ctx -> !ctx.hand().isEmpty()
            && ctx.scoringCards().stream().noneMatch(ctx::isFace));
    }

    public static Condition firstHandOfRound() {
        return hand("first hand", ctx -> ctx.run().getHandsPlayedThisRound(), ctx -> ctx.run().getHandsPlayedThisRound() == 0);
    }

    public static Condition finalHandOfRound() {
        return hand("final hand", GameContext::handsRemaining, ctx -> ctx.handsRemaining() == 0);
    }

    /**
     * The current hand is the class played most often before it.
     */
    public static Condition mostPlayedHand() {
        return hand("most played hand",
            ctx -> Objects.hash(handShape(ctx), ctx.run().mostPlayedHand()), ctx -> !ctx.hand().isEmpty()
            && ctx.handRank() == ctx.run().mostPlayedHand());
    }

    public static Condition bossBlind() {
        return hand("boss blind", ctx -> ctx.stage().ordinal(), ctx -> ctx.stage() == Stage.BOSS_BLIND);
    }

    // ==================== RESOURCES ====================

    public static Condition moneyAtLeast(int amount) {
        return hand("money >= " + amount, GameContext::money, ctx -> ctx.money() >= amount);
    }

    public static Condition moneyAtMost(int amount) {
        return hand("money <= " + amount, GameContext::money, ctx -> ctx.money() <= amount);
    }

    public static Condition discardsRemaining(int count) {
        return hand("discards == " + count, GameContext::discardsRemaining, ctx -> ctx.discardsRemaining() == count);
    }

    public static Condition jokerCountAtLeast(int count) {
        return hand("jokers >= " + count, GameContext::jokerCount, ctx -> ctx.jokerCount() >= count);
    }

    public static Condition deckRemainingAtMost(int count) {
        return hand("deck <= " + count, ctx -> ctx.deck().remaining(), ctx -> ctx.deck().remaining() <= count);
    }

    // ==================== CARD ====================

    public static Condition cardSuit(Suit suit) {
        return card("card is " + suit, Conditions::smeared, (ctx, c) -> ctx.hasSuit(c, suit));
    }

    public static Condition cardRank(Rank... ranks) {
        Set<Rank> allowed = EnumSet.copyOf(Arrays.asList(ranks));
        return card("card rank in " + allowed, Conditions::nothing, (ctx, c) -> !c.isStone() && allowed.contains(c.rank()));
    }

    public static Condition cardFace() {
        return card("card is face", Conditions::allFace, (ctx, c) -> ctx.isFace(c));
    }

    public static Condition cardEven() {
        return card("card is even", Conditions::nothing, (ctx, c) -> !c.isStone() && c.rank().isEven());
    }

    public static Condition cardOdd() {
        return card("card is odd", Conditions::nothing, (ctx, c) -> !c.isStone() && c.rank().isOdd());
    }

    public static Condition cardFibonacci() {
        return card("card is fibonacci", Conditions::nothing, (ctx, c) -> !c.isStone() && c.rank().isFibonacci());
    }

    public static Condition cardEnhancement(Enhancement enhancement) {
        return card("card is " + enhancement, Conditions::nothing, (ctx, c) -> c.enhancement() == enhancement);
    }

    /**
     * The card is the first scoring card of the hand (by identity).
     */
    public static Condition firstScoringCard() {
        return new Named("first scoring card", false, GameContext::fingerprint,
            (ctx, c) -> c != null && !ctx.scoringCards().isEmpty() && ctx.scoringCards().get(0) == c);
    }

    /**
     * The card is the first face card among the scoring cards (by identity).
     */
    public static Condition firstScoringFace() {
        return new Named("first scoring face", false, GameContext::fingerprint, (ctx, c) -> {
            if (c == null) {
                return false;
            }
            for (Card scoring : ctx.scoringCards()) {
                if (ctx.isFace(scoring)) {
                    return scoring == c;
                }
            }
            return false;
        });
    }

    // ==================== RANDOM ====================

    /**
     * Listed "numerator in denominator" chance, scaled by probability modifiers. Never cached.
     */
    public static Condition chance(int numerator, int denominator) {
        return new Named(numerator + " in " + denominator, false, GameContext::fingerprint,
            (ctx, card) -> ctx.chance(numerator, denominator));
    }
}
