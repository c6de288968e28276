package com.balatro.jokers.compat;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.Rarity;

import java.util.List;

/**
 * Jokers still written against {@link LegacyJoker}.
 */
public final class LegacyJokers {

    private LegacyJokers() {
        // Utility class - prevent instantiation
    }

    abstract static class Base implements LegacyJoker {
        private final JokerId id;
        private final String name;
        private final String description;
        private final Rarity rarity;

        Base(JokerId id, String name, String description, Rarity rarity) {
            this.id = id;
            this.name = name;
            this.description = description;
            this.rarity = rarity;
        }

        @Override
        public JokerId id() {
            return id;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String description() {
            return description;
        }

        @Override
        public Rarity rarity() {
            return rarity;
        }

        @Override
        public int cost() {
            return rarity.getDefaultCost();
        }
    }

    public static final class ScaryFace extends Base {
        public ScaryFace() {
            super(JokerId.SCARY_FACE, "Scary Face", "Played face cards give +30 Chips when scored", Rarity.COMMON);
        }

        @Override
        public JokerEffect onCardScored(GameContext context, Card card) {
            return context.isFace(card) ? JokerEffect.chips(30) : JokerEffect.none();
        }
    }

    public static final class BusinessCard extends Base {
        public BusinessCard() {
            super(JokerId.BUSINESS_CARD, "Business Card",
                "Played face cards have a 1 in 2 chance to give $2 when scored", Rarity.COMMON);
        }

        @Override
        public JokerEffect onCardScored(GameContext context, Card card) {
            if (context.isFace(card) && context.chance(1, 2)) {
                return JokerEffect.money(2);
            }
            return JokerEffect.none();
        }
    }

    public static final class DelayedGratification extends Base {
        public DelayedGratification() {
            super(JokerId.DELAYED_GRATIFICATION, "Delayed Gratification",
                "Earn $2 per discard if no discards are used by end of the round", Rarity.COMMON);
        }

        @Override
        public JokerEffect onRoundEnd(GameContext context) {
            if (context.run().getDiscardsUsedThisRound() == 0 && context.discardsRemaining() > 0) {
                return JokerEffect.money(2 * context.discardsRemaining());
            }
            return JokerEffect.none();
        }
    }

    public static final class Egg extends Base {
        public Egg() {
            super(JokerId.EGG, "Egg", "Gains $3 of sell value at end of round", Rarity.COMMON);
        }

        @Override
        public JokerEffect onRoundEnd(GameContext context) {
            return JokerEffect.builder().sellValueIncrease(3).build();
        }
    }

    public static final class FacelessJoker extends Base {
        public FacelessJoker() {
            super(JokerId.FACELESS_JOKER, "Faceless Joker",
                "Earn $5 if 3 or more face cards are discarded at the same time", Rarity.COMMON);
        }

        @Override
        public JokerEffect onDiscard(GameContext context, List<Card> discarded) {
            long faces = discarded.stream().filter(context::isFace).count();
            return faces >= 3 ? JokerEffect.money(5) : JokerEffect.none();
        }
    }

    public static final class Juggler extends Base {
        public Juggler() {
            super(JokerId.JUGGLER, "Juggler", "+1 hand size", Rarity.COMMON);
        }

        @Override
        public int handSizeBonus() {
            return 1;
        }
    }

    public static final class Drunkard extends Base {
        public Drunkard() {
            super(JokerId.DRUNKARD, "Drunkard", "+1 discard each round", Rarity.COMMON);
        }

        @Override
        public int discardBonus() {
            return 1;
        }
    }

    public static final class GoldenJoker extends Base {
        public GoldenJoker() {
            super(JokerId.GOLDEN_JOKER, "Golden Joker", "Earn $4 at end of round", Rarity.COMMON);
        }

        @Override
        public JokerEffect onRoundEnd(GameContext context) {
            return JokerEffect.money(4);
        }
    }

    public static final class Burglar extends Base {
        public Burglar() {
            super(JokerId.BURGLAR, "Burglar", "When Blind is selected, gain +3 Hands and lose all discards",
                Rarity.UNCOMMON);
        }

        @Override
        public JokerEffect onBlindStart(GameContext context) {
            return JokerEffect.builder().discardMod(-context.discardsRemaining()).build();
        }

        @Override
        public int handBonus() {
            return 3;
        }
    }

    public static final class Cloud9 extends Base {
        public Cloud9() {
            super(JokerId.CLOUD_9, "Cloud 9", "Earn $1 for each 9 in your full deck at end of round", Rarity.UNCOMMON);
        }

        @Override
        public JokerEffect onRoundEnd(GameContext context) {
            return JokerEffect.money(context.deck().count(Rank.NINE));
        }
    }

    public static final class Troubadour extends Base {
        public Troubadour() {
            super(JokerId.TROUBADOUR, "Troubadour", "+2 hand size, -1 hand each round", Rarity.UNCOMMON);
        }

        @Override
        public int handSizeBonus() {
            return 2;
        }

        @Override
        public int handBonus() {
            return -1;
        }
    }

    public static final class MerryAndy extends Base {
        public MerryAndy() {
            super(JokerId.MERRY_ANDY, "Merry Andy", "+3 discards each round, -1 hand size", Rarity.UNCOMMON);
        }

        @Override
        public int discardBonus() {
            return 3;
        }

        @Override
        public int handSizeBonus() {
            return -1;
        }
    }

    public static final class Stuntman extends Base {
        public Stuntman() {
            super(JokerId.STUNTMAN, "Stuntman", "+250 Chips, -2 hand size", Rarity.RARE);
        }

        @Override
        public JokerEffect onHandPlayed(GameContext context) {
            return JokerEffect.chips(250);
        }

        @Override
        public int handSizeBonus() {
            return -2;
        }
    }

    /**
     * Every legacy joker, one fresh instance each.
     */
    public static List<LegacyJoker> all() {
        return List.of(new ScaryFace(), new BusinessCard(), new DelayedGratification(), new Egg(),
            new FacelessJoker(), new Juggler(), new Drunkard(), new GoldenJoker(), new Burglar(),
            new Cloud9(), new Troubadour(), new MerryAndy(), new Stuntman());
    }
}
