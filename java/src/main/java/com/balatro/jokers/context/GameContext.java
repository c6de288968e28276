package com.balatro.jokers.context;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.HandRank;
import com.balatro.jokers.card.PlayedHand;
import com.balatro.jokers.card.Suit;
import com.balatro.jokers.effect.EffectAccumulator;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.effect.NumericViolation;
import com.balatro.jokers.effect.SaturatingMath;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.RuleFlag;
import com.balatro.jokers.rng.GameRng;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToIntFunction;

/**
 * Per-evaluation view handed to joker hooks.
 * <p>
 * Hooks read run progression, the hand, the sibling list and the current accumulators.
 * The only write path is {@link #accumulate(JokerEffect, String)}, which the pipeline
 * calls with each hook's returned effect; hooks never mutate another joker's view.
 */
public final class GameContext {
    private final RunState run;
    private final PlayedHand hand;
    private final List<Joker> jokers;
    private final JokerStateStore store;
    private final GameRng rng;
    private final ModifierSummary modifiers;
    private final EffectAccumulator accumulator;
    private final ToIntFunction<Joker> sellValues;

    private GameContext(Builder b) {
        this.run = Objects.requireNonNull(b.run, "run");
        this.hand = b.hand != null ? b.hand : PlayedHand.empty();
        this.jokers = Collections.unmodifiableList(List.copyOf(b.jokers));
        this.store = b.store != null ? b.store : new JokerStateStore();
        this.rng = b.rng != null ? b.rng : GameRng.scoped(run.getSeed(), run.getAnte(), run.getRound(), run.getHandIndex());
        this.modifiers = b.modifiers != null ? b.modifiers : ModifierSummary.collect(jokers);
        this.accumulator = b.accumulator != null ? b.accumulator : new EffectAccumulator(b.maxMult);
        this.sellValues = b.sellValues != null ? b.sellValues : GameContext::baseSellValue;
    }

    public static Builder builder(RunState run) {
        return new Builder(run);
    }

    // ==================== ACCUMULATION ====================

    /**
     * Fold an effect into this evaluation's running total.
     * @return numeric violations raised (clamped or rejected values)
     */
    public List<NumericViolation> accumulate(JokerEffect effect, String source) {
        return accumulator.accumulate(effect, source);
    }

    public JokerEffect aggregate() {
        return accumulator.toEffect();
    }

    /** Chips accumulated so far in this pass. */
    public int chips() {
        return accumulator.chips();
    }

    /** Additive mult accumulated so far in this pass. */
    public double mult() {
        return accumulator.mult();
    }

    public double multMultiplier() {
        return accumulator.multMultiplier();
    }

    /**
     * Wallet as it would stand with the money accumulated so far.
     */
    public int money() {
        return SaturatingMath.add(run.getMoney(), accumulator.money());
    }

    // ==================== RUN ====================

    public RunState run() {
        return run;
    }

    public int ante() {
        return run.getAnte();
    }

    public int round() {
        return run.getRound();
    }

    public Stage stage() {
        return run.getStage();
    }

    public int handsRemaining() {
        return run.getHandsRemaining();
    }

    public int discardsRemaining() {
        return run.getDiscardsRemaining();
    }

    public DeckComposition deck() {
        return run.getDeck();
    }

    // ==================== HAND ====================

    public PlayedHand hand() {
        return hand;
    }

    public HandRank handRank() {
        return hand.getRank();
    }

    public boolean handContains(HandRank rank) {
        return !hand.isEmpty() && hand.contains(rank);
    }

    public List<Card> scoringCards() {
        return hand.getScoring();
    }

    public List<Card> playedCards() {
        return hand.getPlayed();
    }

    public List<Card> heldCards() {
        return hand.getHeld();
    }

    // ==================== JOKERS ====================

    /**
     * Active jokers in run order, as they stood when the pass began.
     */
    public List<Joker> jokers() {
        return jokers;
    }

    public int jokerCount() {
        return jokers.size();
    }

    /**
     * Position of an instance in run order, by identity; -1 if absent.
     */
    public int indexOf(Joker joker) {
        for (int i = 0; i < jokers.size(); i++) {
            if (jokers.get(i) == joker) {
                return i;
            }
        }
        return -1;
    }

    public Optional<Joker> rightNeighbour(Joker joker) {
        int index = indexOf(joker);
        if (index < 0 || index + 1 >= jokers.size()) {
            return Optional.empty();
        }
        return Optional.of(jokers.get(index + 1));
    }

    public Optional<Joker> leftmost() {
        return jokers.isEmpty() ? Optional.empty() : Optional.of(jokers.get(0));
    }

    /**
     * What a sibling would sell for right now, including any accrued increases
     * its owner tracks.
     */
    public int sellValue(Joker joker) {
        return sellValues.applyAsInt(joker);
    }

    private static int baseSellValue(Joker joker) {
        return joker instanceof JokerIdentity ? ((JokerIdentity) joker).metadata().baseSellValue() : 0;
    }

    public JokerStateStore store() {
        return store;
    }

    public ModifierSummary modifiers() {
        return modifiers;
    }

    // ==================== HELPERS ====================

    public boolean isFace(Card card) {
        return card.isFace(modifiers.has(RuleFlag.ALL_FACE));
    }

    public boolean hasSuit(Card card, Suit suit) {
        return card.hasSuit(suit, modifiers.has(RuleFlag.SMEARED_SUITS));
    }

    /**
     * Roll a listed "numerator in denominator" chance, scaled by probability modifiers.
     */
    public boolean chance(int numerator, int denominator) {
        return rng.chance(numerator * modifiers.probabilityMultiplier(), denominator);
    }

    public GameRng rng() {
        return rng;
    }

    /**
     * Hash of everything a condition could read. Conditions that declare a narrower
     * slice fingerprint only that slice.
     */
    public long fingerprint() {
        long h = 17;
        h = h * 31 + hand.getRank().ordinal();
        h = h * 31 + hand.getContained().hashCode();
        h = h * 31 + hand.getPlayed().hashCode();
        h = h * 31 + hand.getHeld().hashCode();
        h = h * 31 + money();
        h = h * 31 + run.getAnte();
        h = h * 31 + run.getRound();
        h = h * 31 + run.getHandsRemaining();
        h = h * 31 + run.getDiscardsRemaining();
        h = h * 31 + run.getHandsPlayedThisRound();
        h = h * 31 + run.getStage().ordinal();
        h = h * 31 + run.getDeck().hashCode();
        h = h * 31 + run.getHandPlayCounts().hashCode();
        h = h * 31 + jokers.size();
        return h;
    }

    public static final class Builder {
        private final RunState run;
        private PlayedHand hand;
        private List<Joker> jokers = List.of();
        private JokerStateStore store;
        private GameRng rng;
        private ModifierSummary modifiers;
        private EffectAccumulator accumulator;
        private ToIntFunction<Joker> sellValues;
        private double maxMult = 1_000_000;

        private Builder(RunState run) {
            this.run = run;
        }

        public Builder hand(PlayedHand hand) {
            this.hand = hand;
            return this;
        }

        public Builder jokers(List<? extends Joker> jokers) {
            this.jokers = List.copyOf(jokers);
            return this;
        }

        public Builder store(JokerStateStore store) {
            this.store = store;
            return this;
        }

        public Builder rng(GameRng rng) {
            this.rng = rng;
            return this;
        }

        public Builder modifiers(ModifierSummary modifiers) {
            this.modifiers = modifiers;
            return this;
        }

        public Builder accumulator(EffectAccumulator accumulator) {
            this.accumulator = accumulator;
            return this;
        }

        /**
         * Source of effective sell values; defaults to each joker's base sell value.
         */
        public Builder sellValues(ToIntFunction<Joker> sellValues) {
            this.sellValues = sellValues;
            return this;
        }

        public Builder maxMult(double maxMult) {
            this.maxMult = maxMult;
            return this;
        }

        public GameContext build() {
            return new GameContext(this);
        }
    }
}
