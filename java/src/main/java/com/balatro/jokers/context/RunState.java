package com.balatro.jokers.context;

import com.balatro.jokers.card.HandRank;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of run progression supplied by the game engine for one evaluation.
 * Immutable; use {@link #toBuilder()} to derive the next snapshot.
 */
public final class RunState {
    private final int ante;
    private final int round;
    private final Stage stage;
    private final int money;
    private final int handsRemaining;
    private final int discardsRemaining;
    private final int handSize;
    private final int handsPlayedThisRound;
    private final int discardsUsedThisRound;
    private final long handsPlayedThisRun;
    private final Map<HandRank, Integer> handPlayCounts;
    private final DeckComposition deck;
    private final int jokerSlots;
    private final long seed;
    private final int handIndex;

    private RunState(Builder b) {
        this.ante = b.ante;
        this.round = b.round;
        this.stage = Objects.requireNonNull(b.stage, "stage");
        this.money = b.money;
        this.handsRemaining = b.handsRemaining;
        this.discardsRemaining = b.discardsRemaining;
        this.handSize = b.handSize;
        this.handsPlayedThisRound = b.handsPlayedThisRound;
        this.discardsUsedThisRound = b.discardsUsedThisRound;
        this.handsPlayedThisRun = b.handsPlayedThisRun;
        this.handPlayCounts = Map.copyOf(b.handPlayCounts);
        this.deck = Objects.requireNonNull(b.deck, "deck");
        this.jokerSlots = b.jokerSlots;
        this.seed = b.seed;
        this.handIndex = b.handIndex;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start of ante 1, small blind, default resources.
     */
    public static RunState initial(long seed) {
        return builder().seed(seed).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.ante = ante;
        b.round = round;
        b.stage = stage;
        b.money = money;
        b.handsRemaining = handsRemaining;
        b.discardsRemaining = discardsRemaining;
        b.handSize = handSize;
        b.handsPlayedThisRound = handsPlayedThisRound;
        b.discardsUsedThisRound = discardsUsedThisRound;
        b.handsPlayedThisRun = handsPlayedThisRun;
        b.handPlayCounts.putAll(handPlayCounts);
        b.deck = deck;
        b.jokerSlots = jokerSlots;
        b.seed = seed;
        b.handIndex = handIndex;
        return b;
    }

    public int getAnte() {
        return ante;
    }

    public int getRound() {
        return round;
    }

    public Stage getStage() {
        return stage;
    }

    public int getMoney() {
        return money;
    }

    /**
     * Hands left after the one being evaluated. 0 means this is the final hand.
     */
    public int getHandsRemaining() {
        return handsRemaining;
    }

    public int getDiscardsRemaining() {
        return discardsRemaining;
    }

    public int getHandSize() {
        return handSize;
    }

    /**
     * Hands played earlier this round. 0 means the hand being evaluated is the first.
     */
    public int getHandsPlayedThisRound() {
        return handsPlayedThisRound;
    }

    public int getDiscardsUsedThisRound() {
        return discardsUsedThisRound;
    }

    public long getHandsPlayedThisRun() {
        return handsPlayedThisRun;
    }

    /**
     * Times a hand class was played earlier this run, not counting the current hand.
     */
    public int timesPlayed(HandRank rank) {
        return handPlayCounts.getOrDefault(rank, 0);
    }

    public Map<HandRank, Integer> getHandPlayCounts() {
        return handPlayCounts;
    }

    /**
     * The hand class played most often so far, or null before the first hand.
     */
    public HandRank mostPlayedHand() {
        HandRank best = null;
        int bestCount = 0;
        for (HandRank rank : HandRank.values()) {
            int count = timesPlayed(rank);
            if (count > bestCount) {
                best = rank;
                bestCount = count;
            }
        }
        return best;
    }

    public DeckComposition getDeck() {
        return deck;
    }

    public int getJokerSlots() {
        return jokerSlots;
    }

    public long getSeed() {
        return seed;
    }

    public int getHandIndex() {
        return handIndex;
    }

    @Override
    public String toString() {
        return "RunState{ante=" + ante + ", round=" + round + ", stage=" + stage + ", money=" + money
            + ", hands=" + handsRemaining + ", discards=" + discardsRemaining + "}";
    }

    public static final class Builder {
        private int ante = 1;
        private int round = 1;
        private Stage stage = Stage.SMALL_BLIND;
        private int money = 4;
        private int handsRemaining = 3;
        private int discardsRemaining = 3;
        private int handSize = 8;
        private int handsPlayedThisRound;
        private int discardsUsedThisRound;
        private long handsPlayedThisRun;
        private final Map<HandRank, Integer> handPlayCounts = new EnumMap<>(HandRank.class);
        private DeckComposition deck = DeckComposition.standard();
        private int jokerSlots = 5;
        private long seed;
        private int handIndex;

        private Builder() {
        }

        public Builder ante(int ante) {
            this.ante = ante;
            return this;
        }

        public Builder round(int round) {
            this.round = round;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder money(int money) {
            this.money = money;
            return this;
        }

        public Builder handsRemaining(int handsRemaining) {
            this.handsRemaining = handsRemaining;
            return this;
        }

        public Builder discardsRemaining(int discardsRemaining) {
            this.discardsRemaining = discardsRemaining;
            return this;
        }

        public Builder handSize(int handSize) {
            this.handSize = handSize;
            return this;
        }

        public Builder handsPlayedThisRound(int handsPlayedThisRound) {
            this.handsPlayedThisRound = handsPlayedThisRound;
            return this;
        }

        public Builder discardsUsedThisRound(int discardsUsedThisRound) {
            this.discardsUsedThisRound = discardsUsedThisRound;
            return this;
        }

        public Builder handsPlayedThisRun(long handsPlayedThisRun) {
            this.handsPlayedThisRun = handsPlayedThisRun;
            return this;
        }

        public Builder timesPlayed(HandRank rank, int count) {
            this.handPlayCounts.put(rank, count);
            return this;
        }

        public Builder recordPlayed(HandRank rank) {
            this.handPlayCounts.merge(rank, 1, Integer::sum);
            return this;
        }

        public Builder deck(DeckComposition deck) {
            this.deck = deck;
            return this;
        }

        public Builder jokerSlots(int jokerSlots) {
            this.jokerSlots = jokerSlots;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder handIndex(int handIndex) {
            this.handIndex = handIndex;
            return this;
        }

        public RunState build() {
            if (ante < 0 || round < 0) {
                throw new IllegalArgumentException("ante and round must be >= 0");
            }
            return new RunState(this);
        }
    }
}
