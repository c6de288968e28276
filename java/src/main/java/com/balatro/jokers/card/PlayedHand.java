package com.balatro.jokers.card;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A classified played hand: the selection, the cards that score (in play order),
 * the best rank, every rank the selection contains, and the cards still held.
 */
public class PlayedHand {
    private final List<Card> played;
    private final List<Card> scoring;
    private final List<Card> held;
    private final HandRank rank;
    private final Set<HandRank> contained;

    public PlayedHand(List<Card> played, List<Card> scoring, List<Card> held,
                      HandRank rank, Set<HandRank> contained) {
        this.played = List.copyOf(played);
        this.scoring = List.copyOf(scoring);
        this.held = List.copyOf(held);
        this.rank = rank;
        this.contained = contained.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(contained));
    }

    /**
     * A hand with no cards: pass 1 still runs, pass 2 is empty.
     */
    public static PlayedHand empty() {
        return new PlayedHand(List.of(), List.of(), List.of(), HandRank.HIGH_CARD, EnumSet.noneOf(HandRank.class));
    }

    public List<Card> getPlayed() {
        return played;
    }

    public List<Card> getScoring() {
        return scoring;
    }

    public List<Card> getHeld() {
        return held;
    }

    public HandRank getRank() {
        return rank;
    }

    /**
     * Check whether the hand contains the given rank (a Full House contains a Pair).
     */
    public boolean contains(HandRank handRank) {
        return contained.contains(handRank);
    }

    public Set<HandRank> getContained() {
        return contained;
    }

    public boolean isEmpty() {
        return played.isEmpty();
    }

    public int size() {
        return played.size();
    }

    @Override
    public String toString() {
        return rank.getDisplayName() + " " + played;
    }
}
