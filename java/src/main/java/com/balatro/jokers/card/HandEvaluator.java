package com.balatro.jokers.card;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifies a played selection into a {@link PlayedHand}.
 */
public final class HandEvaluator {

    private HandEvaluator() {
        // Utility class - prevent instantiation
    }

    public static PlayedHand evaluate(List<Card> played) {
        return evaluate(played, List.of(), HandRules.STANDARD);
    }

    /**
     * Classify a selection.
     * @param played The cards played, in play order
     * @param held   The cards remaining in hand
     * @param rules  Rule switches from active modifiers
     */
    public static PlayedHand evaluate(List<Card> played, List<Card> held, HandRules rules) {
        if (played.isEmpty()) {
            return new PlayedHand(List.of(), List.of(), held, HandRank.HIGH_CARD, EnumSet.noneOf(HandRank.class));
        }

        List<Card> ranked = new ArrayList<>();
        for (Card card : played) {
            if (!card.isStone()) {
                ranked.add(card);
            }
        }

        List<List<Card>> groups = groupByRank(ranked);
        int largest = groups.isEmpty() ? 0 : groups.get(0).size();
        int second = groups.size() > 1 ? groups.get(1).size() : 0;

        List<Card> flushCards = findFlush(ranked, rules);
        List<Card> straightCards = findStraight(ranked, rules);
        boolean flush = !flushCards.isEmpty();
        boolean straight = !straightCards.isEmpty();
        boolean royal = straight && flush && isRoyal(straightCards);

        boolean five = largest >= 5;
        boolean four = largest >= 4;
        boolean three = largest >= 3;
        boolean fullHouse = largest >= 3 && second >= 2;
        boolean twoPair = largest >= 2 && second >= 2;
        boolean pair = largest >= 2;

        HandRank rank;
        List<Card> core = new ArrayList<>();
        if (five && flush) {
            rank = HandRank.FLUSH_FIVE;
            core.addAll(groups.get(0));
            core.addAll(flushCards);
        } else if (fullHouse && flush) {
            rank = HandRank.FLUSH_HOUSE;
            core.addAll(groups.get(0));
            core.addAll(groups.get(1));
            core.addAll(flushCards);
        } else if (five) {
            rank = HandRank.FIVE_OF_A_KIND;
            core.addAll(groups.get(0));
        } else if (straight && flush) {
            rank = royal ? HandRank.ROYAL_FLUSH : HandRank.STRAIGHT_FLUSH;
            core.addAll(straightCards);
            core.addAll(flushCards);
        } else if (four) {
            rank = HandRank.FOUR_OF_A_KIND;
            core.addAll(groups.get(0));
        } else if (fullHouse) {
            rank = HandRank.FULL_HOUSE;
            core.addAll(groups.get(0));
            core.addAll(groups.get(1));
        } else if (flush) {
            rank = HandRank.FLUSH;
            core.addAll(flushCards);
        } else if (straight) {
            rank = HandRank.STRAIGHT;
            core.addAll(straightCards);
        } else if (three) {
            rank = HandRank.THREE_OF_A_KIND;
            core.addAll(groups.get(0));
        } else if (twoPair) {
            rank = HandRank.TWO_PAIR;
            core.addAll(groups.get(0));
            core.addAll(groups.get(1));
        } else if (pair) {
            rank = HandRank.PAIR;
            core.addAll(groups.get(0));
        } else {
            rank = HandRank.HIGH_CARD;
            Card highest = highestCard(ranked);
            if (highest != null) {
                core.add(highest);
            }
        }

        Set<Card> coreSet = Collections.newSetFromMap(new IdentityHashMap<>());
        coreSet.addAll(core);
        List<Card> scoring = new ArrayList<>();
        for (Card card : played) {
            if (rules.allCardsScore() || card.isStone() || coreSet.contains(card)) {
                scoring.add(card);
            }
        }

        Set<HandRank> contained = EnumSet.of(HandRank.HIGH_CARD, rank);
        if (pair) contained.add(HandRank.PAIR);
        if (twoPair || four) contained.add(HandRank.TWO_PAIR);
        if (three) contained.add(HandRank.THREE_OF_A_KIND);
        if (straight) contained.add(HandRank.STRAIGHT);
        if (flush) contained.add(HandRank.FLUSH);
        if (fullHouse) contained.add(HandRank.FULL_HOUSE);
        if (four) contained.add(HandRank.FOUR_OF_A_KIND);
        if (five) contained.add(HandRank.FIVE_OF_A_KIND);
        if (straight && flush) contained.add(HandRank.STRAIGHT_FLUSH);
        if (royal) contained.add(HandRank.ROYAL_FLUSH);
        if (fullHouse && flush) contained.add(HandRank.FLUSH_HOUSE);
        if (five && flush) contained.add(HandRank.FLUSH_FIVE);

        return new PlayedHand(played, scoring, held, rank, contained);
    }

    // ==================== GROUPS ====================

    /**
     * Group ranked cards by rank, largest group first, ties broken by higher rank.
     */
    private static List<List<Card>> groupByRank(List<Card> ranked) {
        Map<Rank, List<Card>> byRank = new EnumMap<>(Rank.class);
        for (Card card : ranked) {
            byRank.computeIfAbsent(card.rank(), k -> new ArrayList<>()).add(card);
        }
        List<List<Card>> groups = new ArrayList<>(byRank.values());
        groups.sort((a, b) -> {
            if (a.size() != b.size()) {
                return Integer.compare(b.size(), a.size());
            }
            return Integer.compare(b.get(0).rank().getValue(), a.get(0).rank().getValue());
        });
        return groups;
    }

    private static Card highestCard(List<Card> ranked) {
        Card best = null;
        for (Card card : ranked) {
            if (best == null || card.rank().getValue() > best.rank().getValue()) {
                best = card;
            }
        }
        return best;
    }

    // ==================== FLUSH ====================

    private static List<Card> findFlush(List<Card> ranked, HandRules rules) {
        List<Card> best = List.of();
        for (Suit suit : Suit.values()) {
            List<Card> matching = new ArrayList<>();
            for (Card card : ranked) {
                if (card.hasSuit(suit, rules.smearedSuits())) {
                    matching.add(card);
                }
            }
            if (matching.size() >= rules.runLength() && matching.size() > best.size()) {
                best = matching;
            }
        }
        return best;
    }

    // ==================== STRAIGHT ====================

    private static List<Card> findStraight(List<Card> ranked, HandRules rules) {
        TreeSet<Integer> values = new TreeSet<>();
        for (Card card : ranked) {
            values.add(card.rank().getValue());
            if (card.rank() == Rank.ACE) {
                values.add(1);
            }
        }

        int maxStep = rules.shortcut() ? 2 : 1;
        List<Integer> bestChain = List.of();
        List<Integer> chain = new ArrayList<>();
        Integer previous = null;
        for (int value : values) {
            if (previous != null && value - previous > maxStep) {
                if (chain.size() >= bestChain.size()) {
                    bestChain = chain;
                }
                chain = new ArrayList<>();
            }
            chain.add(value);
            previous = value;
        }
        if (chain.size() >= bestChain.size()) {
            bestChain = chain;
        }

        if (bestChain.size() < rules.runLength()) {
            return List.of();
        }

        Set<Integer> chainValues = Set.copyOf(bestChain);
        List<Card> cards = new ArrayList<>();
        for (Card card : ranked) {
            int value = card.rank().getValue();
            boolean aceLow = card.rank() == Rank.ACE && chainValues.contains(1);
            if (chainValues.contains(value) || aceLow) {
                cards.add(card);
            }
        }
        return cards;
    }

    private static boolean isRoyal(List<Card> straightCards) {
        boolean hasAce = false;
        for (Card card : straightCards) {
            if (card.rank().getValue() < Rank.TEN.getValue()) {
                return false;
            }
            hasAce |= card.rank() == Rank.ACE;
        }
        return hasAce;
    }
}
