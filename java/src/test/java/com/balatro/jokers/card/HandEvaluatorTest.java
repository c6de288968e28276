package com.balatro.jokers.card;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HandEvaluator classification and scoring-card selection.
 */
class HandEvaluatorTest {

    private static PlayedHand eval(String cards) {
        return HandEvaluator.evaluate(Card.parseList(cards));
    }

    private static PlayedHand eval(String cards, HandRules rules) {
        return HandEvaluator.evaluate(Card.parseList(cards), List.of(), rules);
    }

    @Test
    void testPair() {
        PlayedHand hand = eval("KS KH 3D 7C 9S");
        assertEquals(HandRank.PAIR, hand.getRank());
        assertEquals(2, hand.getScoring().size());
        assertEquals(5, hand.getPlayed().size());
    }

    @Test
    void testHighCardScoresOnlyTheHighestCard() {
        PlayedHand hand = eval("2S 7H 9D JC KS");
        assertEquals(HandRank.HIGH_CARD, hand.getRank());
        assertEquals(List.of(Card.parse("KS")), hand.getScoring());
    }

    @Test
    void testFullHouseContainsSmallerHands() {
        PlayedHand hand = eval("KS KH KD 3C 3S");
        assertEquals(HandRank.FULL_HOUSE, hand.getRank());
        assertTrue(hand.contains(HandRank.PAIR));
        assertTrue(hand.contains(HandRank.TWO_PAIR));
        assertTrue(hand.contains(HandRank.THREE_OF_A_KIND));
        assertFalse(hand.contains(HandRank.FLUSH));
        assertEquals(5, hand.getScoring().size());
    }

    @Test
    void testFourOfAKindContainsTwoPair() {
        PlayedHand hand = eval("9S 9H 9D 9C 2S");
        assertEquals(HandRank.FOUR_OF_A_KIND, hand.getRank());
        assertTrue(hand.contains(HandRank.TWO_PAIR));
        assertEquals(4, hand.getScoring().size());
    }

    @Test
    void testFlush() {
        PlayedHand hand = eval("2H 5H 9H JH KH");
        assertEquals(HandRank.FLUSH, hand.getRank());
        assertEquals(5, hand.getScoring().size());
    }

    @Test
    void testAceLowStraight() {
        PlayedHand hand = eval("AS 2H 3D 4C 5S");
        assertEquals(HandRank.STRAIGHT, hand.getRank());
        assertEquals(5, hand.getScoring().size());
    }

    @Test
    void testRoyalFlush() {
        PlayedHand hand = eval("TS JS QS KS AS");
        assertEquals(HandRank.ROYAL_FLUSH, hand.getRank());
        assertTrue(hand.contains(HandRank.STRAIGHT_FLUSH));
        assertTrue(hand.contains(HandRank.STRAIGHT));
        assertTrue(hand.contains(HandRank.FLUSH));
    }

    @Test
    void testFlushFive() {
        PlayedHand hand = eval("7H 7H 7H 7H 7H");
        assertEquals(HandRank.FLUSH_FIVE, hand.getRank());
        assertTrue(hand.contains(HandRank.FIVE_OF_A_KIND));
        assertTrue(hand.contains(HandRank.FOUR_OF_A_KIND));
    }

    @Test
    void testFourFingersAllowsFourCardFlush() {
        String cards = "2H 5H 9H JH KS";
        assertEquals(HandRank.HIGH_CARD, eval(cards).getRank());

        PlayedHand hand = eval(cards, new HandRules(true, false, false, false, false));
        assertEquals(HandRank.FLUSH, hand.getRank());
        assertEquals(4, hand.getScoring().size());
    }

    @Test
    void testShortcutAllowsGaps() {
        String cards = "2S 4H 6D 8C TS";
        assertEquals(HandRank.HIGH_CARD, eval(cards).getRank());
        assertEquals(HandRank.STRAIGHT, eval(cards, new HandRules(false, true, false, false, false)).getRank());
    }

    @Test
    void testSmearedSuitsMergeColors() {
        String cards = "2H 5D 9H JD KH";
        assertEquals(HandRank.HIGH_CARD, eval(cards).getRank());
        assertEquals(HandRank.FLUSH, eval(cards, new HandRules(false, false, true, false, false)).getRank());
    }

    @Test
    void testWildCardCompletesFlush() {
        PlayedHand hand = eval("2S 5S 9S JS KH:wild");
        assertEquals(HandRank.FLUSH, hand.getRank());
    }

    @Test
    void testSplashScoresEveryCard() {
        PlayedHand hand = eval("KS KH 3D 7C 9S", new HandRules(false, false, false, true, false));
        assertEquals(HandRank.PAIR, hand.getRank());
        assertEquals(5, hand.getScoring().size());
    }

    @Test
    void testStoneCardAlwaysScores() {
        PlayedHand hand = eval("KS KH 5D:stone");
        assertEquals(HandRank.PAIR, hand.getRank());
        assertEquals(3, hand.getScoring().size());
        assertTrue(hand.getScoring().get(2).isStone());
    }

    @Test
    void testEmptyHand() {
        PlayedHand hand = HandEvaluator.evaluate(List.of());
        assertEquals(HandRank.HIGH_CARD, hand.getRank());
        assertTrue(hand.isEmpty());
        assertTrue(hand.getScoring().isEmpty());
    }

    @Test
    void testHeldCardsAreCarried() {
        List<Card> held = Card.parseList("QS QH");
        PlayedHand hand = HandEvaluator.evaluate(Card.parseList("AS"), held, HandRules.STANDARD);
        assertEquals(held, hand.getHeld());
    }

    @Test
    void testParseRejectsBadCard() {
        assertThrows(IllegalArgumentException.class, () -> Card.parse("XYZ"));
        assertEquals(50, Card.parse("KD:stone").chipValue());
        assertEquals(41, Card.parse("AS:bonus").chipValue());
    }
}
