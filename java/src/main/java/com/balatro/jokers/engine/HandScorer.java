package com.balatro.jokers.engine;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Edition;
import com.balatro.jokers.card.Enhancement;
import com.balatro.jokers.card.PlayedHand;
import com.balatro.jokers.effect.SaturatingMath;
import com.balatro.jokers.pipeline.ProcessingResult;

/**
 * Base chips and mult of a hand before joker effects: the hand class's level-one
 * values plus what each scoring card contributes every time it is evaluated.
 * Glass, steel and polychrome multipliers are left to the game engine.
 */
public final class HandScorer {
    static final int MULT_CARD_BONUS = 4;
    static final int FOIL_CHIPS = 50;
    static final int HOLOGRAPHIC_MULT = 10;

    private HandScorer() {
        // Utility class - prevent instantiation
    }

    public static long baseChips(PlayedHand hand, ProcessingResult result) {
        if (hand.isEmpty()) {
            return 0;
        }
        long chips = hand.getRank().getBaseChips();
        for (int i = 0; i < result.scoringCards().size(); i++) {
            Card card = result.scoringCards().get(i);
            int perEvaluation = card.chipValue() + (card.edition() == Edition.FOIL ? FOIL_CHIPS : 0);
            chips = SaturatingMath.add(chips, (long) perEvaluation * result.timesScored(i));
        }
        return chips;
    }

    public static double baseMult(PlayedHand hand, ProcessingResult result) {
        if (hand.isEmpty()) {
            return 0;
        }
        double mult = hand.getRank().getBaseMult();
        for (int i = 0; i < result.scoringCards().size(); i++) {
            Card card = result.scoringCards().get(i);
            int perEvaluation = 0;
            if (card.enhancement() == Enhancement.MULT) {
                perEvaluation += MULT_CARD_BONUS;
            }
            if (card.edition() == Edition.HOLOGRAPHIC) {
                perEvaluation += HOLOGRAPHIC_MULT;
            }
            mult += (double) perEvaluation * result.timesScored(i);
        }
        return mult;
    }
}
