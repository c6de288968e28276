package com.balatro.jokers.engine;

import com.balatro.jokers.card.PlayedHand;
import com.balatro.jokers.effect.AppliedScore;
import com.balatro.jokers.pipeline.ProcessingResult;

import java.util.List;

/**
 * A scored hand.
 *
 * @param hand    The classified hand
 * @param result  Aggregate effect, directives and isolated failures
 * @param score   The aggregate applied to the hand's base values and the wallet
 * @param spawned Jokers added to the run while resolving directives
 */
public record HandResult(PlayedHand hand, ProcessingResult result, AppliedScore score, List<InstanceHandle> spawned) {
    public HandResult {
        spawned = List.copyOf(spawned);
    }
}
