package com.balatro.jokers.engine;

import com.balatro.jokers.pipeline.ProcessingResult;

import java.util.List;

/**
 * @param sold      The handle that was sold
 * @param value     Money paid for it: base sell value plus accrued increases
 * @param onSell    The sold joker's own sale hook
 * @param reactions Siblings' reaction to the sale
 * @param spawned   Jokers added to the run by either pass
 */
public record SaleOutcome(InstanceHandle sold, int value, ProcessingResult onSell,
                          ProcessingResult reactions, List<InstanceHandle> spawned) {
    public SaleOutcome {
        spawned = List.copyOf(spawned);
    }
}
