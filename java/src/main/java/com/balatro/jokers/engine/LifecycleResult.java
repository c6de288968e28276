package com.balatro.jokers.engine;

import com.balatro.jokers.pipeline.ProcessingResult;

import java.util.List;

/**
 * Outcome of a lifecycle pass (round start or end, discard, external event).
 * Money and other effects in {@code result.aggregate()} are for the caller to apply.
 *
 * @param result  The pass itself
 * @param spawned Jokers the pass added to the run
 */
public record LifecycleResult(ProcessingResult result, List<InstanceHandle> spawned) {
    public LifecycleResult {
        spawned = List.copyOf(spawned);
    }

    public int money() {
        return result.aggregate().getMoney();
    }
}
