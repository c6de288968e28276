package com.balatro.jokers.engine;

import com.balatro.jokers.persistence.EntryFailure;

import java.util.List;

/**
 * What a load restored and what it lost. A lost entry leaves a gap in run order;
 * the jokers around it keep their relative order.
 */
public record LoadReport(int formatVersion, List<InstanceHandle> loaded, List<EntryFailure> failures) {
    public LoadReport {
        loaded = List.copyOf(loaded);
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
