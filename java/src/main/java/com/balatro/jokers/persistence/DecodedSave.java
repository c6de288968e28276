package com.balatro.jokers.persistence;

import java.util.List;

/**
 * A save blob split into readable entries and entries that were malformed on their own.
 */
public record DecodedSave(int formatVersion, List<SaveEntry> entries, List<EntryFailure> failures) {
    public DecodedSave {
        entries = List.copyOf(entries);
        failures = List.copyOf(failures);
    }
}
