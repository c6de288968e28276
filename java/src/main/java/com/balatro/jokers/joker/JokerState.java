package com.balatro.jokers.joker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Persistence of an instance's own data as a self-describing JSON value.
 */
public interface JokerState extends Joker {

    /**
     * Schema version written alongside the payload.
     */
    int stateVersion();

    JsonNode serializeState();

    /**
     * Restore state written by {@link #serializeState()} at the given schema version.
     * On failure the instance keeps its previous state unchanged.
     *
     * @throws UnsupportedStateVersionException if {@code schemaVersion} is newer than {@link #stateVersion()}
     * @throws StateDeserializeException if the payload is malformed
     */
    void deserializeState(int schemaVersion, JsonNode state) throws StateDeserializeException;
}
