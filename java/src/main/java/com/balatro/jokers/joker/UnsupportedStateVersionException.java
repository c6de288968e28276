package com.balatro.jokers.joker;

/**
 * Thrown when a payload was written by a newer schema than this build understands.
 */
public class UnsupportedStateVersionException extends StateDeserializeException {
    private final int foundVersion;
    private final int supportedVersion;

    public UnsupportedStateVersionException(JokerId jokerId, int foundVersion, int supportedVersion) {
        super(jokerId, "unsupported state version " + foundVersion + " (newest supported: " + supportedVersion + ")");
        this.foundVersion = foundVersion;
        this.supportedVersion = supportedVersion;
    }

    public int getFoundVersion() {
        return foundVersion;
    }

    public int getSupportedVersion() {
        return supportedVersion;
    }
}
