package com.balatro.jokers.persistence;

/**
 * The blob was written by a newer save format than this build reads.
 */
public class UnsupportedSaveVersionException extends SaveFormatException {
    private final int found;
    private final int supported;

    public UnsupportedSaveVersionException(int found, int supported) {
        super("save format " + found + " is newer than the supported format " + supported);
        this.found = found;
        this.supported = supported;
    }

    public int getFound() {
        return found;
    }

    public int getSupported() {
        return supported;
    }
}
