package com.balatro.jokers.config;

/**
 * Exception thrown when engine configuration cannot be read or is out of range.
 */
public class ConfigException extends Exception {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
