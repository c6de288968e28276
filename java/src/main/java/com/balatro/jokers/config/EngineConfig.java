package com.balatro.jokers.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Engine tuning loaded from JSON. Missing keys keep their defaults; unknown keys are errors.
 */
public class EngineConfig {
    public static final String DEFAULT_RESOURCE = "joker-engine.json";

    @JsonProperty("max_mult")
    private double maxMult = 1_000_000;

    @JsonProperty("max_retriggers_per_card")
    private int maxRetriggersPerCard = 10;

    @JsonProperty("condition_cache_enabled")
    private boolean conditionCacheEnabled = true;

    @JsonProperty("condition_cache_max_entries")
    private int conditionCacheMaxEntries = 256;

    /** 0 runs batches on the common fork-join pool. */
    @JsonProperty("simulation_threads")
    private int simulationThreads;

    @JsonProperty("default_seed")
    private long defaultSeed = 42;

    public EngineConfig() {
    }

    private EngineConfig(EngineConfig other) {
        this.maxMult = other.maxMult;
        this.maxRetriggersPerCard = other.maxRetriggersPerCard;
        this.conditionCacheEnabled = other.conditionCacheEnabled;
        this.conditionCacheMaxEntries = other.conditionCacheMaxEntries;
        this.simulationThreads = other.simulationThreads;
        this.defaultSeed = other.defaultSeed;
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    // ==================== LOADING ====================

    /**
     * Load configuration from a JSON file.
     */
    public static EngineConfig fromFile(String path) throws ConfigException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new ConfigException("IO error reading " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     */
    public static EngineConfig fromResource(String resourcePath) throws ConfigException {
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new ConfigException("Resource not found: " + resourcePath);
            }
            return validated(mapper().readValue(is, EngineConfig.class));
        } catch (IOException e) {
            throw new ConfigException("JSON parsing error in " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a JSON string.
     */
    public static EngineConfig fromJson(String json) throws ConfigException {
        try {
            return validated(mapper().readValue(json, EngineConfig.class));
        } catch (IOException e) {
            throw new ConfigException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static ObjectMapper mapper() {
        return new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static EngineConfig validated(EngineConfig config) throws ConfigException {
        if (!(config.maxMult > 0) || Double.isInfinite(config.maxMult)) {
            throw new ConfigException("max_mult must be positive and finite: " + config.maxMult);
        }
        if (config.maxRetriggersPerCard < 0) {
            throw new ConfigException("max_retriggers_per_card must be >= 0: " + config.maxRetriggersPerCard);
        }
        if (config.conditionCacheMaxEntries <= 0) {
            throw new ConfigException("condition_cache_max_entries must be > 0: " + config.conditionCacheMaxEntries);
        }
        if (config.simulationThreads < 0) {
            throw new ConfigException("simulation_threads must be >= 0: " + config.simulationThreads);
        }
        return config;
    }

    // ==================== OVERRIDES ====================

    public EngineConfig withMaxMult(double maxMult) throws ConfigException {
        EngineConfig copy = new EngineConfig(this);
        copy.maxMult = maxMult;
        return validated(copy);
    }

    public EngineConfig withSimulationThreads(int threads) throws ConfigException {
        EngineConfig copy = new EngineConfig(this);
        copy.simulationThreads = threads;
        return validated(copy);
    }

    public EngineConfig withConditionCacheEnabled(boolean enabled) {
        EngineConfig copy = new EngineConfig(this);
        copy.conditionCacheEnabled = enabled;
        return copy;
    }

    public EngineConfig withDefaultSeed(long seed) {
        EngineConfig copy = new EngineConfig(this);
        copy.defaultSeed = seed;
        return copy;
    }

    // ==================== GETTERS ====================

    public double getMaxMult() {
        return maxMult;
    }

    public int getMaxRetriggersPerCard() {
        return maxRetriggersPerCard;
    }

    public boolean isConditionCacheEnabled() {
        return conditionCacheEnabled;
    }

    public int getConditionCacheMaxEntries() {
        return conditionCacheMaxEntries;
    }

    public int getSimulationThreads() {
        return simulationThreads;
    }

    public long getDefaultSeed() {
        return defaultSeed;
    }

    @Override
    public String toString() {
        return "EngineConfig{maxMult=" + maxMult
            + ", maxRetriggersPerCard=" + maxRetriggersPerCard
            + ", conditionCacheEnabled=" + conditionCacheEnabled
            + ", conditionCacheMaxEntries=" + conditionCacheMaxEntries
            + ", simulationThreads=" + simulationThreads
            + ", defaultSeed=" + defaultSeed + "}";
    }
}
