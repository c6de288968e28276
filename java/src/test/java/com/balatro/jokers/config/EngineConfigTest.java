package com.balatro.jokers.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EngineConfig loading and validation.
 */
class EngineConfigTest {

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();
        assertEquals(1_000_000, config.getMaxMult());
        assertEquals(10, config.getMaxRetriggersPerCard());
        assertTrue(config.isConditionCacheEnabled());
        assertEquals(256, config.getConditionCacheMaxEntries());
        assertEquals(0, config.getSimulationThreads());
        assertEquals(42, config.getDefaultSeed());
    }

    @Test
    void testBundledResourceLoads() throws ConfigException {
        EngineConfig config = EngineConfig.fromResource(EngineConfig.DEFAULT_RESOURCE);
        assertEquals(1_000_000, config.getMaxMult());
        assertEquals(10, config.getMaxRetriggersPerCard());
    }

    @Test
    void testMissingResource() {
        assertThrows(ConfigException.class, () -> EngineConfig.fromResource("no-such-config.json"));
    }

    @Test
    void testPartialJsonKeepsDefaults() throws ConfigException {
        EngineConfig config = EngineConfig.fromJson("{\"max_mult\": 5000, \"default_seed\": 7}");
        assertEquals(5000, config.getMaxMult());
        assertEquals(7, config.getDefaultSeed());
        assertEquals(10, config.getMaxRetriggersPerCard());
    }

    @Test
    void testUnknownKeyRejected() {
        ConfigException e = assertThrows(ConfigException.class,
            () -> EngineConfig.fromJson("{\"max_multt\": 5000}"));
        assertTrue(e.getMessage().contains("max_multt"));
    }

    @Test
    void testOutOfRangeValuesRejected() {
        assertThrows(ConfigException.class, () -> EngineConfig.fromJson("{\"max_mult\": 0}"));
        assertThrows(ConfigException.class, () -> EngineConfig.fromJson("{\"max_retriggers_per_card\": -1}"));
        assertThrows(ConfigException.class, () -> EngineConfig.fromJson("{\"condition_cache_max_entries\": 0}"));
        assertThrows(ConfigException.class, () -> EngineConfig.defaults().withSimulationThreads(-2));
    }

    @Test
    void testOverridesReturnCopies() throws ConfigException {
        EngineConfig base = EngineConfig.defaults();
        EngineConfig changed = base.withMaxMult(100).withSimulationThreads(4).withConditionCacheEnabled(false);

        assertEquals(100, changed.getMaxMult());
        assertEquals(4, changed.getSimulationThreads());
        assertFalse(changed.isConditionCacheEnabled());
        assertEquals(1_000_000, base.getMaxMult());
    }

    @Test
    void testFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("engine.json");
        Files.writeString(file, "{\"simulation_threads\": 2}");

        assertEquals(2, EngineConfig.fromFile(file.toString()).getSimulationThreads());
        assertThrows(ConfigException.class, () -> EngineConfig.fromFile(dir.resolve("missing.json").toString()));
    }
}
