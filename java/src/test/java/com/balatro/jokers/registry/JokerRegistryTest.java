package com.balatro.jokers.registry;

import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.joker.UnlockProfile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JokerRegistry publication and queries.
 */
class JokerRegistryTest {

    @AfterEach
    void tearDown() {
        JokerRegistry.resetForTesting();
    }

    @Test
    void testInitializeIsIdempotent() {
        JokerRegistry.resetForTesting();
        assertFalse(JokerRegistry.isInitialized());

        JokerRegistry first = JokerRegistry.initialize();
        JokerRegistry second = JokerRegistry.initialize();

        assertSame(first, second);
        assertSame(first, JokerRegistry.global());
        assertTrue(JokerRegistry.isInitialized());
    }

    @Test
    void testConcurrentInitializationPublishesOneInstance() throws Exception {
        JokerRegistry.resetForTesting();
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<JokerRegistry>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<JokerRegistry> task = () -> {
                    start.await();
                    return JokerRegistry.initialize();
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            JokerRegistry expected = futures.get(0).get();
            for (Future<JokerRegistry> future : futures) {
                JokerRegistry registry = future.get();
                assertSame(expected, registry);
                assertEquals(JokerId.values().length, registry.size());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testCatalogRegistersEveryIdentifier() {
        JokerRegistry registry = JokerRegistry.global();
        assertEquals(150, registry.size());
        for (JokerId id : JokerId.values()) {
            assertTrue(registry.contains(id), "missing " + id);
            assertTrue(registry.metadata(id).isPresent());
        }
    }

    @Test
    void testByRarityPartitionsTheCatalog() {
        JokerRegistry registry = JokerRegistry.global();
        Set<JokerId> seen = EnumSet.noneOf(JokerId.class);
        int total = 0;
        for (Rarity rarity : Rarity.values()) {
            for (JokerId id : registry.byRarity(rarity)) {
                assertEquals(rarity, registry.metadata(id).orElseThrow().rarity());
                seen.add(id);
                total++;
            }
        }
        assertEquals(registry.size(), total);
        assertEquals(registry.ids(), seen);
        assertFalse(registry.byRarity(Rarity.LEGENDARY).isEmpty());
    }

    @Test
    void testLegendariesAreNotEligibleForFreshProfile() {
        JokerRegistry registry = JokerRegistry.global();
        List<JokerId> eligible = registry.eligibleFor(UnlockProfile.FRESH);
        for (JokerId legendary : registry.byRarity(Rarity.LEGENDARY)) {
            assertFalse(eligible.contains(legendary));
        }
        assertTrue(eligible.contains(JokerId.JOKER));
    }

    @Test
    void testDuplicateRegistrationFails() {
        JokerMetadata meta = JokerMetadata.of("Joker", "+4 Mult", Rarity.COMMON);
        JokerRegistry.Builder builder = JokerRegistry.builder()
            .register(JokerId.JOKER, meta, args -> null);

        assertThrows(IllegalStateException.class, () -> builder.register(JokerId.JOKER, meta, args -> null));
    }

    @Test
    void testBuiltRegistryIsIndependentOfGlobal() {
        JokerMetadata meta = JokerMetadata.of("Joker", "+4 Mult", Rarity.COMMON);
        JokerRegistry local = JokerRegistry.builder()
            .register(JokerId.JOKER, meta, args -> () -> JokerId.JOKER)
            .build();

        assertEquals(1, local.size());
        assertEquals(List.of(JokerId.JOKER), local.byRarity(Rarity.COMMON));
        assertTrue(local.byRarity(Rarity.RARE).isEmpty());
        assertFalse(local.contains(JokerId.BLUEPRINT));
    }
}
