package com.balatro.jokers;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.config.ConfigException;
import com.balatro.jokers.config.EngineConfig;
import com.balatro.jokers.context.RunState;
import com.balatro.jokers.engine.HandResult;
import com.balatro.jokers.engine.JokerEngine;
import com.balatro.jokers.factory.ConstructionException;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.pipeline.HookError;
import com.balatro.jokers.registry.JokerRegistry;
import com.balatro.jokers.simulation.Deck;
import com.balatro.jokers.simulation.JokerLoadout;
import com.balatro.jokers.simulation.SimulationEngine;
import com.balatro.jokers.simulation.SimulationResult;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.*;
import java.util.concurrent.Callable;

/**
 * joker-engine CLI - Main entry point.
 */
@Command(name = "joker-engine",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Joker scoring engine and run simulator",
        subcommands = {
                Main.ListCommand.class,
                Main.ScoreCommand.class,
                Main.SimulateCommand.class
        })
public class Main implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== LIST COMMAND ==========
    @Command(name = "list", description = "List registered jokers by rarity")
    static class ListCommand implements Callable<Integer> {
        @Option(names = {"-r", "--rarity"},
                description = "Only this rarity (common, uncommon, rare, legendary)")
        String rarity;

        @Override
        public Integer call() {
            JokerRegistry registry = JokerRegistry.global();
            List<Rarity> rarities;
            try {
                rarities = rarity == null ? List.of(Rarity.values()) : List.of(Rarity.fromString(rarity));
            } catch (IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            for (Rarity tier : rarities) {
                List<JokerId> ids = registry.byRarity(tier);
                System.out.println("\n=== " + tier.getJsonValue() + " (" + ids.size() + ") ===\n");
                for (JokerId id : ids) {
                    JokerMetadata meta = registry.metadata(id).orElseThrow();
                    System.out.printf("  %-22s $%-3d %s%n", id.wireName(), meta.baseCost(), meta.description());
                }
            }
            System.out.println("\nTotal: " + registry.size() + " jokers");
            return 0;
        }
    }

    // ========== SCORE COMMAND ==========
    @Command(name = "score", description = "Score one hand against a joker lineup")
    static class ScoreCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Played cards, e.g. \"AS KS QS JS TS\"")
        String played;

        @Option(names = {"-H", "--held"}, defaultValue = "",
                description = "Cards still held in hand")
        String held;

        @Option(names = {"-j", "--joker"},
                description = "Joker to acquire, in run order (repeatable): wire_name[:key=value,...]")
        List<String> jokers = new ArrayList<>();

        @Option(names = {"-m", "--money"}, defaultValue = "4",
                description = "Wallet before the hand")
        int money;

        @Option(names = {"-a", "--ante"}, defaultValue = "1",
                description = "Current ante")
        int ante;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional, defaults to the config seed)")
        Long seed;

        @Option(names = {"-c", "--config"},
                description = "Path to an engine config JSON (defaults to the bundled one)")
        String configPath;

        @Option(names = {"--max-mult"},
                description = "Override the mult cap")
        Double maxMult;

        @Override
        public Integer call() {
            EngineConfig config;
            try {
                config = loadConfig(configPath, maxMult, null);
            } catch (ConfigException e) {
                System.err.println("✗ Failed to load config: " + e.getMessage());
                return 1;
            }

            List<Card> playedCards;
            List<Card> heldCards;
            try {
                playedCards = Card.parseList(played);
                heldCards = Card.parseList(held);
            } catch (IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            JokerEngine engine = new JokerEngine(JokerRegistry.global(), config);
            for (String text : jokers) {
                try {
                    JokerLoadout loadout = JokerLoadout.parse(text);
                    engine.acquire(loadout.wireName(), loadout.args());
                } catch (ConstructionException | IllegalArgumentException e) {
                    System.err.println("✗ Cannot acquire '" + text + "': " + e.getMessage());
                    return 1;
                }
            }

            RunState run = RunState.builder()
                    .ante(ante)
                    .money(money)
                    .seed(seed != null ? seed : config.getDefaultSeed())
                    .build();
            HandResult result = engine.process(playedCards, heldCards, run);

            System.out.println("\n=== " + result.hand().getRank().getDisplayName() + " ===\n");
            System.out.println("Scoring: " + result.hand().getScoring());
            System.out.println("Jokers:  " + engine.active());
            System.out.println("Effect:  " + result.result().aggregate());
            System.out.printf("%nChips %d x Mult %.2f = %d%n",
                    result.score().chips(), result.score().mult(), result.score().score());
            System.out.println("Money: $" + money + " -> $" + result.score().wallet());
            if (engine.modifiers().debtLimit() > 0) {
                System.out.println("Shop spending: $" + engine.modifiers().spendable(result.score().wallet()));
            }
            for (HookError error : result.result().errors()) {
                System.out.println("! " + error);
            }
            if (!result.result().removals().isEmpty()) {
                System.out.println("Removed: " + result.result().removals());
            }
            return 0;
        }
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Simulate whole runs with a joker lineup")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-games"}, defaultValue = "1000",
                description = "Number of games to simulate")
        int numGames;

        @Option(names = {"-s", "--seed"},
                description = "Base seed (optional, defaults to the config seed)")
        Long seed;

        @Option(names = {"-v", "--verbose"},
                description = "Verbose output (single game trace)")
        boolean verbose;

        @Option(names = {"-j", "--joker"},
                description = "Joker to acquire, in run order (repeatable): wire_name[:key=value,...]")
        List<String> jokers = new ArrayList<>();

        @Option(names = {"-d", "--deck"},
                description = "Path to deck file (defaults to the standard 52 cards)")
        String deckPath;

        @Option(names = {"-t", "--threads"},
                description = "Worker threads (0 = common pool)")
        Integer threads;

        @Option(names = {"-c", "--config"},
                description = "Path to an engine config JSON (defaults to the bundled one)")
        String configPath;

        @Override
        public Integer call() {
            EngineConfig config;
            try {
                config = loadConfig(configPath, null, threads);
            } catch (ConfigException e) {
                System.err.println("✗ Failed to load config: " + e.getMessage());
                return 1;
            }

            Deck deck;
            try {
                deck = deckPath == null ? Deck.standard() : Deck.loadFromFile(deckPath);
            } catch (Deck.DeckException e) {
                System.err.println("✗ Failed to parse deck file '" + deckPath + "': " + e.getMessage());
                return 1;
            }

            List<JokerLoadout> loadout = new ArrayList<>();
            JokerRegistry registry = JokerRegistry.global();
            JokerEngine validator = new JokerEngine(registry, config);
            for (String text : jokers) {
                try {
                    JokerLoadout joker = JokerLoadout.parse(text);
                    validator.acquire(joker.wireName(), joker.args());
                    loadout.add(joker);
                } catch (ConstructionException | IllegalArgumentException e) {
                    System.err.println("✗ Cannot acquire '" + text + "': " + e.getMessage());
                    return 1;
                }
            }

            long baseSeed = seed != null ? seed : config.getDefaultSeed();
            System.out.println("\n=== Joker Run Simulator ===\n");
            System.out.println("Deck: " + deck.getName() + " (" + deck.size() + " cards)");
            System.out.println("Jokers: " + (loadout.isEmpty() ? "none" : loadout));
            System.out.println("Games: " + numGames);
            System.out.println("Seed: " + baseSeed);
            System.out.println();

            if (verbose) {
                SimulationEngine.runGame(deck.getCards(), loadout, baseSeed, registry, config, true);
                return 0;
            }

            long startTime = System.currentTimeMillis();
            List<SimulationResult> results = SimulationEngine.runBatch(
                    deck.getCards(), loadout, numGames, baseSeed, registry, config);
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, numGames, elapsed);
            return 0;
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Load the config file or the bundled default, then apply command-line overrides.
     */
    static EngineConfig loadConfig(String path, Double maxMult, Integer threads) throws ConfigException {
        EngineConfig config = path != null
                ? EngineConfig.fromFile(path)
                : EngineConfig.fromResource(EngineConfig.DEFAULT_RESOURCE);
        if (maxMult != null) {
            config = config.withMaxMult(maxMult);
        }
        if (threads != null) {
            config = config.withSimulationThreads(threads);
        }
        return config;
    }

    /**
     * Print simulation results.
     */
    private static void printResults(List<SimulationResult> results, int numGames, long elapsedMs) {
        long wins = results.stream().filter(SimulationResult::isWin).count();
        double winRate = (double) wins / numGames;
        double avgAntes = results.stream().mapToInt(SimulationResult::antesCleared).average().orElse(0.0);
        double avgBest = results.stream().mapToLong(SimulationResult::bestHand).average().orElse(0.0);
        long hookErrors = results.stream().mapToLong(SimulationResult::hookErrors).sum();

        // Ante distribution
        Map<Integer, Long> anteDist = new TreeMap<>();
        for (SimulationResult r : results) {
            anteDist.merge(r.antesCleared(), 1L, Long::sum);
        }

        System.out.println("=== Results ===\n");
        System.out.printf("Win rate: %.1f%% (%d/%d)%n", winRate * 100.0, wins, numGames);
        System.out.printf("Average antes cleared: %.2f%n", avgAntes);
        System.out.printf("Average best hand: %.0f%n", avgBest);
        if (hookErrors > 0) {
            System.out.println("Joker hook failures: " + hookErrors);
        }
        System.out.println();

        System.out.println("Antes cleared:");
        for (Map.Entry<Integer, Long> entry : anteDist.entrySet()) {
            double pct = (double) entry.getValue() / numGames * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  %d: %5.1f%% %s (%d)%n", entry.getKey(), pct, bar, entry.getValue());
        }

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double gamesPerSec = elapsedSec > 0 ? numGames / elapsedSec : 0;
        System.out.printf("Simulation completed in %.2fs (%.0f games/sec)%n", elapsedSec, gamesPerSec);
    }
}
