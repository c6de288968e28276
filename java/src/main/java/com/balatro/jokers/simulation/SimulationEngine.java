package com.balatro.jokers.simulation;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.HandEvaluator;
import com.balatro.jokers.card.HandRules;
import com.balatro.jokers.card.PlayedHand;
import com.balatro.jokers.config.EngineConfig;
import com.balatro.jokers.context.DeckComposition;
import com.balatro.jokers.context.ModifierSummary;
import com.balatro.jokers.context.RunState;
import com.balatro.jokers.context.Stage;
import com.balatro.jokers.effect.EffectApplier;
import com.balatro.jokers.effect.SaturatingMath;
import com.balatro.jokers.engine.HandResult;
import com.balatro.jokers.engine.JokerEngine;
import com.balatro.jokers.engine.LifecycleResult;
import com.balatro.jokers.factory.ConstructionException;
import com.balatro.jokers.joker.GameEvent;
import com.balatro.jokers.registry.JokerRegistry;
import com.balatro.jokers.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * Plays whole runs against a joker loadout: deal, pick the best hand, score it
 * through a {@link JokerEngine}, and advance blinds and antes until the run is won or lost.
 * The player model is greedy and deterministic for a given seed.
 */
public final class SimulationEngine {
    private static final Logger logger = LoggerFactory.getLogger(SimulationEngine.class);

    public static final int FINAL_ANTE = 8;

    // Small blind score target per ante; big and boss blinds scale it
    private static final long[] ANTE_TARGETS = {300, 800, 2000, 5000, 11000, 20000, 35000, 50000};
    private static final Stage[] BLINDS = {Stage.SMALL_BLIND, Stage.BIG_BLIND, Stage.BOSS_BLIND};
    private static final double[] BLIND_MULTIPLIERS = {1.0, 1.5, 2.0};
    private static final int[] BLIND_REWARDS = {3, 4, 5};

    static final int STARTING_MONEY = 4;
    static final int HANDS_PER_ROUND = 4;
    static final int DISCARDS_PER_ROUND = 3;
    static final int HAND_SIZE = 8;
    static final int MAX_PLAYED = 5;
    static final int INTEREST_CAP = 5;

    private SimulationEngine() {
        // Utility class - prevent instantiation
    }

    // ==================== TARGETS ====================

    /**
     * Score needed to beat a blind.
     * @param blindIndex 0 small, 1 big, 2 boss
     */
    public static long blindTarget(int ante, int blindIndex) {
        int index = Math.min(Math.max(ante, 1), ANTE_TARGETS.length) - 1;
        return (long) (ANTE_TARGETS[index] * BLIND_MULTIPLIERS[blindIndex]);
    }

    /**
     * $1 per $5 held, up to the cap.
     */
    public static int interest(int money) {
        return Math.max(0, Math.min(money / 5, INTEREST_CAP));
    }

    // ==================== HAND CHOICE ====================

    /**
     * Estimated value of a selection before jokers: base chips plus scoring card chips, times base mult.
     */
    static long estimate(PlayedHand hand) {
        long chips = hand.getRank().getBaseChips();
        for (Card card : hand.getScoring()) {
            chips += card.chipValue();
        }
        return chips * hand.getRank().getBaseMult();
    }

    /**
     * Pick the selection of up to five cards with the highest estimate.
     * Ties keep the earliest selection, so the choice is stable for a given hand order.
     */
    public static List<Card> chooseBestHand(List<Card> hand, HandRules rules) {
        int n = Math.min(hand.size(), 12);
        List<Card> best = List.of();
        long bestValue = -1;
        for (int mask = 1; mask < (1 << n); mask++) {
            if (Integer.bitCount(mask) > MAX_PLAYED) {
                continue;
            }
            List<Card> selection = new ArrayList<>(MAX_PLAYED);
            for (int i = 0; i < n; i++) {
                if ((mask & (1 << i)) != 0) {
                    selection.add(hand.get(i));
                }
            }
            long value = estimate(HandEvaluator.evaluate(selection, List.of(), rules));
            if (value > bestValue) {
                bestValue = value;
                best = selection;
            }
        }
        return best;
    }

    /**
     * Cards to throw away: the lowest-chip cards outside the chosen hand, at most five.
     */
    static List<Card> chooseDiscards(List<Card> hand, List<Card> keep) {
        List<Card> candidates = new ArrayList<>(hand);
        for (Card card : keep) {
            candidates.remove(card);
        }
        candidates.sort(Comparator.comparingInt(Card::chipValue));
        return new ArrayList<>(candidates.subList(0, Math.min(MAX_PLAYED, candidates.size())));
    }

    private static void draw(List<Card> library, List<Card> hand, int handSize) {
        while (hand.size() < handSize && !library.isEmpty()) {
            hand.add(library.remove(library.size() - 1));
        }
    }

    // ==================== GAME ====================

    /**
     * Run one game.
     *
     * @param deck     The cards of the run's deck
     * @param loadout  Jokers acquired before the first blind, in run order
     * @param seed     Seed for shuffles and every joker roll
     * @param verbose  Print a trace of every hand
     */
    public static SimulationResult runGame(List<Card> deck, List<JokerLoadout> loadout, long seed,
                                           JokerRegistry registry, EngineConfig config, boolean verbose) {
        GameRng rng = new GameRng(seed);
        JokerEngine engine = new JokerEngine(registry, config);
        DeckComposition composition = DeckComposition.of(deck, deck.size());
        RunState run = RunState.builder()
            .seed(seed)
            .money(STARTING_MONEY)
            .deck(composition)
            .build();
        engine.updateRun(run);

        for (JokerLoadout joker : loadout) {
            try {
                engine.acquire(joker.wireName(), joker.args());
            } catch (ConstructionException e) {
                logger.warn("Skipping joker {}: {}", joker, e.getMessage());
            }
        }

        if (verbose) {
            System.out.println("=== Run Start (seed: " + seed + ") ===");
            System.out.println("Jokers: " + engine.active());
        }

        int money = STARTING_MONEY;
        int roundsWon = 0;
        int handsPlayed = 0;
        int hookErrors = 0;
        long bestHand = 0;
        int round = 0;

        for (int ante = 1; ante <= FINAL_ANTE; ante++) {
            for (int blind = 0; blind < BLINDS.length; blind++) {
                round++;
                long target = blindTarget(ante, blind);
                ModifierSummary modifiers = engine.modifiers();
                int hands = Math.max(1, HANDS_PER_ROUND + modifiers.handsDelta());
                int discards = Math.max(0, DISCARDS_PER_ROUND + modifiers.discardsDelta());
                int handSize = Math.max(1, HAND_SIZE + modifiers.handSizeDelta());

                List<Card> library = new ArrayList<>(deck);
                rng.shuffle(library);
                List<Card> hand = new ArrayList<>();
                draw(library, hand, handSize);

                run = run.toBuilder()
                    .ante(ante)
                    .round(round)
                    .stage(BLINDS[blind])
                    .money(money)
                    .handsRemaining(hands)
                    .discardsRemaining(discards)
                    .handSize(handSize)
                    .handsPlayedThisRound(0)
                    .discardsUsedThisRound(0)
                    .handIndex(0)
                    .deck(composition.withRemaining(library.size()))
                    .build();
                LifecycleResult start = engine.roundStarted(run);
                money = EffectApplier.applyMoney(money, start.money());
                hookErrors += start.result().errors().size();

                if (verbose) {
                    System.out.printf("%nAnte %d %s: target %d%n", ante, BLINDS[blind].getJsonValue(), target);
                }

                long scored = 0;
                int handIndex = 0;
                int discardsUsed = 0;
                while (scored < target && hands > 0 && !hand.isEmpty()) {
                    HandRules rules = engine.modifiers().handRules();
                    List<Card> chosen = chooseBestHand(hand, rules);
                    long estimate = estimate(HandEvaluator.evaluate(chosen, List.of(), rules));

                    if (discards > 0 && estimate * hands < target - scored && !library.isEmpty()) {
                        List<Card> thrown = chooseDiscards(hand, chosen);
                        if (!thrown.isEmpty()) {
                            discards--;
                            discardsUsed++;
                            run = run.toBuilder()
                                .money(money)
                                .discardsRemaining(discards)
                                .discardsUsedThisRound(discardsUsed)
                                .build();
                            LifecycleResult discarded = engine.discard(thrown, run);
                            money = EffectApplier.applyMoney(money, discarded.money());
                            hookErrors += discarded.result().errors().size();
                            for (Card card : thrown) {
                                hand.remove(card);
                            }
                            draw(library, hand, handSize);
                            continue;
                        }
                    }

                    for (Card card : chosen) {
                        hand.remove(card);
                    }
                    run = run.toBuilder()
                        .money(money)
                        .handsRemaining(hands)
                        .handsPlayedThisRound(handIndex)
                        .handsPlayedThisRun(handsPlayed)
                        .handIndex(handIndex)
                        .deck(composition.withRemaining(library.size()))
                        .build();
                    HandResult result = engine.process(chosen, hand, run);
                    long score = result.score().score();
                    scored = SaturatingMath.add(scored, score);
                    money = result.score().wallet();
                    bestHand = Math.max(bestHand, score);
                    hookErrors += result.result().errors().size();
                    run = run.toBuilder().recordPlayed(result.hand().getRank()).build();

                    hands--;
                    handIndex++;
                    handsPlayed++;
                    draw(library, hand, handSize);

                    if (verbose) {
                        System.out.printf("  %-16s %-28s chips %d x mult %.1f = %d (total %d)%n",
                            result.hand().getRank().getDisplayName(), chosen, result.score().chips(),
                            result.score().mult(), score, scored);
                    }
                }

                if (scored < target) {
                    if (verbose) {
                        System.out.printf("Lost at ante %d with %d / %d%n", ante, scored, target);
                    }
                    return new SimulationResult(seed, ante - 1, roundsWon, handsPlayed, bestHand,
                        money, engine.size(), hookErrors);
                }

                roundsWon++;
                run = run.toBuilder().money(money).handsRemaining(hands).stage(Stage.POST_BLIND).build();
                LifecycleResult end = engine.roundEnded(run);
                money = EffectApplier.applyMoney(money, end.money());
                hookErrors += end.result().errors().size();
                if (BLINDS[blind] == Stage.BOSS_BLIND) {
                    LifecycleResult boss = engine.dispatch(new GameEvent.BossBlindDefeated(), run);
                    money = EffectApplier.applyMoney(money, boss.money());
                    hookErrors += boss.result().errors().size();
                }
                money = EffectApplier.applyMoney(money,
                    BLIND_REWARDS[blind] + hands + interest(money) + end.result().aggregate().getInterestBonus());
                run = run.toBuilder().money(money).stage(Stage.SHOP).build();
                LifecycleResult shop = engine.dispatch(new GameEvent.ShopExited(), run);
                money = EffectApplier.applyMoney(money, shop.money());
                hookErrors += shop.result().errors().size();
            }
        }

        if (verbose) {
            System.out.println("\nRun won with $" + money);
        }
        return new SimulationResult(seed, FINAL_ANTE, roundsWon, handsPlayed, bestHand,
            money, engine.size(), hookErrors);
    }

    // ==================== BATCH ====================

    /**
     * Run {@code games} independent games with seeds {@code baseSeed, baseSeed + 1, ...}.
     * Each game owns its engine; only the registry is shared. Results are in seed order.
     */
    public static List<SimulationResult> runBatch(List<Card> deck, List<JokerLoadout> loadout, int games,
                                                  long baseSeed, JokerRegistry registry, EngineConfig config) {
        int threads = config.getSimulationThreads();
        if (threads <= 0) {
            return runRange(deck, loadout, games, baseSeed, registry, config);
        }
        ForkJoinPool pool = new ForkJoinPool(threads);
        try {
            return pool.submit(() -> runRange(deck, loadout, games, baseSeed, registry, config)).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Simulation failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private static List<SimulationResult> runRange(List<Card> deck, List<JokerLoadout> loadout, int games,
                                                   long baseSeed, JokerRegistry registry, EngineConfig config) {
        return IntStream.range(0, games)
            .parallel()
            .mapToObj(i -> runGame(deck, loadout, baseSeed + i, registry, config, false))
            .toList();
    }
}
