package com.balatro.jokers.engine;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.HandEvaluator;
import com.balatro.jokers.card.PlayedHand;
import com.balatro.jokers.compat.JokerCollection;
import com.balatro.jokers.config.EngineConfig;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.JokerStateStore;
import com.balatro.jokers.context.ModifierSummary;
import com.balatro.jokers.context.RunState;
import com.balatro.jokers.context.StoreBound;
import com.balatro.jokers.effect.AppliedScore;
import com.balatro.jokers.effect.EffectApplier;
import com.balatro.jokers.effect.JokerSpawn;
import com.balatro.jokers.effect.SaturatingMath;
import com.balatro.jokers.factory.ConstructionArgs;
import com.balatro.jokers.factory.ConstructionException;
import com.balatro.jokers.factory.JokerFactory;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.GameEvent;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerLifecycle;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.JokerState;
import com.balatro.jokers.joker.StateDeserializeException;
import com.balatro.jokers.joker.UnsupportedStateVersionException;
import com.balatro.jokers.persistence.DecodedSave;
import com.balatro.jokers.persistence.EntryFailure;
import com.balatro.jokers.persistence.JokerSaveCodec;
import com.balatro.jokers.persistence.SaveEntry;
import com.balatro.jokers.persistence.SaveFormatException;
import com.balatro.jokers.pipeline.JokerEffectProcessor;
import com.balatro.jokers.pipeline.ProcessingResult;
import com.balatro.jokers.pipeline.RemovalDirective;
import com.balatro.jokers.registry.JokerRegistry;
import com.balatro.jokers.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The joker side of one game: the active jokers in run order, their state store, and
 * the operations the game engine drives (acquire, sell, score, round and event hooks,
 * save and load).
 * <p>
 * One engine belongs to one game and is not thread-safe. Parallel simulations build
 * one engine per game over a shared {@link JokerRegistry}.
 */
public final class JokerEngine {
    private static final Logger logger = LoggerFactory.getLogger(JokerEngine.class);

    private static final int ROUND_START_SCOPE = -1;
    private static final int ROUND_END_SCOPE = -2;

    private final JokerRegistry registry;
    private final JokerFactory factory;
    private final EngineConfig config;
    private final JokerEffectProcessor processor;
    private final EffectApplier applier;
    private final JokerSaveCodec codec;

    private JokerCollection jokers = new JokerCollection();
    private JokerStateStore store = new JokerStateStore();
    private Map<Joker, Slot> slots = new IdentityHashMap<>();
    private int nextSlot = 1;
    private int lifecyclePasses;
    private RunState run;

    public JokerEngine(JokerRegistry registry) {
        this(registry, EngineConfig.defaults());
    }

    public JokerEngine(JokerRegistry registry, EngineConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.factory = new JokerFactory(registry);
        this.processor = new JokerEffectProcessor(config.getMaxRetriggersPerCard(), this::label);
        this.applier = new EffectApplier(config.getMaxMult());
        this.codec = new JokerSaveCodec();
        this.run = RunState.initial(config.getDefaultSeed());
    }

    /**
     * Per-instance bookkeeping that is not part of the joker's own state.
     */
    private static final class Slot {
        final InstanceHandle handle;
        int sellValueBonus;

        Slot(InstanceHandle handle, int sellValueBonus) {
            this.handle = handle;
            this.sellValueBonus = sellValueBonus;
        }
    }

    // ==================== RUN STATE ====================

    /**
     * Replace the run snapshot used by operations that do not take one (acquire, sell, save).
     */
    public void updateRun(RunState newRun) {
        this.run = Objects.requireNonNull(newRun, "run");
    }

    public RunState run() {
        return run;
    }

    // ==================== ACQUIRE / SELL ====================

    public InstanceHandle acquire(JokerId id) throws ConstructionException {
        return acquire(id, ConstructionArgs.EMPTY);
    }

    /**
     * Build a joker and add it at the end of run order.
     * @throws ConstructionException if the identifier is not implemented or an argument is invalid
     */
    public InstanceHandle acquire(JokerId id, ConstructionArgs args) throws ConstructionException {
        return install(factory.create(id, args));
    }

    /**
     * Acquire by wire name, as typed by a user or read from a shop listing.
     */
    public InstanceHandle acquire(String wireName, ConstructionArgs args) throws ConstructionException {
        return install(factory.create(wireName, args));
    }

    private InstanceHandle install(Joker joker) {
        InstanceHandle handle = place(joker, nextSlot++, 0, jokers, store, slots);
        GameContext context = context(run, null, null);
        if (joker instanceof JokerLifecycle) {
            JokerLifecycle lifecycle = (JokerLifecycle) joker;
            guarded(handle, "onAcquire", () -> lifecycle.onAcquire(context));
        }
        notifySiblings(joker, sibling -> sibling.onSiblingAdded(joker.id()), "onSiblingAdded");
        logger.debug("Acquired {}", handle);
        return handle;
    }

    /**
     * Attach a joker to a store and append it to a collection. Used for live acquisition
     * and for building the replacement collection during a load.
     */
    private InstanceHandle place(Joker joker, int slot, int sellBonus,
                                 JokerCollection into, JokerStateStore intoStore, Map<Joker, Slot> intoSlots) {
        InstanceHandle handle = new InstanceHandle(joker.id(), slot);
        if (joker instanceof StoreBound) {
            ((StoreBound) joker).attach(handle.toKey(), intoStore);
        }
        if (joker instanceof AdvancedJoker) {
            AdvancedJoker advanced = (AdvancedJoker) joker;
            advanced.conditionCache().setEnabled(config.isConditionCacheEnabled());
            advanced.conditionCache().setMaxEntries(config.getConditionCacheMaxEntries());
        }
        into.add(joker);
        intoSlots.put(joker, new Slot(handle, sellBonus));
        return handle;
    }

    /**
     * Sell an active joker. Its sale hook runs first, then it leaves the run, then the
     * remaining jokers see a {@link GameEvent.JokerSold}.
     * @throws IllegalArgumentException if the handle is not active
     */
    public SaleOutcome sell(InstanceHandle handle) {
        Joker joker = find(handle).orElseThrow(() ->
            new IllegalArgumentException("No active joker " + handle));
        int value = sellValue(joker);

        GameContext context = context(run, null, scopedRng(nextEventScope()));
        ProcessingResult onSell = processor.processSingle(context, joker, "onSell", JokerLifecycle::onSell);
        detach(joker);
        notifySiblings(joker, sibling -> sibling.onSiblingRemoved(joker.id()), "onSiblingRemoved");

        List<InstanceHandle> spawned = new ArrayList<>(resolve(onSell, context));
        LifecycleResult reactions = dispatch(new GameEvent.JokerSold(joker.id()), run);
        spawned.addAll(reactions.spawned());
        logger.debug("Sold {} for {}", handle, value);
        return new SaleOutcome(handle, value, onSell, reactions.result(), spawned);
    }

    public int sellValue(InstanceHandle handle) {
        Joker joker = find(handle).orElseThrow(() ->
            new IllegalArgumentException("No active joker " + handle));
        return sellValue(joker);
    }

    private int sellValue(Joker joker) {
        int base = metadataOf(joker).map(JokerMetadata::baseSellValue).orElse(1);
        Slot slot = slots.get(joker);
        return Math.max(0, base + (slot != null ? slot.sellValueBonus : 0));
    }

    private Optional<JokerMetadata> metadataOf(Joker joker) {
        if (joker instanceof JokerIdentity) {
            return Optional.of(((JokerIdentity) joker).metadata());
        }
        return registry.metadata(joker.id());
    }

    // ==================== SCORING ====================

    /**
     * Classify and score a played selection.
     * @param played Cards played, in play order
     * @param held   Cards left in hand
     */
    public HandResult process(List<Card> played, List<Card> held, RunState runState) {
        PlayedHand hand = HandEvaluator.evaluate(played, held, modifiers().handRules());
        return process(hand, runState);
    }

    /**
     * Score an already classified hand and resolve the pass's directives.
     */
    public HandResult process(PlayedHand hand, RunState runState) {
        updateRun(runState);
        ModifierSummary modifiers = modifiers();
        GameContext context = GameContext.builder(runState)
            .hand(hand)
            .jokers(jokers.snapshot())
            .store(store)
            .modifiers(modifiers)
            .sellValues(this::sellValue)
            .maxMult(config.getMaxMult())
            .build();

        ProcessingResult result = processor.process(context);
        List<InstanceHandle> spawned = resolve(result, context);

        long baseChips = HandScorer.baseChips(hand, result);
        double baseMult = HandScorer.baseMult(hand, result);
        AppliedScore score = applier.apply(baseChips, baseMult, runState.getMoney(), result.aggregate());
        return new HandResult(hand, result, score, spawned);
    }

    // ==================== LIFECYCLE ====================

    /**
     * A blind was selected.
     */
    public LifecycleResult roundStarted(RunState runState) {
        updateRun(runState);
        lifecyclePasses = 0;
        return lifecycle(runState, ROUND_START_SCOPE, "onRoundStart", JokerLifecycle::onRoundStart);
    }

    /**
     * A blind was won. The result's money is the round-end payout.
     */
    public LifecycleResult roundEnded(RunState runState) {
        updateRun(runState);
        return lifecycle(runState, ROUND_END_SCOPE, "onRoundEnd", JokerLifecycle::onRoundEnd);
    }

    public LifecycleResult discard(List<Card> discarded, RunState runState) {
        updateRun(runState);
        List<Card> cards = List.copyOf(discarded);
        return lifecycle(runState, nextEventScope(), "onDiscard", (joker, ctx) -> joker.onDiscard(ctx, cards));
    }

    /**
     * Forward a notification from the shop, packs, consumables or deck edits.
     */
    public LifecycleResult dispatch(GameEvent event, RunState runState) {
        updateRun(runState);
        return lifecycle(runState, nextEventScope(), "onGameEvent", (joker, ctx) -> joker.onGameEvent(ctx, event));
    }

    private LifecycleResult lifecycle(RunState runState, int scope, String hookName,
                                      JokerEffectProcessor.LifecycleHook hook) {
        GameContext context = context(runState, null, scopedRng(scope));
        ProcessingResult result = processor.processLifecycle(context, hookName, hook);
        List<InstanceHandle> spawned = resolve(result, context);
        return new LifecycleResult(result, spawned);
    }

    private int nextEventScope() {
        return -3 - lifecyclePasses++;
    }

    private GameRng scopedRng(int scope) {
        return GameRng.scoped(run.getSeed(), run.getAnte(), run.getRound(), scope);
    }

    // ==================== DIRECTIVES ====================

    /**
     * Apply what a pass deferred: removals, sell value changes, then spawns.
     * @return handles of spawned jokers
     */
    private List<InstanceHandle> resolve(ProcessingResult result, GameContext context) {
        for (RemovalDirective removal : result.removals()) {
            Joker joker = removal.joker();
            if (!slots.containsKey(joker)) {
                continue;
            }
            if (joker instanceof JokerLifecycle) {
                JokerLifecycle lifecycle = (JokerLifecycle) joker;
                guarded(slots.get(joker).handle, "onDestroy", () -> lifecycle.onDestroy(context));
            }
            InstanceHandle handle = detach(joker);
            notifySiblings(joker, sibling -> sibling.onSiblingRemoved(joker.id()), "onSiblingRemoved");
            logger.debug("Removed {} ({} by {})", handle, removal.reason(), removal.cause());
        }

        result.sellValueIncreases().forEach((joker, amount) -> {
            Slot slot = slots.get(joker);
            if (slot != null) {
                slot.sellValueBonus = SaturatingMath.add(slot.sellValueBonus, amount.intValue());
            }
        });
        int all = result.aggregate().getSellValueIncreaseAll();
        if (all != 0) {
            for (Slot slot : slots.values()) {
                slot.sellValueBonus = SaturatingMath.add(slot.sellValueBonus, all);
            }
        }

        List<InstanceHandle> spawned = new ArrayList<>();
        for (JokerSpawn spawn : result.aggregate().getJokerSpawns()) {
            if (jokers.size() >= run.getJokerSlots()) {
                logger.debug("No free joker slot for {}", spawn);
                break;
            }
            spawn(spawn, context.rng()).ifPresent(spawned::add);
        }
        return spawned;
    }

    private Optional<InstanceHandle> spawn(JokerSpawn spawn, GameRng rng) {
        if (spawn.kind() == JokerSpawn.Kind.RANDOM_OF_RARITY) {
            List<JokerId> candidates = registry.byRarity(spawn.rarity());
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            JokerId id = rng.pick(candidates);
            try {
                return Optional.of(install(factory.create(id)));
            } catch (ConstructionException e) {
                logger.warn("Could not spawn {}: {}", id, e.getMessage());
                return Optional.empty();
            }
        }

        if (jokers.isEmpty()) {
            return Optional.empty();
        }
        Joker original = jokers.get(rng.nextInt(jokers.size()));
        Joker copy;
        try {
            copy = factory.create(original.id());
        } catch (ConstructionException e) {
            logger.warn("Could not duplicate {}: {}", label(original), e.getMessage());
            return Optional.empty();
        }
        InstanceHandle handle = install(copy);
        if (original instanceof JokerState && copy instanceof JokerState) {
            JokerState source = (JokerState) original;
            try {
                ((JokerState) copy).deserializeState(source.stateVersion(), source.serializeState());
            } catch (StateDeserializeException e) {
                logger.warn("Duplicate {} of {} starts fresh: {}", handle, label(original), e.getMessage());
            }
        }
        return Optional.of(handle);
    }

    private InstanceHandle detach(Joker joker) {
        Slot slot = slots.remove(joker);
        jokers.remove(joker);
        store.remove(slot.handle.toKey());
        return slot.handle;
    }

    private void notifySiblings(Joker changed, Consumer<JokerLifecycle> notification, String hookName) {
        for (Joker sibling : jokers.snapshot()) {
            if (sibling != changed && sibling instanceof JokerLifecycle) {
                JokerLifecycle lifecycle = (JokerLifecycle) sibling;
                guarded(slots.get(sibling).handle, hookName, () -> notification.accept(lifecycle));
            }
        }
    }

    private static void guarded(InstanceHandle handle, String hookName, Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            logger.warn("Hook {} of {} failed", hookName, handle, e);
        }
    }

    // ==================== QUERIES ====================

    /**
     * Passive modifiers of every active joker combined.
     */
    public ModifierSummary modifiers() {
        return ModifierSummary.collect(jokers);
    }

    /**
     * Active jokers in run order.
     */
    public List<InstanceHandle> active() {
        List<InstanceHandle> handles = new ArrayList<>(jokers.size());
        for (Joker joker : jokers) {
            handles.add(slots.get(joker).handle);
        }
        return handles;
    }

    public List<Joker> jokers() {
        return jokers.snapshot();
    }

    public Optional<Joker> find(InstanceHandle handle) {
        for (Joker joker : jokers) {
            if (slots.get(joker).handle.equals(handle)) {
                return Optional.of(joker);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return jokers.size();
    }

    public JokerStateStore store() {
        return store;
    }

    public EngineConfig config() {
        return config;
    }

    public JokerRegistry registry() {
        return registry;
    }

    // ==================== SAVE / LOAD ====================

    /**
     * Write every active joker, in run order, to a versioned blob.
     */
    public byte[] serializeAll() throws SaveFormatException {
        List<SaveEntry> entries = new ArrayList<>(jokers.size());
        int position = 0;
        for (Joker joker : jokers) {
            Slot slot = slots.get(joker);
            if (joker instanceof JokerState) {
                JokerState state = (JokerState) joker;
                entries.add(new SaveEntry(position, joker.id().wireName(), slot.handle.slot(),
                    state.stateVersion(), slot.sellValueBonus, state.serializeState()));
            } else {
                entries.add(new SaveEntry(position, joker.id().wireName(), slot.handle.slot(),
                    1, slot.sellValueBonus, null));
            }
            position++;
        }
        return codec.encode(entries);
    }

    /**
     * Replace the active jokers with the contents of a blob. Entries that cannot be
     * restored are reported and skipped; the rest load in their saved order.
     * @throws SaveFormatException if the blob as a whole is unreadable or too new;
     *         the current jokers are then left untouched
     */
    public LoadReport deserializeAll(byte[] blob) throws SaveFormatException {
        DecodedSave decoded = codec.decode(blob);

        JokerCollection loaded = new JokerCollection();
        JokerStateStore loadedStore = new JokerStateStore();
        Map<Joker, Slot> loadedSlots = new IdentityHashMap<>();
        List<InstanceHandle> handles = new ArrayList<>();
        List<EntryFailure> failures = new ArrayList<>(decoded.failures());
        Set<Integer> usedSlots = new HashSet<>();
        int highestSlot = 0;

        for (SaveEntry entry : decoded.entries()) {
            if (entry.slot() < 0 || !usedSlots.add(entry.slot())) {
                failures.add(new EntryFailure(entry.position(), entry.id(), EntryFailure.Reason.MALFORMED_ENTRY,
                    "slot " + entry.slot() + " is negative or already used"));
                continue;
            }

            Joker joker;
            try {
                joker = factory.create(entry.id(), ConstructionArgs.EMPTY);
            } catch (ConstructionException e) {
                EntryFailure.Reason reason = e.getReason() == ConstructionException.Reason.UNKNOWN_IDENTIFIER
                    ? EntryFailure.Reason.UNKNOWN_IDENTIFIER
                    : EntryFailure.Reason.NOT_CONSTRUCTIBLE;
                failures.add(new EntryFailure(entry.position(), entry.id(), reason, e.getMessage()));
                continue;
            }

            JokerCollection staging = new JokerCollection();
            Map<Joker, Slot> stagingSlots = new IdentityHashMap<>();
            InstanceHandle handle = place(joker, entry.slot(), entry.sellValueBonus(),
                staging, loadedStore, stagingSlots);
            if (joker instanceof JokerState && entry.state() != null) {
                try {
                    ((JokerState) joker).deserializeState(entry.schemaVersion(), entry.state());
                } catch (UnsupportedStateVersionException e) {
                    loadedStore.remove(handle.toKey());
                    failures.add(new EntryFailure(entry.position(), entry.id(),
                        EntryFailure.Reason.UNSUPPORTED_STATE_VERSION, e.getMessage()));
                    continue;
                } catch (StateDeserializeException e) {
                    loadedStore.remove(handle.toKey());
                    failures.add(new EntryFailure(entry.position(), entry.id(),
                        EntryFailure.Reason.STATE_REJECTED, e.getMessage()));
                    continue;
                }
            }
            loaded.add(joker);
            loadedSlots.putAll(stagingSlots);
            handles.add(handle);
            highestSlot = Math.max(highestSlot, entry.slot());
        }

        for (EntryFailure failure : failures) {
            logger.warn("Save entry lost: {}", failure);
        }

        this.jokers = loaded;
        this.store = loadedStore;
        this.slots = loadedSlots;
        this.nextSlot = Math.max(nextSlot, highestSlot + 1);
        logger.info("Loaded {} jokers from format {} save ({} lost)",
            handles.size(), decoded.formatVersion(), failures.size());
        return new LoadReport(decoded.formatVersion(), handles, failures);
    }

    // ==================== HELPERS ====================

    private GameContext context(RunState runState, PlayedHand hand, GameRng rng) {
        GameContext.Builder builder = GameContext.builder(runState)
            .jokers(jokers.snapshot())
            .store(store)
            .sellValues(this::sellValue)
            .maxMult(config.getMaxMult());
        if (hand != null) {
            builder.hand(hand);
        }
        if (rng != null) {
            builder.rng(rng);
        }
        return builder.build();
    }

    private String label(Joker joker) {
        Slot slot = slots.get(joker);
        return slot != null ? slot.handle.toString() : joker.id().wireName();
    }
}
