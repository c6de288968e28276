package com.balatro.jokers.pipeline;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.CardTransform;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.effect.NumericViolation;
import com.balatro.jokers.effect.SaturatingMath;
import com.balatro.jokers.joker.Joker;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs joker hooks over one evaluation in run order and folds their effects.
 * <p>
 * Scoring a hand is two passes over the same snapshot of the joker list: every
 * {@link JokerGameplay#onHandPlayed} first, then every {@link JokerGameplay#onCardScored}
 * for each scoring card in hand order. Retriggers requested during a card's first
 * evaluation replay that card, up to the configured limit. Lifecycle moments
 * (round start, discards, events...) are single passes through {@link #processLifecycle}.
 * <p>
 * A hook that throws is skipped: its effect counts as identity and the failure is
 * reported in the result. Removals are only collected here, never applied, so every
 * hook of a pass sees the same sibling list.
 */
public final class JokerEffectProcessor {
    private static final Logger logger = LoggerFactory.getLogger(JokerEffectProcessor.class);

    public static final int DEFAULT_MAX_RETRIGGERS_PER_CARD = 10;

    /**
     * One lifecycle hook, invoked on a joker that supports the lifecycle capability.
     */
    @FunctionalInterface
    public interface LifecycleHook {
        JokerEffect invoke(JokerLifecycle joker, GameContext context);
    }

    private final int maxRetriggersPerCard;
    private final Function<Joker, String> labeler;

    public JokerEffectProcessor() {
        this(DEFAULT_MAX_RETRIGGERS_PER_CARD, joker -> joker.id().wireName());
    }

    /**
     * @param maxRetriggersPerCard Upper bound on extra evaluations of one scoring card
     * @param labeler              Names an instance in errors and violation reports
     */
    public JokerEffectProcessor(int maxRetriggersPerCard, Function<Joker, String> labeler) {
        if (maxRetriggersPerCard < 0) {
            throw new IllegalArgumentException("maxRetriggersPerCard must be >= 0: " + maxRetriggersPerCard);
        }
        this.maxRetriggersPerCard = maxRetriggersPerCard;
        this.labeler = labeler;
    }

    public int getMaxRetriggersPerCard() {
        return maxRetriggersPerCard;
    }

    // ==================== HAND ====================

    /**
     * Score one hand. The context carries the hand, the joker snapshot and the accumulator.
     */
    public ProcessingResult process(GameContext context) {
        Pass pass = new Pass(context);
        List<Joker> jokers = context.jokers();

        // Pass 1: hand-level hooks
        for (int i = 0; i < jokers.size(); i++) {
            Joker joker = jokers.get(i);
            if (joker instanceof JokerGameplay) {
                JokerGameplay gameplay = (JokerGameplay) joker;
                pass.run(i, "onHandPlayed", () -> gameplay.onHandPlayed(context));
            }
        }

        // Pass 2: card-level hooks, with retriggers
        List<Card> scoring = context.scoringCards();
        List<Integer> retriggers = new ArrayList<>(scoring.size());
        for (Card card : scoring) {
            int requested = 0;
            for (int i = 0; i < jokers.size(); i++) {
                Joker joker = jokers.get(i);
                if (joker instanceof JokerGameplay) {
                    JokerGameplay gameplay = (JokerGameplay) joker;
                    JokerEffect effect = pass.run(i, "onCardScored", () -> gameplay.onCardScored(context, card));
                    requested += Math.max(0, effect.getRetriggers());
                }
            }
            int replays = Math.min(requested, maxRetriggersPerCard);
            for (int r = 0; r < replays; r++) {
                for (int i = 0; i < jokers.size(); i++) {
                    Joker joker = jokers.get(i);
                    if (joker instanceof JokerGameplay) {
                        JokerGameplay gameplay = (JokerGameplay) joker;
                        pass.run(i, "onCardScored", () -> withoutRetriggers(gameplay.onCardScored(context, card)));
                    }
                }
            }
            retriggers.add(replays);
        }

        ProcessingResult result = pass.finish(scoring, retriggers);
        if (logger.isDebugEnabled()) {
            logger.debug("Scored {} with {} jokers: {}", context.hand().isEmpty() ? "empty hand"
                : context.handRank().getDisplayName(), jokers.size(), result.aggregate());
        }
        return result;
    }

    // ==================== LIFECYCLE ====================

    /**
     * Run one lifecycle hook over every joker that supports it, in run order.
     * @param hookName Name used in error reports
     */
    public ProcessingResult processLifecycle(GameContext context, String hookName, LifecycleHook hook) {
        Pass pass = new Pass(context);
        List<Joker> jokers = context.jokers();
        for (int i = 0; i < jokers.size(); i++) {
            Joker joker = jokers.get(i);
            if (joker instanceof JokerLifecycle) {
                JokerLifecycle lifecycle = (JokerLifecycle) joker;
                pass.run(i, hookName, () -> hook.invoke(lifecycle, context));
            }
        }
        return pass.finish(List.of(), List.of());
    }

    /**
     * Run one lifecycle hook on a single joker (a sale, for instance) with the same isolation.
     */
    public ProcessingResult processSingle(GameContext context, Joker joker, String hookName, LifecycleHook hook) {
        Pass pass = new Pass(context);
        if (joker instanceof JokerLifecycle) {
            JokerLifecycle lifecycle = (JokerLifecycle) joker;
            int position = context.indexOf(joker);
            pass.run(position, joker, hookName, () -> hook.invoke(lifecycle, context));
        }
        return pass.finish(List.of(), List.of());
    }

    private static JokerEffect withoutRetriggers(JokerEffect effect) {
        if (effect.getRetriggers() == 0) {
            return effect;
        }
        return effect.toBuilder().retriggers(0).build();
    }

    // ==================== PASS ====================

    /**
     * Mutable bookkeeping for one pass.
     */
    private final class Pass {
        private final GameContext context;
        private final List<RemovalDirective> removals = new ArrayList<>();
        private final Set<Joker> removed = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<CardTransform> transforms = new ArrayList<>();
        private final List<HookError> errors = new ArrayList<>();
        private final List<NumericViolation> violations = new ArrayList<>();
        private final Map<Joker, Integer> sellValueIncreases = new IdentityHashMap<>();

        Pass(GameContext context) {
            this.context = context;
        }

        JokerEffect run(int position, String hook, Supplier<JokerEffect> call) {
            return run(position, context.jokers().get(position), hook, call);
        }

        JokerEffect run(int position, Joker joker, String hook, Supplier<JokerEffect> call) {
            String source = labeler.apply(joker);
            JokerEffect effect;
            try {
                effect = call.get();
            } catch (RuntimeException e) {
                HookError error = new HookError(source, joker.id(), hook, String.valueOf(e.getMessage()), e);
                errors.add(error);
                logger.warn("Hook {} of {} failed, treating its effect as identity", hook, source, e);
                return JokerEffect.none();
            }
            if (effect == null || effect.isIdentity()) {
                return JokerEffect.none();
            }

            List<NumericViolation> raised = context.accumulate(effect, source);
            for (NumericViolation violation : raised) {
                logger.warn("Numeric bound hit: {}", violation);
            }
            violations.addAll(raised);

            transforms.addAll(effect.getTransforms());
            if (effect.getSellValueIncrease() != 0) {
                sellValueIncreases.merge(joker, effect.getSellValueIncrease(),
                    (a, b) -> SaturatingMath.add(a.intValue(), b.intValue()));
            }
            if (effect.isDestroySelf()) {
                schedule(joker, position, RemovalDirective.Reason.SELF_DESTROY, source);
            }
            for (int target : effect.getDestroyedJokerPositions()) {
                if (target < 0 || target >= context.jokerCount()) {
                    logger.warn("{} asked to destroy joker at position {} but only {} are active",
                        source, target, context.jokerCount());
                    continue;
                }
                schedule(context.jokers().get(target), target, RemovalDirective.Reason.DESTROYED_BY_SIBLING, source);
            }
            return effect;
        }

        private void schedule(Joker joker, int position, RemovalDirective.Reason reason, String cause) {
            if (removed.add(joker)) {
                removals.add(new RemovalDirective(joker, position, reason, cause));
            }
        }

        ProcessingResult finish(List<Card> scoring, List<Integer> retriggers) {
            return new ProcessingResult(context.aggregate(), removals, transforms, scoring, retriggers,
                errors, violations, sellValueIncreases);
        }
    }
}
