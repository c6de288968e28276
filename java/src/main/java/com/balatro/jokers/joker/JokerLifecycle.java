package com.balatro.jokers.joker;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;

import java.util.List;

/**
 * Lifecycle hooks. Every hook may be called zero or many times per round, and no
 * ordering is guaranteed relative to other instances beyond run order.
 * Hooks that return an effect have it accumulated like a scoring effect.
 */
public interface JokerLifecycle extends Joker {

    default void onAcquire(GameContext context) {
    }

    /**
     * Called when the player sells this instance, before it is removed.
     */
    default JokerEffect onSell(GameContext context) {
        return JokerEffect.none();
    }

    /**
     * Called when this instance is removed for any reason other than a sale.
     */
    default void onDestroy(GameContext context) {
    }

    /**
     * Called once when a blind is selected.
     */
    default JokerEffect onRoundStart(GameContext context) {
        return JokerEffect.none();
    }

    /**
     * Called once when a round (blind) is won. The returned effect is typically money.
     */
    default JokerEffect onRoundEnd(GameContext context) {
        return JokerEffect.none();
    }

    /**
     * Called once per discard action with the discarded cards in order.
     */
    default JokerEffect onDiscard(GameContext context, List<Card> discarded) {
        return JokerEffect.none();
    }

    default void onSiblingAdded(JokerId sibling) {
    }

    default void onSiblingRemoved(JokerId sibling) {
    }

    /**
     * Notification from an external collaborator (shop, packs, consumables, deck edits).
     */
    default JokerEffect onGameEvent(GameContext context, GameEvent event) {
        return JokerEffect.none();
    }
}
