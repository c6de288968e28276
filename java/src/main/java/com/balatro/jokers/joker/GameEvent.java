package com.balatro.jokers.joker;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.effect.ConsumableKind;

/**
 * Notifications raised by collaborators outside the scoring pipeline
 * (blinds, shop, packs, consumables, deck edits).
 */
public sealed interface GameEvent {

    record BlindSkipped() implements GameEvent {
    }

    record BossBlindDefeated() implements GameEvent {
    }

    record PackOpened() implements GameEvent {
    }

    record PackSkipped() implements GameEvent {
    }

    record ShopRerolled() implements GameEvent {
    }

    record ShopExited() implements GameEvent {
    }

    record ConsumableUsed(ConsumableKind kind, String name) implements GameEvent {
    }

    record CardAdded(Card card) implements GameEvent {
    }

    record CardDestroyed(Card card) implements GameEvent {
    }

    record JokerSold(JokerId id) implements GameEvent {
    }
}
