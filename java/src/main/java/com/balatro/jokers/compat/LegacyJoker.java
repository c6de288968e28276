package com.balatro.jokers.compat;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.Rarity;

import java.util.List;

/**
 * The original single-interface joker shape. Kept only so older behaviors keep
 * working through {@link LegacyJokerAdapter}; new jokers implement the capability
 * interfaces directly.
 */
public interface LegacyJoker {

    JokerId id();

    String name();

    String description();

    Rarity rarity();

    int cost();

    default JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.none();
    }

    default JokerEffect onCardScored(GameContext context, Card card) {
        return JokerEffect.none();
    }

    default JokerEffect onBlindStart(GameContext context) {
        return JokerEffect.none();
    }

    default JokerEffect onDiscard(GameContext context, List<Card> discarded) {
        return JokerEffect.none();
    }

    default JokerEffect onRoundEnd(GameContext context) {
        return JokerEffect.none();
    }

    default int handSizeBonus() {
        return 0;
    }

    default int discardBonus() {
        return 0;
    }

    default int handBonus() {
        return 0;
    }
}
