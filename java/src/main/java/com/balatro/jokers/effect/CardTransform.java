package com.balatro.jokers.effect;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Enhancement;

import java.util.Objects;

/**
 * A change to a playing card that the engine applies after scoring.
 *
 * @param card        The card to change
 * @param kind        What to do with it
 * @param enhancement New enhancement for {@link Kind#SET_ENHANCEMENT}, otherwise null
 * @param amount      Chip bonus for {@link Kind#ADD_PERMANENT_CHIPS}, otherwise 0
 */
public record CardTransform(Card card, Kind kind, Enhancement enhancement, int amount) {

    public enum Kind {
        DESTROY,
        SET_ENHANCEMENT,
        ADD_PERMANENT_CHIPS,
        DUPLICATE,
        /** {@code card} is a new card to put into the deck. */
        ADD_TO_DECK
    }

    public CardTransform {
        Objects.requireNonNull(card, "card");
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.SET_ENHANCEMENT) {
            Objects.requireNonNull(enhancement, "enhancement");
        }
    }

    public static CardTransform destroy(Card card) {
        return new CardTransform(card, Kind.DESTROY, null, 0);
    }

    public static CardTransform enhance(Card card, Enhancement enhancement) {
        return new CardTransform(card, Kind.SET_ENHANCEMENT, enhancement, 0);
    }

    public static CardTransform addChips(Card card, int amount) {
        return new CardTransform(card, Kind.ADD_PERMANENT_CHIPS, null, amount);
    }

    public static CardTransform duplicate(Card card) {
        return new CardTransform(card, Kind.DUPLICATE, null, 0);
    }

    public static CardTransform addToDeck(Card card) {
        return new CardTransform(card, Kind.ADD_TO_DECK, null, 0);
    }
}
