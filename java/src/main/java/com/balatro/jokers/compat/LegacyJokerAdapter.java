package com.balatro.jokers.compat;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerLifecycle;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.JokerModifiers;
import com.balatro.jokers.joker.UnlockCondition;

import java.util.List;
import java.util.Objects;

/**
 * Presents a {@link LegacyJoker} through the capability interfaces. Every hook forwards
 * to the matching legacy call and returns its result unchanged; metadata is captured
 * once at wrap time so identity accessors do not allocate.
 */
public final class LegacyJokerAdapter implements JokerIdentity, JokerLifecycle, JokerGameplay, JokerModifiers {
    private final LegacyJoker legacy;
    private final JokerMetadata metadata;

    public LegacyJokerAdapter(LegacyJoker legacy) {
        this.legacy = Objects.requireNonNull(legacy, "legacy");
        this.metadata = new JokerMetadata(legacy.name(), legacy.description(), legacy.rarity(), legacy.cost(),
            UnlockCondition.ALWAYS, false);
    }

    public LegacyJoker unwrap() {
        return legacy;
    }

    @Override
    public JokerId id() {
        return legacy.id();
    }

    @Override
    public JokerMetadata metadata() {
        return metadata;
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return legacy.onHandPlayed(context);
    }

    @Override
    public JokerEffect onCardScored(GameContext context, Card card) {
        return legacy.onCardScored(context, card);
    }

    @Override
    public JokerEffect onRoundStart(GameContext context) {
        return legacy.onBlindStart(context);
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        return legacy.onRoundEnd(context);
    }

    @Override
    public JokerEffect onDiscard(GameContext context, List<Card> discarded) {
        return legacy.onDiscard(context, discarded);
    }

    @Override
    public int handSizeDelta() {
        return legacy.handSizeBonus();
    }

    @Override
    public int discardsDelta() {
        return legacy.discardBonus();
    }

    @Override
    public int handsDelta() {
        return legacy.handBonus();
    }

    @Override
    public String toString() {
        return "LegacyJokerAdapter{" + legacy.id().wireName() + "}";
    }
}
