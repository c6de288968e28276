package com.balatro.jokers.catalog;

import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.effect.JokerSpawn;
import com.balatro.jokers.framework.AdvancedJoker;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;

/**
 * After 2 rounds, sell this to duplicate a random owned joker.
 */
public final class InvisibleJoker extends AdvancedJoker {
    static final String ROUNDS = "rounds";
    static final int ROUNDS_REQUIRED = 2;

    public InvisibleJoker(JokerMetadata metadata) {
        super(JokerId.INVISIBLE_JOKER, metadata);
    }

    public boolean isReady() {
        return state().counter(ROUNDS) >= ROUNDS_REQUIRED;
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        state().increment(ROUNDS, 1);
        return JokerEffect.none();
    }

    @Override
    public JokerEffect onSell(GameContext context) {
        if (!isReady()) {
            return JokerEffect.none();
        }
        return JokerEffect.builder().spawn(JokerSpawn.duplicateRandomOwned()).build();
    }
}
