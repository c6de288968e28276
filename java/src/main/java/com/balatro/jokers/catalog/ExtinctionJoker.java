package com.balatro.jokers.catalog;

import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.joker.JokerGameplay;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerIdentity;
import com.balatro.jokers.joker.JokerLifecycle;
import com.balatro.jokers.joker.JokerMetadata;

/**
 * A flat scorer with a listed chance of destroying itself at the end of each round
 * (Gros Michel, Cavendish).
 */
public final class ExtinctionJoker implements JokerIdentity, JokerGameplay, JokerLifecycle {
    private final JokerId id;
    private final JokerMetadata metadata;
    private final JokerEffect effect;
    private final int odds;

    public ExtinctionJoker(JokerId id, JokerMetadata metadata, JokerEffect effect, int odds) {
        this.id = id;
        this.metadata = metadata;
        this.effect = effect;
        this.odds = odds;
    }

    @Override
    public JokerId id() {
        return id;
    }

    @Override
    public JokerMetadata metadata() {
        return metadata;
    }

    @Override
    public JokerEffect onHandPlayed(GameContext context) {
        return effect;
    }

    @Override
    public JokerEffect onRoundEnd(GameContext context) {
        return context.chance(1, odds) ? JokerEffect.destroySelf() : JokerEffect.none();
    }

    public int getOdds() {
        return odds;
    }
}
