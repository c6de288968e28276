package com.balatro.jokers.context;

import com.balatro.jokers.effect.JokerEffect;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameContext derived values.
 */
class GameContextTest {

    @Test
    void testMoneyAddsAccumulatedDelta() {
        GameContext context = GameContext.builder(RunState.builder().money(4).build()).build();
        context.accumulate(JokerEffect.money(3), "test");

        assertEquals(7, context.money());
    }

    @Test
    void testMoneySaturatesInsteadOfWrapping() {
        GameContext context = GameContext.builder(RunState.builder().money(4).build()).build();
        context.accumulate(JokerEffect.money(Integer.MAX_VALUE), "test");

        assertEquals(Integer.MAX_VALUE, context.money());
    }
}
