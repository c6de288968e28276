package com.balatro.jokers.catalog;

import com.balatro.jokers.card.Card;
import com.balatro.jokers.card.Enhancement;
import com.balatro.jokers.card.HandEvaluator;
import com.balatro.jokers.card.Rank;
import com.balatro.jokers.card.Seal;
import com.balatro.jokers.card.Suit;
import com.balatro.jokers.context.GameContext;
import com.balatro.jokers.context.Stage;
import com.balatro.jokers.effect.CardTransform;
import com.balatro.jokers.effect.ConsumableKind;
import com.balatro.jokers.effect.ConsumableRequest;
import com.balatro.jokers.effect.JokerEffect;
import com.balatro.jokers.effect.JokerSpawn;
import com.balatro.jokers.framework.EventJoker;
import com.balatro.jokers.joker.GameEvent;
import com.balatro.jokers.joker.JokerId;
import com.balatro.jokers.joker.JokerMetadata;
import com.balatro.jokers.joker.Rarity;
import com.balatro.jokers.registry.JokerRegistry;
import com.balatro.jokers.rng.GameRng;

import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;

import static com.balatro.jokers.catalog.JokerCatalog.meta;

/**
 * Stateless jokers that act on round boundaries, discards, sales and shop events:
 * money, consumables and deck additions rather than score.
 */
final class EconomyJokers {
    static final int INTEREST_CAP = 5;

    private static final List<Seal> SEALS = List.of(Seal.GOLD, Seal.RED, Seal.BLUE, Seal.PURPLE);

    private EconomyJokers() {
        // Utility class - prevent instantiation
    }

    static void register(JokerRegistry.Builder r) {
        event(r, JokerId.RIFF_RAFF, meta("Riff-Raff", "When Blind is selected, create 2 Common Jokers", Rarity.COMMON),
            b -> b.onRoundStart(ctx -> JokerEffect.builder()
                .spawn(JokerSpawn.ofRarity(Rarity.COMMON))
                .spawn(JokerSpawn.ofRarity(Rarity.COMMON))
                .build()));
        event(r, JokerId.HALLUCINATION, meta("Hallucination",
            "1 in 2 chance to create a Tarot card when any Booster Pack is opened", Rarity.COMMON),
            b -> b.onEvent((ctx, event) -> event instanceof GameEvent.PackOpened && ctx.chance(1, 2)
                ? tarot()
                : JokerEffect.none()));

        event(r, JokerId.CARTOMANCER, meta("Cartomancer", "Create a Tarot card when Blind is selected",
            Rarity.UNCOMMON), b -> b.onRoundStart(ctx -> tarot()));
        event(r, JokerId.TO_THE_MOON, meta("To the Moon",
            "Earn an extra $1 of interest for every $5 you have at end of round (max $5)", Rarity.UNCOMMON),
            b -> b.onRoundEnd(ctx -> JokerEffect.builder()
                .interestBonus(Math.min(INTEREST_CAP, Math.max(0, ctx.money()) / 5))
                .build()));
        event(r, JokerId.GIFT_CARD, meta("Gift Card",
            "Add $1 of sell value to every Joker and Consumable card at end of round", Rarity.UNCOMMON),
            b -> b.onRoundEnd(ctx -> JokerEffect.builder().sellValueIncreaseAll(1).build()));
        event(r, JokerId.DIET_COLA, meta("Diet Cola", "Sell this card to create a free Double Tag", Rarity.UNCOMMON),
            b -> b);
        event(r, JokerId.LUCHADOR, meta("Luchador", "Sell this card to disable the current Boss Blind",
            Rarity.UNCOMMON), b -> b.onSell(ctx -> ctx.stage() == Stage.BOSS_BLIND
                ? JokerEffect.builder().disableBossBlind(true).build()
                : JokerEffect.none()));
        event(r, JokerId.CERTIFICATE, meta("Certificate",
            "When round begins, add a random playing card with a random seal to your hand", Rarity.UNCOMMON),
            b -> b.onRoundStart(ctx -> addToDeck(randomCard(ctx.rng()).withSeal(ctx.rng().pick(SEALS)))));
        event(r, JokerId.MARBLE_JOKER, meta("Marble Joker", "Adds one Stone card to deck when Blind is selected",
            Rarity.UNCOMMON), b -> b.onRoundStart(ctx ->
                addToDeck(randomCard(ctx.rng()).withEnhancement(Enhancement.STONE))));
        event(r, JokerId.TRADING_CARD, meta("Trading Card",
            "If first discard of round has only 1 card, destroy it and earn $3", Rarity.UNCOMMON),
            b -> b.onDiscard((ctx, discarded) -> firstDiscard(ctx) && discarded.size() == 1
                ? JokerEffect.builder().transform(CardTransform.destroy(discarded.get(0))).money(3).build()
                : JokerEffect.none()));

        event(r, JokerId.BURNT_JOKER, meta("Burnt Joker",
            "Upgrade the level of the first discarded poker hand each round", Rarity.RARE),
            b -> b.onDiscard((ctx, discarded) -> firstDiscard(ctx) && !discarded.isEmpty()
                ? JokerEffect.builder().levelUp(HandEvaluator.evaluate(discarded).getRank()).build()
                : JokerEffect.none()));

        event(r, JokerId.PERKEO, meta("Perkeo",
            "Creates a Negative copy of 1 random consumable card in your possession at the end of the shop",
            Rarity.LEGENDARY), b -> b.onEvent((ctx, event) -> event instanceof GameEvent.ShopExited
                ? JokerEffect.builder().consumable(ConsumableRequest.negativeCopyOfHeld()).build()
                : JokerEffect.none()));
    }

    private static void event(JokerRegistry.Builder r, JokerId id, JokerMetadata metadata,
                              UnaryOperator<EventJoker.Builder> shape) {
        r.register(id, metadata, args -> shape.apply(EventJoker.builder(id, metadata)).build());
    }

    private static boolean firstDiscard(GameContext context) {
        return context.run().getDiscardsUsedThisRound() == 0;
    }

    private static JokerEffect tarot() {
        return JokerEffect.builder().consumable(ConsumableRequest.random(ConsumableKind.TAROT)).build();
    }

    private static JokerEffect addToDeck(Card card) {
        return JokerEffect.builder().transform(CardTransform.addToDeck(card)).build();
    }

    private static Card randomCard(GameRng rng) {
        Rank rank = rng.pick(Arrays.asList(Rank.values()));
        Suit suit = rng.pick(Arrays.asList(Suit.values()));
        return Card.of(rank, suit);
    }
}
