package com.balatro.jokers.joker;

/**
 * Game-rule switches turned on by passive modifiers.
 */
public enum RuleFlag {
    /** Flushes and straights need only four cards. */
    FOUR_FINGERS,
    /** Straights may skip one rank between cards. */
    SHORTCUT,
    /** Hearts and Diamonds count as one suit, Spades and Clubs as another. */
    SMEARED_SUITS,
    /** Every played card scores. */
    ALL_CARDS_SCORE,
    /** Every ranked card counts as a face card. */
    ALL_FACE,
    /** Held-in-hand card abilities trigger one extra time. */
    RETRIGGER_HELD_CARDS,
    /** One free shop reroll per shop. */
    FREE_REROLL,
    /** The shop may offer duplicates of owned jokers and consumables. */
    ALLOW_DUPLICATES,
    /** Planet cards and Celestial packs in the shop are free. */
    FREE_PLANET_SHOP,
    /** Boss blind abilities are disabled. */
    DISABLE_BOSS_BLIND,
    /** Losing a round with at least 25% of the target scored is survived once. */
    PREVENT_DEATH
}
