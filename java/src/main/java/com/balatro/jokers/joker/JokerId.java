package com.balatro.jokers.joker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Every joker kind. The wire name is the persisted reference in save data and
 * must never change once released; new kinds are appended, never renamed.
 */
public enum JokerId {
    // Common
    JOKER, GREEDY_JOKER, LUSTY_JOKER, WRATHFUL_JOKER,
    GLUTTONOUS_JOKER, JOLLY_JOKER, ZANY_JOKER, MAD_JOKER,
    CRAZY_JOKER, DROLL_JOKER, SLY_JOKER, WILY_JOKER,
    CLEVER_JOKER, DEVIOUS_JOKER, CRAFTY_JOKER, HALF_JOKER,
    CREDIT_CARD, BANNER, MYSTIC_SUMMIT, EIGHT_BALL,
    MISPRINT, RAISED_FIST, CHAOS_THE_CLOWN, SCARY_FACE,
    ABSTRACT_JOKER, DELAYED_GRATIFICATION, GROS_MICHEL, EVEN_STEVEN,
    ODD_TODD, SCHOLAR, BUSINESS_CARD, SUPERNOVA,
    RIDE_THE_BUS, EGG, RUNNER, ICE_CREAM,
    SPLASH, BLUE_JOKER, FACELESS_JOKER, GREEN_JOKER,
    SUPERPOSITION, TO_DO_LIST, CAVENDISH, RED_CARD,
    SQUARE_JOKER, RIFF_RAFF, PHOTOGRAPH, RESERVED_PARKING,
    MAIL_IN_REBATE, HALLUCINATION, FORTUNE_TELLER, JUGGLER,
    DRUNKARD, GOLDEN_JOKER, POPCORN, WALKIE_TALKIE,
    SMILEY_FACE, GOLDEN_TICKET, SWASHBUCKLER, HANGING_CHAD,
    SHOOT_THE_MOON,

    // Uncommon
    JOKER_STENCIL, FOUR_FINGERS, MIME, CEREMONIAL_DAGGER,
    MARBLE_JOKER, LOYALTY_CARD, DUSK, FIBONACCI,
    STEEL_JOKER, HACK, PAREIDOLIA, SPACE_JOKER,
    BURGLAR, BLACKBOARD, SIXTH_SENSE, CONSTELLATION,
    HIKER, CARD_SHARP, MADNESS, SEANCE,
    SHORTCUT, HOLOGRAM, VAMPIRE, CLOUD_9,
    ROCKET, MIDAS_MASK, LUCHADOR, GIFT_CARD,
    TURTLE_BEAN, EROSION, TO_THE_MOON, STONE_JOKER,
    LUCKY_CAT, BULL, DIET_COLA, TRADING_CARD,
    FLASH_CARD, SPARE_TROUSERS, RAMEN, SELTZER,
    CASTLE, MR_BONES, ACROBAT, SOCK_AND_BUSKIN,
    TROUBADOUR, CERTIFICATE, SMEARED_JOKER, THROWBACK,
    ROUGH_GEM, BLOODSTONE, ARROWHEAD, ONYX_AGATE,
    GLASS_JOKER, SHOWMAN, FLOWER_POT, MERRY_ANDY,
    OOPS_ALL_SIXES, THE_IDOL, SEEING_DOUBLE, MATADOR,
    SATELLITE, CARTOMANCER, ASTRONOMER, BOOTSTRAPS,

    // Rare
    DNA, VAGABOND, BARON, OBELISK,
    BASEBALL_CARD, ANCIENT_JOKER, CAMPFIRE, BLUEPRINT,
    WEE_JOKER, HIT_THE_ROAD, THE_DUO, THE_TRIO,
    THE_FAMILY, THE_ORDER, THE_TRIBE, STUNTMAN,
    INVISIBLE_JOKER, BRAINSTORM, DRIVERS_LICENSE, BURNT_JOKER,

    // Legendary
    CANIO, TRIBOULET, YORICK, CHICOT,
    PERKEO;

    private final String wireName;

    JokerId() {
        this.wireName = name().toLowerCase(Locale.ROOT);
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a persisted wire name.
     * @throws IllegalArgumentException if no joker has that wire name
     */
    @JsonCreator
    public static JokerId fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Joker id cannot be null");
        }
        try {
            return JokerId.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown joker id: " + value, e);
        }
    }
}
