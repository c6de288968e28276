package com.balatro.jokers.joker;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The five capability roles a joker instance may implement.
 */
public enum Capability {
    IDENTITY(JokerIdentity.class),
    LIFECYCLE(JokerLifecycle.class),
    GAMEPLAY(JokerGameplay.class),
    MODIFIERS(JokerModifiers.class),
    STATE(JokerState.class);

    private final Class<? extends Joker> role;

    Capability(Class<? extends Joker> role) {
        this.role = role;
    }

    public Class<? extends Joker> getRole() {
        return role;
    }

    public boolean isSupportedBy(Joker joker) {
        return role.isInstance(joker);
    }

    /**
     * All roles an instance supports.
     */
    public static Set<Capability> of(Joker joker) {
        Set<Capability> supported = EnumSet.noneOf(Capability.class);
        for (Capability capability : values()) {
            if (capability.isSupportedBy(joker)) {
                supported.add(capability);
            }
        }
        return supported;
    }

    /**
     * View an instance through one role, if it supports it.
     */
    public static <T extends Joker> Optional<T> as(Joker joker, Class<T> role) {
        return role.isInstance(joker) ? Optional.of(role.cast(joker)) : Optional.empty();
    }
}
