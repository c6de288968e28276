package com.balatro.jokers.joker;

/**
 * A live joker instance. Instances implement whichever subset of the capability
 * interfaces they need; callers ask {@link Capability#isSupportedBy(Joker)} instead of
 * assuming a fixed shape.
 *
 * @see JokerIdentity
 * @see JokerLifecycle
 * @see JokerGameplay
 * @see JokerModifiers
 * @see JokerState
 */
public interface Joker {

    /**
     * The kind of this instance.
     */
    JokerId id();
}
