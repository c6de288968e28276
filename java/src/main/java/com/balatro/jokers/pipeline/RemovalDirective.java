package com.balatro.jokers.pipeline;

import com.balatro.jokers.joker.Joker;

/**
 * A joker scheduled for removal once the pass has finished.
 *
 * @param joker    The instance to remove
 * @param position Its run-order position when the pass began
 * @param reason   Why it goes
 * @param cause    Label of the instance whose effect requested it
 */
public record RemovalDirective(Joker joker, int position, Reason reason, String cause) {

    public enum Reason {
        /** The joker's own effect set the self-destroy flag. */
        SELF_DESTROY,
        /** Another joker's effect named this position. */
        DESTROYED_BY_SIBLING
    }
}
