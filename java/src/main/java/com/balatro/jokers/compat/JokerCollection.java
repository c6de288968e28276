package com.balatro.jokers.compat;

import com.balatro.jokers.joker.Joker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of active jokers, native or legacy. Legacy jokers are wrapped on
 * insertion so readers only ever see the capability interfaces.
 * Order is insertion (acquisition) order and is stable under removal.
 */
public final class JokerCollection implements Iterable<Joker> {
    private final List<Joker> jokers = new ArrayList<>();

    public JokerCollection() {
    }

    public JokerCollection(List<? extends Joker> initial) {
        initial.forEach(this::add);
    }

    public void add(Joker joker) {
        jokers.add(Objects.requireNonNull(joker, "joker"));
    }

    /**
     * Wrap and add a legacy joker.
     * @return the adapter now held by the collection
     */
    public Joker addLegacy(LegacyJoker legacy) {
        Joker adapted = new LegacyJokerAdapter(legacy);
        jokers.add(adapted);
        return adapted;
    }

    /**
     * Remove by identity.
     */
    public boolean remove(Joker joker) {
        for (int i = 0; i < jokers.size(); i++) {
            if (jokers.get(i) == joker) {
                jokers.remove(i);
                return true;
            }
        }
        return false;
    }

    public Joker get(int index) {
        return jokers.get(index);
    }

    public int indexOf(Joker joker) {
        for (int i = 0; i < jokers.size(); i++) {
            if (jokers.get(i) == joker) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return jokers.size();
    }

    public boolean isEmpty() {
        return jokers.isEmpty();
    }

    public long legacyCount() {
        return jokers.stream().filter(j -> j instanceof LegacyJokerAdapter).count();
    }

    /**
     * Read-only snapshot in run order.
     */
    public List<Joker> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(jokers));
    }

    public void clear() {
        jokers.clear();
    }

    @Override
    public Iterator<Joker> iterator() {
        return Collections.unmodifiableList(jokers).iterator();
    }
}
