package io.snapdiff.core.snapshot;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lazily materialized item -> section map for a {@link Snapshot}.
 * <p>
 * States:
 *  - ABSENT:   nothing cached; lookups must fall back to scanning sections.
 *  - BUILDING: a rebuild is in progress (re-entrant access is a bug).
 *  - PRESENT:  map is complete and kept in sync by cheap mutations.
 * <p>
 * Build-vs-query tradeoff:
 *  - The common workflow (append N items, then diff) never needs reverse
 *    lookup, so it never pays the O(N) build.
 *  - Anchored mutations (insert before/after, move) need O(1) lookup and
 *    trigger a build on first use.
 *  - Appends and inserts patch the map only when it is PRESENT.
 *  - Bulk deletes invalidate (back to ABSENT) instead of patching: removing
 *    an arbitrary set from a hash map is no cheaper than one O(N) rebuild,
 *    and the rebuild may never be needed before the snapshot is diffed.
 */
final class ReverseIndex<I, S> {

    enum State { ABSENT, BUILDING, PRESENT }

    private State state = State.ABSENT;
    private Map<I, S> map;

    State state() {
        return state;
    }

    boolean isPresent() {
        return state == State.PRESENT;
    }

    /**
     * Return the map, building it from {@code sections}/{@code items} first if
     * it is absent. {@code items.get(i)} must hold the items of {@code sections.get(i)}.
     */
    Map<I, S> ensure(List<S> sections, List<? extends List<I>> items, int expectedSize) {
        switch (state) {
            case PRESENT -> {
                return map;
            }
            case BUILDING -> throw new IllegalStateException("reverse index rebuild re-entered");
            default -> {
                state = State.BUILDING;
                Map<I, S> built = new HashMap<>((int) (expectedSize / 0.75f) + 1);
                for (int s = 0; s < sections.size(); s++) {
                    S section = sections.get(s);
                    for (I item : items.get(s)) {
                        built.put(item, section);
                    }
                }
                map = built;
                state = State.PRESENT;
                return map;
            }
        }
    }

    /** Lookup without forcing a build; empty when absent or unknown. */
    Optional<S> lookup(I item) {
        return isPresent() ? Optional.ofNullable(map.get(item)) : Optional.empty();
    }

    /** True only when the index is present and already maps {@code item}. */
    boolean knows(I item) {
        return isPresent() && map.containsKey(item);
    }

    void put(I item, S section) {
        if (isPresent()) {
            map.put(item, section);
        }
    }

    void remove(I item) {
        if (isPresent()) {
            map.remove(item);
        }
    }

    void invalidate() {
        map = null;
        state = State.ABSENT;
    }

    ReverseIndex<I, S> copy() {
        ReverseIndex<I, S> out = new ReverseIndex<>();
        if (isPresent()) {
            out.map = new HashMap<>(map);
            out.state = State.PRESENT;
        }
        return out;
    }
}
