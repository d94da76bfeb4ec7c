// file: src/main/java/io/snapdiff/core/diff/FlatDiff.java
package io.snapdiff.core.diff;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Heckel's six-pass O(n) diff over two sequences of identity keys.
 * <p>
 * Passes:
 *  1) scan new, counting occurrences per key;
 *  2) scan old, counting occurrences per key;
 *  3) match keys that occur exactly once on both sides;
 *  4) grow matches forward into equal, still-unmatched neighbours;
 *  5) grow matches backward the same way;
 *  6) collect: unmatched old = delete, unmatched new = insert, the rest = matched.
 * <p>
 * Keys are compared with {@code equals}/{@code hashCode}. Keys occurring more
 * than once on either side are never matched by pass 3; they only match when
 * an expansion from a unique neighbour reaches them, which may pair equal
 * candidates arbitrarily. Callers must not depend on a particular pairing of
 * duplicates, only on the result being internally consistent.
 */
public final class FlatDiff {

    /** Working-array marker for "still refers to the symbol table". */
    private static final int UNMATCHED = -1;

    private FlatDiff() {}

    /**
     * Occurrence count of a key on one side: none, exactly one (with its
     * position), or more than one.
     */
    sealed interface Counter permits Counter.Zero, Counter.One, Counter.Many {

        Counter ZERO = new Zero();
        Counter MANY = new Many();

        Counter increment(int index);

        record Zero() implements Counter {
            @Override public Counter increment(int index) { return new One(index); }
        }

        record One(int index) implements Counter {
            @Override public Counter increment(int index) { return MANY; }
        }

        record Many() implements Counter {
            @Override public Counter increment(int index) { return this; }
        }
    }

    /** Symbol table entry shared by every occurrence of one key. */
    static final class SymbolEntry {
        Counter oldCounter = Counter.ZERO;
        Counter newCounter = Counter.ZERO;
    }

    public static <T> DiffResult diff(List<? extends T> old, List<? extends T> updated) {
        Objects.requireNonNull(old, "old");
        Objects.requireNonNull(updated, "updated");

        if (old.isEmpty() && updated.isEmpty()) {
            return DiffResult.EMPTY;
        }

        int oldCount = old.size();
        int newCount = updated.size();

        Map<T, SymbolEntry> table = new HashMap<>(capacityFor(oldCount + newCount));

        // Three working arrays: symbol refs for new, and "index in other" for both sides.
        SymbolEntry[] newRefs = new SymbolEntry[newCount];
        int[] na = new int[newCount];
        int[] oa = new int[oldCount];

        // 1) new
        for (int i = 0; i < newCount; i++) {
            SymbolEntry entry = table.computeIfAbsent(updated.get(i), k -> new SymbolEntry());
            entry.newCounter = entry.newCounter.increment(i);
            newRefs[i] = entry;
            na[i] = UNMATCHED;
        }

        // 2) old
        for (int j = 0; j < oldCount; j++) {
            SymbolEntry entry = table.computeIfAbsent(old.get(j), k -> new SymbolEntry());
            entry.oldCounter = entry.oldCounter.increment(j);
            oa[j] = UNMATCHED;
        }

        // 3) unique on both sides
        for (int i = 0; i < newCount; i++) {
            SymbolEntry entry = newRefs[i];
            if (entry.oldCounter instanceof Counter.One o
                    && entry.newCounter instanceof Counter.One n
                    && n.index() == i) {
                na[i] = o.index();
                oa[o.index()] = i;
            }
        }

        // 4) forward expansion
        for (int i = 0; i < newCount - 1; i++) {
            int j = na[i];
            if (j == UNMATCHED || j + 1 >= oldCount) {
                continue;
            }
            if (na[i + 1] == UNMATCHED && oa[j + 1] == UNMATCHED
                    && Objects.equals(updated.get(i + 1), old.get(j + 1))) {
                na[i + 1] = j + 1;
                oa[j + 1] = i + 1;
            }
        }

        // 5) backward expansion
        for (int i = newCount - 1; i > 0; i--) {
            int j = na[i];
            if (j == UNMATCHED || j - 1 < 0) {
                continue;
            }
            if (na[i - 1] == UNMATCHED && oa[j - 1] == UNMATCHED
                    && Objects.equals(updated.get(i - 1), old.get(j - 1))) {
                na[i - 1] = j - 1;
                oa[j - 1] = i - 1;
            }
        }

        // 6) collect
        List<Integer> deletes = new ArrayList<>();
        for (int j = 0; j < oldCount; j++) {
            if (oa[j] == UNMATCHED) {
                deletes.add(j);
            }
        }

        List<Integer> inserts = new ArrayList<>();
        List<DiffResult.Move> moves = new ArrayList<>();
        List<DiffResult.Match> matched = new ArrayList<>(Math.min(oldCount, newCount));
        for (int i = 0; i < newCount; i++) {
            int j = na[i];
            if (j == UNMATCHED) {
                inserts.add(i);
            } else {
                matched.add(new DiffResult.Match(j, i));
                if (j != i) {
                    moves.add(new DiffResult.Move(j, i));
                }
            }
        }

        return new DiffResult(deletes, inserts, moves, matched);
    }

    private static int capacityFor(int expected) {
        return (int) (expected / 0.75f) + 1;
    }
}
