package io.snapdiff.core.diff;

import java.util.List;

/**
 * Output of {@link FlatDiff#diff(List, List)}.
 * <p>
 * Index conventions:
 *  - deletes: positions in the old sequence, ascending.
 *  - inserts: positions in the new sequence, ascending.
 *  - moves:   matched pairs whose old index differs from their new index.
 *  - matched: every identity match (moved or not), ordered by new index.
 * <p>
 * A matched pair is "moved" purely by index inequality. Whether a move is
 * worth reporting to a renderer is decided later by {@link ChangesetReconciler}.
 */
public record DiffResult(
        List<Integer> deletes,
        List<Integer> inserts,
        List<Move> moves,
        List<Match> matched
) {

    static final DiffResult EMPTY = new DiffResult(List.of(), List.of(), List.of(), List.of());

    public DiffResult {
        deletes = List.copyOf(deletes);
        inserts = List.copyOf(inserts);
        moves = List.copyOf(moves);
        matched = List.copyOf(matched);
    }

    /** A relocated element: old position -> new position. */
    public record Move(int from, int to) {}

    /** An identity match between an old position and a new position. */
    public record Match(int oldIndex, int newIndex) {
        public boolean moved() { return oldIndex != newIndex; }
    }

    public boolean isEmpty() {
        return deletes.isEmpty() && inserts.isEmpty() && moves.isEmpty();
    }
}
