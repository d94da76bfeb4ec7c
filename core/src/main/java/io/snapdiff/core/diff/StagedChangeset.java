package io.snapdiff.core.diff;

import io.snapdiff.core.ItemPath;

import java.util.List;

/**
 * Section- and item-level operations that take one snapshot to another.
 * <p>
 * Apply order expected from the renderer:
 *  1) deletes (old indices),
 *  2) inserts (new indices),
 *  3) moves (old -> new),
 *  4) reloads and reconfigures (new indices, after the structural changes land).
 * <p>
 * Item deletes are sorted descending and item inserts ascending so they can
 * be applied one by one without index shifting surprises.
 */
public record StagedChangeset(
        List<Integer> sectionDeletes,
        List<Integer> sectionInserts,
        List<DiffResult.Move> sectionMoves,
        List<Integer> sectionReloads,
        List<ItemPath> itemDeletes,
        List<ItemPath> itemInserts,
        List<ItemMove> itemMoves,
        List<ItemPath> itemReloads,
        List<ItemPath> itemReconfigures
) {

    public static final StagedChangeset EMPTY = new StagedChangeset(
            List.of(), List.of(), List.of(), List.of(),
            List.of(), List.of(), List.of(), List.of(), List.of()
    );

    public StagedChangeset {
        sectionDeletes = List.copyOf(sectionDeletes);
        sectionInserts = List.copyOf(sectionInserts);
        sectionMoves = List.copyOf(sectionMoves);
        sectionReloads = List.copyOf(sectionReloads);
        itemDeletes = List.copyOf(itemDeletes);
        itemInserts = List.copyOf(itemInserts);
        itemMoves = List.copyOf(itemMoves);
        itemReloads = List.copyOf(itemReloads);
        itemReconfigures = List.copyOf(itemReconfigures);
    }

    /** An item relocation, possibly across sections. */
    public record ItemMove(ItemPath from, ItemPath to) {
        public boolean crossesSections() { return from.section() != to.section(); }
    }

    /** True when there is nothing at all to hand to the renderer. */
    public boolean isEmpty() {
        return !hasStructuralChanges()
                && sectionReloads.isEmpty()
                && itemReloads.isEmpty()
                && itemReconfigures.isEmpty();
    }

    /** True when any delete, insert or move is present (reloads excluded). */
    public boolean hasStructuralChanges() {
        return !sectionDeletes.isEmpty()
                || !sectionInserts.isEmpty()
                || !sectionMoves.isEmpty()
                || !itemDeletes.isEmpty()
                || !itemInserts.isEmpty()
                || !itemMoves.isEmpty();
    }

    /** Total number of operations, reloads included. */
    public int operationCount() {
        return sectionDeletes.size() + sectionInserts.size() + sectionMoves.size() + sectionReloads.size()
                + itemDeletes.size() + itemInserts.size() + itemMoves.size()
                + itemReloads.size() + itemReconfigures.size();
    }
}
