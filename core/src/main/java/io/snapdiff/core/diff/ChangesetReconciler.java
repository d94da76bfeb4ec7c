// file: src/main/java/io/snapdiff/core/diff/ChangesetReconciler.java
package io.snapdiff.core.diff;

import io.snapdiff.core.ItemPath;
import io.snapdiff.core.snapshot.HierarchicalSnapshot;
import io.snapdiff.core.snapshot.Snapshot;
import io.snapdiff.core.snapshot.Snapshots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link StagedChangeset} between two snapshots.
 * <p>
 * Steps:
 *  1) diff section identifiers;
 *  2) diff item identifiers of every section present on both sides
 *     (identical item lists are skipped);
 *  3) pair item deletes in one surviving section with inserts of the same
 *     item in another surviving section: those become cross-section moves;
 *  4) keep only the minimal moves: matched pairs on the longest increasing
 *     subsequence of old positions (in new order) stay put, the rest move;
 *  5) fold in reload / reconfigure bookkeeping from the new snapshot.
 * <p>
 * Items of deleted or inserted sections produce no item operations; the
 * section operation covers them. An item leaving a deleted section for a
 * surviving one is an insert, and an item leaving a surviving section for an
 * inserted one is a delete.
 * <p>
 * Pure: reads both snapshots, never mutates them, and never forces their
 * reverse index to be built, so it is safe to call from any thread as long as
 * nobody mutates the inputs concurrently.
 */
public final class ChangesetReconciler {

    private ChangesetReconciler() {}

    public static <S, I> StagedChangeset reconcile(Snapshot<S, I> old, Snapshot<S, I> updated) {
        List<S> oldSections = old.sectionIdentifiers();
        List<S> newSections = updated.sectionIdentifiers();

        // 1. Sections
        DiffResult sectionDiff = FlatDiff.diff(oldSections, newSections);
        List<DiffResult.Move> sectionMoves = minimalMoves(sectionDiff.matched());

        // 2. Items of surviving sections
        List<ItemPath> itemDeletes = new ArrayList<>();
        List<ItemPath> itemInserts = new ArrayList<>();
        List<StagedChangeset.ItemMove> itemMoves = new ArrayList<>();

        boolean crossSectionPossible = old.numberOfSections() > 1 || updated.numberOfSections() > 1;
        Map<I, ItemPath> deleteCandidates = new LinkedHashMap<>();
        Map<I, ItemPath> insertCandidates = new LinkedHashMap<>();

        for (DiffResult.Match section : sectionDiff.matched()) {
            int oldSectionIdx = section.oldIndex();
            int newSectionIdx = section.newIndex();
            List<I> oldItems = old.itemIdentifiers(oldSections.get(oldSectionIdx));
            List<I> newItems = updated.itemIdentifiers(newSections.get(newSectionIdx));

            if (oldItems.equals(newItems)) {
                continue;
            }

            DiffResult itemDiff = FlatDiff.diff(oldItems, newItems);
            for (DiffResult.Move move : minimalMoves(itemDiff.matched())) {
                itemMoves.add(new StagedChangeset.ItemMove(
                        new ItemPath(oldSectionIdx, move.from()),
                        new ItemPath(newSectionIdx, move.to())));
            }

            if (crossSectionPossible) {
                for (int d : itemDiff.deletes()) {
                    deleteCandidates.put(oldItems.get(d), new ItemPath(oldSectionIdx, d));
                }
                for (int n : itemDiff.inserts()) {
                    insertCandidates.put(newItems.get(n), new ItemPath(newSectionIdx, n));
                }
            } else {
                for (int d : itemDiff.deletes()) {
                    itemDeletes.add(new ItemPath(oldSectionIdx, d));
                }
                for (int n : itemDiff.inserts()) {
                    itemInserts.add(new ItemPath(newSectionIdx, n));
                }
            }
        }

        // 3. Cross-section moves between surviving sections
        if (crossSectionPossible) {
            for (Map.Entry<I, ItemPath> e : deleteCandidates.entrySet()) {
                ItemPath to = insertCandidates.remove(e.getKey());
                if (to != null) {
                    itemMoves.add(new StagedChangeset.ItemMove(e.getValue(), to));
                } else {
                    itemDeletes.add(e.getValue());
                }
            }
            itemInserts.addAll(insertCandidates.values());
        }

        // 5. Bookkeeping, in new indices
        List<Integer> sectionReloads = sectionReloads(old, updated);
        List<ItemPath> itemReloads = new ArrayList<>();
        List<ItemPath> itemReconfigures = new ArrayList<>();
        collectItemMarkers(updated, itemReloads, itemReconfigures);

        itemDeletes.sort(Collections.reverseOrder());
        Collections.sort(itemInserts);

        return new StagedChangeset(
                sectionDiff.deletes(),
                sectionDiff.inserts(),
                sectionMoves,
                sectionReloads,
                itemDeletes,
                itemInserts,
                itemMoves,
                itemReloads,
                itemReconfigures
        );
    }

    /**
     * Changeset for showing {@code hierarchical}'s visible items in
     * {@code section} of {@code old}, everything else unchanged.
     *
     * @throws IllegalStateException if {@code section} is not in {@code old}
     */
    public static <S, I> StagedChangeset reconcile(Snapshot<S, I> old,
                                                   HierarchicalSnapshot<I> hierarchical,
                                                   S section) {
        return reconcile(old, Snapshots.flatten(hierarchical, section, old));
    }

    // ---------- helpers ----------

    /**
     * Matched pairs (ordered by new index) that are not on the longest
     * increasing run of old indices. Pairs on that run keep their relative
     * order, so only the others need to move.
     */
    static List<DiffResult.Move> minimalMoves(List<DiffResult.Match> matched) {
        int n = matched.size();
        if (n == 0) {
            return List.of();
        }
        int[] oldIndices = new int[n];
        boolean anyMoved = false;
        for (int k = 0; k < n; k++) {
            DiffResult.Match m = matched.get(k);
            oldIndices[k] = m.oldIndex();
            anyMoved |= m.moved();
        }
        if (!anyMoved) {
            return List.of();
        }

        boolean[] stays = LongestIncreasingSubsequence.membership(oldIndices);
        List<DiffResult.Move> moves = new ArrayList<>();
        for (int k = 0; k < n; k++) {
            if (!stays[k]) {
                DiffResult.Match m = matched.get(k);
                moves.add(new DiffResult.Move(m.oldIndex(), m.newIndex()));
            }
        }
        return moves;
    }

    /** New indices of reloaded sections that exist on both sides, ascending. */
    private static <S, I> List<Integer> sectionReloads(Snapshot<S, I> old, Snapshot<S, I> updated) {
        Set<S> reloaded = updated.reloadedSectionIdentifiers();
        if (reloaded.isEmpty()) {
            return List.of();
        }
        List<Integer> out = new ArrayList<>();
        for (S id : reloaded) {
            if (old.containsSection(id)) {
                updated.indexOfSection(id).ifPresent(out::add);
            }
        }
        Collections.sort(out);
        return out;
    }

    private static <S, I> void collectItemMarkers(Snapshot<S, I> updated,
                                                  List<ItemPath> reloads,
                                                  List<ItemPath> reconfigures) {
        Set<I> reloaded = updated.reloadedItemIdentifiers();
        Set<I> reconfigured = updated.reconfiguredItemIdentifiers();
        if (reloaded.isEmpty() && reconfigured.isEmpty()) {
            return;
        }
        List<S> sections = updated.sectionIdentifiers();
        for (int s = 0; s < sections.size(); s++) {
            List<I> items = updated.itemIdentifiers(sections.get(s));
            for (int i = 0; i < items.size(); i++) {
                I item = items.get(i);
                if (reloaded.contains(item)) {
                    reloads.add(new ItemPath(s, i));
                }
                if (reconfigured.contains(item)) {
                    reconfigures.add(new ItemPath(s, i));
                }
            }
        }
    }
}
