// file: bench/src/main/java/io/snapdiff/bench/Workload.java
package io.snapdiff.bench;

import io.snapdiff.core.snapshot.Snapshot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * A base snapshot and a mutated copy of it, used as one diff input pair.
 *
 * Mutations, each touching about {@code mutationRatio} of the items at
 * Zipf-skewed positions:
 *  - deletes,
 *  - inserts of fresh items,
 *  - moves to another position (possibly another section).
 *
 * @param base    the starting snapshot
 * @param mutated the snapshot after mutations
 * @param deleted number of items deleted
 * @param inserted number of items inserted
 * @param moved   number of items moved
 */
public record Workload(
        Snapshot<String, String> base,
        Snapshot<String, String> mutated,
        int deleted,
        int inserted,
        int moved
) {

    /** Build a base snapshot of {@code items} items spread evenly over {@code sections}. */
    public static Snapshot<String, String> baseSnapshot(int items, int sections) {
        if (items < 0) throw new IllegalArgumentException("items must be >= 0");
        if (sections <= 0) throw new IllegalArgumentException("sections must be > 0");

        Snapshot<String, String> s = new Snapshot<>();
        List<String> sectionIds = new ArrayList<>(sections);
        for (int i = 0; i < sections; i++) {
            sectionIds.add("section-" + i);
        }
        s.appendSections(sectionIds);

        int perSection = items / sections;
        int extra = items % sections;
        int next = 0;
        for (int i = 0; i < sections; i++) {
            int count = perSection + (i < extra ? 1 : 0);
            List<String> batch = new ArrayList<>(count);
            for (int k = 0; k < count; k++) {
                batch.add("item-" + next++);
            }
            s.appendItems(batch, sectionIds.get(i));
        }
        return s;
    }

    public static Workload generate(int items, int sections, double mutationRatio, double zipfSkew, long seed) {
        if (mutationRatio < 0.0 || mutationRatio > 1.0) {
            throw new IllegalArgumentException("mutationRatio must be in [0, 1]");
        }
        Snapshot<String, String> base = baseSnapshot(items, sections);
        Snapshot<String, String> mutated = base.copy();
        if (items == 0 || mutationRatio == 0.0) {
            return new Workload(base, mutated, 0, 0, 0);
        }

        Random rnd = new Random(seed);
        int perKind = Math.max(1, (int) Math.round(items * mutationRatio / 3.0));
        List<String> all = base.itemIdentifiers();

        // deletes
        int deleteCount = Math.min(perKind, all.size());
        int[] deletePositions = new ZipfianIndexPicker(all.size(), zipfSkew, seed).nextDistinct(deleteCount);
        Set<String> deleted = new HashSet<>();
        for (int p : deletePositions) {
            deleted.add(all.get(p));
        }
        mutated.deleteItems(deleted);

        // moves, among survivors
        List<String> survivors = mutated.itemIdentifiers();
        int moved = 0;
        if (survivors.size() > 1) {
            ZipfianIndexPicker picker = new ZipfianIndexPicker(survivors.size(), zipfSkew, seed + 1);
            int moveCount = Math.min(perKind, survivors.size() - 1);
            for (int p : picker.nextDistinct(moveCount)) {
                String item = survivors.get(p);
                String anchor = survivors.get(rnd.nextInt(survivors.size()));
                if (!anchor.equals(item)) {
                    mutated.moveItemAfter(item, anchor);
                    moved++;
                }
            }
        }

        // inserts: fresh ids next to Zipf-picked anchors, or appended when nothing survived
        int inserted = 0;
        List<String> anchors = mutated.itemIdentifiers();
        ZipfianIndexPicker insertPicker = anchors.isEmpty()
                ? null
                : new ZipfianIndexPicker(anchors.size(), zipfSkew, seed + 2);
        for (int k = 0; k < perKind; k++) {
            String fresh = "new-" + k;
            if (insertPicker == null) {
                mutated.appendItems(List.of(fresh));
            } else {
                mutated.insertItemsBefore(List.of(fresh), anchors.get(insertPicker.next()));
            }
            inserted++;
        }

        return new Workload(base, mutated, deleted.size(), inserted, moved);
    }
}
