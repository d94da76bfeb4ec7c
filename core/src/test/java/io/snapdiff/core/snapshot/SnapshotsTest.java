package io.snapdiff.core.snapshot;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotsTest {

    @Test
    void flattenReplacesOnlyTheTargetSection() {
        Snapshot<String, String> base = Snapshot.of(List.of(
                SectionModel.of("head", "h1"),
                SectionModel.of("tree", "old1", "old2")
        ));
        HierarchicalSnapshot<String> h = new HierarchicalSnapshot<>();
        h.append(List.of("A", "B"));
        h.append(List.of("A1"), "A");
        h.expand(List.of("A"));

        Snapshot<String, String> flat = Snapshots.flatten(h, "tree", base);

        assertEquals(List.of("A", "A1", "B"), flat.itemIdentifiers("tree"));
        assertEquals(List.of("h1"), flat.itemIdentifiers("head"));
        assertEquals(List.of("old1", "old2"), base.itemIdentifiers("tree"));
    }

    @Test
    void flattenSkipsCollapsedChildren() {
        Snapshot<String, String> base = new Snapshot<>();
        base.appendSections(List.of("tree"));
        HierarchicalSnapshot<String> h = new HierarchicalSnapshot<>();
        h.append(List.of("A"));
        h.append(List.of("A1"), "A");

        assertEquals(List.of("A"), Snapshots.flatten(h, "tree", base).itemIdentifiers("tree"));
    }

    @Test
    void flattenIntoMissingSectionFails() {
        Snapshot<String, String> base = new Snapshot<>();
        assertThrows(IllegalStateException.class,
                () -> Snapshots.flatten(new HierarchicalSnapshot<>(), "tree", base));
    }

    @Test
    void sectionSnapshotLiftsItemsAsRoots() {
        Snapshot<String, Integer> s = Snapshot.of(List.of(SectionModel.of("a", 1, 2, 3)));

        HierarchicalSnapshot<Integer> h = Snapshots.sectionSnapshot(s, "a");
        assertEquals(List.of(1, 2, 3), h.rootItems());
        assertEquals(List.of(1, 2, 3), h.visibleItems());
        assertEquals(0, Snapshots.sectionSnapshot(s, "missing").size());
    }
}
