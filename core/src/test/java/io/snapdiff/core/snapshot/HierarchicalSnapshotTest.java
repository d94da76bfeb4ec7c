package io.snapdiff.core.snapshot;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the tree-shaped snapshot.
 *
 * Goal is to validate:
 *  - depth-first order is kept by appends and sibling inserts,
 *  - visibility follows ancestor expansion only,
 *  - subtree deletion and extraction never leave dangling parents.
 */
class HierarchicalSnapshotTest {

    /**
     * A
     * ├─ B
     * │  ├─ D
     * │  └─ E
     * └─ C
     * F
     */
    private static HierarchicalSnapshot<String> tree() {
        HierarchicalSnapshot<String> h = new HierarchicalSnapshot<>();
        h.append(List.of("A", "F"));
        h.append(List.of("B", "C"), "A");
        h.append(List.of("D", "E"), "B");
        return h;
    }

    @Test
    void collapseHidesChildrenButKeepsOrder() {
        HierarchicalSnapshot<String> h = new HierarchicalSnapshot<>();
        h.append(List.of("A"));
        h.expand(List.of("A"));
        h.append(List.of("B", "C"), "A");

        assertEquals(List.of("A", "B", "C"), h.visibleItems());

        h.collapse(List.of("A"));
        assertEquals(List.of("A"), h.visibleItems());
        assertEquals(List.of("A", "B", "C"), h.items());
    }

    @Test
    void childrenLandAfterTheWholeExistingSubtree() {
        HierarchicalSnapshot<String> h = tree();
        assertEquals(List.of("A", "B", "D", "E", "C", "F"), h.items());

        h.append(List.of("G"), "B");
        assertEquals(List.of("A", "B", "D", "E", "G", "C", "F"), h.items());
        assertEquals(List.of("D", "E", "G"), h.children("B"));
    }

    @Test
    void appendToMissingParentIsNoop() {
        HierarchicalSnapshot<String> h = tree();
        h.append(List.of("Z"), "nope");
        assertFalse(h.contains("Z"));
        assertEquals(6, h.size());
    }

    @Test
    void duplicateAppendTripsAssertion() {
        HierarchicalSnapshot<String> h = tree();
        assertThrows(AssertionError.class, () -> h.append(List.of("D"), "C"));
    }

    @Test
    void insertBeforeAndAfterSiblings() {
        HierarchicalSnapshot<String> h = tree();
        h.insertBefore(List.of("X"), "C");
        h.insertAfter(List.of("Y"), "B");
        h.insertAfter(List.of("R"), "A");

        assertEquals(List.of("A", "B", "D", "E", "Y", "X", "C", "R", "F"), h.items());
        assertEquals(List.of("B", "Y", "X", "C"), h.children("A"));
        assertEquals(Optional.of("A"), h.parent("X"));
        assertEquals(Optional.empty(), h.parent("R"));
        assertEquals(List.of("A", "R", "F"), h.rootItems());
    }

    @Test
    void levelsAndParents() {
        HierarchicalSnapshot<String> h = tree();
        assertEquals(0, h.level("A"));
        assertEquals(1, h.level("B"));
        assertEquals(2, h.level("E"));
        assertEquals(0, h.level("unknown"));
        assertEquals(Optional.of("B"), h.parent("D"));
        assertEquals(Optional.empty(), h.parent("A"));
        assertEquals(List.of(), h.children("F"));
    }

    @Test
    void visibilityRequiresEveryAncestorExpanded() {
        HierarchicalSnapshot<String> h = tree();
        h.expand(List.of("B"));

        // B expanded but A collapsed: D stays hidden
        assertFalse(h.isVisible("D"));
        assertEquals(List.of("A", "F"), h.visibleItems());

        h.expand(List.of("A"));
        assertTrue(h.isVisible("D"));
        assertTrue(h.isExpanded("A"));
        assertEquals(List.of("A", "B", "D", "E", "C", "F"), h.visibleItems());

        h.collapse(List.of("A"));
        assertFalse(h.isVisible("E"));
        assertTrue(h.isExpanded("B"));
        assertEquals(List.of("A", "F"), h.visibleItems());
        assertFalse(h.isVisible("unknown"));
    }

    @Test
    void visibleItemsMatchesAncestorWalkOnEveryNode() {
        HierarchicalSnapshot<String> h = tree();
        h.expand(List.of("A", "E"));
        for (String item : h.items()) {
            assertEquals(h.isVisible(item), h.visibleItems().contains(item), item);
        }
    }

    @Test
    void deleteRemovesWholeSubtree() {
        HierarchicalSnapshot<String> h = tree();
        h.expand(List.of("A", "B"));
        h.delete(List.of("B", "nope"));

        assertEquals(List.of("A", "C", "F"), h.items());
        assertEquals(List.of("C"), h.children("A"));
        assertFalse(h.contains("D"));
        assertFalse(h.isExpanded("B"));
        assertEquals(Optional.empty(), h.parent("D"));
    }

    @Test
    void deletingLastChildClearsChildList() {
        HierarchicalSnapshot<String> h = tree();
        h.delete(List.of("D", "E"));
        assertEquals(List.of(), h.children("B"));

        h.append(List.of("Q"), "B");
        assertEquals(List.of("A", "B", "Q", "C", "F"), h.items());
    }

    @Test
    void subtreeExtractionWithoutParentHasNoDanglingParents() {
        HierarchicalSnapshot<String> h = tree();
        h.expand(List.of("A", "B"));

        HierarchicalSnapshot<String> sub = h.snapshot("A");
        assertEquals(List.of("B", "D", "E", "C"), sub.items());
        assertEquals(List.of("B", "C"), sub.rootItems());
        for (String item : sub.items()) {
            sub.parent(item).ifPresent(p -> assertTrue(sub.contains(p), item + " -> " + p));
        }
        assertEquals(Optional.empty(), sub.parent("B"));
        assertEquals(Optional.of("B"), sub.parent("D"));
        assertTrue(sub.isExpanded("B"));
        assertFalse(sub.contains("A"));
    }

    @Test
    void subtreeExtractionIncludingParent() {
        HierarchicalSnapshot<String> h = tree();
        HierarchicalSnapshot<String> sub = h.snapshot("B", true);

        assertEquals(List.of("B", "D", "E"), sub.items());
        assertEquals(List.of("B"), sub.rootItems());
        assertEquals(Optional.empty(), sub.parent("B"));
        assertEquals(1, sub.level("E"));
    }

    @Test
    void extractedSubtreeIsIndependent() {
        HierarchicalSnapshot<String> h = tree();
        HierarchicalSnapshot<String> sub = h.snapshot("A", true);
        sub.append(List.of("N"), "C");
        sub.delete(List.of("B"));

        assertTrue(h.contains("D"));
        assertFalse(h.contains("N"));
        assertEquals(List.of("B", "C"), h.children("A"));
    }

    @Test
    void extractingUnknownItemIsEmpty() {
        assertEquals(0, tree().snapshot("nope", true).size());
    }

    @Test
    void copyIsIndependentAndEqual() {
        HierarchicalSnapshot<String> h = tree();
        HierarchicalSnapshot<String> copy = h.copy();
        assertEquals(h, copy);

        copy.append(List.of("Z"), "F");
        assertFalse(h.contains("Z"));
        assertEquals(List.of(), h.children("F"));
        assertNotEquals(h, copy);
    }

    @Test
    void expandingBeforeAppendTakesEffectOnceAppended() {
        HierarchicalSnapshot<String> h = new HierarchicalSnapshot<>();
        h.expand(List.of("A"));
        h.append(List.of("A"));
        h.append(List.of("B", "C"), "A");

        assertTrue(h.isExpanded("A"));
        assertEquals(List.of("A", "B", "C"), h.visibleItems());

        h.collapse(List.of("A"));
        assertEquals(List.of("A"), h.visibleItems());
        assertEquals(List.of("A", "B", "C"), h.items());
    }

    @Test
    void deletingAnItemClearsItsExpandedFlag() {
        HierarchicalSnapshot<String> h = tree();
        h.expand(List.of("A", "B"));
        h.delete(List.of("B"));
        assertFalse(h.isExpanded("B"));

        h.append(List.of("B"), "A");
        assertFalse(h.isExpanded("B"));
    }

    @Test
    void deleteAllEmptiesTheTree() {
        HierarchicalSnapshot<String> h = tree();
        h.expand(List.of("A"));
        h.deleteAll();

        assertEquals(0, h.size());
        assertEquals(List.of(), h.rootItems());
        assertEquals(List.of(), h.visibleItems());
        assertFalse(h.contains("A"));
        assertFalse(h.isExpanded("A"));
        assertEquals(Optional.empty(), h.parent("B"));
        assertEquals(new HierarchicalSnapshot<String>(), h);

        h.append(List.of("A"));
        assertEquals(List.of("A"), h.visibleItems());
    }
}
