package io.snapdiff.core.snapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between flat and hierarchical snapshots.
 */
public final class Snapshots {

    private Snapshots() {
    }

    /**
     * Copy of {@code base} whose {@code section} holds exactly the visible
     * items of {@code hierarchical}. Parent/child structure is not carried
     * into the flat result. {@code base} is left untouched.
     *
     * @throws IllegalStateException if {@code section} is not in {@code base}
     */
    public static <S, I> Snapshot<S, I> flatten(HierarchicalSnapshot<I> hierarchical,
                                                S section,
                                                Snapshot<S, I> base) {
        if (!base.containsSection(section)) {
            throw new IllegalStateException("Cannot flatten into missing section " + section);
        }
        Snapshot<S, I> out = base.copy();
        out.deleteItems(new ArrayList<>(out.itemIdentifiers(section)));
        List<I> visible = hierarchical.visibleItems();
        if (!visible.isEmpty()) {
            out.appendItems(visible, section);
        }
        return out;
    }

    /**
     * Items of {@code section} as root items of a new hierarchical snapshot.
     * Empty when the section does not exist.
     */
    public static <S, I> HierarchicalSnapshot<I> sectionSnapshot(Snapshot<S, I> snapshot, S section) {
        HierarchicalSnapshot<I> out = new HierarchicalSnapshot<>();
        List<I> items = snapshot.itemIdentifiers(section);
        if (!items.isEmpty()) {
            out.append(new ArrayList<>(items));
        }
        return out;
    }
}
