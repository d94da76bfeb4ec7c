package io.snapdiff.core.content;

import io.snapdiff.core.snapshot.Snapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * Content-change detection between two snapshots.
 * <p>
 * Items are matched by identity ({@code equals}); the predicate then decides
 * whether the matched pair still shows the same content. Mismatches are the
 * items to reconfigure.
 */
public final class ContentChanges {

    private ContentChanges() {
    }

    /**
     * Items of {@code updated} (the new instances) whose identity also exists in
     * {@code old} but whose content differs, in render order of {@code updated}.
     */
    public static <S, I> List<I> itemsToReconfigure(Snapshot<S, I> old,
                                                    Snapshot<S, I> updated,
                                                    BiPredicate<? super I, ? super I> sameContent) {
        List<I> oldItems = old.itemIdentifiers();
        if (oldItems.isEmpty()) {
            return List.of();
        }
        Map<I, I> oldLookup = new HashMap<>(oldItems.size() * 2);
        for (I item : oldItems) {
            oldLookup.put(item, item);
        }

        List<I> out = new ArrayList<>();
        for (I item : updated.itemIdentifiers()) {
            I previous = oldLookup.get(item);
            if (previous != null && !sameContent.test(item, previous)) {
                out.add(item);
            }
        }
        return out;
    }

    /**
     * Marks every content-changed item of {@code updated} as reconfigured.
     *
     * @return number of items marked
     */
    public static <S, I> int markReconfigured(Snapshot<S, I> old,
                                              Snapshot<S, I> updated,
                                              BiPredicate<? super I, ? super I> sameContent) {
        List<I> changed = itemsToReconfigure(old, updated, sameContent);
        if (!changed.isEmpty()) {
            updated.reconfigureItems(changed);
        }
        return changed.size();
    }

    /** Predicate backed by {@link ContentEquatable#isContentEqual}. */
    public static <I extends ContentEquatable<? super I>> BiPredicate<I, I> contentEquality() {
        return (updated, previous) -> updated.isContentEqual(previous);
    }
}
