// file: src/main/java/io/snapdiff/core/snapshot/Snapshot.java
package io.snapdiff.core.snapshot;

import io.snapdiff.core.ItemPath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Ordered, sectioned collection of uniquely identified items.
 * <p>
 * Layout:
 *  - sectionIdentifiers: render order of sections.
 *  - sectionItems: items per section, parallel to sectionIdentifiers.
 *  - sectionIndex: section id -> position, rebuilt on structural section changes.
 *  - reverseIndex: item id -> section id, built lazily (see {@link ReverseIndex}).
 * <p>
 * Bookkeeping sets record items to reload, items to reconfigure and sections
 * to reload; they do not affect structure and are carried into the changeset.
 * <p>
 * Invariant: an item appears in at most one section. Violations are caught
 * by assertions on a best-effort basis only (when the reverse index is
 * already built), so callers must not treat them as a validator.
 * <p>
 * Not thread safe. Snapshots are values: callers mutate their own instance
 * and hand a {@link #copy()} to anything that outlives the mutation.
 *
 * @param <S> section identifier type
 * @param <I> item identifier type
 */
public final class Snapshot<S, I> {

    private final List<S> sectionIdentifiers;
    private final List<List<I>> sectionItems;
    private final Map<S, Integer> sectionIndex;
    private final ReverseIndex<I, S> reverseIndex;
    private int numberOfItems;

    private final Set<I> reloadedItems;
    private final Set<I> reconfiguredItems;
    private final Set<S> reloadedSections;

    public Snapshot() {
        this.sectionIdentifiers = new ArrayList<>();
        this.sectionItems = new ArrayList<>();
        this.sectionIndex = new HashMap<>();
        this.reverseIndex = new ReverseIndex<>();
        this.reloadedItems = new LinkedHashSet<>();
        this.reconfiguredItems = new LinkedHashSet<>();
        this.reloadedSections = new LinkedHashSet<>();
    }

    private Snapshot(Snapshot<S, I> other) {
        this.sectionIdentifiers = new ArrayList<>(other.sectionIdentifiers);
        this.sectionItems = new ArrayList<>(other.sectionItems.size());
        for (List<I> items : other.sectionItems) {
            this.sectionItems.add(new ArrayList<>(items));
        }
        this.sectionIndex = new HashMap<>(other.sectionIndex);
        this.reverseIndex = other.reverseIndex.copy();
        this.numberOfItems = other.numberOfItems;
        this.reloadedItems = new LinkedHashSet<>(other.reloadedItems);
        this.reconfiguredItems = new LinkedHashSet<>(other.reconfiguredItems);
        this.reloadedSections = new LinkedHashSet<>(other.reloadedSections);
    }

    /** Build a snapshot from section models, in order. */
    public static <S, I> Snapshot<S, I> of(List<SectionModel<S, I>> sections) {
        Snapshot<S, I> snapshot = new Snapshot<>();
        for (SectionModel<S, I> section : sections) {
            snapshot.appendSections(List.of(section.id()));
            snapshot.appendItems(section.items(), section.id());
        }
        return snapshot;
    }

    /** Independent deep copy (bookkeeping sets and a built reverse index included). */
    public Snapshot<S, I> copy() {
        return new Snapshot<>(this);
    }

    // ---------- section mutations ----------

    public void appendSections(List<S> identifiers) {
        for (S id : identifiers) {
            assert !sectionIndex.containsKey(id) : "Section " + id + " already exists";
            sectionIndex.put(id, sectionIdentifiers.size());
            sectionIdentifiers.add(id);
            sectionItems.add(new ArrayList<>());
        }
    }

    /** Insert sections before {@code before}. No-op when {@code before} is absent. */
    public void insertSectionsBefore(List<S> identifiers, S before) {
        Integer index = sectionIndex.get(before);
        if (index == null) {
            return;
        }
        insertSectionsAt(identifiers, index);
    }

    /** Insert sections after {@code after}. No-op when {@code after} is absent. */
    public void insertSectionsAfter(List<S> identifiers, S after) {
        Integer index = sectionIndex.get(after);
        if (index == null) {
            return;
        }
        insertSectionsAt(identifiers, index + 1);
    }

    /** Delete sections and all of their items. Unknown ids are ignored. */
    public void deleteSections(Collection<S> identifiers) {
        Set<S> toDelete = new HashSet<>(identifiers);
        boolean removedAny = false;
        for (int s = sectionIdentifiers.size() - 1; s >= 0; s--) {
            if (!toDelete.contains(sectionIdentifiers.get(s))) {
                continue;
            }
            List<I> items = sectionItems.remove(s);
            sectionIdentifiers.remove(s);
            numberOfItems -= items.size();
            // Deleted sections name their items exactly, so patching is proportional to the delete.
            for (I item : items) {
                reverseIndex.remove(item);
            }
            removedAny = true;
        }
        if (removedAny) {
            rebuildSectionIndex();
        }
    }

    public void moveSectionBefore(S identifier, S before) {
        Integer from = sectionIndex.get(identifier);
        Integer to = sectionIndex.get(before);
        if (from == null || to == null || from.equals(to)) {
            return;
        }
        int target = from < to ? to - 1 : to;
        relocateSection(from, target);
    }

    public void moveSectionAfter(S identifier, S after) {
        Integer from = sectionIndex.get(identifier);
        Integer to = sectionIndex.get(after);
        if (from == null || to == null || from.equals(to)) {
            return;
        }
        int target = from < to ? to : to + 1;
        relocateSection(from, target);
    }

    public void reloadSections(Collection<S> identifiers) {
        reloadedSections.addAll(identifiers);
    }

    // ---------- item mutations ----------

    /**
     * Append items to the last section.
     *
     * @throws IllegalStateException if the snapshot has no sections
     */
    public void appendItems(List<I> identifiers) {
        if (sectionIdentifiers.isEmpty()) {
            throw new IllegalStateException("No section available to append items");
        }
        appendItems(identifiers, sectionIdentifiers.get(sectionIdentifiers.size() - 1));
    }

    /**
     * Append items to {@code section}.
     *
     * @throws IllegalStateException if {@code section} does not exist
     */
    public void appendItems(List<I> identifiers, S section) {
        Integer idx = sectionIndex.get(section);
        if (idx == null) {
            throw new IllegalStateException("Cannot append items to missing section " + section);
        }

        assert batchIsUnique(identifiers);
        assert noneIndexed(identifiers);

        sectionItems.get(idx).addAll(identifiers);
        numberOfItems += identifiers.size();

        // Patch only when already built; the build-then-diff path skips this entirely.
        if (reverseIndex.isPresent()) {
            for (I id : identifiers) {
                reverseIndex.put(id, section);
            }
        }
    }

    /** Insert items before {@code before}, in its section. No-op when {@code before} is absent. */
    public void insertItemsBefore(List<I> identifiers, I before) {
        insertItemsNextTo(identifiers, before, 0);
    }

    /** Insert items after {@code after}, in its section. No-op when {@code after} is absent. */
    public void insertItemsAfter(List<I> identifiers, I after) {
        insertItemsNextTo(identifiers, after, 1);
    }

    /**
     * Delete items wherever they are. Unknown ids are ignored.
     * Always invalidates the reverse index.
     */
    public void deleteItems(Collection<I> identifiers) {
        Set<I> toDelete = new HashSet<>(identifiers);
        int remaining = toDelete.size();
        for (List<I> items : sectionItems) {
            if (remaining == 0) {
                break;
            }
            int before = items.size();
            items.removeIf(toDelete::contains);
            int removed = before - items.size();
            numberOfItems -= removed;
            remaining -= removed;
        }
        reverseIndex.invalidate();
    }

    /** Remove every item; sections stay. */
    public void deleteAllItems() {
        for (List<I> items : sectionItems) {
            items.clear();
        }
        numberOfItems = 0;
        reverseIndex.invalidate();
    }

    /** Move {@code identifier} directly before {@code before}, possibly into another section. */
    public void moveItemBefore(I identifier, I before) {
        moveItemNextTo(identifier, before, 0);
    }

    /** Move {@code identifier} directly after {@code after}, possibly into another section. */
    public void moveItemAfter(I identifier, I after) {
        moveItemNextTo(identifier, after, 1);
    }

    public void reloadItems(Collection<I> identifiers) {
        reloadedItems.addAll(identifiers);
    }

    public void reconfigureItems(Collection<I> identifiers) {
        reconfiguredItems.addAll(identifiers);
    }

    // ---------- queries ----------

    public List<S> sectionIdentifiers() {
        return Collections.unmodifiableList(sectionIdentifiers);
    }

    public int numberOfSections() {
        return sectionIdentifiers.size();
    }

    public int numberOfItems() {
        return numberOfItems;
    }

    /** All items in render order. */
    public List<I> itemIdentifiers() {
        List<I> out = new ArrayList<>(numberOfItems);
        for (List<I> items : sectionItems) {
            out.addAll(items);
        }
        return out;
    }

    /** Items of {@code section}, or an empty list when it does not exist. */
    public List<I> itemIdentifiers(S section) {
        Integer idx = sectionIndex.get(section);
        if (idx == null) {
            return List.of();
        }
        return Collections.unmodifiableList(sectionItems.get(idx));
    }

    /** Fast path for renderers: item at (sectionIndex, itemIndex). */
    public Optional<I> itemIdentifier(int sectionIdx, int itemIdx) {
        if (sectionIdx < 0 || sectionIdx >= sectionItems.size()) {
            return Optional.empty();
        }
        List<I> items = sectionItems.get(sectionIdx);
        if (itemIdx < 0 || itemIdx >= items.size()) {
            return Optional.empty();
        }
        return Optional.of(items.get(itemIdx));
    }

    public Optional<I> itemIdentifier(ItemPath path) {
        return itemIdentifier(path.section(), path.item());
    }

    public Optional<S> sectionIdentifier(int index) {
        if (index < 0 || index >= sectionIdentifiers.size()) {
            return Optional.empty();
        }
        return Optional.of(sectionIdentifiers.get(index));
    }

    /**
     * Section holding {@code item}. Uses the reverse index when it is already
     * built and otherwise scans, so a single query never forces a build.
     */
    public Optional<S> sectionIdentifierContaining(I item) {
        if (reverseIndex.isPresent()) {
            return reverseIndex.lookup(item);
        }
        for (int s = 0; s < sectionItems.size(); s++) {
            if (sectionItems.get(s).contains(item)) {
                return Optional.of(sectionIdentifiers.get(s));
            }
        }
        return Optional.empty();
    }

    /** Flat position of {@code item} across all sections. */
    public OptionalInt indexOfItem(I item) {
        int offset = 0;
        for (List<I> items : sectionItems) {
            int local = items.indexOf(item);
            if (local >= 0) {
                return OptionalInt.of(offset + local);
            }
            offset += items.size();
        }
        return OptionalInt.empty();
    }

    public OptionalInt indexOfSection(S section) {
        Integer idx = sectionIndex.get(section);
        return idx == null ? OptionalInt.empty() : OptionalInt.of(idx);
    }

    public Optional<ItemPath> indexPath(I item) {
        Optional<S> section = sectionIdentifierContaining(item);
        if (section.isEmpty()) {
            return Optional.empty();
        }
        int s = sectionIndex.get(section.get());
        int i = sectionItems.get(s).indexOf(item);
        return i < 0 ? Optional.empty() : Optional.of(new ItemPath(s, i));
    }

    public boolean containsSection(S section) {
        return sectionIndex.containsKey(section);
    }

    public int numberOfItems(S section) {
        Integer idx = sectionIndex.get(section);
        return idx == null ? 0 : sectionItems.get(idx).size();
    }

    public int numberOfItemsInSection(int sectionIdx) {
        if (sectionIdx < 0 || sectionIdx >= sectionItems.size()) {
            return 0;
        }
        return sectionItems.get(sectionIdx).size();
    }

    public Set<I> reloadedItemIdentifiers() {
        return Collections.unmodifiableSet(reloadedItems);
    }

    public Set<I> reconfiguredItemIdentifiers() {
        return Collections.unmodifiableSet(reconfiguredItems);
    }

    public Set<S> reloadedSectionIdentifiers() {
        return Collections.unmodifiableSet(reloadedSections);
    }

    /** For tests: current state of the lazy reverse index. */
    ReverseIndex.State reverseIndexState() {
        return reverseIndex.state();
    }

    // ---------- helpers ----------

    private void insertSectionsAt(List<S> identifiers, int index) {
        for (int k = 0; k < identifiers.size(); k++) {
            S id = identifiers.get(k);
            assert !sectionIndex.containsKey(id) : "Section " + id + " already exists";
            sectionIdentifiers.add(index + k, id);
            sectionItems.add(index + k, new ArrayList<>());
        }
        rebuildSectionIndex();
    }

    private void relocateSection(int from, int to) {
        S id = sectionIdentifiers.remove(from);
        List<I> items = sectionItems.remove(from);
        sectionIdentifiers.add(to, id);
        sectionItems.add(to, items);
        rebuildSectionIndex();
    }

    private void insertItemsNextTo(List<I> identifiers, I anchor, int offset) {
        Map<I, S> index = reverseIndex.ensure(sectionIdentifiers, sectionItems, numberOfItems);
        S section = index.get(anchor);
        if (section == null) {
            return;
        }
        assert batchIsUnique(identifiers);
        assert noneIndexed(identifiers);

        List<I> items = sectionItems.get(sectionIndex.get(section));
        int at = items.indexOf(anchor);
        if (at < 0) {
            return;
        }
        items.addAll(at + offset, identifiers);
        for (I id : identifiers) {
            index.put(id, section);
        }
        numberOfItems += identifiers.size();
    }

    /**
     * Resolve the destination completely (section, anchor position) before
     * touching the source, so a bad destination leaves the snapshot untouched.
     */
    private void moveItemNextTo(I identifier, I anchor, int offset) {
        if (Objects.equals(identifier, anchor)) {
            return;
        }
        Map<I, S> index = reverseIndex.ensure(sectionIdentifiers, sectionItems, numberOfItems);
        S fromSection = index.get(identifier);
        S toSection = index.get(anchor);
        if (fromSection == null || toSection == null) {
            return;
        }
        Integer fromIdx = sectionIndex.get(fromSection);
        Integer toIdx = sectionIndex.get(toSection);
        if (fromIdx == null || toIdx == null || toIdx >= sectionItems.size()) {
            return;
        }
        List<I> source = sectionItems.get(fromIdx);
        List<I> destination = sectionItems.get(toIdx);
        int sourcePos = source.indexOf(identifier);
        if (sourcePos < 0 || !destination.contains(anchor)) {
            return;
        }

        source.remove(sourcePos);
        int anchorPos = destination.indexOf(anchor);
        destination.add(anchorPos + offset, identifier);
        index.put(identifier, toSection);
    }

    private void rebuildSectionIndex() {
        sectionIndex.clear();
        for (int i = 0; i < sectionIdentifiers.size(); i++) {
            sectionIndex.put(sectionIdentifiers.get(i), i);
        }
    }

    private boolean batchIsUnique(List<I> identifiers) {
        if (identifiers.size() > 1) {
            Set<I> seen = new HashSet<>();
            for (I id : identifiers) {
                if (!seen.add(id)) {
                    throw new AssertionError("Duplicate item " + id + " in appended batch");
                }
            }
        }
        return true;
    }

    private boolean noneIndexed(List<I> identifiers) {
        for (I id : identifiers) {
            if (reverseIndex.knows(id)) {
                throw new AssertionError("Item " + id + " already exists in section "
                        + reverseIndex.lookup(id).orElse(null)
                        + ". Each item must belong to exactly one section.");
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot<?, ?> other)) return false;
        return sectionIdentifiers.equals(other.sectionIdentifiers)
                && sectionItems.equals(other.sectionItems)
                && reloadedItems.equals(other.reloadedItems)
                && reconfiguredItems.equals(other.reconfiguredItems)
                && reloadedSections.equals(other.reloadedSections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionIdentifiers, sectionItems);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Snapshot{");
        for (int s = 0; s < sectionIdentifiers.size(); s++) {
            if (s > 0) sb.append(", ");
            sb.append(sectionIdentifiers.get(s)).append('=').append(sectionItems.get(s));
        }
        return sb.append('}').toString();
    }
}
