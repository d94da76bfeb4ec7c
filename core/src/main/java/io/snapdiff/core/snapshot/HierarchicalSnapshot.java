package io.snapdiff.core.snapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tree-shaped items of a single section, with per-node expand/collapse.
 * <p>
 * Representation:
 *  - items:     every item in depth-first order, including hidden ones.
 *               This list is the canonical order.
 *  - parentMap: item -> parent (roots have no entry).
 *  - children:  parent -> ordered immediate children.
 *  - expanded:  items whose children are shown when the item itself is shown.
 *  - members:   membership set for O(1) contains.
 * <p>
 * Depth-first invariant: a node's descendants form one contiguous run right
 * after the node. Inserts locate subtree boundaries instead of re-linearizing.
 * <p>
 * Not thread safe; use {@link #copy()} to hand an instance to another owner.
 *
 * @param <I> item identifier type
 */
public final class HierarchicalSnapshot<I> {

    private final List<I> items;
    private final Map<I, I> parentMap;
    private final Map<I, List<I>> children;
    private final Set<I> expanded;
    private final Set<I> members;

    public HierarchicalSnapshot() {
        this.items = new ArrayList<>();
        this.parentMap = new HashMap<>();
        this.children = new HashMap<>();
        this.expanded = new LinkedHashSet<>();
        this.members = new HashSet<>();
    }

    private HierarchicalSnapshot(HierarchicalSnapshot<I> other) {
        this.items = new ArrayList<>(other.items);
        this.parentMap = new HashMap<>(other.parentMap);
        this.children = new HashMap<>();
        for (Map.Entry<I, List<I>> e : other.children.entrySet()) {
            this.children.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        this.expanded = new LinkedHashSet<>(other.expanded);
        this.members = new HashSet<>(other.members);
    }

    public HierarchicalSnapshot<I> copy() {
        return new HierarchicalSnapshot<>(this);
    }

    // ---------- mutations ----------

    /** Append root items. */
    public void append(List<I> newItems) {
        assert allNew(newItems);
        items.addAll(newItems);
        members.addAll(newItems);
    }

    /**
     * Append {@code newItems} as the last children of {@code parent}; they land
     * right after the parent's current subtree. {@code parent == null} appends roots.
     * No-op when {@code parent} is not in the snapshot.
     */
    public void append(List<I> newItems, I parent) {
        if (parent == null) {
            append(newItems);
            return;
        }
        if (!members.contains(parent)) {
            return;
        }
        assert allNew(newItems);

        int insertAt = subtreeEnd(parent);
        items.addAll(insertAt, newItems);
        members.addAll(newItems);
        children.computeIfAbsent(parent, k -> new ArrayList<>()).addAll(newItems);
        for (I item : newItems) {
            parentMap.put(item, parent);
        }
    }

    /** Insert {@code newItems} as siblings directly before {@code sibling}. */
    public void insertBefore(List<I> newItems, I sibling) {
        if (!members.contains(sibling)) {
            return;
        }
        assert allNew(newItems);

        items.addAll(items.indexOf(sibling), newItems);
        adoptAsSiblings(newItems, sibling, 0);
    }

    /** Insert {@code newItems} as siblings directly after {@code sibling}'s subtree. */
    public void insertAfter(List<I> newItems, I sibling) {
        if (!members.contains(sibling)) {
            return;
        }
        assert allNew(newItems);

        items.addAll(subtreeEnd(sibling), newItems);
        adoptAsSiblings(newItems, sibling, 1);
    }

    /** Delete items together with their whole subtrees. Unknown items are ignored. */
    public void delete(Collection<I> toDelete) {
        Set<I> doomed = new HashSet<>();
        for (I item : toDelete) {
            if (!members.contains(item) || doomed.contains(item)) {
                continue;
            }
            collectSubtree(item, doomed);

            I parent = parentMap.get(item);
            if (parent != null) {
                List<I> siblings = children.get(parent);
                if (siblings != null) {
                    siblings.remove(item);
                    if (siblings.isEmpty()) {
                        children.remove(parent);
                    }
                }
            }
        }
        if (doomed.isEmpty()) {
            return;
        }
        for (I item : doomed) {
            parentMap.remove(item);
            children.remove(item);
            expanded.remove(item);
            members.remove(item);
        }
        items.removeIf(doomed::contains);
    }

    /** Remove everything. */
    public void deleteAll() {
        items.clear();
        parentMap.clear();
        children.clear();
        expanded.clear();
        members.clear();
    }

    /**
     * Marks items as expanded. Items not appended yet are recorded too and show
     * as expanded once they are; deleting an item clears its flag.
     */
    public void expand(Collection<I> toExpand) {
        expanded.addAll(toExpand);
    }

    public void collapse(Collection<I> toCollapse) {
        expanded.removeAll(toCollapse);
    }

    // ---------- queries ----------

    /** All items, depth-first, hidden ones included. */
    public List<I> items() {
        return Collections.unmodifiableList(items);
    }

    public int size() {
        return items.size();
    }

    public boolean contains(I item) {
        return members.contains(item);
    }

    public Optional<I> parent(I item) {
        return Optional.ofNullable(parentMap.get(item));
    }

    public List<I> children(I item) {
        List<I> c = children.get(item);
        return c == null ? List.of() : Collections.unmodifiableList(c);
    }

    /** Distance to the root: 0 for roots (and for unknown items). */
    public int level(I item) {
        int level = 0;
        I current = parentMap.get(item);
        while (current != null) {
            level++;
            current = parentMap.get(current);
        }
        return level;
    }

    public boolean isExpanded(I item) {
        return expanded.contains(item);
    }

    /** True when {@code item} is present and every ancestor is expanded. */
    public boolean isVisible(I item) {
        if (!members.contains(item)) {
            return false;
        }
        I current = parentMap.get(item);
        while (current != null) {
            if (!expanded.contains(current)) {
                return false;
            }
            current = parentMap.get(current);
        }
        return true;
    }

    public List<I> rootItems() {
        List<I> out = new ArrayList<>();
        for (I item : items) {
            if (!parentMap.containsKey(item)) {
                out.add(item);
            }
        }
        return out;
    }

    /**
     * Items reachable from a root through expanded ancestors only, in
     * depth-first order. One pass: parents always precede their children in
     * {@link #items()}, so a child is visible iff its parent was already found
     * visible and is expanded.
     */
    public List<I> visibleItems() {
        List<I> out = new ArrayList<>();
        Set<I> visible = new HashSet<>();
        for (I item : items) {
            I parent = parentMap.get(item);
            if (parent == null || (expanded.contains(parent) && visible.contains(parent))) {
                visible.add(item);
                out.add(item);
            }
        }
        return out;
    }

    /**
     * Independent copy of {@code item}'s descendants, optionally with
     * {@code item} itself as the single root. Parent links pointing outside
     * the copied subtree are dropped, so the top level of the copy is rootless.
     * Empty when {@code item} is unknown.
     */
    public HierarchicalSnapshot<I> snapshot(I item, boolean includingParent) {
        HierarchicalSnapshot<I> out = new HierarchicalSnapshot<>();
        if (!members.contains(item)) {
            return out;
        }
        if (includingParent) {
            out.items.add(item);
        }
        appendDescendants(item, out.items);
        out.members.addAll(out.items);

        for (I copied : out.items) {
            I parent = parentMap.get(copied);
            if (parent != null && out.members.contains(parent)) {
                out.parentMap.put(copied, parent);
            }
            List<I> kids = children.get(copied);
            if (kids != null) {
                out.children.put(copied, new ArrayList<>(kids));
            }
            if (expanded.contains(copied)) {
                out.expanded.add(copied);
            }
        }
        return out;
    }

    public HierarchicalSnapshot<I> snapshot(I item) {
        return snapshot(item, false);
    }

    // ---------- helpers ----------

    /** Index just past {@code item}'s subtree in the depth-first list. */
    private int subtreeEnd(I item) {
        I last = item;
        List<I> kids = children.get(last);
        while (kids != null && !kids.isEmpty()) {
            last = kids.get(kids.size() - 1);
            kids = children.get(last);
        }
        return items.indexOf(last) + 1;
    }

    private void adoptAsSiblings(List<I> newItems, I sibling, int offset) {
        members.addAll(newItems);
        I parent = parentMap.get(sibling);
        if (parent == null) {
            return;
        }
        for (I item : newItems) {
            parentMap.put(item, parent);
        }
        List<I> siblings = children.get(parent);
        int at = siblings.indexOf(sibling);
        siblings.addAll(at + offset, newItems);
    }

    private void collectSubtree(I root, Set<I> into) {
        Deque<I> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            I current = stack.pop();
            if (into.add(current)) {
                List<I> kids = children.get(current);
                if (kids != null) {
                    kids.forEach(stack::push);
                }
            }
        }
    }

    /** Depth-first, in child order. */
    private void appendDescendants(I item, List<I> out) {
        Deque<I> stack = new ArrayDeque<>();
        pushChildrenReversed(item, stack);
        while (!stack.isEmpty()) {
            I current = stack.pop();
            out.add(current);
            pushChildrenReversed(current, stack);
        }
    }

    private void pushChildrenReversed(I item, Deque<I> stack) {
        List<I> kids = children.get(item);
        if (kids == null) {
            return;
        }
        for (int i = kids.size() - 1; i >= 0; i--) {
            stack.push(kids.get(i));
        }
    }

    private boolean allNew(List<I> newItems) {
        Set<I> batch = new HashSet<>();
        for (I item : newItems) {
            if (members.contains(item) || !batch.add(item)) {
                throw new AssertionError("Item " + item + " already exists in the hierarchical snapshot");
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HierarchicalSnapshot<?> other)) return false;
        return items.equals(other.items)
                && parentMap.equals(other.parentMap)
                && expanded.equals(other.expanded);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, parentMap);
    }

    @Override
    public String toString() {
        return "HierarchicalSnapshot{items=" + items + ", expanded=" + expanded + '}';
    }
}
