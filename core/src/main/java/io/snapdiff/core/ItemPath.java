package io.snapdiff.core;

import java.util.Comparator;

/** Position of an item: section index plus item index within that section. */
public record ItemPath(int section, int item) implements Comparable<ItemPath> {

    private static final Comparator<ItemPath> ORDER =
            Comparator.comparingInt(ItemPath::section).thenComparingInt(ItemPath::item);

    public ItemPath {
        if (section < 0) throw new IllegalArgumentException("section must be >= 0");
        if (item < 0) throw new IllegalArgumentException("item must be >= 0");
    }

    public static ItemPath of(int section, int item) {
        return new ItemPath(section, item);
    }

    @Override
    public int compareTo(ItemPath other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "[" + section + "," + item + "]";
    }
}
