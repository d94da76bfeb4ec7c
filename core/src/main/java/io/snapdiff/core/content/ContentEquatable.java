package io.snapdiff.core.content;

/**
 * Opt-in content comparison for items whose {@code equals}/{@code hashCode}
 * describe identity only.
 * <p>
 * Two items that are equal (same identity) but not content-equal are
 * reconfigured in place instead of being deleted and re-inserted.
 *
 * @param <T> the item type
 */
public interface ContentEquatable<T> {

    /** True when the visible content of {@code this} and {@code other} is the same. */
    boolean isContentEqual(T other);
}
