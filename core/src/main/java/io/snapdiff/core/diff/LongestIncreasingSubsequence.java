package io.snapdiff.core.diff;

/**
 * Patience-sorting longest strictly increasing subsequence, O(n log n).
 * <p>
 * Used to pick the largest set of matched elements that are already in
 * relative order; everything outside that set has to be reported as a move.
 */
final class LongestIncreasingSubsequence {

    private LongestIncreasingSubsequence() {}

    /**
     * Mark which positions of {@code values} belong to one longest strictly
     * increasing subsequence. When several subsequences have the maximal
     * length, the one ending in the last pile's top card is chosen.
     */
    static boolean[] membership(int[] values) {
        int n = values.length;
        boolean[] member = new boolean[n];
        if (n == 0) {
            return member;
        }

        // tops[k] = position of the smallest tail of any increasing run of length k+1
        int[] tops = new int[n];
        int[] previous = new int[n];
        int piles = 0;

        for (int i = 0; i < n; i++) {
            int v = values[i];
            int lo = 0;
            int hi = piles;
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (values[tops[mid]] < v) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            previous[i] = lo > 0 ? tops[lo - 1] : -1;
            tops[lo] = i;
            if (lo == piles) {
                piles++;
            }
        }

        for (int i = tops[piles - 1]; i >= 0; i = previous[i]) {
            member[i] = true;
        }
        return member;
    }

    /** Length of the longest strictly increasing subsequence. */
    static int length(int[] values) {
        boolean[] member = membership(values);
        int count = 0;
        for (boolean b : member) {
            if (b) count++;
        }
        return count;
    }
}
