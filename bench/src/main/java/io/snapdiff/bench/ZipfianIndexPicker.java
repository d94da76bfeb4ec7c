// file: bench/src/main/java/io/snapdiff/bench/ZipfianIndexPicker.java
package io.snapdiff.bench;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Random;

/**
 * Zipf-distributed positions in [0, n): low positions are picked far more
 * often than high ones, like edits clustering at the top of a feed.
 *
 * Precomputes the normalized CDF once; each pick is a binary search.
 */
public final class ZipfianIndexPicker {

    private final int n;
    private final double[] cdf;
    private final Random rnd;

    public ZipfianIndexPicker(int n, double skew, long seed) {
        if (n <= 0) throw new IllegalArgumentException("n must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        this.n = n;
        this.rnd = new Random(seed);
        this.cdf = new double[n];

        double total = 0.0;
        for (int rank = 1; rank <= n; rank++) {
            total += 1.0 / Math.pow(rank, skew);
        }
        double running = 0.0;
        for (int i = 0; i < n; i++) {
            running += (1.0 / Math.pow(i + 1, skew)) / total;
            cdf[i] = running;
        }
        cdf[n - 1] = 1.0;
    }

    public int size() {
        return n;
    }

    /** One position in [0, n). */
    public int next() {
        double u = rnd.nextDouble();
        int lo = 0;
        int hi = n - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u <= cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    /**
     * {@code count} distinct positions, ascending. Falls back to the lowest
     * unpicked position once the skew keeps hitting already chosen ones.
     */
    public int[] nextDistinct(int count) {
        if (count < 0 || count > n) {
            throw new IllegalArgumentException("count must be in [0, " + n + "]");
        }
        BitSet picked = new BitSet(n);
        int[] out = new int[count];
        int attemptsLeft = count * 8;
        for (int k = 0; k < count; k++) {
            int p = next();
            while (picked.get(p) && attemptsLeft-- > 0) {
                p = next();
            }
            if (picked.get(p)) {
                p = picked.nextClearBit(0);
            }
            picked.set(p);
            out[k] = p;
        }
        Arrays.sort(out);
        return out;
    }
}
