// file: bench/src/main/java/io/snapdiff/bench/DiffBench.java
package io.snapdiff.bench;

import io.snapdiff.core.diff.ChangesetReconciler;
import io.snapdiff.core.diff.DiffResult;
import io.snapdiff.core.diff.FlatDiff;
import io.snapdiff.core.diff.StagedChangeset;
import io.snapdiff.core.snapshot.Snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Microbenchmark driver for snapshot building, flat diffing and reconciling.
 *
 * Usage:
 *   java -cp bench.jar io.snapdiff.bench.DiffBench \
 *     --items 10000 \
 *     --sections 4 \
 *     --runs 15 \
 *     --warmup 5 \
 *     --mutation-ratio 0.1 \
 *     --zipf-skew 0.99
 *
 * Output:
 *   - One summary line per scenario to stderr (median and p95).
 *   - CSV to stdout with every timed run:
 *       scenario,run,millis
 */
public final class DiffBench {

    /** Timed runs of one scenario. */
    record Result(String scenario, List<Double> millis) {

        double median() {
            return percentile(sorted(), 0.50);
        }

        double p95() {
            return percentile(sorted(), 0.95);
        }

        private List<Double> sorted() {
            List<Double> copy = new ArrayList<>(millis);
            Collections.sort(copy);
            return copy;
        }
    }

    /** Benchmark parameters, parsed from {@code --key value} pairs. */
    record Options(int items, int sections, int runs, int warmup, double mutationRatio, double zipfSkew) {

        Options {
            if (items < 0) throw new IllegalArgumentException("items must be >= 0");
            if (sections <= 0) throw new IllegalArgumentException("sections must be > 0");
            if (runs <= 0) throw new IllegalArgumentException("runs must be > 0");
            if (warmup < 0) throw new IllegalArgumentException("warmup must be >= 0");
        }

        static Options parse(String[] args) {
            Map<String, String> cfg = parseArgs(args);
            return new Options(
                    Integer.parseInt(cfg.getOrDefault("items", "10000")),
                    Integer.parseInt(cfg.getOrDefault("sections", "1")),
                    Integer.parseInt(cfg.getOrDefault("runs", "15")),
                    Integer.parseInt(cfg.getOrDefault("warmup", "5")),
                    Double.parseDouble(cfg.getOrDefault("mutation-ratio", "0.1")),
                    Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"))
            );
        }
    }

    private DiffBench() {
    }

    public static void main(String[] args) {
        Options options = Options.parse(args);
        List<Result> results = run(options);
        summarizeAndPrint(options, results);
    }

    static List<Result> run(Options o) {
        Workload w = Workload.generate(o.items(), o.sections(), o.mutationRatio(), o.zipfSkew(), 42L);
        List<String> oldItems = w.base().itemIdentifiers();
        List<String> newItems = w.mutated().itemIdentifiers();

        Map<String, Runnable> scenarios = new LinkedHashMap<>();
        scenarios.put("build", () -> blackhole(Workload.baseSnapshot(o.items(), o.sections()).numberOfItems()));
        scenarios.put("flat-diff", () -> {
            DiffResult r = FlatDiff.diff(oldItems, newItems);
            blackhole(r.matched().size());
        });
        scenarios.put("flat-diff-identical", () -> {
            DiffResult r = FlatDiff.diff(oldItems, oldItems);
            blackhole(r.matched().size());
        });
        scenarios.put("reconcile", () -> {
            StagedChangeset c = ChangesetReconciler.reconcile(w.base(), w.mutated());
            blackhole(c.operationCount());
        });
        scenarios.put("query-index-path", () -> {
            Snapshot<String, String> s = w.mutated();
            for (int i = 0; i < Math.min(100, newItems.size()); i++) {
                blackhole(s.indexPath(newItems.get(i)).isPresent() ? 1 : 0);
            }
        });

        List<Result> out = new ArrayList<>();
        for (Map.Entry<String, Runnable> e : scenarios.entrySet()) {
            out.add(measure(e.getKey(), o.warmup(), o.runs(), e.getValue()));
        }
        return out;
    }

    static Result measure(String scenario, int warmup, int runs, Runnable block) {
        for (int i = 0; i < warmup; i++) {
            block.run();
        }
        List<Double> millis = new ArrayList<>(runs);
        for (int i = 0; i < runs; i++) {
            long start = System.nanoTime();
            block.run();
            millis.add((System.nanoTime() - start) / 1_000_000.0);
        }
        return new Result(scenario, millis);
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static void summarizeAndPrint(Options o, List<Result> results) {
        System.err.printf("items=%d, sections=%d, runs=%d, warmup=%d, mutation-ratio=%.2f, zipf-skew=%.2f%n",
                o.items(), o.sections(), o.runs(), o.warmup(), o.mutationRatio(), o.zipfSkew());
        for (Result r : results) {
            System.err.printf("%-20s median=%.3fms, p95=%.3fms%n", r.scenario(), r.median(), r.p95());
        }

        // CSV to stdout.
        System.out.println("scenario,run,millis");
        for (Result r : results) {
            for (int i = 0; i < r.millis().size(); i++) {
                System.out.printf("%s,%d,%.3f%n", r.scenario(), i, r.millis().get(i));
            }
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }

    // Keeps the JIT from discarding benchmarked work.
    private static volatile long sink;

    private static void blackhole(long value) {
        sink += value;
    }
}
