// file: scheduler/src/main/java/io/snapdiff/scheduler/UpdateScheduler.java
package io.snapdiff.scheduler;

import io.snapdiff.core.ItemPath;
import io.snapdiff.core.content.ContentChanges;
import io.snapdiff.core.diff.ChangesetReconciler;
import io.snapdiff.core.diff.StagedChangeset;
import io.snapdiff.core.snapshot.HierarchicalSnapshot;
import io.snapdiff.core.snapshot.Snapshot;
import io.snapdiff.core.snapshot.Snapshots;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Serializes transitions of one render target from its current snapshot to
 * newer ones.
 *
 * Responsibilities:
 *  - Chain every request behind the previous one, so transitions resolve in
 *    issuance order and at most one is in flight.
 *  - Reconcile inline for small inputs and on the diff executor for inputs
 *    above {@link SchedulerConfig#backgroundDiffThreshold()}.
 *  - Call the {@link RenderTarget} only on the injected apply executor.
 *  - With coalescing on, drop a transition whose token is older than the
 *    latest full-snapshot request, both before reconciling and again before
 *    committing. A hierarchical request only rewrites one section of whatever
 *    is current when it runs, so it never drops the requests queued before it.
 *
 * The current snapshot is replaced as a whole, never mutated, so the query
 * methods can be called from any thread. It is published right before the
 * render target is called (renderers read it back while applying) and rolled
 * back if the target fails.
 *
 * A failed transition completes its future exceptionally and is logged; the
 * chain continues with the next request.
 *
 * @param <S> section identifier type
 * @param <I> item identifier type
 */
public final class UpdateScheduler<S, I> implements AutoCloseable {
    private static final Logger log = Logger.getLogger(UpdateScheduler.class.getName());

    private final RenderTarget<S, I> target;
    private final Executor applyExecutor;
    private final Executor diffExecutor;
    private final ExecutorService ownedDiffExecutor; // null when the diff executor was injected
    private final SchedulerConfig config;
    private final BiPredicate<? super I, ? super I> contentEquality; // null: no automatic reconfigure

    private final Object chainLock = new Object();
    private CompletableFuture<TransitionOutcome> tail = CompletableFuture.completedFuture(null);
    private final AtomicLong issued = new AtomicLong();
    private final AtomicLong latestFullSnapshot = new AtomicLong();

    private volatile Snapshot<S, I> current = new Snapshot<>();
    private volatile boolean closed = false;

    public UpdateScheduler(RenderTarget<S, I> target, Executor applyExecutor) {
        this(target, applyExecutor, SchedulerConfig.defaults());
    }

    public UpdateScheduler(RenderTarget<S, I> target, Executor applyExecutor, SchedulerConfig config) {
        this(target, applyExecutor, null, config, null);
    }

    /**
     * @param target          render surface receiving changesets.
     * @param applyExecutor   the executor owning the render surface; every
     *                        target call and every commit runs on it.
     * @param diffExecutor    executor for large diffs, or null to create a
     *                        single daemon thread owned (and closed) by this scheduler.
     * @param config          thresholds and coalescing policy.
     * @param contentEquality content predicate for automatic reconfigure, or null.
     */
    public UpdateScheduler(RenderTarget<S, I> target,
                           Executor applyExecutor,
                           Executor diffExecutor,
                           SchedulerConfig config,
                           BiPredicate<? super I, ? super I> contentEquality) {
        this.target = Objects.requireNonNull(target, "target");
        this.applyExecutor = Objects.requireNonNull(applyExecutor, "applyExecutor");
        this.config = Objects.requireNonNull(config, "config");
        this.contentEquality = contentEquality;
        if (diffExecutor != null) {
            this.diffExecutor = diffExecutor;
            this.ownedDiffExecutor = null;
        } else {
            this.ownedDiffExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "snapdiff-diff");
                t.setDaemon(true);
                return t;
            });
            this.diffExecutor = ownedDiffExecutor;
        }
    }

    // ---------- requests ----------

    /** Animated transition to {@code snapshot}. */
    public CompletableFuture<TransitionOutcome> apply(Snapshot<S, I> snapshot) {
        return apply(snapshot, true);
    }

    /**
     * Transition to {@code snapshot}. The snapshot is copied now, so the caller
     * may keep mutating its instance. Without animation the target reloads
     * instead of running a batch update.
     */
    public CompletableFuture<TransitionOutcome> apply(Snapshot<S, I> snapshot, boolean animate) {
        Snapshot<S, I> next = snapshot.copy();
        return enqueue(previous -> next, true, animate, false);
    }

    /** Replace the current snapshot and reload the target without diffing. */
    public CompletableFuture<TransitionOutcome> applyUsingReloadData(Snapshot<S, I> snapshot) {
        Snapshot<S, I> next = snapshot.copy();
        return enqueue(previous -> next, true, false, true);
    }

    /**
     * Show {@code hierarchical}'s visible items in {@code section}, leaving the
     * other sections as they are when the transition runs. Fails with
     * {@link IllegalStateException} if the section is missing at that point.
     */
    public CompletableFuture<TransitionOutcome> apply(HierarchicalSnapshot<I> hierarchical, S section, boolean animate) {
        HierarchicalSnapshot<I> tree = hierarchical.copy();
        return enqueue(previous -> Snapshots.flatten(tree, section, previous), false, animate, false);
    }

    // ---------- queries ----------

    /** Copy of the last committed snapshot. */
    public Snapshot<S, I> currentSnapshot() {
        return current.copy();
    }

    public Optional<I> itemIdentifier(ItemPath path) {
        return current.itemIdentifier(path);
    }

    public Optional<ItemPath> indexPath(I item) {
        return current.indexPath(item);
    }

    public Optional<S> sectionIdentifier(int index) {
        return current.sectionIdentifier(index);
    }

    public OptionalInt indexOfSection(S section) {
        return current.indexOfSection(section);
    }

    public int numberOfSections() {
        return current.numberOfSections();
    }

    public int numberOfItems() {
        return current.numberOfItems();
    }

    /** Issuance number of the most recent request. */
    public long latestToken() {
        return issued.get();
    }

    /**
     * Stop accepting requests. Transitions already queued still run; the owned
     * diff executor is shut down once the last of them has resolved.
     */
    @Override
    public void close() {
        synchronized (chainLock) {
            if (closed) {
                return;
            }
            closed = true;
            if (ownedDiffExecutor != null) {
                tail.whenComplete((r, e) -> ownedDiffExecutor.shutdown());
            }
        }
        log.fine("UpdateScheduler closed after " + issued.get() + " transitions");
    }

    // ---------- pipeline ----------

    /**
     * @param fullSnapshot true when {@code nextState} ignores its argument, so
     *                     every earlier transition may be skipped in its favour.
     */
    private CompletableFuture<TransitionOutcome> enqueue(Function<Snapshot<S, I>, Snapshot<S, I>> nextState,
                                                         boolean fullSnapshot,
                                                         boolean animate,
                                                         boolean reloadOnly) {
        CompletableFuture<TransitionOutcome> next;
        synchronized (chainLock) {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException("UpdateScheduler is closed"));
            }
            long token = issued.incrementAndGet();
            if (fullSnapshot) {
                latestFullSnapshot.set(token);
            }
            long issuedAt = System.nanoTime();
            next = tail
                    .handle((r, e) -> (Void) null)
                    .thenComposeAsync(ignored -> run(token, issuedAt, nextState, animate, reloadOnly), applyExecutor);
            next.whenComplete((outcome, error) -> TransitionLogger.logTransition(
                    token, outcome, System.nanoTime() - issuedAt, unwrap(error)));
            tail = next;
        }
        // Callers get a copy: cancelling it must not unblock the chain early.
        return next.copy();
    }

    /** Runs on the apply executor. */
    private CompletionStage<TransitionOutcome> run(long token,
                                                   long issuedAt,
                                                   Function<Snapshot<S, I>, Snapshot<S, I>> nextState,
                                                   boolean animate,
                                                   boolean reloadOnly) {
        if (isSuperseded(token)) {
            return CompletableFuture.completedFuture(superseded(token, issuedAt, false, 0L));
        }

        Snapshot<S, I> previous = current;
        Snapshot<S, I> next = nextState.apply(previous);

        if (reloadOnly) {
            reload(previous, next);
            return CompletableFuture.completedFuture(new TransitionOutcome(
                    token, TransitionOutcome.Status.RELOADED, StagedChangeset.EMPTY,
                    false, 0L, System.nanoTime() - issuedAt));
        }

        boolean background = previous.numberOfItems() + next.numberOfItems() > config.backgroundDiffThreshold();
        if (!background) {
            Diffed diffed = reconcile(previous, next);
            return commit(token, issuedAt, previous, next, diffed, false, animate);
        }
        return CompletableFuture
                .supplyAsync(() -> reconcile(previous, next), diffExecutor)
                .thenComposeAsync(diffed -> commit(token, issuedAt, previous, next, diffed, true, animate), applyExecutor);
    }

    /** Runs on the apply executor; last point where a stale transition can be dropped. */
    private CompletionStage<TransitionOutcome> commit(long token,
                                                      long issuedAt,
                                                      Snapshot<S, I> previous,
                                                      Snapshot<S, I> next,
                                                      Diffed diffed,
                                                      boolean background,
                                                      boolean animate) {
        if (isSuperseded(token)) {
            return CompletableFuture.completedFuture(superseded(token, issuedAt, background, diffed.nanos()));
        }

        StagedChangeset changeset = diffed.changeset();
        if (changeset.isEmpty()) {
            current = next;
            return CompletableFuture.completedFuture(outcome(
                    token, TransitionOutcome.Status.UNCHANGED, changeset, background, diffed.nanos(), issuedAt));
        }

        if (!animate) {
            reload(previous, next);
            return CompletableFuture.completedFuture(outcome(
                    token, TransitionOutcome.Status.RELOADED, changeset, background, diffed.nanos(), issuedAt));
        }

        current = next;
        CompletionStage<Void> batch;
        try {
            batch = target.performBatchUpdates(next, changeset);
        } catch (RuntimeException e) {
            current = previous;
            throw e;
        }
        return batch.toCompletableFuture()
                .whenComplete((v, error) -> {
                    if (error != null) {
                        current = previous;
                    }
                })
                .thenApply(v -> outcome(
                        token, TransitionOutcome.Status.APPLIED, changeset, background, diffed.nanos(), issuedAt));
    }

    private void reload(Snapshot<S, I> previous, Snapshot<S, I> next) {
        current = next;
        try {
            target.reloadData(next);
        } catch (RuntimeException e) {
            current = previous;
            throw e;
        }
    }

    private boolean isSuperseded(long token) {
        return config.coalesceSuperseded() && token < latestFullSnapshot.get();
    }

    /** Runs inline or on the diff executor; {@code next} is owned by this transition. */
    private Diffed reconcile(Snapshot<S, I> previous, Snapshot<S, I> next) {
        long start = System.nanoTime();
        if (config.autoReconfigure() && contentEquality != null) {
            ContentChanges.markReconfigured(previous, next, contentEquality);
        }
        StagedChangeset changeset = ChangesetReconciler.reconcile(previous, next);
        return new Diffed(changeset, System.nanoTime() - start);
    }

    private static TransitionOutcome superseded(long token, long issuedAt, boolean background, long diffNanos) {
        return new TransitionOutcome(token, TransitionOutcome.Status.SUPERSEDED, StagedChangeset.EMPTY,
                background, diffNanos, System.nanoTime() - issuedAt);
    }

    private static TransitionOutcome outcome(long token,
                                             TransitionOutcome.Status status,
                                             StagedChangeset changeset,
                                             boolean background,
                                             long diffNanos,
                                             long issuedAt) {
        return new TransitionOutcome(token, status, changeset, background, diffNanos, System.nanoTime() - issuedAt);
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private record Diffed(StagedChangeset changeset, long nanos) {}
}
