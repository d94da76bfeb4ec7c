// file: scheduler/src/test/java/io/snapdiff/scheduler/UpdateSchedulerTest.java
package io.snapdiff.scheduler;

import io.snapdiff.core.ItemPath;
import io.snapdiff.core.diff.StagedChangeset;
import io.snapdiff.core.snapshot.HierarchicalSnapshot;
import io.snapdiff.core.snapshot.SectionModel;
import io.snapdiff.core.snapshot.Snapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the transition pipeline.
 *
 * Goal is to validate:
 *  - transitions resolve in issuance order on the apply executor,
 *  - superseded transitions are dropped without touching the target,
 *  - large diffs go to the diff executor, small ones stay inline,
 *  - a failing transition leaves the last committed snapshot in place.
 */
class UpdateSchedulerTest {

    private ExecutorService render;
    private ExecutorService diffPool;
    private RecordingTarget target;

    @BeforeEach
    void setUp() {
        render = Executors.newSingleThreadExecutor(r -> new Thread(r, "render"));
        diffPool = Executors.newSingleThreadExecutor(r -> new Thread(r, "diff-test"));
        target = new RecordingTarget();
    }

    @AfterEach
    void tearDown() {
        render.shutdownNow();
        diffPool.shutdownNow();
    }

    @Test
    void firstApplyInsertsSectionsAndCommits() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            TransitionOutcome o = await(s.apply(snapshot(1, 2, 3)));

            assertEquals(TransitionOutcome.Status.APPLIED, o.status());
            assertEquals(List.of(0), o.changeset().sectionInserts());
            assertEquals(snapshot(1, 2, 3), s.currentSnapshot());
            assertEquals(List.of("batch[1, 2, 3]"), target.events);
        }
    }

    @Test
    void targetIsOnlyCalledOnTheApplyExecutor() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render, diffPool,
                SchedulerConfig.defaults().withBackgroundDiffThreshold(0), null)) {
            await(s.apply(snapshot(1, 2)));
            await(s.apply(snapshot(2, 1), false));
            await(s.applyUsingReloadData(snapshot(3)));

            assertEquals(3, target.threads.size());
            for (String thread : target.threads) {
                assertEquals("render", thread);
            }
        }
    }

    @Test
    void transitionsResolveInIssuanceOrderWithoutCoalescing() throws Exception {
        SchedulerConfig config = SchedulerConfig.defaults().withCoalesceSuperseded(false);
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render, config)) {
            List<CompletableFuture<TransitionOutcome>> futures = new ArrayList<>();
            for (int i = 1; i <= 5; i++) {
                futures.add(s.apply(snapshot(i)));
            }

            long lastToken = 0;
            for (CompletableFuture<TransitionOutcome> f : futures) {
                TransitionOutcome o = await(f);
                assertEquals(TransitionOutcome.Status.APPLIED, o.status());
                assertTrue(o.token() > lastToken);
                lastToken = o.token();
            }
            assertEquals(List.of("batch[1]", "batch[2]", "batch[3]", "batch[4]", "batch[5]"), target.events);
            assertEquals(snapshot(5), s.currentSnapshot());
        }
    }

    @Test
    void supersededTransitionIsDroppedAndLatestWins() throws Exception {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        target.nextBatchResult = gate;

        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            CompletableFuture<TransitionOutcome> first = s.apply(snapshot(1));
            target.awaitEvents(1);

            CompletableFuture<TransitionOutcome> second = s.apply(snapshot(2));
            CompletableFuture<TransitionOutcome> third = s.apply(snapshot(3));
            gate.complete(null);

            assertEquals(TransitionOutcome.Status.APPLIED, await(first).status());
            TransitionOutcome skipped = await(second);
            assertEquals(TransitionOutcome.Status.SUPERSEDED, skipped.status());
            assertFalse(skipped.committed());
            assertEquals(TransitionOutcome.Status.APPLIED, await(third).status());

            assertEquals(List.of("batch[1]", "batch[3]"), target.events);
            assertEquals(snapshot(3), s.currentSnapshot());
            assertEquals(3, s.latestToken());
        }
    }

    @Test
    void largeDiffsRunOnTheDiffExecutor() throws Exception {
        AtomicInteger diffTasks = new AtomicInteger();
        Executor countingDiff = r -> {
            diffTasks.incrementAndGet();
            diffPool.execute(r);
        };
        SchedulerConfig config = SchedulerConfig.defaults().withBackgroundDiffThreshold(4);

        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render, countingDiff, config, null)) {
            TransitionOutcome small = await(s.apply(snapshot(1, 2)));
            assertFalse(small.backgroundDiff());
            assertEquals(0, diffTasks.get());

            TransitionOutcome large = await(s.apply(snapshot(1, 2, 3, 4)));
            assertTrue(large.backgroundDiff());
            assertEquals(1, diffTasks.get());
            assertEquals(List.of(ItemPath.of(0, 2), ItemPath.of(0, 3)), large.changeset().itemInserts());
        }
    }

    @Test
    void failingTargetKeepsLastCommittedSnapshotAndChainContinues() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            await(s.apply(snapshot(1, 2)));

            target.failNext = true;
            CompletableFuture<TransitionOutcome> failed = s.apply(snapshot(2, 1, 9));
            ExecutionException e = assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, rootCause(e));
            assertEquals(snapshot(1, 2), s.currentSnapshot());

            TransitionOutcome after = await(s.apply(snapshot(1, 2, 3)));
            assertEquals(TransitionOutcome.Status.APPLIED, after.status());
            assertEquals(List.of(ItemPath.of(0, 2)), after.changeset().itemInserts());
            assertEquals(snapshot(1, 2, 3), s.currentSnapshot());
        }
    }

    @Test
    void asynchronouslyFailingBatchRollsBack() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            await(s.apply(snapshot(1)));

            target.nextBatchResult = CompletableFuture.failedFuture(new IllegalStateException("surface gone"));
            CompletableFuture<TransitionOutcome> failed = s.apply(snapshot(1, 2));
            assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));

            assertEquals(snapshot(1), s.currentSnapshot());
        }
    }

    @Test
    void nonAnimatedTransitionReloads() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            TransitionOutcome o = await(s.apply(snapshot(4, 5), false));

            assertEquals(TransitionOutcome.Status.RELOADED, o.status());
            assertFalse(o.changeset().isEmpty());
            assertEquals(List.of("reload[4, 5]"), target.events);
        }
    }

    @Test
    void unchangedTransitionSkipsTheTarget() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            await(s.apply(snapshot(1, 2)));
            TransitionOutcome o = await(s.apply(snapshot(1, 2)));

            assertEquals(TransitionOutcome.Status.UNCHANGED, o.status());
            assertTrue(o.changeset().isEmpty());
            assertEquals(1, target.events.size());
        }
    }

    @Test
    void reloadDataSkipsDiffing() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            TransitionOutcome o = await(s.applyUsingReloadData(snapshot(7)));

            assertEquals(TransitionOutcome.Status.RELOADED, o.status());
            assertSame(StagedChangeset.EMPTY, o.changeset());
            assertEquals(0L, o.diffNanos());
            assertEquals(List.of("reload[7]"), target.events);
            assertEquals(snapshot(7), s.currentSnapshot());
        }
    }

    @Test
    void callerMutationsAfterApplyAreNotSeen() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            Snapshot<String, Integer> mine = snapshot(1);
            CompletableFuture<TransitionOutcome> f = s.apply(mine);
            mine.appendItems(List.of(2), "main");
            await(f);

            assertEquals(snapshot(1), s.currentSnapshot());
        }
    }

    @Test
    void hierarchicalApplyFlattensVisibleItems() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            await(s.apply(snapshot(1)));

            HierarchicalSnapshot<Integer> tree = new HierarchicalSnapshot<>();
            tree.append(List.of(1));
            tree.append(List.of(10, 11), 1);
            tree.expand(List.of(1));

            TransitionOutcome o = await(s.apply(tree, "main", true));
            assertEquals(List.of(ItemPath.of(0, 1), ItemPath.of(0, 2)), o.changeset().itemInserts());
            assertEquals(snapshot(1, 10, 11), s.currentSnapshot());
        }
    }

    @Test
    void hierarchicalApplyToMissingSectionFails() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            CompletableFuture<TransitionOutcome> f = s.apply(new HierarchicalSnapshot<>(), "nope", true);
            ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, rootCause(e));
            assertEquals(0, s.numberOfSections());
        }
    }

    @Test
    void contentChangesAreReconfiguredAutomatically() throws Exception {
        SchedulerConfig config = SchedulerConfig.defaults();
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render, null, config,
                (updated, previous) -> updated != 2)) {
            await(s.apply(snapshot(1, 2, 3)));
            TransitionOutcome o = await(s.apply(snapshot(1, 2, 3)));

            assertEquals(TransitionOutcome.Status.APPLIED, o.status());
            assertEquals(List.of(ItemPath.of(0, 1)), o.changeset().itemReconfigures());
        }
    }

    @Test
    void autoReconfigureCanBeDisabled() throws Exception {
        SchedulerConfig config = new SchedulerConfig(1000, true, false);
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render, null, config,
                (updated, previous) -> false)) {
            await(s.apply(snapshot(1, 2, 3)));
            assertEquals(TransitionOutcome.Status.UNCHANGED, await(s.apply(snapshot(1, 2, 3))).status());
        }
    }

    @Test
    void querySurfaceReadsTheCommittedSnapshot() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            await(s.apply(snapshot(5, 6, 7)));

            assertEquals(Optional.of(6), s.itemIdentifier(ItemPath.of(0, 1)));
            assertEquals(Optional.of(ItemPath.of(0, 2)), s.indexPath(7));
            assertEquals(Optional.of("main"), s.sectionIdentifier(0));
            assertEquals(OptionalInt.of(0), s.indexOfSection("main"));
            assertEquals(Optional.empty(), s.itemIdentifier(ItemPath.of(3, 0)));
            assertEquals(1, s.numberOfSections());
            assertEquals(3, s.numberOfItems());
        }
    }

    @Test
    void closedSchedulerRejectsRequests() {
        UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render);
        s.close();
        CompletableFuture<TransitionOutcome> f = s.apply(snapshot(1));
        assertTrue(f.isCompletedExceptionally());
    }

    @Test
    void transitionsQueuedBeforeCloseStillDiffInTheBackground() throws Exception {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        target.nextBatchResult = gate;
        SchedulerConfig config = SchedulerConfig.defaults().withBackgroundDiffThreshold(0);

        UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render, null, config, null);
        CompletableFuture<TransitionOutcome> first = s.apply(snapshot(1));
        target.awaitEvents(1);
        CompletableFuture<TransitionOutcome> second = s.apply(snapshot(1, 2));

        s.close();
        gate.complete(null);

        assertEquals(TransitionOutcome.Status.APPLIED, await(first).status());
        TransitionOutcome o = await(second);
        assertEquals(TransitionOutcome.Status.APPLIED, o.status());
        assertTrue(o.backgroundDiff());
        assertEquals(snapshot(1, 2), s.currentSnapshot());
        assertTrue(s.apply(snapshot(3)).isCompletedExceptionally());
    }

    @Test
    void hierarchicalRequestDoesNotSupersedeQueuedFullSnapshots() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            await(s.apply(snapshot(1)));

            CompletableFuture<Void> gate = new CompletableFuture<>();
            target.nextBatchResult = gate;
            CompletableFuture<TransitionOutcome> first = s.apply(snapshot(1, 3));
            target.awaitEvents(2);

            Snapshot<String, Integer> withExtra = Snapshot.of(List.of(
                    new SectionModel<>("main", List.of(1, 3)),
                    new SectionModel<>("extra", List.of(9))));
            CompletableFuture<TransitionOutcome> second = s.apply(withExtra);

            HierarchicalSnapshot<Integer> tree = new HierarchicalSnapshot<>();
            tree.append(List.of(1, 3, 4));
            CompletableFuture<TransitionOutcome> third = s.apply(tree, "main", true);
            gate.complete(null);

            assertEquals(TransitionOutcome.Status.APPLIED, await(first).status());
            assertEquals(TransitionOutcome.Status.APPLIED, await(second).status());
            assertEquals(TransitionOutcome.Status.APPLIED, await(third).status());

            Snapshot<String, Integer> expected = Snapshot.of(List.of(
                    new SectionModel<>("main", List.of(1, 3, 4)),
                    new SectionModel<>("extra", List.of(9))));
            assertEquals(expected, s.currentSnapshot());
        }
    }

    @Test
    void fullSnapshotSupersedesQueuedHierarchicalRequest() throws Exception {
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render)) {
            await(s.apply(snapshot(1)));

            CompletableFuture<Void> gate = new CompletableFuture<>();
            target.nextBatchResult = gate;
            CompletableFuture<TransitionOutcome> first = s.apply(snapshot(1, 2));
            target.awaitEvents(2);

            HierarchicalSnapshot<Integer> tree = new HierarchicalSnapshot<>();
            tree.append(List.of(7));
            CompletableFuture<TransitionOutcome> relative = s.apply(tree, "main", true);
            CompletableFuture<TransitionOutcome> last = s.apply(snapshot(5));
            gate.complete(null);

            assertEquals(TransitionOutcome.Status.APPLIED, await(first).status());
            assertEquals(TransitionOutcome.Status.SUPERSEDED, await(relative).status());
            assertEquals(TransitionOutcome.Status.APPLIED, await(last).status());
            assertEquals(List.of("batch[1]", "batch[1, 2]", "batch[5]"), target.events);
        }
    }

    @Test
    void backgroundDiffAlsoMarksContentChanges() throws Exception {
        AtomicInteger diffTasks = new AtomicInteger();
        Executor countingDiff = r -> {
            diffTasks.incrementAndGet();
            diffPool.execute(r);
        };
        SchedulerConfig config = SchedulerConfig.defaults().withBackgroundDiffThreshold(0);
        try (UpdateScheduler<String, Integer> s = new UpdateScheduler<>(target, render, countingDiff, config,
                (updated, previous) -> updated != 2)) {
            await(s.apply(snapshot(1, 2, 3)));
            TransitionOutcome o = await(s.apply(snapshot(1, 2, 3)));

            assertTrue(o.backgroundDiff());
            assertEquals(2, diffTasks.get());
            assertEquals(List.of(ItemPath.of(0, 1)), o.changeset().itemReconfigures());
        }
    }

    // ---------- helpers ----------

    private static Snapshot<String, Integer> snapshot(Integer... items) {
        return Snapshot.of(List.of(new SectionModel<>("main", List.of(items))));
    }

    private static TransitionOutcome await(CompletableFuture<TransitionOutcome> f) throws Exception {
        return f.get(5, TimeUnit.SECONDS);
    }

    private static Throwable rootCause(Throwable t) {
        Throwable c = t;
        while (c.getCause() != null && c.getCause() != c) {
            c = c.getCause();
        }
        return c;
    }

    /** Records calls; can be told to fail or to hold the next batch open. */
    private static final class RecordingTarget implements RenderTarget<String, Integer> {
        final List<String> events = new CopyOnWriteArrayList<>();
        final List<String> threads = new CopyOnWriteArrayList<>();
        volatile boolean failNext = false;
        volatile CompletableFuture<Void> nextBatchResult = null;

        @Override
        public CompletionStage<Void> performBatchUpdates(Snapshot<String, Integer> snapshot, StagedChangeset changeset) {
            threads.add(Thread.currentThread().getName());
            if (failNext) {
                failNext = false;
                throw new IllegalStateException("batch rejected");
            }
            events.add("batch" + snapshot.itemIdentifiers());
            CompletableFuture<Void> result = nextBatchResult;
            nextBatchResult = null;
            return result != null ? result : CompletableFuture.completedFuture(null);
        }

        @Override
        public void reloadData(Snapshot<String, Integer> snapshot) {
            threads.add(Thread.currentThread().getName());
            events.add("reload" + snapshot.itemIdentifiers());
        }

        void awaitEvents(int count) throws InterruptedException {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (events.size() < count && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            assertTrue(events.size() >= count, "target was not called in time");
        }
    }
}
