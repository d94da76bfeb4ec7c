package io.snapdiff.scheduler;

import io.snapdiff.core.diff.StagedChangeset;
import io.snapdiff.core.snapshot.Snapshot;

import java.util.concurrent.CompletionStage;

/**
 * The consumer of computed changesets: whatever owns the rendering surface.
 * <p>
 * Both methods are invoked on the apply executor handed to
 * {@link UpdateScheduler}, never concurrently with each other.
 *
 * @param <S> section identifier type
 * @param <I> item identifier type
 */
public interface RenderTarget<S, I> {

    /**
     * Animate from the previous state to {@code snapshot}. Operations should be
     * applied in the order documented on {@link StagedChangeset}. The returned
     * stage completes when the surface has finished applying the batch.
     */
    CompletionStage<Void> performBatchUpdates(Snapshot<S, I> snapshot, StagedChangeset changeset);

    /** Replace everything with {@code snapshot}, without animation. */
    void reloadData(Snapshot<S, I> snapshot);
}
