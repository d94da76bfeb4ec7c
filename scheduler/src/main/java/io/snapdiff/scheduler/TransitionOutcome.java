package io.snapdiff.scheduler;

import io.snapdiff.core.diff.StagedChangeset;

import java.util.Objects;

/**
 * Result of one transition request.
 *
 * @param token          issuance number, strictly increasing per scheduler
 * @param status         what happened to the request
 * @param changeset      the computed changeset; {@link StagedChangeset#EMPTY} when
 *                       no diff was computed or it was discarded
 * @param backgroundDiff whether the diff ran on the background executor
 * @param diffNanos      time spent reconciling, 0 when skipped
 * @param totalNanos     time from issuance to completion
 */
public record TransitionOutcome(
        long token,
        Status status,
        StagedChangeset changeset,
        boolean backgroundDiff,
        long diffNanos,
        long totalNanos
) {

    public enum Status {
        /** Batch update performed on the render target. */
        APPLIED,
        /** Render target reloaded without animation. */
        RELOADED,
        /** Nothing changed; the render target was not called. */
        UNCHANGED,
        /** A newer request arrived first; nothing was committed. */
        SUPERSEDED
    }

    public TransitionOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(changeset, "changeset");
    }

    /** True when this transition's target state became the current snapshot. */
    public boolean committed() {
        return status != Status.SUPERSEDED;
    }
}
