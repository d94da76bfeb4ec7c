// file: scheduler/src/main/java/io/snapdiff/scheduler/TransitionLogger.java
package io.snapdiff.scheduler;

import io.snapdiff.core.diff.StagedChangeset;

import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single place that logs transition outcomes.
 *
 * Responsibilities:
 *  - One line per transition with status, operation counts and latency.
 *  - Superseded transitions at FINE, failures at WARNING with the cause.
 */
public final class TransitionLogger {
    private static final Logger log = Logger.getLogger(TransitionLogger.class.getName());

    private TransitionLogger() {
        // utility
    }

    /**
     * Log a finished transition.
     *
     * @param token      issuance number of the transition
     * @param outcome    the outcome, or null when the transition failed
     * @param totalNanos wall-clock latency since issuance
     * @param error      failure cause, null if none
     */
    public static void logTransition(long token, TransitionOutcome outcome, long totalNanos, Throwable error) {
        if (error != null || outcome == null) {
            log.log(Level.WARNING,
                    String.format("transition #%d failed after %dms", token, millis(totalNanos)),
                    error);
            return;
        }

        StagedChangeset c = outcome.changeset();
        String msg = String.format(
                "transition #%d -> %s (sections=-%d/+%d/~%d, items=-%d/+%d/~%d, reloads=%d, total=%dms%s)",
                token,
                outcome.status(),
                c.sectionDeletes().size(),
                c.sectionInserts().size(),
                c.sectionMoves().size(),
                c.itemDeletes().size(),
                c.itemInserts().size(),
                c.itemMoves().size(),
                c.sectionReloads().size() + c.itemReloads().size() + c.itemReconfigures().size(),
                millis(outcome.totalNanos()),
                outcome.diffNanos() > 0
                        ? ", diff=" + millis(outcome.diffNanos()) + "ms" + (outcome.backgroundDiff() ? " in background" : "")
                        : ""
        );

        if (outcome.status() == TransitionOutcome.Status.SUPERSEDED) {
            log.log(Level.FINE, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    private static long millis(long nanos) {
        return TimeUnit.NANOSECONDS.toMillis(nanos);
    }
}
