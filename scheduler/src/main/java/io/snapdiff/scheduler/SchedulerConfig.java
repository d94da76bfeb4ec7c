// file: scheduler/src/main/java/io/snapdiff/scheduler/SchedulerConfig.java
package io.snapdiff.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.snapdiff.scheduler.dto.JsonSchedulerConfig;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Tuning knobs for {@link UpdateScheduler}.
 *
 * @param backgroundDiffThreshold diffs whose old+new item count exceeds this run
 *                                on the background executor; smaller ones run inline
 * @param coalesceSuperseded      drop a transition that a newer request superseded
 *                                before it committed
 * @param autoReconfigure         mark content-changed items as reconfigured when a
 *                                content predicate is configured
 */
public record SchedulerConfig(
        int backgroundDiffThreshold,
        boolean coalesceSuperseded,
        boolean autoReconfigure
) {

    public static final int DEFAULT_BACKGROUND_DIFF_THRESHOLD = 1000;

    public SchedulerConfig {
        if (backgroundDiffThreshold < 0) {
            throw new IllegalArgumentException("backgroundDiffThreshold must be >= 0");
        }
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(DEFAULT_BACKGROUND_DIFF_THRESHOLD, true, true);
    }

    public SchedulerConfig withBackgroundDiffThreshold(int threshold) {
        return new SchedulerConfig(threshold, coalesceSuperseded, autoReconfigure);
    }

    public SchedulerConfig withCoalesceSuperseded(boolean coalesce) {
        return new SchedulerConfig(backgroundDiffThreshold, coalesce, autoReconfigure);
    }

    public static SchedulerConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonSchedulerConfig cfg = mapper.readValue(path.toFile(), JsonSchedulerConfig.class);
            SchedulerConfig d = defaults();
            return new SchedulerConfig(
                    cfg.backgroundDiffThreshold != null ? cfg.backgroundDiffThreshold : d.backgroundDiffThreshold(),
                    cfg.coalesceSuperseded != null ? cfg.coalesceSuperseded : d.coalesceSuperseded(),
                    cfg.autoReconfigure != null ? cfg.autoReconfigure : d.autoReconfigure()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load SchedulerConfig from " + path, e);
        }
    }
}
