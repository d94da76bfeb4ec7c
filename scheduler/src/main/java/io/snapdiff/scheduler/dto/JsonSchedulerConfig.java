package io.snapdiff.scheduler.dto;

/**
 * JSON shape of {@link io.snapdiff.scheduler.SchedulerConfig}.
 * Absent fields stay null and fall back to defaults.
 */
public class JsonSchedulerConfig {
    public Integer backgroundDiffThreshold;
    public Boolean coalesceSuperseded;
    public Boolean autoReconfigure;
}
