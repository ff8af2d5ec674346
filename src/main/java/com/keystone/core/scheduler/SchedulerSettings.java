package com.keystone.core.scheduler;

import java.time.Duration;

/**
 * @param maxParallelPaths  worker pool size
 * @param timeoutMultiplier attempt timeout as a multiple of the block's estimated effort
 * @param resourcePoll      how long the scheduler waits for worker messages before checking resources
 */
public record SchedulerSettings(int maxParallelPaths, double timeoutMultiplier, Duration resourcePoll) {

    public SchedulerSettings {
        if (maxParallelPaths < 1) {
            throw new IllegalArgumentException("maxParallelPaths must be at least 1 (current: " + maxParallelPaths + ")");
        }
        if (timeoutMultiplier <= 0) {
            throw new IllegalArgumentException("timeoutMultiplier must be positive (current: " + timeoutMultiplier + ")");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(Runtime.getRuntime().availableProcessors(), 2.0, Duration.ofMillis(250));
    }

    /** Zero when the effort is zero, meaning no timeout. */
    public Duration attemptTimeout(Duration estimatedEffort) {
        return Duration.ofMillis((long) (estimatedEffort.toMillis() * timeoutMultiplier));
    }
}
