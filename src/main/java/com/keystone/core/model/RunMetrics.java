package com.keystone.core.model;

import java.io.Serializable;

/**
 * Aggregate counters for one orchestration run.
 */
public record RunMetrics(
    long totalDurationMs,
    int blocksCompleted,
    int blocksCompletedWithIssues,
    int blocksFailed,
    int blocksDeferred,
    int retries,
    int checkpointsCreated,
    int layersExecuted
) implements Serializable {
}
