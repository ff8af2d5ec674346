package com.keystone.core.persistence;

import com.keystone.core.model.Artifact;
import com.keystone.core.model.BlockStatus;

import java.io.Serializable;
import java.util.Map;

/**
 * Serializable view of orchestration state: block statuses plus artifact contents.
 */
public record OrchestrationSnapshot(
    String runId,
    Map<String, BlockState> blocks,
    Map<String, Artifact> artifacts
) implements Serializable {

    public OrchestrationSnapshot {
        blocks = blocks == null ? Map.of() : Map.copyOf(blocks);
        artifacts = artifacts == null ? Map.of() : Map.copyOf(artifacts);
    }

    public record BlockState(BlockStatus status, String reason, int attempts) implements Serializable {}

    public String summary() {
        long done = blocks.values().stream().filter(b -> b.status().isSuccessful()).count();
        long failed = blocks.values().stream().filter(b -> b.status() == BlockStatus.FAILED).count();
        long running = blocks.values().stream().filter(b -> b.status() == BlockStatus.IN_PROGRESS).count();
        return String.format("%d/%d blocks done, %d in progress, %d failed, %d artifacts",
                done, blocks.size(), running, failed, artifacts.size());
    }
}
