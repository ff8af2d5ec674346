package com.keystone.core.model;

import com.keystone.core.persistence.Checkpoint;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Everything an orchestration run leaves behind: final block states, produced artifacts,
 * the schedule that was followed and the checkpoints still retained.
 */
public record RunReport(
    String runId,
    Map<String, ImplementationBlock> blocks,
    Map<String, BlockOutcome> outcomes,
    Map<String, Artifact> artifacts,
    List<List<String>> layers,
    List<String> criticalPath,
    List<Checkpoint> checkpoints,
    List<String> warnings,
    RunMetrics metrics
) implements Serializable {

    public RunReport {
        blocks = Map.copyOf(blocks);
        outcomes = Map.copyOf(outcomes);
        artifacts = Map.copyOf(artifacts);
        layers = List.copyOf(layers);
        criticalPath = List.copyOf(criticalPath);
        checkpoints = List.copyOf(checkpoints);
        warnings = List.copyOf(warnings);
    }

    public BlockStatus statusOf(String blockId) {
        var block = blocks.get(blockId);
        return block != null ? block.status() : null;
    }

    public long successfulBlocks() {
        return blocks.values().stream().filter(b -> b.status().isSuccessful()).count();
    }
}
