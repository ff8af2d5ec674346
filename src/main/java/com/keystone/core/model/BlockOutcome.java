package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final result of executing one block in a pass.
 *
 * @param blockId    the block
 * @param status     terminal status for the pass
 * @param reason     human-readable reason, always present
 * @param artifacts  artifacts the block produced (empty unless successful)
 * @param validation last validation verdict (nullable when validation never ran)
 * @param attempts   number of invocations, including retries and fallbacks
 * @param elapsedMs  wall-clock execution time
 */
public record BlockOutcome(
    String blockId,
    BlockStatus status,
    String reason,
    List<Artifact> artifacts,
    ValidationResult validation,
    int attempts,
    long elapsedMs
) implements Serializable {

    public BlockOutcome {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
