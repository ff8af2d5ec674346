package com.keystone.core.persistence;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable metadata of a stored snapshot.
 *
 * @param id        checkpoint identifier
 * @param createdAt creation timestamp
 * @param sequence  creation order within the lineage; breaks timestamp ties
 * @param reason    reason tag
 * @param detail    reason detail, typically the block id (nullable)
 * @param summary   human-readable state summary
 * @param stateRef  storage reference of the serialized state
 */
public record Checkpoint(
    String id,
    Instant createdAt,
    long sequence,
    CheckpointReason reason,
    String detail,
    String summary,
    String stateRef
) implements Serializable {
}
