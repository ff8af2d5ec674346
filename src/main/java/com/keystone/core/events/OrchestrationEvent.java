package com.keystone.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run or a branch exploration progresses.
 *
 * @param eventType event type (e.g. "run.started", "block.retrying", "checkpoint.created")
 * @param runId     the run (or branch lineage) this event belongs to
 * @param blockId   the block this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record OrchestrationEvent(
    String eventType,
    String runId,
    String blockId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static OrchestrationEvent of(String eventType, String runId, String blockId, Map<String, Object> payload) {
        return new OrchestrationEvent(eventType, runId, blockId, payload, Instant.now());
    }
}
