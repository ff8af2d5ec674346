package com.keystone.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * A discrete, independently schedulable unit of work.
 *
 * @param id                 unique identifier (e.g., "BLK-001")
 * @param description        what the block implements
 * @param priority           base priority score
 * @param riskFactor         risk on a [0.0, 1.0] scale
 * @param securityCritical   validation issues count as failures when set
 * @param dependencies       edges to prerequisites, attached when the graph is built
 * @param steps              ordered execution steps
 * @param estimatedEffort    expected duration, drives the critical path and attempt timeout
 * @param validationCriteria criteria handed to the validation collaborator
 * @param status             current status
 * @param statusReason       human-readable reason for the current status (nullable)
 */
public record ImplementationBlock(
    String id,
    String description,
    int priority,
    double riskFactor,
    boolean securityCritical,
    List<BlockDependency> dependencies,
    List<ExecutionStep> steps,
    Duration estimatedEffort,
    List<String> validationCriteria,
    BlockStatus status,
    String statusReason
) implements Serializable {

    public ImplementationBlock {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Block id must not be blank");
        }
        if (riskFactor < 0.0 || riskFactor > 1.0) {
            throw new IllegalArgumentException(
                    "riskFactor must be within [0.0, 1.0] (block " + id + ": " + riskFactor + ")");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        steps = steps == null ? List.of() : List.copyOf(steps);
        validationCriteria = validationCriteria == null ? List.of() : List.copyOf(validationCriteria);
        estimatedEffort = estimatedEffort == null ? Duration.ZERO : estimatedEffort;
        status = status == null ? BlockStatus.NOT_STARTED : status;
    }

    /** New block in {@link BlockStatus#NOT_STARTED}, dependencies attached later by the graph. */
    public static ImplementationBlock of(String id, String description, int priority, double riskFactor,
                                         List<ExecutionStep> steps, Duration estimatedEffort) {
        return new ImplementationBlock(id, description, priority, riskFactor, false, List.of(),
                steps, estimatedEffort, List.of(), BlockStatus.NOT_STARTED, null);
    }

    public ImplementationBlock withStatus(BlockStatus newStatus, String reason) {
        return new ImplementationBlock(id, description, priority, riskFactor, securityCritical,
                dependencies, steps, estimatedEffort, validationCriteria, newStatus, reason);
    }

    public ImplementationBlock withDependencies(List<BlockDependency> resolved) {
        return new ImplementationBlock(id, description, priority, riskFactor, securityCritical,
                resolved, steps, estimatedEffort, validationCriteria, status, statusReason);
    }

    public ImplementationBlock asSecurityCritical() {
        return new ImplementationBlock(id, description, priority, riskFactor, true,
                dependencies, steps, estimatedEffort, validationCriteria, status, statusReason);
    }
}
