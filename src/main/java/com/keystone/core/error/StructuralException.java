package com.keystone.core.error;

import java.util.List;

/**
 * Raised while building the dependency graph, before anything executes. Always fatal to the run.
 */
public class StructuralException extends OrchestrationException {

    private final List<String> cyclePath;

    private StructuralException(ErrorCategory category, String message, List<String> cyclePath) {
        super(category, message);
        this.cyclePath = cyclePath;
    }

    public static StructuralException cycleDetected(List<String> path) {
        return new StructuralException(ErrorCategory.CYCLE_DETECTED,
                "Dependency cycle detected: " + String.join(" -> ", path), List.copyOf(path));
    }

    public static StructuralException missingDependency(String blockId, String missingId) {
        return new StructuralException(ErrorCategory.MISSING_DEPENDENCY,
                "Block " + blockId + " references unknown block " + missingId, List.of());
    }

    public static StructuralException duplicateBlock(String blockId) {
        return new StructuralException(ErrorCategory.DUPLICATE_BLOCK,
                "Duplicate block identifier: " + blockId, List.of());
    }

    /** The cyclic sequence for {@link ErrorCategory#CYCLE_DETECTED}; first and last entries are equal. */
    public List<String> cyclePath() {
        return cyclePath;
    }
}
