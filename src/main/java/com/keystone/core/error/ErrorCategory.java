package com.keystone.core.error;

/**
 * Fine-grained failure category. Recovery policies are keyed by category.
 */
public enum ErrorCategory {
    CYCLE_DETECTED(ErrorFamily.STRUCTURAL),
    MISSING_DEPENDENCY(ErrorFamily.STRUCTURAL),
    DUPLICATE_BLOCK(ErrorFamily.STRUCTURAL),

    MEMORY_LIMIT_EXCEEDED(ErrorFamily.RESOURCE),
    CPU_LIMIT_EXCEEDED(ErrorFamily.RESOURCE),
    DISK_LIMIT_EXCEEDED(ErrorFamily.RESOURCE),

    GENERATION_FAILURE(ErrorFamily.EXECUTION),
    VALIDATION_FAILURE(ErrorFamily.EXECUTION),
    BUILD_ERROR(ErrorFamily.EXECUTION),
    TIMEOUT(ErrorFamily.EXECUTION),

    CHECKPOINT_NOT_FOUND(ErrorFamily.PERSISTENCE),
    SERIALIZATION_ERROR(ErrorFamily.PERSISTENCE),
    IO_ERROR(ErrorFamily.PERSISTENCE),

    BRANCH_NOT_FOUND(ErrorFamily.MERGE),
    MERGE_CONFLICT(ErrorFamily.MERGE),
    NO_BRANCHES_AVAILABLE(ErrorFamily.MERGE);

    private final ErrorFamily family;

    ErrorCategory(ErrorFamily family) {
        this.family = family;
    }

    public ErrorFamily family() {
        return family;
    }
}
