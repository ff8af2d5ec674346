package com.keystone.core.model;

/**
 * Status of an implementation block within one orchestration pass.
 */
public enum BlockStatus {
    NOT_STARTED,
    READY,
    IN_PROGRESS,
    COMPLETED,
    COMPLETED_WITH_ISSUES,
    FAILED,
    BLOCKED,   // a gating prerequisite has not succeeded
    DEFERRED;

    public boolean isSuccessful() {
        return this == COMPLETED || this == COMPLETED_WITH_ISSUES;
    }

    /** Terminal for the current pass; FAILED is terminal once recovery gave up on it. */
    public boolean isTerminal() {
        return isSuccessful() || this == DEFERRED;
    }

    public boolean isSettled() {
        return isTerminal() || this == FAILED;
    }
}
