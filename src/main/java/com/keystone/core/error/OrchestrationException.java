package com.keystone.core.error;

/**
 * Base of the orchestration error taxonomy. Each family has its own subclass;
 * collaborator-specific exceptions are converted into one of these at the call site.
 */
public abstract class OrchestrationException extends RuntimeException {

    private final ErrorCategory category;

    protected OrchestrationException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected OrchestrationException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    public ErrorFamily family() {
        return category.family();
    }

    /**
     * Whether the Recovery Manager may retry or fall back on this failure.
     * Structural and merge failures never are.
     */
    public boolean isRecoverable() {
        return family() == ErrorFamily.RESOURCE || family() == ErrorFamily.EXECUTION;
    }
}
