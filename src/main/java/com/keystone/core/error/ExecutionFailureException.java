package com.keystone.core.error;

/**
 * A block execution step failed: generation, validation, build or timeout.
 */
public class ExecutionFailureException extends OrchestrationException {

    public ExecutionFailureException(ErrorCategory category, String message) {
        super(requireExecution(category), message);
    }

    public ExecutionFailureException(ErrorCategory category, String message, Throwable cause) {
        super(requireExecution(category), message, cause);
    }

    private static ErrorCategory requireExecution(ErrorCategory category) {
        if (category.family() != ErrorFamily.EXECUTION) {
            throw new IllegalArgumentException("Not an execution category: " + category);
        }
        return category;
    }
}
