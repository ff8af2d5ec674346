package com.keystone.core.error;

/**
 * Checkpoint persistence failure. A failed {@link Operation#LOAD} is fatal to the session;
 * a failed {@link Operation#CREATE} is retried and may degrade to a warning.
 */
public class PersistenceException extends OrchestrationException {

    public enum Operation { CREATE, LOAD, DELETE }

    private final Operation operation;

    public PersistenceException(ErrorCategory category, Operation operation, String message) {
        super(category, message);
        this.operation = operation;
    }

    public PersistenceException(ErrorCategory category, Operation operation, String message, Throwable cause) {
        super(category, message, cause);
        this.operation = operation;
    }

    public static PersistenceException notFound(String checkpointId) {
        return new PersistenceException(ErrorCategory.CHECKPOINT_NOT_FOUND, Operation.LOAD,
                "Checkpoint not found: " + checkpointId);
    }

    public Operation operation() {
        return operation;
    }

    @Override
    public boolean isRecoverable() {
        return operation == Operation.CREATE;
    }
}
