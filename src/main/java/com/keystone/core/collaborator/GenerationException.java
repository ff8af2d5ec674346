package com.keystone.core.collaborator;

/**
 * Failure reported by a {@link GenerationCollaborator}. Converted into the core taxonomy
 * by {@link CollaboratorCalls} and never propagated as-is.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
