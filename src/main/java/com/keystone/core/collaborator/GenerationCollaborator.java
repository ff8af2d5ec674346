package com.keystone.core.collaborator;

import com.keystone.core.model.ExecutionStep;

/**
 * Produces content for an execution step. Invoked synchronously from a worker thread;
 * implementations may block.
 */
@FunctionalInterface
public interface GenerationCollaborator {

    GeneratedContent generate(ExecutionStep step) throws GenerationException;
}
