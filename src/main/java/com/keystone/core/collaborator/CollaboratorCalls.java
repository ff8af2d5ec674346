package com.keystone.core.collaborator;

import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.ExecutionFailureException;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.ExecutionStep;
import com.keystone.core.model.ImplementationBlock;
import com.keystone.core.model.ValidationResult;

import java.util.List;

/**
 * Conversion boundary between collaborator calls and the orchestration error taxonomy.
 */
public final class CollaboratorCalls {

    private CollaboratorCalls() {}

    public static GeneratedContent generate(GenerationCollaborator generator, ExecutionStep step) {
        try {
            return generator.generate(step);
        } catch (GenerationException e) {
            throw new ExecutionFailureException(ErrorCategory.GENERATION_FAILURE,
                    "Generation failed for step " + step.id() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ExecutionFailureException(ErrorCategory.GENERATION_FAILURE,
                    "Generator error for step " + step.id() + ": " + e.getMessage(), e);
        }
    }

    public static ValidationResult validate(ValidationCollaborator validator, ImplementationBlock block,
                                            List<Artifact> artifacts) {
        ValidationResult result;
        try {
            result = validator.validate(block, artifacts);
        } catch (RuntimeException e) {
            throw new ExecutionFailureException(ErrorCategory.VALIDATION_FAILURE,
                    "Validator error for block " + block.id() + ": " + e.getMessage(), e);
        }
        if (result == null) {
            throw new ExecutionFailureException(ErrorCategory.VALIDATION_FAILURE,
                    "Validator returned no verdict for block " + block.id());
        }
        return result;
    }
}
