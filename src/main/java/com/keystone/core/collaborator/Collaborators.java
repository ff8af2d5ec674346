package com.keystone.core.collaborator;

import java.util.Objects;

/**
 * The generation and validation capabilities one run executes blocks with.
 */
public record Collaborators(GenerationCollaborator generator, ValidationCollaborator validator) {

    public Collaborators {
        Objects.requireNonNull(generator, "generator");
        Objects.requireNonNull(validator, "validator");
    }
}
