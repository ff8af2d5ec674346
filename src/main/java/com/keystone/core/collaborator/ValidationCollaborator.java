package com.keystone.core.collaborator;

import com.keystone.core.model.Artifact;
import com.keystone.core.model.ImplementationBlock;
import com.keystone.core.model.ValidationResult;

import java.util.List;

/**
 * Judges the artifacts a block produced against its validation criteria.
 */
@FunctionalInterface
public interface ValidationCollaborator {

    ValidationResult validate(ImplementationBlock block, List<Artifact> artifacts);
}
