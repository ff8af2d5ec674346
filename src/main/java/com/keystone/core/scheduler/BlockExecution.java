package com.keystone.core.scheduler;

import com.keystone.core.model.Artifact;
import com.keystone.core.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * What one successful execution of a block (or of a variant of it) produced.
 *
 * @param artifacts  generated artifacts, one per step
 * @param validation the verdict, null when the variant was not validated as a whole
 * @param notes      problems that did not fail the execution, such as failed subdivisions
 */
public record BlockExecution(List<Artifact> artifacts, ValidationResult validation, List<String> notes) {

    public BlockExecution {
        artifacts = List.copyOf(artifacts);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public boolean hasIssues() {
        return !notes.isEmpty() || (validation != null && !validation.issues().isEmpty());
    }

    public List<String> issues() {
        var issues = new ArrayList<String>();
        if (validation != null) {
            issues.addAll(validation.issues());
        }
        issues.addAll(notes);
        return issues;
    }
}
