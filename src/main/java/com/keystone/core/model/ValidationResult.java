package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Verdict of the validation collaborator for one block's artifacts.
 *
 * @param passed         whether the block meets its validation criteria
 * @param buildSucceeded false when the artifacts did not build at all
 * @param metrics        named scores in [0, 1] (e.g. "quality", "coverage")
 * @param issues         non-fatal findings
 */
public record ValidationResult(
    boolean passed,
    boolean buildSucceeded,
    Map<String, Double> metrics,
    List<String> issues
) implements Serializable {

    public ValidationResult {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static ValidationResult passed(Map<String, Double> metrics) {
        return new ValidationResult(true, true, metrics, List.of());
    }

    public static ValidationResult passedWithIssues(Map<String, Double> metrics, List<String> issues) {
        return new ValidationResult(true, true, metrics, issues);
    }

    public static ValidationResult failed(List<String> issues) {
        return new ValidationResult(false, true, Map.of(), issues);
    }

    public static ValidationResult buildFailed(List<String> issues) {
        return new ValidationResult(false, false, Map.of(), issues);
    }

    public double metric(String name, double fallback) {
        Double value = metrics.get(name);
        return value != null ? value : fallback;
    }
}
