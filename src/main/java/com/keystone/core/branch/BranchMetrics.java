package com.keystone.core.branch;

import java.io.Serializable;
import java.util.Map;

/**
 * Scores of one implemented branch, each in [0, 1].
 *
 * @param componentScores score per artifact path, used by selective merging
 */
public record BranchMetrics(
    double quality,
    double functionality,
    double performance,
    double maintainability,
    double overallScore,
    Map<String, Double> componentScores
) implements Serializable {

    public BranchMetrics {
        componentScores = componentScores == null ? Map.of() : Map.copyOf(componentScores);
    }

    public double componentScore(String path) {
        return componentScores.getOrDefault(path, 0.0);
    }
}
