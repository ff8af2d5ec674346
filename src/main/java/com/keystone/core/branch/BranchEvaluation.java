package com.keystone.core.branch;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Metrics of every evaluated branch, ranked by overall score (then id).
 */
public record BranchEvaluation(Map<String, BranchMetrics> metrics, List<String> ranking, EvaluationWeights weights) {

    public BranchEvaluation {
        metrics = Map.copyOf(metrics);
        ranking = List.copyOf(ranking);
    }

    public Optional<String> best() {
        return ranking.isEmpty() ? Optional.empty() : Optional.of(ranking.get(0));
    }

    public boolean includes(String branchId) {
        return metrics.containsKey(branchId);
    }
}
