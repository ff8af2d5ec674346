package com.keystone.core.branch;

import com.keystone.core.model.RunReport;

/**
 * Computes the subscores of an implemented branch from its run report. Must be deterministic:
 * the same report always yields the same metrics.
 */
public interface BranchScorer {

    BranchMetrics score(RunReport report, EvaluationWeights weights);
}
