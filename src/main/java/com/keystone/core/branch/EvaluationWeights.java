package com.keystone.core.branch;

/**
 * Weights of the four branch subscores. The overall score is the weighted sum divided by the
 * weight total, so any non-negative weights with a positive total are accepted.
 */
public record EvaluationWeights(double quality, double functionality, double performance, double maintainability) {

    public EvaluationWeights {
        if (quality < 0 || functionality < 0 || performance < 0 || maintainability < 0) {
            throw new IllegalArgumentException("Evaluation weights must not be negative");
        }
        if (quality + functionality + performance + maintainability <= 0) {
            throw new IllegalArgumentException("At least one evaluation weight must be positive");
        }
    }

    public static EvaluationWeights defaults() {
        return new EvaluationWeights(0.3, 0.3, 0.2, 0.2);
    }

    public double total() {
        return quality + functionality + performance + maintainability;
    }

    public double overall(double qualityScore, double functionalityScore, double performanceScore,
                          double maintainabilityScore) {
        return (quality * qualityScore + functionality * functionalityScore
                + performance * performanceScore + maintainability * maintainabilityScore) / total();
    }
}
