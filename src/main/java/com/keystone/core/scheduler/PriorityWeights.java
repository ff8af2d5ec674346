package com.keystone.core.scheduler;

/**
 * Weights of the priority formula:
 * {@code base + criticalPathBonus (on the critical path) + dependentCountBonus * weighted dependents
 * + riskFactor * riskWeight}. Soft dependents count {@code softDependentWeight} each.
 */
public record PriorityWeights(
    double criticalPathBonus,
    double dependentCountBonus,
    double riskWeight,
    double softDependentWeight
) {

    public static PriorityWeights defaults() {
        return new PriorityWeights(10.0, 2.0, 5.0, 0.5);
    }
}
