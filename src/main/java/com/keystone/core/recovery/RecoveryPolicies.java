package com.keystone.core.recovery;

import com.keystone.core.error.ErrorCategory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Built-in policies used when configuration does not override a category.
 */
public final class RecoveryPolicies {

    private RecoveryPolicies() {}

    public static Map<ErrorCategory, RecoveryPolicy> defaults() {
        var policies = new EnumMap<ErrorCategory, RecoveryPolicy>(ErrorCategory.class);

        var resourceBackoff = new BackoffStrategy.Exponential(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));
        policies.put(ErrorCategory.MEMORY_LIMIT_EXCEEDED, new RecoveryPolicy(1, resourceBackoff, FallbackAction.subdivide()));
        policies.put(ErrorCategory.CPU_LIMIT_EXCEEDED, new RecoveryPolicy(2, resourceBackoff, FallbackAction.simplify()));
        policies.put(ErrorCategory.DISK_LIMIT_EXCEEDED, new RecoveryPolicy(1, resourceBackoff, FallbackAction.simplify()));

        policies.put(ErrorCategory.GENERATION_FAILURE, new RecoveryPolicy(3,
                new BackoffStrategy.Exponential(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30)),
                FallbackAction.simplify()));
        policies.put(ErrorCategory.VALIDATION_FAILURE, new RecoveryPolicy(2,
                new BackoffStrategy.Linear(Duration.ofMillis(500), Duration.ofMillis(500), Duration.ofSeconds(5)),
                FallbackAction.subdivide()));
        policies.put(ErrorCategory.BUILD_ERROR, new RecoveryPolicy(2,
                new BackoffStrategy.Fixed(Duration.ofSeconds(1)), FallbackAction.revert()));
        policies.put(ErrorCategory.TIMEOUT, new RecoveryPolicy(1,
                new BackoffStrategy.Fixed(Duration.ofSeconds(1)), FallbackAction.subdivide()));

        policies.put(ErrorCategory.IO_ERROR, new RecoveryPolicy(2,
                new BackoffStrategy.Fixed(Duration.ofMillis(200)), FallbackAction.skip()));
        policies.put(ErrorCategory.SERIALIZATION_ERROR, new RecoveryPolicy(0,
                new BackoffStrategy.Fixed(Duration.ZERO), FallbackAction.skip()));
        return policies;
    }
}
