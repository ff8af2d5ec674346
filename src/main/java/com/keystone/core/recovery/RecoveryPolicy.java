package com.keystone.core.recovery;

import java.time.Duration;
import java.util.Objects;

/**
 * How one error category is recovered: how often to retry, how long to wait, what to do after.
 */
public record RecoveryPolicy(int maxRetries, BackoffStrategy backoff, FallbackAction fallback) {

    public RecoveryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative (current: " + maxRetries + ")");
        }
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(fallback, "fallback");
    }

    /** Applied to categories without a configured policy. */
    public static RecoveryPolicy conservative() {
        return new RecoveryPolicy(1, new BackoffStrategy.Fixed(Duration.ofMillis(500)), FallbackAction.abort());
    }
}
