package com.keystone.core.recovery;

import com.keystone.core.error.OrchestrationException;

import java.time.Duration;

/**
 * Observer of recovery progress. Both callbacks run on the thread calling
 * {@link RecoveryManager#attempt}.
 */
public interface RecoveryListener {

    RecoveryListener NONE = new RecoveryListener() {};

    /** Called before sleeping for retry number {@code retry} (1-based). */
    default void onRetry(int retry, OrchestrationException cause, Duration delay) {}

    default void onFallback(FallbackAction action, OrchestrationException cause) {}
}
