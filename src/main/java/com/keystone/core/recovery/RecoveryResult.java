package com.keystone.core.recovery;

import com.keystone.core.error.OrchestrationException;
import com.keystone.core.persistence.OrchestrationSnapshot;

/**
 * What {@link RecoveryManager#attempt} ended with when it did not throw.
 *
 * @param outcome       how the attempt ended
 * @param value         the result for SUCCEEDED and RECOVERED, null otherwise
 * @param invocations   how many times an operation (or a variant of it) was invoked
 * @param fallback      the fallback that was applied, null for SUCCEEDED
 * @param failure       the last failure for SKIPPED and REVERTED (and RECOVERED), null for SUCCEEDED
 * @param revertedTo    checkpoint id restored by a REVERT fallback
 * @param revertedState the snapshot loaded from {@code revertedTo}
 */
public record RecoveryResult<T>(
    Outcome outcome,
    T value,
    int invocations,
    FallbackAction fallback,
    OrchestrationException failure,
    String revertedTo,
    OrchestrationSnapshot revertedState
) {

    public enum Outcome {
        SUCCEEDED,
        RECOVERED,
        SKIPPED,
        REVERTED
    }

    static <T> RecoveryResult<T> succeeded(T value, int invocations) {
        return new RecoveryResult<>(Outcome.SUCCEEDED, value, invocations, null, null, null, null);
    }

    static <T> RecoveryResult<T> recovered(T value, int invocations, FallbackAction fallback,
                                           OrchestrationException failure) {
        return new RecoveryResult<>(Outcome.RECOVERED, value, invocations, fallback, failure, null, null);
    }

    static <T> RecoveryResult<T> skipped(int invocations, FallbackAction fallback, OrchestrationException failure) {
        return new RecoveryResult<>(Outcome.SKIPPED, null, invocations, fallback, failure, null, null);
    }

    static <T> RecoveryResult<T> reverted(int invocations, FallbackAction fallback, OrchestrationException failure,
                                          String checkpointId, OrchestrationSnapshot snapshot) {
        return new RecoveryResult<>(Outcome.REVERTED, null, invocations, fallback, failure, checkpointId, snapshot);
    }

    public boolean hasValue() {
        return outcome == Outcome.SUCCEEDED || outcome == Outcome.RECOVERED;
    }

    public int retries() {
        return Math.max(0, invocations - 1);
    }
}
