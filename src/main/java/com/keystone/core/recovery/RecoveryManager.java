package com.keystone.core.recovery;

import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.ExecutionFailureException;
import com.keystone.core.error.OrchestrationException;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.persistence.CheckpointStore;
import com.keystone.core.persistence.OrchestrationSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Retries failed operations according to a per-category {@link RecoveryPolicy} and applies the
 * policy's fallback exactly once when retries are exhausted.
 * <p>
 * Only {@link OrchestrationException#isRecoverable() recoverable} failures are handled; any other
 * failure, including one raised by a fallback itself, propagates to the caller unchanged.
 */
public class RecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(RecoveryManager.class);

    private final Map<ErrorCategory, RecoveryPolicy> policies;
    private final RecoveryPolicy defaultPolicy;
    private final CheckpointStore checkpoints;
    private final Sleeper sleeper;
    private final KeystoneMetrics metrics;

    /**
     * @param checkpoints source of snapshots for REVERT; may be null, in which case REVERT propagates the failure
     * @param metrics     may be null
     */
    public RecoveryManager(Map<ErrorCategory, RecoveryPolicy> policies, RecoveryPolicy defaultPolicy,
                           CheckpointStore checkpoints, Sleeper sleeper, KeystoneMetrics metrics) {
        this.policies = new EnumMap<>(ErrorCategory.class);
        this.policies.putAll(policies);
        this.defaultPolicy = defaultPolicy;
        this.checkpoints = checkpoints;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public RecoveryPolicy strategyFor(ErrorCategory category) {
        return policies.getOrDefault(category, defaultPolicy);
    }

    public RecoveryPolicy strategyFor(OrchestrationException error) {
        return strategyFor(error.category());
    }

    public <T> RecoveryResult<T> attempt(RecoverableOperation<T> operation) {
        return attempt(operation, RecoveryListener.NONE);
    }

    /**
     * Invokes {@code operation}; on a recoverable failure continues as
     * {@link #attempt(RecoverableOperation, OrchestrationException, RecoveryListener)}.
     */
    public <T> RecoveryResult<T> attempt(RecoverableOperation<T> operation, RecoveryListener listener) {
        try {
            return RecoveryResult.succeeded(operation.execute(), 1);
        } catch (OrchestrationException e) {
            return recover(operation, e, 1, listener);
        }
    }

    /**
     * Recovers from a failure that already happened outside the manager. The failed invocation
     * counts as the initial attempt, so up to {@code maxRetries} further invocations follow.
     */
    public <T> RecoveryResult<T> attempt(RecoverableOperation<T> operation, OrchestrationException error,
                                         RecoveryListener listener) {
        return recover(operation, error, 1, listener);
    }

    private <T> RecoveryResult<T> recover(RecoverableOperation<T> operation, OrchestrationException error,
                                          int invocations, RecoveryListener listener) {
        if (!error.isRecoverable()) {
            throw error;
        }
        RecoveryPolicy policy = strategyFor(error);
        OrchestrationException last = error;

        for (int retry = 0; retry < policy.maxRetries(); retry++) {
            Duration delay = policy.backoff().delay(retry);
            log.info("Retrying {} after {} ({}/{}) in {}ms", operation.name(), last.category(),
                    retry + 1, policy.maxRetries(), delay.toMillis());
            listener.onRetry(retry + 1, last, delay);
            if (metrics != null) {
                metrics.recordRetry(last.category());
            }
            pause(delay, operation.name());
            invocations++;
            try {
                return RecoveryResult.succeeded(operation.execute(), invocations);
            } catch (OrchestrationException e) {
                if (!e.isRecoverable()) {
                    throw e;
                }
                last = e;
            }
        }

        FallbackAction fallback = policy.fallback();
        log.warn("{} exhausted {} retr{} on {}, applying fallback {}", operation.name(), policy.maxRetries(),
                policy.maxRetries() == 1 ? "y" : "ies", last.category(), fallback);
        listener.onFallback(fallback, last);
        if (metrics != null) {
            metrics.recordFallback(fallback.type());
        }
        return applyFallback(operation, policy, fallback, last, invocations);
    }

    private <T> RecoveryResult<T> applyFallback(RecoverableOperation<T> operation, RecoveryPolicy policy,
                                                FallbackAction fallback, OrchestrationException failure,
                                                int invocations) {
        switch (fallback.type()) {
            case SKIP:
                return RecoveryResult.skipped(invocations, fallback, failure);

            case SIMPLIFY: {
                var simplified = operation.simplified().orElseThrow(() -> failure);
                T value = simplified.execute();
                return RecoveryResult.recovered(value, invocations + 1, fallback, failure);
            }

            case USE_ALTERNATE: {
                var alternate = operation.alternate(fallback.alternateId()).orElseThrow(() -> failure);
                T value = alternate.execute();
                return RecoveryResult.recovered(value, invocations + 1, fallback, failure);
            }

            case REVERT: {
                if (checkpoints == null) {
                    throw failure;
                }
                var latest = checkpoints.latest().orElseThrow(() -> failure);
                // A failed load is not recoverable and propagates as-is.
                OrchestrationSnapshot snapshot = checkpoints.load(latest.id());
                log.info("Reverted {} to checkpoint {}", operation.name(), latest.id());
                return RecoveryResult.reverted(invocations, fallback, failure, latest.id(), snapshot);
            }

            case SUBDIVIDE:
                return subdivide(operation, policy, fallback, failure, invocations);

            case ABORT:
            default:
                throw failure;
        }
    }

    private <T> RecoveryResult<T> subdivide(RecoverableOperation<T> operation, RecoveryPolicy policy,
                                            FallbackAction fallback, OrchestrationException failure,
                                            int invocations) {
        List<RecoverableOperation<T>> parts = operation.subdivide();
        if (parts.isEmpty()) {
            throw failure;
        }
        var results = new ArrayList<T>();
        var failures = new ArrayList<OrchestrationException>();
        int total = invocations;
        for (var part : parts) {
            int retries = 0;
            while (true) {
                total++;
                try {
                    results.add(part.execute());
                    break;
                } catch (OrchestrationException e) {
                    if (!e.isRecoverable()) {
                        throw e;
                    }
                    if (retries >= policy.maxRetries()) {
                        log.warn("Subdivision {} of {} failed: {}", part.name(), operation.name(), e.getMessage());
                        failures.add(e);
                        break;
                    }
                    pause(policy.backoff().delay(retries), part.name());
                    retries++;
                }
            }
        }
        if (results.isEmpty()) {
            throw failures.get(failures.size() - 1);
        }
        log.info("{} recovered by subdivision: {}/{} part(s) succeeded", operation.name(), results.size(), parts.size());
        return RecoveryResult.recovered(operation.combine(results, failures), total, fallback, failure);
    }

    private void pause(Duration delay, String operationName) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionFailureException(ErrorCategory.TIMEOUT,
                    "Interrupted while backing off before retrying " + operationName, e);
        }
    }
}
