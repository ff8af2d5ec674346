package com.keystone.core.scheduler;

import com.keystone.core.error.OrchestrationException;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation request for one in-flight block, checked at every step boundary.
 * A request is consumed when it is thrown, so retries and fallbacks run uncancelled.
 */
public final class CancellationToken {

    private final AtomicReference<OrchestrationException> pending = new AtomicReference<>();

    /** @return false if a request is already pending */
    public boolean cancel(OrchestrationException reason) {
        return pending.compareAndSet(null, reason);
    }

    public boolean isCancellationRequested() {
        return pending.get() != null;
    }

    public void throwIfCancelled() {
        OrchestrationException reason = pending.getAndSet(null);
        if (reason != null) {
            throw reason;
        }
    }
}
