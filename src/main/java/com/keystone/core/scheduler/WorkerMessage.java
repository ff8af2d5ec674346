package com.keystone.core.scheduler;

import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.OrchestrationException;
import com.keystone.core.model.BlockOutcome;
import com.keystone.core.persistence.OrchestrationSnapshot;

/**
 * Messages posted by block workers to the scheduler thread, the only writer of graph state.
 */
sealed interface WorkerMessage permits WorkerMessage.RetryNotice, WorkerMessage.Finished, WorkerMessage.Fatal {

    String blockId();

    record RetryNotice(String blockId, int retry, ErrorCategory cause, String message) implements WorkerMessage {}

    /**
     * @param revertedTo    checkpoint restored by a REVERT fallback, null otherwise
     * @param revertedState snapshot of {@code revertedTo}
     */
    record Finished(BlockOutcome outcome, String revertedTo, OrchestrationSnapshot revertedState)
            implements WorkerMessage {

        @Override
        public String blockId() {
            return outcome.blockId();
        }
    }

    /** A non-recoverable failure that ends the run. */
    record Fatal(String blockId, OrchestrationException error) implements WorkerMessage {}
}
