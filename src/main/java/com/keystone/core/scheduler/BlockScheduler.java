package com.keystone.core.scheduler;

import com.keystone.core.collaborator.Collaborators;
import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.ExecutionFailureException;
import com.keystone.core.error.OrchestrationException;
import com.keystone.core.error.ResourceLimitException;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.OrchestrationEvent;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.BlockOutcome;
import com.keystone.core.model.BlockStatus;
import com.keystone.core.model.RunMetrics;
import com.keystone.core.model.RunReport;
import com.keystone.core.persistence.CheckpointReason;
import com.keystone.core.persistence.OrchestrationSnapshot;
import com.keystone.core.recovery.RecoverableOperation;
import com.keystone.core.recovery.RecoveryListener;
import com.keystone.core.recovery.RecoveryResult;
import com.keystone.core.resources.LimitStatus;
import com.keystone.core.resources.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one run over a {@link DependencyGraph}, layer by layer.
 * <p>
 * Blocks of a layer execute concurrently on a bounded worker pool; the scheduler thread is the
 * single writer of block state and consumes retry notices and outcomes posted by the workers.
 * A layer finishes only when every block in it has settled. Checkpoints are taken before and after
 * every block; a checkpoint that cannot be written degrades to a warning on the report.
 */
public class BlockScheduler {

    private static final Logger log = LoggerFactory.getLogger(BlockScheduler.class);

    private final String runId;
    private final DependencyGraph graph;
    private final Collaborators collaborators;
    private final RunResources resources;
    private final SchedulerSettings settings;
    private final EventBus eventBus;
    private final KeystoneMetrics metrics;

    private final Map<String, Artifact> artifacts = new LinkedHashMap<>();
    private final Map<String, BlockOutcome> outcomes = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();
    private int retries;
    private int checkpointsCreated;
    private int layersExecuted;

    /**
     * @param eventBus may be null
     * @param metrics  may be null
     */
    public BlockScheduler(String runId, DependencyGraph graph, Collaborators collaborators, RunResources resources,
                          SchedulerSettings settings, EventBus eventBus, KeystoneMetrics metrics) {
        this.runId = runId;
        this.graph = graph;
        this.collaborators = collaborators;
        this.resources = resources;
        this.settings = settings;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public RunReport run() {
        return run(null);
    }

    /**
     * Executes every layer. With a snapshot, blocks it records as successful keep their status
     * and artifacts and are not executed again.
     *
     * @throws OrchestrationException when a non-recoverable failure (such as a failed checkpoint load) ends the run
     */
    public synchronized RunReport run(OrchestrationSnapshot resumeFrom) {
        long start = System.currentTimeMillis();
        ExecutorService workers = Executors.newFixedThreadPool(settings.maxParallelPaths(), threadFactory("keystone-block"));
        ExecutorService attempts = Executors.newCachedThreadPool(threadFactory("keystone-attempt"));
        MdcContext.setRun(runId);
        try {
            if (resumeFrom != null) {
                restore(resumeFrom);
            }
            log.info("Starting run {}: {} blocks in {} layers", runId, graph.blocks().size(), graph.layers().size());
            publish("run.started", null, Map.of("blocks", graph.blocks().size(), "layers", graph.layers().size(),
                    "resumed", resumeFrom != null));
            checkpoint(CheckpointReason.RUN_START, null);

            var layers = graph.layers();
            for (int i = 0; i < layers.size(); i++) {
                MdcContext.setLayer(runId, i + 1);
                executeLayer(i + 1, layers.get(i), workers, attempts);
            }
            deferBlocked();
            checkpoint(CheckpointReason.RUN_END, null);

            var report = report(System.currentTimeMillis() - start);
            log.info("Run {} finished in {}ms: {} completed, {} with issues, {} failed, {} deferred",
                    runId, report.metrics().totalDurationMs(), report.metrics().blocksCompleted(),
                    report.metrics().blocksCompletedWithIssues(), report.metrics().blocksFailed(),
                    report.metrics().blocksDeferred());
            publish("run.completed", null, Map.of("successful", report.successfulBlocks(),
                    "durationMs", report.metrics().totalDurationMs()));
            return report;
        } finally {
            workers.shutdownNow();
            attempts.shutdownNow();
            MdcContext.clear();
        }
    }

    public String runId() {
        return runId;
    }

    public DependencyGraph graph() {
        return graph;
    }

    private void restore(OrchestrationSnapshot snapshot) {
        int restored = 0;
        for (var entry : snapshot.blocks().entrySet()) {
            var state = entry.getValue();
            if (graph.contains(entry.getKey()) && state.status().isSuccessful()) {
                graph.restore(entry.getKey(), state.status(), state.reason(), state.attempts());
                outcomes.put(entry.getKey(), new BlockOutcome(entry.getKey(), state.status(),
                        "Restored: " + state.reason(), List.of(), null, 0, 0));
                restored++;
            }
        }
        for (var artifact : snapshot.artifacts().values()) {
            if (graph.contains(artifact.blockId()) && graph.block(artifact.blockId()).status().isSuccessful()) {
                artifacts.put(artifact.path(), artifact);
            }
        }
        log.info("Resumed run {} from snapshot of {}: {} block(s) already complete", runId, snapshot.runId(), restored);
    }

    private void executeLayer(int layerNumber, List<String> layer, ExecutorService workers, ExecutorService attempts) {
        var runnable = new ArrayList<String>();
        for (String id : layer) {
            var status = graph.block(id).status();
            if (status.isSettled() || status == BlockStatus.BLOCKED) {
                continue;
            }
            Optional<String> unmet = graph.firstUnsatisfiedPrerequisite(id);
            if (unmet.isPresent()) {
                block(id, unmet.get());
                continue;
            }
            graph.transition(id, BlockStatus.READY, "Prerequisites satisfied");
            runnable.add(id);
        }
        if (runnable.isEmpty()) {
            return;
        }

        layersExecuted++;
        if (metrics != null) {
            metrics.recordLayerExecution(runnable.size());
        }
        log.info("Layer {}: executing {}", layerNumber, runnable);
        publish("layer.started", null, Map.of("layer", layerNumber, "blocks", List.copyOf(runnable)));

        BlockingQueue<WorkerMessage> channel = new LinkedBlockingQueue<>();
        var inFlight = new LinkedHashMap<String, InFlight>();
        for (String id : runnable) {
            checkpoint(CheckpointReason.BEFORE_BLOCK, id);
            var block = graph.transition(id, BlockStatus.IN_PROGRESS, "Executing");
            publish("block.started", id, Map.of("priority", graph.priority(id)));
            var token = new CancellationToken();
            var context = new BlockRunner.Context(collaborators, resources.chunker(), token, attempts,
                    settings.attemptTimeout(block.estimatedEffort()), graph);
            Future<?> future = workers.submit(() -> work(new BlockRunner(block, context), channel));
            inFlight.put(id, new InFlight(token, future));
        }

        while (!inFlight.isEmpty()) {
            WorkerMessage message;
            try {
                message = channel.poll(settings.resourcePoll().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                inFlight.values().forEach(f -> f.future().cancel(true));
                throw new ExecutionFailureException(ErrorCategory.TIMEOUT, "Run " + runId + " interrupted", e);
            }
            if (message == null) {
                enforceResourceLimits(inFlight);
                continue;
            }
            if (message instanceof WorkerMessage.RetryNotice notice) {
                applyRetry(notice);
            } else if (message instanceof WorkerMessage.Finished finished) {
                inFlight.remove(finished.blockId());
                applyOutcome(finished);
            } else if (message instanceof WorkerMessage.Fatal fatal) {
                inFlight.values().forEach(f -> f.future().cancel(true));
                log.error("Run {} aborted by block {}: {}", runId, fatal.blockId(), fatal.error().getMessage());
                throw fatal.error();
            }
        }
    }

    /** Runs on a worker thread. Posts messages only; never touches graph state. */
    private void work(BlockRunner runner, BlockingQueue<WorkerMessage> channel) {
        String blockId = runner.name();
        MdcContext.setBlock(runId, blockId);
        long start = System.currentTimeMillis();
        var retryCount = new AtomicInteger();
        var listener = new RecoveryListener() {
            @Override
            public void onRetry(int retry, OrchestrationException cause, Duration delay) {
                retryCount.set(retry);
                channel.offer(new WorkerMessage.RetryNotice(blockId, retry, cause.category(), cause.getMessage()));
            }
        };
        try {
            RecoveryResult<BlockExecution> result = resources.recovery().attempt(runner, listener);
            channel.offer(finished(blockId, result, System.currentTimeMillis() - start));
        } catch (OrchestrationException e) {
            if (!e.isRecoverable()) {
                channel.offer(new WorkerMessage.Fatal(blockId, e));
            } else {
                String reason = String.format("Failed after %d attempt(s): %s: %s",
                        retryCount.get() + 1, e.category(), e.getMessage());
                channel.offer(new WorkerMessage.Finished(new BlockOutcome(blockId, BlockStatus.FAILED, reason,
                        List.of(), null, retryCount.get() + 1, System.currentTimeMillis() - start), null, null));
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error executing block {}", blockId, e);
            channel.offer(new WorkerMessage.Finished(new BlockOutcome(blockId, BlockStatus.FAILED,
                    "Unexpected error: " + e, List.of(), null, retryCount.get() + 1,
                    System.currentTimeMillis() - start), null, null));
        } finally {
            MdcContext.clear();
        }
    }

    private WorkerMessage.Finished finished(String blockId, RecoveryResult<BlockExecution> result, long elapsedMs) {
        var failure = result.failure();
        switch (result.outcome()) {
            case SUCCEEDED: {
                var execution = result.value();
                boolean issues = execution.hasIssues();
                String reason = issues
                        ? "Completed with issues: " + String.join("; ", execution.issues())
                        : "Completed";
                return new WorkerMessage.Finished(new BlockOutcome(blockId,
                        issues ? BlockStatus.COMPLETED_WITH_ISSUES : BlockStatus.COMPLETED, reason,
                        execution.artifacts(), execution.validation(), result.invocations(), elapsedMs), null, null);
            }
            case RECOVERED: {
                var execution = result.value();
                String reason = String.format("Completed via %s after %s: %s", result.fallback(),
                        failure.category(), failure.getMessage());
                if (execution.hasIssues()) {
                    reason += " (" + String.join("; ", execution.issues()) + ")";
                }
                return new WorkerMessage.Finished(new BlockOutcome(blockId, BlockStatus.COMPLETED_WITH_ISSUES,
                        reason, execution.artifacts(), execution.validation(), result.invocations(), elapsedMs),
                        null, null);
            }
            case SKIPPED:
                return new WorkerMessage.Finished(new BlockOutcome(blockId, BlockStatus.DEFERRED,
                        "Skipped after " + failure.category() + ": " + failure.getMessage(), List.of(), null,
                        result.invocations(), elapsedMs), null, null);
            case REVERTED:
            default:
                return new WorkerMessage.Finished(new BlockOutcome(blockId, BlockStatus.FAILED,
                        "Reverted to checkpoint " + result.revertedTo() + " after " + failure.category() + ": "
                                + failure.getMessage(), List.of(), null, result.invocations(), elapsedMs),
                        result.revertedTo(), result.revertedState());
        }
    }

    private void applyRetry(WorkerMessage.RetryNotice notice) {
        String id = notice.blockId();
        graph.transition(id, BlockStatus.FAILED, "Attempt failed: " + notice.cause() + ": " + notice.message());
        graph.transition(id, BlockStatus.IN_PROGRESS, "Retry " + notice.retry());
        retries++;
        publish("block.retrying", id, Map.of("retry", notice.retry(), "cause", notice.cause().name()));
    }

    private void applyOutcome(WorkerMessage.Finished finished) {
        var outcome = finished.outcome();
        String id = outcome.blockId();
        switch (outcome.status()) {
            case COMPLETED, COMPLETED_WITH_ISSUES -> {
                graph.transition(id, outcome.status(), outcome.reason());
                outcome.artifacts().forEach(a -> artifacts.put(a.path(), a));
                log.info("Block {} {}: {}", id, outcome.status(), outcome.reason());
                publish("block.completed", id, Map.of("status", outcome.status().name(),
                        "artifacts", outcome.artifacts().size()));
            }
            case DEFERRED -> {
                graph.transition(id, BlockStatus.FAILED, outcome.reason());
                graph.transition(id, BlockStatus.DEFERRED, outcome.reason());
                log.warn("Block {} skipped: {}", id, outcome.reason());
                publish("block.deferred", id, Map.of("reason", outcome.reason()));
                blockDependents(id);
            }
            default -> {
                graph.transition(id, BlockStatus.FAILED, outcome.reason());
                if (finished.revertedState() != null) {
                    revertArtifacts(id, finished.revertedState());
                }
                log.warn("Block {} failed: {}", id, outcome.reason());
                publish("block.failed", id, Map.of("reason", outcome.reason()));
                blockDependents(id);
            }
        }
        graph.recordAttempts(id, outcome.attempts());
        outcomes.put(id, outcome);
        if (metrics != null) {
            metrics.recordBlockExecution(outcome.status(), outcome.elapsedMs());
        }
        checkpoint(CheckpointReason.AFTER_BLOCK, id);
    }

    private void revertArtifacts(String blockId, OrchestrationSnapshot snapshot) {
        for (var step : graph.block(blockId).steps()) {
            var current = artifacts.get(step.targetPath());
            if (current != null && !current.blockId().equals(blockId)) {
                // written by another block after the snapshot was taken
                continue;
            }
            var previous = snapshot.artifacts().get(step.targetPath());
            if (previous != null) {
                artifacts.put(step.targetPath(), previous);
            } else {
                artifacts.remove(step.targetPath());
            }
        }
    }

    private void blockDependents(String failedId) {
        for (String dependent : graph.gatingDependents(failedId)) {
            if (graph.block(dependent).status() == BlockStatus.NOT_STARTED) {
                block(dependent, failedId);
            }
        }
    }

    private void block(String id, String prerequisite) {
        String reason = "Waiting on prerequisite " + prerequisite + " (" + graph.block(prerequisite).status() + ")";
        graph.transition(id, BlockStatus.BLOCKED, reason);
        log.info("Block {} blocked: {}", id, reason);
        publish("block.blocked", id, Map.of("prerequisite", prerequisite));
    }

    private void deferBlocked() {
        for (var block : graph.blocks()) {
            if (block.status() != BlockStatus.BLOCKED) {
                continue;
            }
            String reason = deferralReason(graph, block.id());
            graph.transition(block.id(), BlockStatus.DEFERRED, reason);
            outcomes.put(block.id(), new BlockOutcome(block.id(), BlockStatus.DEFERRED, reason, List.of(), null, 0, 0));
            publish("block.deferred", block.id(), Map.of("reason", reason));
        }
    }

    static String deferralReason(DependencyGraph graph, String blockId) {
        return graph.firstUnsatisfiedPrerequisite(blockId)
                .map(p -> "Deferred: prerequisite " + p + " did not complete (" + graph.block(p).status() + ")")
                .orElse("Deferred: blocked without an unsatisfied prerequisite");
    }

    /**
     * Cancels the lowest-priority in-flight block off the critical path when a limit is exceeded.
     */
    private void enforceResourceLimits(Map<String, InFlight> inFlight) {
        var statuses = resources.monitor().checkLimits();
        Optional<ResourceKind> exceeded = statuses.entrySet().stream()
                .filter(e -> e.getValue() == LimitStatus.EXCEEDED)
                .map(Map.Entry::getKey)
                .findFirst();
        if (exceeded.isEmpty()) {
            return;
        }
        if (inFlight.values().stream().anyMatch(f -> f.token().isCancellationRequested())) {
            return;
        }
        var kind = exceeded.get();
        inFlight.keySet().stream()
                .filter(id -> !graph.isOnCriticalPath(id))
                .min(Comparator.<String>comparingDouble(graph::priority).thenComparing(Comparator.naturalOrder()))
                .ifPresent(victim -> {
                    String message = String.format("%s usage at %.1f%% of limit; cancelling %s",
                            kind, resources.monitor().percentage(kind), victim);
                    log.warn(message);
                    inFlight.get(victim).token().cancel(new ResourceLimitException(kind.exceededCategory(), message));
                    publish("resource.exceeded", victim, Map.of("resource", kind.name()));
                    if (metrics != null) {
                        metrics.recordResourceCancellation(kind.name().toLowerCase());
                    }
                });
    }

    private void checkpoint(CheckpointReason reason, String detail) {
        var store = resources.checkpoints();
        RecoverableOperation<String> create = RecoverableOperation.of("checkpoint " + reason,
                () -> store.create(() -> graph.snapshot(runId, artifacts), reason, detail));
        try {
            RecoveryResult<String> result = resources.recovery().attempt(create);
            if (result.hasValue()) {
                checkpointsCreated++;
                publish("checkpoint.created", detail, Map.of("checkpointId", result.value(), "reason", reason.name()));
                return;
            }
            skippedCheckpoint(reason, detail, result.failure());
        } catch (OrchestrationException e) {
            skippedCheckpoint(reason, detail, e);
        }
    }

    private void skippedCheckpoint(CheckpointReason reason, String detail, OrchestrationException cause) {
        String warning = String.format("Checkpoint %s%s skipped: %s", reason, detail != null ? " " + detail : "",
                cause.getMessage());
        log.warn(warning);
        warnings.add(warning);
        publish("checkpoint.skipped", detail, Map.of("reason", reason.name()));
        if (metrics != null) {
            metrics.recordCheckpoint("skipped");
        }
    }

    private RunReport report(long durationMs) {
        var blocks = graph.blocksById();
        int completed = 0, withIssues = 0, failed = 0, deferred = 0;
        for (var block : blocks.values()) {
            switch (block.status()) {
                case COMPLETED -> completed++;
                case COMPLETED_WITH_ISSUES -> withIssues++;
                case FAILED -> failed++;
                case DEFERRED -> deferred++;
                default -> { }
            }
        }
        var runMetrics = new RunMetrics(durationMs, completed, withIssues, failed, deferred, retries,
                checkpointsCreated, layersExecuted);
        return new RunReport(runId, blocks, outcomes, artifacts, graph.layers(), graph.criticalPath(),
                resources.checkpoints().list(), warnings, runMetrics);
    }

    private void publish(String type, String blockId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(OrchestrationEvent.of(type, runId, blockId, payload));
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record InFlight(CancellationToken token, Future<?> future) {}
}
