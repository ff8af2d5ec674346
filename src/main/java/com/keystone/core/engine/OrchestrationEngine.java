package com.keystone.core.engine;

import com.keystone.core.chunking.AdaptiveChunker;
import com.keystone.core.chunking.ChunkingSettings;
import com.keystone.core.collaborator.Collaborators;
import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.OrchestrationException;
import com.keystone.core.error.PersistenceException;
import com.keystone.core.events.EventBus;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.BlockStatus;
import com.keystone.core.model.ImplementationPlan;
import com.keystone.core.model.RunReport;
import com.keystone.core.persistence.CheckpointStore;
import com.keystone.core.persistence.CheckpointStoreFactory;
import com.keystone.core.persistence.OrchestrationSnapshot;
import com.keystone.core.recovery.RecoveryManager;
import com.keystone.core.recovery.Sleeper;
import com.keystone.core.resources.ResourceMonitorFactory;
import com.keystone.core.scheduler.BlockScheduler;
import com.keystone.core.scheduler.DependencyGraph;
import com.keystone.core.scheduler.DependencyGraphBuilder;
import com.keystone.core.scheduler.RunResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composes and executes orchestration runs.
 * <p>
 * Every run gets its own Resource Monitor, Adaptive Chunker, Checkpoint Store (keyed by the run id)
 * and Recovery Manager; nothing is shared between concurrent runs except the configuration.
 */
@Service
public class OrchestrationEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final DependencyGraphBuilder graphBuilder;
    private final ResourceMonitorFactory monitorFactory;
    private final CheckpointStoreFactory checkpointFactory;
    private final KeystoneProperties properties;
    private final Sleeper sleeper;
    private final EventBus eventBus;
    private final KeystoneMetrics metrics;

    public OrchestrationEngine(DependencyGraphBuilder graphBuilder, ResourceMonitorFactory monitorFactory,
                               CheckpointStoreFactory checkpointFactory, KeystoneProperties properties,
                               Sleeper sleeper, EventBus eventBus,
                               @Autowired(required = false) KeystoneMetrics metrics) {
        this.graphBuilder = graphBuilder;
        this.monitorFactory = monitorFactory;
        this.checkpointFactory = checkpointFactory;
        this.properties = properties;
        this.sleeper = sleeper;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs {@code plan} under a newly generated run id. Ids whose lineage already holds checkpoints,
     * for instance from a previous process sharing the checkpoint directory, are skipped.
     */
    public RunReport run(ImplementationPlan plan, Collaborators collaborators) {
        DependencyGraph graph = graphBuilder.build(plan);
        String runId = generateRunId();
        CheckpointStore store = checkpointFactory.create(runId);
        while (store.size() > 0) {
            log.debug("Run id {} already has {} checkpoint(s), generating another", runId, store.size());
            runId = generateRunId();
            store = checkpointFactory.create(runId);
        }
        return execute(runId, graph, collaborators, store, null);
    }

    /**
     * Validates the plan and executes it under a fresh checkpoint lineage named {@code runId}.
     *
     * @throws com.keystone.core.error.StructuralException if the plan does not form a valid graph
     * @throws IllegalStateException if the lineage already holds checkpoints; use {@link #resume} for those
     */
    public RunReport run(String runId, ImplementationPlan plan, Collaborators collaborators) {
        DependencyGraph graph = graphBuilder.build(plan);
        CheckpointStore store = checkpointFactory.create(runId);
        if (store.size() > 0) {
            throw new IllegalStateException("Run " + runId + " already has " + store.size()
                    + " checkpoint(s); resume it or choose another run id");
        }
        return execute(runId, graph, collaborators, store, null);
    }

    /**
     * Re-runs {@code plan} from checkpoint {@code checkpointId} of lineage {@code runId}. Blocks
     * the checkpoint records as successful are not executed again.
     *
     * @throws PersistenceException if the checkpoint cannot be loaded; the run does not start
     */
    public RunReport resume(String runId, ImplementationPlan plan, Collaborators collaborators, String checkpointId) {
        DependencyGraph graph = graphBuilder.build(plan);
        CheckpointStore store = checkpointFactory.create(runId);
        OrchestrationSnapshot snapshot = store.load(checkpointId);
        log.info("Resuming run {} from checkpoint {}", runId, checkpointId);
        return execute(runId, graph, collaborators, store, snapshot);
    }

    /**
     * Resumes from the newest checkpoint of lineage {@code runId}.
     */
    public RunReport resumeLatest(String runId, ImplementationPlan plan, Collaborators collaborators) {
        CheckpointStore store = checkpointFactory.create(runId);
        var latest = store.latest().orElseThrow(() -> PersistenceException.notFound(runId + " (latest)"));
        return resume(runId, plan, collaborators, latest.id());
    }

    /**
     * Executes an already-built graph against an existing checkpoint lineage. Used by the branch
     * coordinator, which owns each branch's graph and lineage.
     */
    public RunReport execute(String runId, DependencyGraph graph, Collaborators collaborators,
                             CheckpointStore checkpoints, OrchestrationSnapshot resumeFrom) {
        MdcContext.setRun(runId);
        long start = System.currentTimeMillis();
        try {
            var monitor = monitorFactory.create();
            var chunker = new AdaptiveChunker(monitor, chunkingSettings(), metrics);
            var recovery = new RecoveryManager(properties.getRecovery().resolvePolicies(),
                    properties.getRecovery().getDefaultPolicy().toPolicy(), checkpoints, sleeper, metrics);
            var scheduler = new BlockScheduler(runId, graph, collaborators,
                    new RunResources(monitor, chunker, checkpoints, recovery),
                    properties.getScheduler().toSettings(), eventBus, metrics);

            RunReport report = scheduler.run(resumeFrom);
            if (metrics != null) {
                boolean clean = report.blocks().values().stream()
                        .noneMatch(b -> b.status() == BlockStatus.FAILED || b.status() == BlockStatus.DEFERRED);
                metrics.recordRunResult(clean ? "completed" : "completed_with_failures", report.metrics().totalDurationMs());
            }
            return report;
        } catch (OrchestrationException e) {
            log.error("Run {} aborted: {} ({})", runId, e.getMessage(), e.category());
            if (metrics != null) {
                metrics.recordRunResult("aborted", System.currentTimeMillis() - start);
            }
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public DependencyGraphBuilder graphBuilder() {
        return graphBuilder;
    }

    /**
     * Generates a unique run ID in the format KSTN-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("KSTN-%d-%04d", year, count);
    }

    private ChunkingSettings chunkingSettings() {
        return properties.getChunking().toSettings();
    }
}
