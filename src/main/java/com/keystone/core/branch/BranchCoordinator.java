package com.keystone.core.branch;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.engine.OrchestrationEngine;
import com.keystone.core.error.MergeException;
import com.keystone.core.error.OrchestrationException;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.OrchestrationEvent;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.ImplementationApproach;
import com.keystone.core.model.ImplementationPlan;
import com.keystone.core.persistence.CheckpointReason;
import com.keystone.core.persistence.CheckpointStoreFactory;
import com.keystone.core.persistence.OrchestrationSnapshot;
import com.keystone.core.scheduler.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Explores alternative approaches to the same workload in isolated branches and commits one result.
 * <p>
 * Each branch owns its plan, graph and checkpoint lineage (named after the branch), so branches
 * never observe each other's state. Merging is a pure operation over branch results; a failed merge
 * changes no branch.
 */
@Service
public class BranchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BranchCoordinator.class);

    private final OrchestrationEngine engine;
    private final CheckpointStoreFactory checkpointFactory;
    private final BranchScorer scorer;
    private final BranchMerger merger = new BranchMerger();
    private final EvaluationWeights weights;
    private final MergeStrategy defaultStrategy;
    private final int maxConcurrent;
    private final EventBus eventBus;
    private final KeystoneMetrics metrics;

    private final ConcurrentHashMap<String, ImplementationBranch> branches = new ConcurrentHashMap<>();

    @Autowired
    public BranchCoordinator(OrchestrationEngine engine, CheckpointStoreFactory checkpointFactory,
                             BranchScorer scorer, KeystoneProperties properties, EventBus eventBus,
                             @Autowired(required = false) KeystoneMetrics metrics) {
        this(engine, checkpointFactory, scorer, properties.getBranches().getWeights().toWeights(),
                properties.getBranches().getMergeStrategy(), properties.getBranches().getMaxConcurrent(),
                eventBus, metrics);
    }

    public BranchCoordinator(OrchestrationEngine engine, CheckpointStoreFactory checkpointFactory,
                             BranchScorer scorer, EvaluationWeights weights, MergeStrategy defaultStrategy,
                             int maxConcurrent, EventBus eventBus, KeystoneMetrics metrics) {
        this.engine = engine;
        this.checkpointFactory = checkpointFactory;
        this.scorer = scorer;
        this.weights = weights;
        this.defaultStrategy = defaultStrategy;
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Creates one branch per approach. A plan that does not form a valid graph yields a FAILED branch
     * rather than failing the whole spawn. A SELECTED or FAILED branch of the same approach is
     * superseded and its checkpoint lineage discarded.
     *
     * @throws IllegalArgumentException if a branch for one of the approaches is still in progress
     */
    public List<ImplementationBranch> spawn(List<ImplementationApproach> approaches, BranchWorkload workload) {
        var spawned = new ArrayList<ImplementationBranch>();
        for (var approach : approaches) {
            String branchId = "branch-" + approach.id();
            var existing = branches.get(branchId);
            if (existing != null) {
                if (!isDecided(existing)) {
                    throw new IllegalArgumentException("Branch already exists: " + branchId
                            + " (" + existing.status() + ")");
                }
                log.info("Superseding {} branch {}", existing.status(), branchId);
                existing.checkpoints().clear();
                branches.remove(branchId);
            }
            ImplementationPlan plan = workload.planFor(approach);
            var checkpoints = checkpointFactory.create(branchId);
            DependencyGraph graph = null;
            String failure = null;
            try {
                graph = engine.graphBuilder().build(plan);
            } catch (OrchestrationException e) {
                failure = "Invalid plan: " + e.getMessage();
                log.warn("Branch {} cannot run: {}", branchId, failure);
            }

            var branch = new ImplementationBranch(branchId, approach, plan, graph,
                    workload.collaboratorsFor(approach), checkpoints);
            if (graph != null) {
                var start = graph.snapshot(branchId, Map.of());
                createBranchCheckpoint(branch, start);
                branch.updateStatus(BranchStatus.CREATED, "Spawned for approach " + approach.id());
            } else {
                branch.updateStatus(BranchStatus.FAILED, failure);
            }
            branches.put(branchId, branch);
            spawned.add(branch);
            publish("branch.spawned", branchId, Map.of("approach", approach.id(), "status", branch.status().name()));
        }
        log.info("Spawned {} branch(es): {}", spawned.size(), spawned.stream().map(ImplementationBranch::id).toList());
        return spawned;
    }

    /**
     * Runs every CREATED branch concurrently, at most {@code maxConcurrent} at a time, and waits for all.
     */
    public List<ImplementationBranch> explore(List<ImplementationBranch> toExplore) {
        var runnable = toExplore.stream().filter(b -> b.status() == BranchStatus.CREATED).toList();
        if (runnable.isEmpty()) {
            return toExplore;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(maxConcurrent, runnable.size()));
        try {
            var tasks = new ArrayList<Callable<Void>>();
            for (var branch : runnable) {
                branch.updateStatus(BranchStatus.IMPLEMENTING, "Running");
                tasks.add(() -> {
                    runBranch(branch);
                    return null;
                });
            }
            for (Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while exploring branches", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Branch exploration failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
        return toExplore;
    }

    /**
     * Scores every IMPLEMENTED branch; the others are left out of the evaluation.
     */
    public BranchEvaluation evaluate(List<ImplementationBranch> candidates) {
        var scored = new LinkedHashMap<String, BranchMetrics>();
        for (var branch : candidates) {
            if (branch.status() != BranchStatus.IMPLEMENTED) {
                continue;
            }
            var branchMetrics = scorer.score(branch.report(), weights);
            branch.recordMetrics(branchMetrics);
            branch.updateStatus(BranchStatus.EVALUATED,
                    String.format("Overall score %.3f", branchMetrics.overallScore()));
            scored.put(branch.id(), branchMetrics);
            if (metrics != null) {
                metrics.recordBranchScore(branchMetrics.overallScore());
            }
            publish("branch.evaluated", branch.id(), Map.of("overallScore", branchMetrics.overallScore()));
        }
        var ranking = scored.keySet().stream()
                .sorted(Comparator.<String>comparingDouble(id -> scored.get(id).overallScore()).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
        log.info("Evaluated {} branch(es), ranking {}", scored.size(), ranking);
        return new BranchEvaluation(scored, ranking, weights);
    }

    /**
     * @throws MergeException BRANCH_NOT_FOUND for an unknown id
     */
    public BranchComparison compare(String branchA, String branchB) {
        var a = require(branchA);
        var b = require(branchB);
        return merger.compare(a.id(), a.artifacts(), b.id(), b.artifacts());
    }

    public MergeResult selectAndMerge(List<String> branchIds, BranchEvaluation evaluation) {
        return selectAndMerge(branchIds, evaluation, defaultStrategy, ConflictResolver.UNRESOLVED);
    }

    /**
     * Merges the evaluated branches among {@code branchIds}. On success the contributing branches
     * become SELECTED, the rest REJECTED with their checkpoint lineages discarded and are dropped
     * from the coordinator. On failure no branch changes.
     *
     * @throws MergeException BRANCH_NOT_FOUND, NO_BRANCHES_AVAILABLE or MERGE_CONFLICT
     */
    public MergeResult selectAndMerge(List<String> branchIds, BranchEvaluation evaluation, MergeStrategy strategy,
                                      ConflictResolver resolver) {
        var candidates = branchIds.stream().map(this::require).toList();
        var eligible = candidates.stream().filter(b -> b.status() == BranchStatus.EVALUATED).toList();

        MergeResult result;
        try {
            result = merger.merge(eligible, evaluation, strategy, resolver);
        } catch (MergeException e) {
            log.warn("Merge of {} failed ({}): {}", branchIds, e.category(), e.getMessage());
            if (metrics != null) {
                metrics.recordMerge(strategy.name().toLowerCase(), false);
            }
            throw e;
        }

        var retained = result.contributingBranches();
        for (var branch : candidates) {
            if (retained.contains(branch.id())) {
                branch.updateStatus(BranchStatus.SELECTED, "Selected by " + strategy + " merge");
            } else {
                branch.updateStatus(BranchStatus.REJECTED, "Not selected by " + strategy + " merge");
                branch.checkpoints().clear();
                branches.remove(branch.id(), branch);
            }
        }
        log.info("Merged {} with {}: primary {}, {} artifact(s) from {}", branchIds, strategy,
                result.primaryBranch(), result.artifacts().size(), retained);
        if (metrics != null) {
            metrics.recordMerge(strategy.name().toLowerCase(), true);
        }
        publish("branch.merged", result.primaryBranch(), Map.of("strategy", strategy.name(),
                "selected", List.copyOf(retained)));
        return result;
    }

    public Optional<ImplementationBranch> branch(String branchId) {
        return Optional.ofNullable(branches.get(branchId));
    }

    public List<ImplementationBranch> branches() {
        return branches.values().stream().sorted(Comparator.comparing(ImplementationBranch::id)).toList();
    }

    private void runBranch(ImplementationBranch branch) {
        MdcContext.setBranch(branch.id());
        try {
            var report = engine.execute(branch.id(), branch.graph(), branch.collaborators(), branch.checkpoints(), null);
            branch.recordReport(report);
            if (report.successfulBlocks() > 0) {
                branch.updateStatus(BranchStatus.IMPLEMENTED,
                        report.successfulBlocks() + "/" + report.blocks().size() + " blocks completed");
            } else {
                branch.updateStatus(BranchStatus.FAILED, "No block completed");
            }
        } catch (OrchestrationException e) {
            branch.updateStatus(BranchStatus.FAILED, e.category() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Branch {} failed unexpectedly: {}", branch.id(), e.getMessage(), e);
            branch.updateStatus(BranchStatus.FAILED, "Unexpected error: " + e.getMessage());
        } finally {
            MdcContext.clear();
        }
        log.info("Branch {} finished: {} ({})", branch.id(), branch.status(), branch.statusReason());
    }

    private static boolean isDecided(ImplementationBranch branch) {
        return branch.status() == BranchStatus.SELECTED || branch.status() == BranchStatus.FAILED
                || branch.status() == BranchStatus.REJECTED;
    }

    private void createBranchCheckpoint(ImplementationBranch branch, OrchestrationSnapshot start) {
        try {
            branch.checkpoints().create(start, CheckpointReason.BRANCH_START, branch.approach().id());
        } catch (OrchestrationException e) {
            log.warn("Branch {} starts without a checkpoint: {}", branch.id(), e.getMessage());
        }
    }

    private ImplementationBranch require(String branchId) {
        var branch = branches.get(branchId);
        if (branch == null) {
            throw MergeException.branchNotFound(branchId);
        }
        return branch;
    }

    private void publish(String type, String branchId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(OrchestrationEvent.of(type, branchId, null, payload));
        }
    }
}
