package com.keystone.core.scheduler;

import com.keystone.core.model.Artifact;
import com.keystone.core.model.BlockDependency;
import com.keystone.core.model.BlockStatus;
import com.keystone.core.model.ImplementationBlock;
import com.keystone.core.persistence.OrchestrationSnapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated block graph of one run. Structure (edges, critical path, priorities, layers) is fixed
 * at build time by {@link DependencyGraphBuilder}; block statuses change only through
 * {@link #transition}, which enforces {@link BlockTransitions}.
 */
public class DependencyGraph {

    private final Map<String, ImplementationBlock> blocks;
    private final List<BlockDependency> dependencies;
    private final Map<String, List<String>> gatingPrerequisites;
    private final Map<String, List<String>> gatingDependents;
    private final Map<String, List<String>> softDependents;
    private final Map<String, List<String>> alternatives;
    private final List<String> criticalPath;
    private final Set<String> onCriticalPath;
    private final Map<String, Double> priorities;
    private final List<List<String>> layers;
    private final Map<String, Integer> attempts = new HashMap<>();

    DependencyGraph(LinkedHashMap<String, ImplementationBlock> blocks,
                    List<BlockDependency> dependencies,
                    Map<String, List<String>> gatingPrerequisites,
                    Map<String, List<String>> gatingDependents,
                    Map<String, List<String>> softDependents,
                    Map<String, List<String>> alternatives,
                    List<String> criticalPath,
                    Map<String, Double> priorities,
                    List<List<String>> layers) {
        this.blocks = blocks;
        this.dependencies = List.copyOf(dependencies);
        this.gatingPrerequisites = gatingPrerequisites;
        this.gatingDependents = gatingDependents;
        this.softDependents = softDependents;
        this.alternatives = alternatives;
        this.criticalPath = List.copyOf(criticalPath);
        this.onCriticalPath = Set.copyOf(criticalPath);
        this.priorities = Map.copyOf(priorities);
        this.layers = layers.stream().map(List::copyOf).toList();
    }

    public synchronized ImplementationBlock block(String blockId) {
        var block = blocks.get(blockId);
        if (block == null) {
            throw new IllegalArgumentException("Unknown block: " + blockId);
        }
        return block;
    }

    public synchronized boolean contains(String blockId) {
        return blocks.containsKey(blockId);
    }

    /** Current blocks in plan order. */
    public synchronized List<ImplementationBlock> blocks() {
        return new ArrayList<>(blocks.values());
    }

    public synchronized Map<String, ImplementationBlock> blocksById() {
        return new LinkedHashMap<>(blocks);
    }

    public List<BlockDependency> dependencies() {
        return dependencies;
    }

    public double priority(String blockId) {
        Double priority = priorities.get(blockId);
        if (priority == null) {
            throw new IllegalArgumentException("Unknown block: " + blockId);
        }
        return priority;
    }

    /** Longest effort-weighted chain of gating dependencies, prerequisite first. */
    public List<String> criticalPath() {
        return criticalPath;
    }

    public boolean isOnCriticalPath(String blockId) {
        return onCriticalPath.contains(blockId);
    }

    /** Kahn layers over gating edges, each ordered by priority (highest first) then id. */
    public List<List<String>> layers() {
        return layers;
    }

    public List<String> topologicalOrder() {
        return layers.stream().flatMap(List::stream).toList();
    }

    public List<String> gatingPrerequisites(String blockId) {
        return gatingPrerequisites.getOrDefault(blockId, List.of());
    }

    public List<String> gatingDependents(String blockId) {
        return gatingDependents.getOrDefault(blockId, List.of());
    }

    public List<String> softDependents(String blockId) {
        return softDependents.getOrDefault(blockId, List.of());
    }

    /** Blocks declared as ALTERNATIVE to {@code blockId}. */
    public List<String> alternativesFor(String blockId) {
        return alternatives.getOrDefault(blockId, List.of());
    }

    /**
     * First gating prerequisite that has not completed successfully, if any.
     */
    public synchronized Optional<String> firstUnsatisfiedPrerequisite(String blockId) {
        for (String prerequisite : gatingPrerequisites(blockId)) {
            if (!blocks.get(prerequisite).status().isSuccessful()) {
                return Optional.of(prerequisite);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws IllegalStateException if the transition is not allowed
     */
    public synchronized ImplementationBlock transition(String blockId, BlockStatus to, String reason) {
        var block = block(blockId);
        BlockTransitions.validate(blockId, block.status(), to);
        var updated = block.withStatus(to, reason);
        blocks.put(blockId, updated);
        return updated;
    }

    /**
     * Marks a not-yet-started block as already completed by an earlier run.
     */
    public synchronized void restore(String blockId, BlockStatus status, String reason, int attemptCount) {
        var block = block(blockId);
        if (block.status() != BlockStatus.NOT_STARTED || !status.isSuccessful()) {
            throw new IllegalStateException(String.format(
                    "Cannot restore block %s from %s to %s", blockId, block.status(), status));
        }
        blocks.put(blockId, block.withStatus(status, reason));
        attempts.put(blockId, attemptCount);
    }

    public synchronized void recordAttempts(String blockId, int attemptCount) {
        attempts.merge(blockId, attemptCount, Integer::sum);
    }

    public synchronized int attempts(String blockId) {
        return attempts.getOrDefault(blockId, 0);
    }

    public synchronized OrchestrationSnapshot snapshot(String runId, Map<String, Artifact> artifacts) {
        var states = new LinkedHashMap<String, OrchestrationSnapshot.BlockState>();
        for (var block : blocks.values()) {
            states.put(block.id(), new OrchestrationSnapshot.BlockState(
                    block.status(), block.statusReason(), attempts.getOrDefault(block.id(), 0)));
        }
        return new OrchestrationSnapshot(runId, states, artifacts);
    }
}
