package com.keystone.core.scheduler;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.StructuralException;
import com.keystone.core.model.BlockDependency;
import com.keystone.core.model.DependencyKind;
import com.keystone.core.model.ImplementationBlock;
import com.keystone.core.model.ImplementationPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Validates a plan and computes its schedule.
 * <p>
 * Validation order: duplicate ids, unresolved references, then cycles among gating edges.
 * Non-gating edges never take part in ordering; soft ones feed the priority formula and
 * ALTERNATIVE ones name fallback targets.
 */
@Service
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private enum Mark { WHITE, GRAY, BLACK }

    private final PriorityWeights weights;

    @Autowired
    public DependencyGraphBuilder(KeystoneProperties properties) {
        this(properties.getScheduler().toWeights());
    }

    public DependencyGraphBuilder(PriorityWeights weights) {
        this.weights = weights;
    }

    public DependencyGraph build(ImplementationPlan plan) {
        return build(plan.blocks(), plan.dependencies());
    }

    /**
     * Edges may come from {@code dependencies} or from each block's own dependency list; both are merged.
     *
     * @throws StructuralException DUPLICATE_BLOCK, MISSING_DEPENDENCY or CYCLE_DETECTED
     */
    public DependencyGraph build(List<ImplementationBlock> blocks, List<BlockDependency> dependencies) {
        var byId = new LinkedHashMap<String, ImplementationBlock>();
        for (var block : blocks) {
            if (byId.putIfAbsent(block.id(), block) != null) {
                throw StructuralException.duplicateBlock(block.id());
            }
        }

        var edges = new LinkedHashSet<BlockDependency>(dependencies);
        for (var block : blocks) {
            edges.addAll(block.dependencies());
        }
        for (var edge : edges) {
            if (!byId.containsKey(edge.blockId())) {
                throw StructuralException.missingDependency(edge.prerequisiteId(), edge.blockId());
            }
            if (!byId.containsKey(edge.prerequisiteId())) {
                throw StructuralException.missingDependency(edge.blockId(), edge.prerequisiteId());
            }
        }

        // Sorted maps keep every traversal deterministic.
        var prerequisites = new TreeMap<String, List<String>>();
        var dependents = new TreeMap<String, List<String>>();
        var soft = new TreeMap<String, List<String>>();
        var alternatives = new TreeMap<String, List<String>>();
        for (var edge : edges) {
            if (edge.isGating()) {
                addSorted(prerequisites, edge.blockId(), edge.prerequisiteId());
                addSorted(dependents, edge.prerequisiteId(), edge.blockId());
            } else if (edge.kind().isSoft()) {
                addSorted(soft, edge.prerequisiteId(), edge.blockId());
            } else if (edge.kind() == DependencyKind.ALTERNATIVE) {
                addSorted(alternatives, edge.blockId(), edge.prerequisiteId());
            }
        }

        detectCycles(byId.keySet().stream().sorted().toList(), prerequisites);

        for (var block : blocks) {
            var own = edges.stream().filter(e -> e.blockId().equals(block.id())).toList();
            byId.put(block.id(), block.withDependencies(own));
        }

        List<String> criticalPath = criticalPath(byId, prerequisites, dependents);
        var onCriticalPath = new LinkedHashSet<>(criticalPath);
        var priorities = new HashMap<String, Double>();
        for (var block : byId.values()) {
            double weightedDependents = dependents.getOrDefault(block.id(), List.of()).size()
                    + weights.softDependentWeight() * soft.getOrDefault(block.id(), List.of()).size();
            double priority = block.priority()
                    + (onCriticalPath.contains(block.id()) ? weights.criticalPathBonus() : 0.0)
                    + weights.dependentCountBonus() * weightedDependents
                    + block.riskFactor() * weights.riskWeight();
            priorities.put(block.id(), priority);
        }

        List<List<String>> layers = layers(byId, prerequisites, dependents, priorities);
        log.info("Built dependency graph: {} blocks, {} edges, {} layers, critical path {}",
                byId.size(), edges.size(), layers.size(), criticalPath);

        return new DependencyGraph(byId, new ArrayList<>(edges), prerequisites, dependents, soft, alternatives,
                criticalPath, priorities, layers);
    }

    /**
     * Three-colour depth-first search over gating edges, dependent to prerequisite.
     */
    private static void detectCycles(List<String> ids, Map<String, List<String>> prerequisites) {
        var marks = new HashMap<String, Mark>();
        ids.forEach(id -> marks.put(id, Mark.WHITE));
        var path = new ArrayList<String>();
        for (String id : ids) {
            if (marks.get(id) == Mark.WHITE) {
                visit(id, prerequisites, marks, path);
            }
        }
    }

    private static void visit(String id, Map<String, List<String>> prerequisites, Map<String, Mark> marks,
                              List<String> path) {
        marks.put(id, Mark.GRAY);
        path.add(id);
        for (String next : prerequisites.getOrDefault(id, List.of())) {
            Mark mark = marks.get(next);
            if (mark == Mark.GRAY) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                throw StructuralException.cycleDetected(cycle);
            }
            if (mark == Mark.WHITE) {
                visit(next, prerequisites, marks, path);
            }
        }
        path.remove(path.size() - 1);
        marks.put(id, Mark.BLACK);
    }

    /**
     * Longest path by accumulated effort. Ties prefer the longer chain, then the smaller id.
     */
    private static List<String> criticalPath(Map<String, ImplementationBlock> blocks,
                                             Map<String, List<String>> prerequisites,
                                             Map<String, List<String>> dependents) {
        var distance = new HashMap<String, Long>();
        var length = new HashMap<String, Integer>();
        var predecessor = new HashMap<String, String>();

        for (String id : kahn(blocks.keySet(), prerequisites, dependents, Comparator.naturalOrder())
                .stream().flatMap(List::stream).toList()) {
            long best = 0;
            int bestLength = 0;
            String bestPrerequisite = null;
            for (String prerequisite : prerequisites.getOrDefault(id, List.of())) {
                long d = distance.get(prerequisite);
                int l = length.get(prerequisite);
                if (bestPrerequisite == null || d > best || (d == best && l > bestLength)) {
                    best = d;
                    bestLength = l;
                    bestPrerequisite = prerequisite;
                }
            }
            distance.put(id, best + blocks.get(id).estimatedEffort().toMillis());
            length.put(id, bestLength + 1);
            if (bestPrerequisite != null) {
                predecessor.put(id, bestPrerequisite);
            }
        }

        String end = null;
        for (String id : new TreeSet<>(blocks.keySet())) {
            if (end == null || distance.get(id) > distance.get(end)
                    || (distance.get(id).equals(distance.get(end)) && length.get(id) > length.get(end))) {
                end = id;
            }
        }
        var path = new ArrayDeque<String>();
        for (String id = end; id != null; id = predecessor.get(id)) {
            path.addFirst(id);
        }
        return new ArrayList<>(path);
    }

    private static List<List<String>> layers(Map<String, ImplementationBlock> blocks,
                                             Map<String, List<String>> prerequisites,
                                             Map<String, List<String>> dependents,
                                             Map<String, Double> priorities) {
        Comparator<String> byPriority = Comparator.<String>comparingDouble(priorities::get).reversed()
                .thenComparing(Comparator.naturalOrder());
        return kahn(blocks.keySet(), prerequisites, dependents, byPriority);
    }

    private static List<List<String>> kahn(Iterable<String> ids, Map<String, List<String>> prerequisites,
                                           Map<String, List<String>> dependents, Comparator<String> order) {
        var remaining = new HashMap<String, Integer>();
        var ready = new ArrayList<String>();
        for (String id : ids) {
            int inDegree = prerequisites.getOrDefault(id, List.of()).size();
            remaining.put(id, inDegree);
            if (inDegree == 0) {
                ready.add(id);
            }
        }
        var layers = new ArrayList<List<String>>();
        while (!ready.isEmpty()) {
            ready.sort(order);
            layers.add(List.copyOf(ready));
            var next = new ArrayList<String>();
            for (String id : ready) {
                for (String dependent : dependents.getOrDefault(id, List.of())) {
                    if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            ready = next;
        }
        return layers;
    }

    private static void addSorted(Map<String, List<String>> index, String key, String value) {
        var values = index.computeIfAbsent(key, k -> new ArrayList<>());
        if (!values.contains(value)) {
            values.add(value);
            values.sort(Comparator.naturalOrder());
        }
    }
}
