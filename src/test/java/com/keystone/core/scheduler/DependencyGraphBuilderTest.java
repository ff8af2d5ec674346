package com.keystone.core.scheduler;

import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.StructuralException;
import com.keystone.core.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DependencyGraphBuilder(PriorityWeights.defaults());
    }

    private static ImplementationBlock block(String id) {
        return block(id, 0, 0.0, Duration.ofMinutes(1));
    }

    private static ImplementationBlock block(String id, int priority, double risk, Duration effort) {
        return ImplementationBlock.of(id, "Implement " + id, priority, risk,
                List.of(new ExecutionStep(id + "-1", "Write " + id, "src/" + id + ".java")), effort);
    }

    private static BlockDependency edge(String blockId, String prerequisiteId, DependencyKind kind) {
        return new BlockDependency(blockId, prerequisiteId, kind);
    }

    private DependencyGraph diamondWithIndependentE() {
        return builder.build(
                List.of(block("A"), block("B"), block("C"), block("D"), block("E")),
                List.of(BlockDependency.requiredBefore("B", "A"),
                        BlockDependency.requiredBefore("C", "A"),
                        BlockDependency.requiredBefore("D", "B"),
                        BlockDependency.requiredBefore("D", "C")));
    }

    @Nested
    @DisplayName("Layers")
    class Layers {

        @Test
        @DisplayName("A, E independent; B, C after A; D after B and C -> [A, E], [B, C], [D]")
        void diamondLayers() {
            var graph = diamondWithIndependentE();

            assertEquals(List.of(List.of("A", "E"), List.of("B", "C"), List.of("D")), graph.layers());
            assertEquals(List.of("A", "E", "B", "C", "D"), graph.topologicalOrder());
        }

        @Test
        @DisplayName("Blocks within a layer are ordered by priority, then id")
        void layerOrderedByPriority() {
            var graph = builder.build(
                    List.of(block("A", 0, 0.0, Duration.ofMinutes(1)),
                            block("Y", 0, 0.0, Duration.ofMinutes(1)),
                            block("X", 0, 0.0, Duration.ofMinutes(1)),
                            block("Z", 50, 0.0, Duration.ofMinutes(1))),
                    List.of());

            // A is the critical path end by id tie-break and gets the bonus; Z outranks it by base priority
            assertEquals(List.of(List.of("Z", "A", "X", "Y")), graph.layers());
        }

        @Test
        @DisplayName("Soft and alternative edges do not create layers")
        void nonGatingEdgesDoNotOrder() {
            var graph = builder.build(
                    List.of(block("A"), block("B")),
                    List.of(edge("B", "A", DependencyKind.INFLUENCES),
                            edge("A", "B", DependencyKind.PROVIDES_INFORMATION)));

            assertEquals(1, graph.layers().size());
        }

        @Test
        @DisplayName("REQUIRED_FOR_COMPLETION gates like REQUIRED_BEFORE")
        void requiredForCompletionGates() {
            var graph = builder.build(
                    List.of(block("A"), block("B")),
                    List.of(edge("B", "A", DependencyKind.REQUIRED_FOR_COMPLETION)));

            assertEquals(List.of(List.of("A"), List.of("B")), graph.layers());
            assertEquals(List.of("A"), graph.gatingPrerequisites("B"));
            assertEquals(List.of("B"), graph.gatingDependents("A"));
        }

        @Test
        @DisplayName("Edges declared on the blocks themselves are honoured")
        void blockLevelDependencies() {
            var b = block("B").withDependencies(List.of(BlockDependency.requiredBefore("B", "A")));
            var graph = builder.build(List.of(block("A"), b), List.of());

            assertEquals(List.of(List.of("A"), List.of("B")), graph.layers());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Gating cycle is reported with its path")
        void cycleDetected() {
            var ex = assertThrows(StructuralException.class, () -> builder.build(
                    List.of(block("A"), block("B"), block("C")),
                    List.of(BlockDependency.requiredBefore("A", "B"),
                            BlockDependency.requiredBefore("B", "C"),
                            BlockDependency.requiredBefore("C", "A"))));

            assertEquals(ErrorCategory.CYCLE_DETECTED, ex.category());
            assertEquals(List.of("A", "B", "C", "A"), ex.cyclePath());
            assertFalse(ex.isRecoverable());
        }

        @Test
        @DisplayName("Self dependency is a cycle")
        void selfCycle() {
            var ex = assertThrows(StructuralException.class, () -> builder.build(
                    List.of(block("A")), List.of(BlockDependency.requiredBefore("A", "A"))));

            assertEquals(List.of("A", "A"), ex.cyclePath());
        }

        @Test
        @DisplayName("Cycle through soft edges only is accepted")
        void softCycleAccepted() {
            assertDoesNotThrow(() -> builder.build(
                    List.of(block("A"), block("B")),
                    List.of(edge("A", "B", DependencyKind.INFLUENCES),
                            edge("B", "A", DependencyKind.INFLUENCES))));
        }

        @Test
        @DisplayName("Reference to an unknown block fails")
        void missingDependency() {
            var ex = assertThrows(StructuralException.class, () -> builder.build(
                    List.of(block("A"), block("B")),
                    List.of(BlockDependency.requiredBefore("B", "Z"))));

            assertEquals(ErrorCategory.MISSING_DEPENDENCY, ex.category());
            assertTrue(ex.getMessage().contains("Z"));
        }

        @Test
        @DisplayName("Duplicate block id fails")
        void duplicateBlock() {
            var ex = assertThrows(StructuralException.class, () -> builder.build(
                    List.of(block("A"), block("A")), List.of()));

            assertEquals(ErrorCategory.DUPLICATE_BLOCK, ex.category());
        }
    }

    @Nested
    @DisplayName("Critical path and priorities")
    class CriticalPath {

        @Test
        @DisplayName("Longest effort chain, ties broken by smaller id")
        void criticalPathOfDiamond() {
            var graph = diamondWithIndependentE();

            assertEquals(List.of("A", "B", "D"), graph.criticalPath());
            assertTrue(graph.isOnCriticalPath("B"));
            assertFalse(graph.isOnCriticalPath("C"));
        }

        @Test
        @DisplayName("Heavier branch wins the critical path")
        void heavierBranch() {
            var graph = builder.build(
                    List.of(block("A"), block("B"), block("C", 0, 0.0, Duration.ofMinutes(30)), block("D")),
                    List.of(BlockDependency.requiredBefore("B", "A"),
                            BlockDependency.requiredBefore("C", "A"),
                            BlockDependency.requiredBefore("D", "B"),
                            BlockDependency.requiredBefore("D", "C")));

            assertEquals(List.of("A", "C", "D"), graph.criticalPath());
        }

        @Test
        @DisplayName("Priority combines base, critical path bonus, dependents and risk")
        void priorityFormula() {
            var graph = diamondWithIndependentE();

            assertEquals(14.0, graph.priority("A"), 1e-9);   // 10 + 2 * 2 dependents
            assertEquals(12.0, graph.priority("B"), 1e-9);   // 10 + 2 * 1 dependent
            assertEquals(2.0, graph.priority("C"), 1e-9);
            assertEquals(10.0, graph.priority("D"), 1e-9);
            assertEquals(0.0, graph.priority("E"), 1e-9);
        }

        @Test
        @DisplayName("Soft dependents count at reduced weight and risk raises priority")
        void softDependentsAndRisk() {
            var graph = builder.build(
                    List.of(block("A", 0, 0.4, Duration.ofMinutes(1)), block("B", 0, 0.0, Duration.ofMinutes(2))),
                    List.of(edge("B", "A", DependencyKind.INFLUENCES)));

            assertEquals(List.of("B"), graph.criticalPath());
            assertEquals(List.of("B"), graph.softDependents("A"));
            assertEquals(2 * 0.5 + 0.4 * 5, graph.priority("A"), 1e-9);
        }

        @Test
        @DisplayName("Alternative edges are recorded per block")
        void alternatives() {
            var graph = builder.build(
                    List.of(block("A"), block("A2")),
                    List.of(edge("A", "A2", DependencyKind.ALTERNATIVE)));

            assertEquals(List.of("A2"), graph.alternativesFor("A"));
            assertTrue(graph.alternativesFor("A2").isEmpty());
            assertEquals(1, graph.layers().size());
        }

        @Test
        @DisplayName("Building the same plan twice yields the same schedule")
        void deterministic() {
            var first = diamondWithIndependentE();
            var second = diamondWithIndependentE();

            assertEquals(first.layers(), second.layers());
            assertEquals(first.criticalPath(), second.criticalPath());
        }
    }

    @Nested
    @DisplayName("Graph state")
    class GraphState {

        @Test
        @DisplayName("Unsatisfied prerequisite is reported until it succeeds")
        void unsatisfiedPrerequisite() {
            var graph = diamondWithIndependentE();
            assertEquals("A", graph.firstUnsatisfiedPrerequisite("B").orElseThrow());

            graph.transition("A", BlockStatus.READY, "ready");
            graph.transition("A", BlockStatus.IN_PROGRESS, "running");
            graph.transition("A", BlockStatus.COMPLETED, "done");

            assertTrue(graph.firstUnsatisfiedPrerequisite("B").isEmpty());
        }

        @Test
        @DisplayName("Invalid transition is rejected and leaves the block unchanged")
        void invalidTransition() {
            var graph = diamondWithIndependentE();

            assertThrows(IllegalStateException.class,
                    () -> graph.transition("A", BlockStatus.COMPLETED, "skip ahead"));
            assertEquals(BlockStatus.NOT_STARTED, graph.block("A").status());
        }

        @Test
        @DisplayName("Snapshot captures status, reason and attempts")
        void snapshot() {
            var graph = diamondWithIndependentE();
            graph.transition("A", BlockStatus.READY, "ready");
            graph.recordAttempts("A", 2);

            var snapshot = graph.snapshot("run-1", Map.of());

            assertEquals("run-1", snapshot.runId());
            assertEquals(BlockStatus.READY, snapshot.blocks().get("A").status());
            assertEquals(2, snapshot.blocks().get("A").attempts());
            assertEquals(5, snapshot.blocks().size());
        }

        @Test
        @DisplayName("Restore only applies to not-started blocks and successful statuses")
        void restore() {
            var graph = diamondWithIndependentE();
            graph.restore("A", BlockStatus.COMPLETED, "earlier run", 1);

            assertEquals(BlockStatus.COMPLETED, graph.block("A").status());
            assertThrows(IllegalStateException.class,
                    () -> graph.restore("B", BlockStatus.FAILED, "nope", 1));
            assertThrows(IllegalStateException.class,
                    () -> graph.restore("A", BlockStatus.COMPLETED, "again", 1));
        }

        @Test
        @DisplayName("Unknown block id fails fast")
        void unknownBlock() {
            var graph = diamondWithIndependentE();
            assertThrows(IllegalArgumentException.class, () -> graph.block("nope"));
            assertThrows(IllegalArgumentException.class, () -> graph.priority("nope"));
        }
    }
}
