package com.keystone.core.engine;

import com.keystone.core.collaborator.Collaborators;
import com.keystone.core.collaborator.GeneratedContent;
import com.keystone.core.collaborator.GenerationCollaborator;
import com.keystone.core.collaborator.GenerationException;
import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.PersistenceException;
import com.keystone.core.error.StructuralException;
import com.keystone.core.events.EventBus;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.*;
import com.keystone.core.persistence.CheckpointReason;
import com.keystone.core.persistence.CheckpointStoreFactory;
import com.keystone.core.persistence.FileSystemCheckpointStorage;
import com.keystone.core.persistence.InMemoryCheckpointStorage;
import com.keystone.core.resources.ResourceMonitorFactory;
import com.keystone.core.resources.ResourceUsage;
import com.keystone.core.scheduler.DependencyGraphBuilder;
import com.keystone.core.scheduler.PriorityWeights;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationEngineTest {

    private static final long MB = 1024L * 1024L;

    private final List<String> generatedSteps = new CopyOnWriteArrayList<>();
    private SimpleMeterRegistry registry;
    private KeystoneProperties properties;
    private ResourceMonitorFactory monitorFactory;
    private CheckpointStoreFactory checkpointFactory;
    private OrchestrationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new KeystoneProperties();
        properties.getScheduler().setMaxParallelPaths(2);
        properties.getScheduler().setResourcePollMs(20);
        registry = new SimpleMeterRegistry();

        var storages = new ConcurrentHashMap<String, InMemoryCheckpointStorage>();
        checkpointFactory = new CheckpointStoreFactory(
                lineage -> storages.computeIfAbsent(lineage, InMemoryCheckpointStorage::new), 50, Clock.systemUTC(),
                null);
        monitorFactory = new ResourceMonitorFactory(() -> new ResourceUsage(100 * MB, 5.0, 0), properties,
                Clock.systemUTC());
        engine = engine(checkpointFactory);
    }

    private OrchestrationEngine engine(CheckpointStoreFactory factory) {
        return new OrchestrationEngine(new DependencyGraphBuilder(PriorityWeights.defaults()), monitorFactory,
                factory, properties, delay -> { }, new EventBus(), new KeystoneMetrics(registry));
    }

    private static CheckpointStoreFactory fileSystemFactory(Path dir) {
        return new CheckpointStoreFactory(lineage -> new FileSystemCheckpointStorage(dir.resolve(lineage)), 50,
                Clock.systemUTC(), null);
    }

    /** The run ids the engine's counter hands out after {@code current}. */
    private static List<String> idsAfter(String current, int count) {
        String prefix = current.substring(0, current.lastIndexOf('-') + 1);
        int sequence = Integer.parseInt(current.substring(current.lastIndexOf('-') + 1));
        var ids = new ArrayList<String>();
        for (int i = 1; i <= count; i++) {
            ids.add(prefix + String.format("%04d", sequence + i));
        }
        return ids;
    }

    /** A, then B and C after A. */
    private static ImplementationPlan plan() {
        return new ImplementationPlan("three blocks",
                List.of(block("A"), block("B"), block("C")),
                List.of(BlockDependency.requiredBefore("B", "A"), BlockDependency.requiredBefore("C", "A")));
    }

    private static ImplementationBlock block(String id) {
        return ImplementationBlock.of(id, "Implement " + id, 0, 0.0,
                List.of(new ExecutionStep(id + "-1", "Write " + id, "src/" + id + ".java")), Duration.ZERO);
    }

    private Collaborators collaborators(String failingStep) {
        GenerationCollaborator generator = step -> {
            generatedSteps.add(step.id());
            if (step.id().equals(failingStep)) {
                throw new GenerationException("unavailable");
            }
            return new GeneratedContent("// " + step.id() + "\n");
        };
        return new Collaborators(generator, (block, artifacts) -> ValidationResult.passed(Map.of()));
    }

    @Test
    @DisplayName("run generates a KSTN run id and completes every block")
    void run() {
        var report = engine.run(plan(), collaborators(null));

        assertTrue(report.runId().matches("KSTN-\\d{4}-\\d{4}"), report.runId());
        assertEquals(3, report.successfulBlocks());
        assertEquals(1.0, registry.find("keystone.runs.total").tag("status", "completed").counter().count());
    }

    @Test
    @DisplayName("Run ids are unique")
    void uniqueRunIds() {
        assertNotEquals(engine.generateRunId(), engine.generateRunId());
    }

    @Test
    @DisplayName("A generated run id never reuses a lineage left behind by an earlier process")
    void generatedIdSkipsExistingLineage(@TempDir Path dir) {
        var earlierProcess = fileSystemFactory(dir);
        var leftover = new DependencyGraphBuilder(PriorityWeights.defaults()).build(plan());
        var taken = idsAfter(engine.generateRunId(), 2);
        for (String id : taken) {
            earlierProcess.create(id).create(leftover.snapshot(id, Map.of()), CheckpointReason.RUN_END, "old");
        }

        var report = engine(fileSystemFactory(dir)).run(plan(), collaborators(null));

        assertFalse(taken.contains(report.runId()), report.runId());
        assertEquals(3, report.successfulBlocks());
        assertTrue(report.checkpoints().stream().noneMatch(c -> "old".equals(c.detail())));
        assertEquals(CheckpointReason.RUN_START, report.checkpoints().get(0).reason());
        assertEquals(1, earlierProcess.create(taken.get(0)).size());
    }

    @Test
    @DisplayName("run refuses an explicit run id whose lineage already holds checkpoints")
    void explicitRunIdInUse() {
        engine.run("R-taken", plan(), collaborators(null));
        generatedSteps.clear();

        var ex = assertThrows(IllegalStateException.class,
                () -> engine.run("R-taken", plan(), collaborators(null)));

        assertTrue(ex.getMessage().contains("resume"));
        assertTrue(generatedSteps.isEmpty());
    }

    @Test
    @DisplayName("A cyclic plan is rejected before anything executes")
    void cyclicPlan() {
        var cyclic = new ImplementationPlan("cycle", List.of(block("A"), block("B")),
                List.of(BlockDependency.requiredBefore("A", "B"), BlockDependency.requiredBefore("B", "A")));

        var ex = assertThrows(StructuralException.class, () -> engine.run("R-cycle", cyclic, collaborators(null)));

        assertEquals(ErrorCategory.CYCLE_DETECTED, ex.category());
        assertTrue(generatedSteps.isEmpty());
        assertEquals(0, checkpointFactory.create("R-cycle").size());
    }

    @Test
    @DisplayName("A run with failed blocks is counted as completed_with_failures")
    void runWithFailures() {
        var report = engine.run("R-fail", plan(), collaborators("B-1"));

        assertEquals(BlockStatus.FAILED, report.statusOf("B"));
        assertEquals(BlockStatus.COMPLETED, report.statusOf("C"));
        assertEquals(1.0, registry.find("keystone.runs.total")
                .tag("status", "completed_with_failures").counter().count());
    }

    @Test
    @DisplayName("resume re-runs only blocks the checkpoint does not record as complete")
    void resume() {
        engine.run("R-1", plan(), collaborators("B-1"));
        var afterA = checkpointFactory.create("R-1").list().stream()
                .filter(c -> c.reason() == CheckpointReason.AFTER_BLOCK && "A".equals(c.detail()))
                .findFirst().orElseThrow();
        generatedSteps.clear();

        var report = engine.resume("R-1", plan(), collaborators(null), afterA.id());

        assertFalse(generatedSteps.contains("A-1"));
        assertTrue(generatedSteps.containsAll(List.of("B-1", "C-1")));
        assertEquals(3, report.successfulBlocks());
        assertEquals("R-1", report.runId());
    }

    @Test
    @DisplayName("resumeLatest picks the newest checkpoint of the lineage")
    void resumeLatest() {
        engine.run("R-2", plan(), collaborators("B-1"));
        generatedSteps.clear();

        var report = engine.resumeLatest("R-2", plan(), collaborators(null));

        // the run-end checkpoint records A and C complete, B failed
        assertEquals(List.of("B-1"), generatedSteps);
        assertEquals(BlockStatus.COMPLETED, report.statusOf("B"));
        assertEquals("src/A.java", report.artifacts().get("src/A.java").path());
    }

    @Test
    @DisplayName("resume from an unknown checkpoint fails before the run starts")
    void resumeUnknownCheckpoint() {
        var ex = assertThrows(PersistenceException.class,
                () -> engine.resume("R-3", plan(), collaborators(null), "R-3-CP-0042"));

        assertEquals(ErrorCategory.CHECKPOINT_NOT_FOUND, ex.category());
        assertFalse(ex.isRecoverable());
        assertTrue(generatedSteps.isEmpty());
    }

    @Test
    @DisplayName("resumeLatest without any checkpoint fails with CHECKPOINT_NOT_FOUND")
    void resumeLatestWithoutCheckpoints() {
        var ex = assertThrows(PersistenceException.class,
                () -> engine.resumeLatest("R-empty", plan(), collaborators(null)));

        assertEquals(ErrorCategory.CHECKPOINT_NOT_FOUND, ex.category());
    }
}
