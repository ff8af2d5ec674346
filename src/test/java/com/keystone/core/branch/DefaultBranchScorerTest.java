package com.keystone.core.branch;

import com.keystone.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultBranchScorerTest {

    private final DefaultBranchScorer scorer = new DefaultBranchScorer();

    private static ImplementationBlock block(String id, BlockStatus status) {
        return ImplementationBlock.of(id, "Implement " + id, 0, 0.0,
                List.of(new ExecutionStep(id + "-1", "Write " + id, "src/" + id + ".java")), Duration.ZERO)
                .withStatus(status, status.name());
    }

    private static RunReport report(Map<String, ImplementationBlock> blocks, Map<String, BlockOutcome> outcomes,
                                    Map<String, Artifact> artifacts) {
        return new RunReport("r", blocks, outcomes, artifacts, List.of(), List.of(), List.of(), List.of(),
                new RunMetrics(0, 0, 0, 0, 0, 0, 0, 0));
    }

    /** A completed after two attempts with quality 0.8, B failed. */
    private static RunReport halfDone() {
        var artifact = new Artifact("src/A.java", "A", "A-1", "class A {\n}\n");
        return report(
                Map.of("A", block("A", BlockStatus.COMPLETED), "B", block("B", BlockStatus.FAILED)),
                Map.of("A", new BlockOutcome("A", BlockStatus.COMPLETED, "Completed", List.of(artifact),
                                ValidationResult.passed(Map.of("quality", 0.8)), 2, 10),
                        "B", new BlockOutcome("B", BlockStatus.FAILED, "broken", List.of(), null, 4, 10)),
                Map.of("src/A.java", artifact));
    }

    @Test
    @DisplayName("Subscores follow completion, validation, attempts and artifact shape")
    void subscores() {
        var metrics = scorer.score(halfDone(), EvaluationWeights.defaults());

        assertEquals(0.5, metrics.functionality(), 1e-9);
        assertEquals(0.8, metrics.quality(), 1e-9);
        assertEquals(0.5, metrics.performance(), 1e-9);
        assertEquals(1.0, metrics.maintainability(), 1e-9);
        // 0.3*0.8 + 0.3*0.5 + 0.2*0.5 + 0.2*1.0
        assertEquals(0.69, metrics.overallScore(), 1e-9);
        assertEquals(0.9, metrics.componentScore("src/A.java"), 1e-9);
        assertEquals(0.0, metrics.componentScore("src/unknown.java"));
    }

    @Test
    @DisplayName("The overall score follows the configured weights")
    void weighted() {
        var qualityOnly = scorer.score(halfDone(), new EvaluationWeights(1, 0, 0, 0));

        assertEquals(qualityOnly.quality(), qualityOnly.overallScore(), 1e-9);
    }

    @Test
    @DisplayName("Scoring is deterministic")
    void deterministic() {
        var report = halfDone();

        assertEquals(scorer.score(report, EvaluationWeights.defaults()),
                scorer.score(report, EvaluationWeights.defaults()));
    }

    @Test
    @DisplayName("A report without blocks scores zero")
    void emptyReport() {
        var metrics = scorer.score(report(Map.of(), Map.of(), Map.of()), EvaluationWeights.defaults());

        assertEquals(0.0, metrics.overallScore());
        assertTrue(metrics.componentScores().isEmpty());
    }

    @Test
    @DisplayName("Block quality falls back to issue count and is clamped")
    void blockQuality() {
        assertEquals(DefaultBranchScorer.UNVALIDATED_QUALITY, DefaultBranchScorer.blockQuality(null));
        assertEquals(0.8, DefaultBranchScorer.blockQuality(
                ValidationResult.passedWithIssues(Map.of(), List.of("one", "two"))), 1e-9);
        assertEquals(1.0, DefaultBranchScorer.blockQuality(ValidationResult.passed(Map.of("quality", 1.5))));
    }

    @Test
    @DisplayName("Maintainability penalizes long lines and oversized artifacts")
    void maintainability() {
        String longLine = "x".repeat(DefaultBranchScorer.MAX_LINE_LENGTH + 1);
        assertEquals(0.75, DefaultBranchScorer.maintainability(longLine + "\nshort\n"), 1e-9);
        assertEquals(0.75, DefaultBranchScorer.maintainability("line\n".repeat(800)), 1e-9);
        assertEquals(0.0, DefaultBranchScorer.maintainability("  "));
    }
}
