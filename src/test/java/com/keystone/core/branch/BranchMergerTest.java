package com.keystone.core.branch;

import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.MergeException;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.ImplementationApproach;
import com.keystone.core.model.RunMetrics;
import com.keystone.core.model.RunReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BranchMergerTest {

    private final BranchMerger merger = new BranchMerger();

    private static Map<String, Artifact> artifacts(String branchId, Map<String, String> files) {
        var artifacts = new LinkedHashMap<String, Artifact>();
        files.forEach((path, content) -> artifacts.put(path, new Artifact(path, "BLK", branchId + "-step", content)));
        return artifacts;
    }

    private static ImplementationBranch branch(String id, Map<String, String> files) {
        var branch = new ImplementationBranch(id, ImplementationApproach.named(id, id), null, null, null, null);
        branch.recordReport(new RunReport(id, Map.of(), Map.of(), artifacts(id, files), List.of(), List.of(),
                List.of(), List.of(), new RunMetrics(0, 0, 0, 0, 0, 0, 0, 0)));
        return branch;
    }

    private static BranchMetrics scores(double overall, Map<String, Double> components) {
        return new BranchMetrics(0.5, 0.5, 0.5, 0.5, overall, components);
    }

    private static BranchEvaluation evaluation(Map<String, BranchMetrics> metrics) {
        var ranking = metrics.keySet().stream()
                .sorted(Comparator.<String>comparingDouble(id -> metrics.get(id).overallScore()).reversed())
                .toList();
        return new BranchEvaluation(metrics, ranking, EvaluationWeights.defaults());
    }

    @Nested
    @DisplayName("Comparison")
    class Comparison {

        @Test
        @DisplayName("Paths are classified as common, unique or conflicting")
        void classifiesPaths() {
            var result = merger.compare(
                    "a", artifacts("a", Map.of("x.java", "same\n", "y.java", "only a\n", "z.java", "l1\nl2\nl3\n")),
                    "b", artifacts("b", Map.of("x.java", "same\n", "w.java", "only b\n", "z.java", "l1\nXX\nl3\n")));

            assertEquals(List.of("x.java"), result.common());
            assertEquals(List.of("y.java"), result.uniqueToA());
            assertEquals(List.of("w.java"), result.uniqueToB());
            assertEquals(1, result.conflicts().size());
            var conflict = result.conflicts().get(0);
            assertEquals("z.java", conflict.path());
            assertEquals(2, conflict.startLine());
            assertEquals(2, conflict.endLineA());
            assertEquals(2, conflict.endLineB());
            assertFalse(result.identical());
        }

        @Test
        @DisplayName("Identical artifact sets compare as identical")
        void identical() {
            var files = Map.of("x.java", "class X {}\n");

            assertTrue(merger.compare("a", artifacts("a", files), "b", artifacts("b", files)).identical());
        }

        @Test
        @DisplayName("A pure insertion spans only the inserted lines of the longer side")
        void insertionRegion() {
            var conflict = BranchMerger.conflict("f.txt", "a", "l1\nl3\n", "b", "l1\nl2\nl3\n");

            assertEquals(2, conflict.startLine());
            assertEquals(1, conflict.endLineA());
            assertEquals(2, conflict.endLineB());
            assertEquals("f.txt: a lines 2-1 differ from b lines 2-2", conflict.describe());
        }
    }

    @Nested
    @DisplayName("Single-branch merge")
    class SingleBranch {

        @Test
        @DisplayName("The best-ranked branch is adopted wholesale")
        void adoptsBest() {
            var fast = branch("fast", Map.of("a.java", "fast a", "b.java", "fast b"));
            var careful = branch("careful", Map.of("a.java", "careful a"));
            var eval = evaluation(Map.of("fast", scores(0.4, Map.of()), "careful", scores(0.8, Map.of())));

            var result = merger.merge(List.of(fast, careful), eval, MergeStrategy.SINGLE_BRANCH,
                    ConflictResolver.UNRESOLVED);

            assertEquals("careful", result.primaryBranch());
            assertEquals(Set.of("a.java"), result.artifacts().keySet());
            assertEquals("careful a", result.artifacts().get("a.java").content());
            assertEquals(Set.of("careful"), result.contributingBranches());
        }

        @Test
        @DisplayName("Candidates missing from the evaluation are not eligible")
        void ignoresUnevaluated() {
            var fast = branch("fast", Map.of("a.java", "fast"));
            var unscored = branch("unscored", Map.of("a.java", "other"));
            var eval = evaluation(Map.of("fast", scores(0.1, Map.of())));

            var result = merger.merge(List.of(unscored, fast), eval, MergeStrategy.SINGLE_BRANCH,
                    ConflictResolver.UNRESOLVED);

            assertEquals("fast", result.primaryBranch());
        }

        @Test
        @DisplayName("No eligible branch fails with NO_BRANCHES_AVAILABLE")
        void noBranches() {
            var ex = assertThrows(MergeException.class, () -> merger.merge(List.of(), evaluation(Map.of()),
                    MergeStrategy.SINGLE_BRANCH, ConflictResolver.UNRESOLVED));

            assertEquals(ErrorCategory.NO_BRANCHES_AVAILABLE, ex.category());
            assertFalse(ex.isRecoverable());
        }
    }

    @Nested
    @DisplayName("Selective merge")
    class Selective {

        @Test
        @DisplayName("Each path comes from the branch that scored best on it")
        void bestPerComponent() {
            var a = branch("a", Map.of("x.java", "ax", "y.java", "ay"));
            var b = branch("b", Map.of("x.java", "bx", "z.java", "bz"));
            var eval = evaluation(Map.of(
                    "a", scores(0.9, Map.of("x.java", 0.9, "y.java", 0.4)),
                    "b", scores(0.5, Map.of("x.java", 0.5, "z.java", 0.8))));

            var result = merger.merge(List.of(a, b), eval, MergeStrategy.SELECTIVE, ConflictResolver.UNRESOLVED);

            assertEquals(MergeStrategy.SELECTIVE, result.strategy());
            assertEquals("a", result.primaryBranch());
            assertEquals("ax", result.artifacts().get("x.java").content());
            assertEquals("ay", result.artifacts().get("y.java").content());
            assertEquals("bz", result.artifacts().get("z.java").content());
            assertEquals(Map.of("x.java", "a", "y.java", "a", "z.java", "b"), result.sources());
            assertEquals(Set.of("a", "b"), result.contributingBranches());
            assertTrue(result.resolvedConflicts().isEmpty());
        }

        @Test
        @DisplayName("A tie on different content without a decision is a MERGE_CONFLICT")
        void unresolvedTie() {
            var a = branch("a", Map.of("x.java", "one\n"));
            var b = branch("b", Map.of("x.java", "two\n"));
            var eval = evaluation(Map.of(
                    "a", scores(0.9, Map.of("x.java", 0.7)),
                    "b", scores(0.5, Map.of("x.java", 0.7))));

            var ex = assertThrows(MergeException.class,
                    () -> merger.merge(List.of(a, b), eval, MergeStrategy.SELECTIVE, ConflictResolver.UNRESOLVED));

            assertEquals(ErrorCategory.MERGE_CONFLICT, ex.category());
            assertEquals(List.of("x.java: a lines 1-1 differ from b lines 1-1"), ex.details());
        }

        @Test
        @DisplayName("PREFER_FIRST keeps the higher-ranked branch's content and records the conflict")
        void preferFirst() {
            var a = branch("a", Map.of("x.java", "one\n"));
            var b = branch("b", Map.of("x.java", "two\n"));
            var eval = evaluation(Map.of(
                    "a", scores(0.9, Map.of("x.java", 0.7)),
                    "b", scores(0.5, Map.of("x.java", 0.7))));

            var result = merger.merge(List.of(a, b), eval, MergeStrategy.SELECTIVE, ConflictResolver.PREFER_FIRST);

            assertEquals("one\n", result.artifacts().get("x.java").content());
            assertEquals("a", result.sources().get("x.java"));
            assertEquals(1, result.resolvedConflicts().size());
            assertEquals(Set.of("a"), result.contributingBranches());
        }

        @Test
        @DisplayName("A resolver may pick the rival's content")
        void resolverPicksRival() {
            var a = branch("a", Map.of("x.java", "one\n"));
            var b = branch("b", Map.of("x.java", "two\n"));
            var eval = evaluation(Map.of(
                    "a", scores(0.9, Map.of("x.java", 0.7)),
                    "b", scores(0.5, Map.of("x.java", 0.7))));
            ConflictResolver preferSecond = (conflict, fromA, fromB) -> Optional.of(fromB);

            var result = merger.merge(List.of(a, b), eval, MergeStrategy.SELECTIVE, preferSecond);

            assertEquals("two\n", result.artifacts().get("x.java").content());
            assertEquals("b", result.sources().get("x.java"));
            assertEquals(Set.of("a", "b"), result.contributingBranches());
        }

        @Test
        @DisplayName("A tie on identical content is not a conflict")
        void identicalTie() {
            var a = branch("a", Map.of("x.java", "same\n"));
            var b = branch("b", Map.of("x.java", "same\n"));
            var eval = evaluation(Map.of(
                    "a", scores(0.9, Map.of("x.java", 0.7)),
                    "b", scores(0.5, Map.of("x.java", 0.7))));

            var result = merger.merge(List.of(a, b), eval, MergeStrategy.SELECTIVE, ConflictResolver.UNRESOLVED);

            assertEquals("same\n", result.artifacts().get("x.java").content());
            assertTrue(result.resolvedConflicts().isEmpty());
        }
    }
}
