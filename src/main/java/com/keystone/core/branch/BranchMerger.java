package com.keystone.core.branch;

import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.MergeException;
import com.keystone.core.model.Artifact;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Pure comparison and merge of branch results. Nothing here changes a branch.
 */
public class BranchMerger {

    private static final double SCORE_EPSILON = 1e-9;

    public BranchComparison compare(String branchA, Map<String, Artifact> a, String branchB, Map<String, Artifact> b) {
        var common = new ArrayList<String>();
        var uniqueToA = new ArrayList<String>();
        var uniqueToB = new ArrayList<String>();
        var conflicts = new ArrayList<ArtifactConflict>();

        for (String path : new TreeSet<>(a.keySet())) {
            var other = b.get(path);
            if (other == null) {
                uniqueToA.add(path);
            } else if (Objects.equals(a.get(path).content(), other.content())) {
                common.add(path);
            } else {
                conflicts.add(conflict(path, branchA, a.get(path).content(), branchB, other.content()));
            }
        }
        for (String path : new TreeSet<>(b.keySet())) {
            if (!a.containsKey(path)) {
                uniqueToB.add(path);
            }
        }
        return new BranchComparison(branchA, branchB, common, uniqueToA, uniqueToB, conflicts);
    }

    /**
     * @param candidates branches to merge; only those included in {@code evaluation} are eligible
     * @throws MergeException NO_BRANCHES_AVAILABLE when none is eligible, MERGE_CONFLICT when the
     *                        resolver leaves a selective conflict undecided
     */
    public MergeResult merge(List<ImplementationBranch> candidates, BranchEvaluation evaluation,
                             MergeStrategy strategy, ConflictResolver resolver) {
        var byId = new LinkedHashMap<String, ImplementationBranch>();
        for (var branch : candidates) {
            if (evaluation.includes(branch.id())) {
                byId.put(branch.id(), branch);
            }
        }
        List<String> ranked = evaluation.ranking().stream().filter(byId::containsKey).toList();
        if (ranked.isEmpty()) {
            throw MergeException.noBranchesAvailable();
        }
        String primary = ranked.get(0);

        if (strategy == MergeStrategy.SINGLE_BRANCH) {
            var artifacts = byId.get(primary).artifacts();
            var sources = new LinkedHashMap<String, String>();
            artifacts.keySet().forEach(path -> sources.put(path, primary));
            return new MergeResult(strategy, primary, artifacts, sources, List.of());
        }
        return selective(ranked, byId, evaluation, resolver);
    }

    private MergeResult selective(List<String> ranked, Map<String, ImplementationBranch> byId,
                                  BranchEvaluation evaluation, ConflictResolver resolver) {
        var paths = new TreeSet<String>();
        ranked.forEach(id -> paths.addAll(byId.get(id).artifacts().keySet()));

        var artifacts = new LinkedHashMap<String, Artifact>();
        var sources = new LinkedHashMap<String, String>();
        var resolved = new ArrayList<ArtifactConflict>();
        var unresolved = new ArrayList<ArtifactConflict>();

        for (String path : paths) {
            var contenders = ranked.stream().filter(id -> byId.get(id).artifacts().containsKey(path)).toList();
            double best = contenders.stream()
                    .mapToDouble(id -> evaluation.metrics().get(id).componentScore(path))
                    .max().orElse(0.0);
            var top = contenders.stream()
                    .filter(id -> evaluation.metrics().get(id).componentScore(path) >= best - SCORE_EPSILON)
                    .toList();

            String chosen = top.get(0);
            Artifact artifact = byId.get(chosen).artifacts().get(path);
            boolean undecided = false;
            for (String rival : top.subList(1, top.size())) {
                Artifact other = byId.get(rival).artifacts().get(path);
                if (Objects.equals(artifact.content(), other.content())) {
                    continue;
                }
                var conflict = conflict(path, chosen, artifact.content(), rival, other.content());
                Optional<Artifact> decision = resolver.resolve(conflict, artifact, other);
                if (decision.isEmpty()) {
                    unresolved.add(conflict);
                    undecided = true;
                    break;
                }
                resolved.add(conflict);
                if (decision.get() == other) {
                    chosen = rival;
                }
                artifact = decision.get();
            }
            if (!undecided) {
                artifacts.put(path, artifact);
                sources.put(path, chosen);
            }
        }

        if (!unresolved.isEmpty()) {
            throw new MergeException(ErrorCategory.MERGE_CONFLICT,
                    unresolved.size() + " unresolved merge conflict(s)",
                    unresolved.stream().map(ArtifactConflict::describe).toList());
        }
        return new MergeResult(MergeStrategy.SELECTIVE, ranked.get(0), artifacts, sources, resolved);
    }

    /**
     * Differing line region between two contents: everything between the common leading and
     * trailing lines.
     */
    static ArtifactConflict conflict(String path, String branchA, String contentA, String branchB, String contentB) {
        List<String> a = contentA == null ? List.of() : contentA.lines().toList();
        List<String> b = contentB == null ? List.of() : contentB.lines().toList();
        int shorter = Math.min(a.size(), b.size());

        int prefix = 0;
        while (prefix < shorter && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < shorter - prefix
                && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }
        return new ArtifactConflict(path, branchA, branchB, prefix + 1, a.size() - suffix, b.size() - suffix);
    }
}
