package com.keystone.core.branch;

import com.keystone.core.model.Artifact;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * @param primaryBranch     best-ranked branch among the candidates
 * @param artifacts         merged artifacts by path
 * @param sources           branch each merged artifact was taken from
 * @param resolvedConflicts conflicts the resolver decided
 */
public record MergeResult(
    MergeStrategy strategy,
    String primaryBranch,
    Map<String, Artifact> artifacts,
    Map<String, String> sources,
    List<ArtifactConflict> resolvedConflicts
) {

    public MergeResult {
        artifacts = Map.copyOf(artifacts);
        sources = Map.copyOf(sources);
        resolvedConflicts = List.copyOf(resolvedConflicts);
    }

    /** Branches that contributed at least one artifact, plus the primary branch. */
    public Set<String> contributingBranches() {
        var contributors = new TreeSet<>(sources.values());
        contributors.add(primaryBranch);
        return contributors;
    }
}
