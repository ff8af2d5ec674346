package com.keystone.core.branch;

import java.util.List;

/**
 * Artifact-level difference between two branches. Paths in {@code common} have identical content.
 */
public record BranchComparison(
    String branchA,
    String branchB,
    List<String> common,
    List<String> uniqueToA,
    List<String> uniqueToB,
    List<ArtifactConflict> conflicts
) {

    public BranchComparison {
        common = List.copyOf(common);
        uniqueToA = List.copyOf(uniqueToA);
        uniqueToB = List.copyOf(uniqueToB);
        conflicts = List.copyOf(conflicts);
    }

    public boolean identical() {
        return uniqueToA.isEmpty() && uniqueToB.isEmpty() && conflicts.isEmpty();
    }
}
