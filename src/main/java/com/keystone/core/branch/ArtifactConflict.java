package com.keystone.core.branch;

/**
 * Two branches produced different content for the same artifact path.
 * Lines are 1-based; the region spans the first through the last differing line.
 *
 * @param endLineA last differing line in {@code branchA}'s content (may be before {@code startLine} for a pure insertion in B)
 * @param endLineB last differing line in {@code branchB}'s content
 */
public record ArtifactConflict(
    String path,
    String branchA,
    String branchB,
    int startLine,
    int endLineA,
    int endLineB
) {

    public String describe() {
        return String.format("%s: %s lines %d-%d differ from %s lines %d-%d",
                path, branchA, startLine, endLineA, branchB, startLine, endLineB);
    }
}
