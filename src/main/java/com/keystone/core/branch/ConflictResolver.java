package com.keystone.core.branch;

import com.keystone.core.model.Artifact;

import java.util.Optional;

/**
 * Decides a selective-merge conflict. An empty result leaves the conflict unresolved,
 * which fails the merge.
 */
@FunctionalInterface
public interface ConflictResolver {

    ConflictResolver UNRESOLVED = (conflict, a, b) -> Optional.empty();

    /** Keeps the content of the conflict's first branch. */
    ConflictResolver PREFER_FIRST = (conflict, a, b) -> Optional.of(a);

    Optional<Artifact> resolve(ArtifactConflict conflict, Artifact fromA, Artifact fromB);
}
