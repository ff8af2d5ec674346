package com.keystone.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Directed edge from a block to one of its prerequisites.
 *
 * @param blockId        the dependent block
 * @param prerequisiteId the block that {@code blockId} depends on
 * @param kind           gating or advisory kind of the edge
 */
public record BlockDependency(
    String blockId,
    String prerequisiteId,
    DependencyKind kind
) implements Serializable {

    public BlockDependency {
        Objects.requireNonNull(blockId, "blockId");
        Objects.requireNonNull(prerequisiteId, "prerequisiteId");
        Objects.requireNonNull(kind, "kind");
    }

    public static BlockDependency requiredBefore(String blockId, String prerequisiteId) {
        return new BlockDependency(blockId, prerequisiteId, DependencyKind.REQUIRED_BEFORE);
    }

    public boolean isGating() {
        return kind.isGating();
    }
}
