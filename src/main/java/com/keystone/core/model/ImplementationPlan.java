package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Block list and dependency list supplied by the planning collaborator.
 */
public record ImplementationPlan(
    String summary,
    List<ImplementationBlock> blocks,
    List<BlockDependency> dependencies
) implements Serializable {

    public ImplementationPlan {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
