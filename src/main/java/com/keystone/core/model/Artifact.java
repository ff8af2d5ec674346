package com.keystone.core.model;

import java.io.Serializable;

/**
 * Content produced for one artifact path by a block's execution step.
 */
public record Artifact(
    String path,
    String blockId,
    String stepId,
    String content
) implements Serializable {

    public int lineCount() {
        if (content == null || content.isEmpty()) return 0;
        return (int) content.lines().count();
    }
}
