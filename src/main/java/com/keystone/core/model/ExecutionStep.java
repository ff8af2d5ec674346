package com.keystone.core.model;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * One generation step of a block, producing the content of a single artifact.
 *
 * @param id          step identifier, unique within its block
 * @param description what the step should produce
 * @param targetPath  path of the artifact the step writes
 * @param context     inline context handed to the generator (nullable)
 * @param contextFile file whose content is streamed to the generator (nullable)
 * @param simplified  true for the reduced-scope variant used by the Simplify fallback
 */
public record ExecutionStep(
    String id,
    String description,
    String targetPath,
    String context,
    Path contextFile,
    boolean simplified
) implements Serializable {

    public ExecutionStep(String id, String description, String targetPath) {
        this(id, description, targetPath, null, null, false);
    }

    public ExecutionStep asSimplified() {
        return new ExecutionStep(id, description, targetPath, context, contextFile, true);
    }

    public ExecutionStep withContext(String chunkContext) {
        return new ExecutionStep(id, description, targetPath, chunkContext, null, simplified);
    }

    public boolean hasContext() {
        return (context != null && !context.isEmpty()) || contextFile != null;
    }
}
