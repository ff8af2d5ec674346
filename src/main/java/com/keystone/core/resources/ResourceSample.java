package com.keystone.core.resources;

import java.time.Instant;

/**
 * Timestamped usage reading together with the limits it was taken against.
 */
public record ResourceSample(Instant timestamp, ResourceUsage usage, ResourceLimits limits) {

    public double percentage(ResourceKind kind) {
        return usage.valueOf(kind) / limits.limitOf(kind) * 100.0;
    }
}
