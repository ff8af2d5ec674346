package com.keystone.core.resources;

/**
 * Configured limits and warning ratios per resource.
 *
 * @param memoryBytes  memory limit in bytes
 * @param cpuPercent   CPU limit in percent
 * @param diskBytes    disk limit in bytes
 * @param warningRatio fraction of a limit above which a resource reports {@link LimitStatus#WARNING}
 */
public record ResourceLimits(long memoryBytes, double cpuPercent, long diskBytes, double warningRatio) {

    private static final long MB = 1024L * 1024L;

    public ResourceLimits {
        if (memoryBytes <= 0 || cpuPercent <= 0 || diskBytes <= 0) {
            throw new IllegalArgumentException("Resource limits must be positive");
        }
        if (warningRatio <= 0.0 || warningRatio > 1.0) {
            throw new IllegalArgumentException("warningRatio must be within (0, 1] (current: " + warningRatio + ")");
        }
    }

    public static ResourceLimits ofMegabytes(long memoryMb, double cpuPercent, long diskMb, double warningRatio) {
        return new ResourceLimits(memoryMb * MB, cpuPercent, diskMb * MB, warningRatio);
    }

    public double limitOf(ResourceKind kind) {
        return switch (kind) {
            case MEMORY -> memoryBytes;
            case CPU -> cpuPercent;
            case DISK -> diskBytes;
        };
    }
}
