package com.keystone.core.resources;

/**
 * Raw usage figures. Memory and disk in bytes, CPU in percent of total capacity.
 */
public record ResourceUsage(long memoryBytes, double cpuPercent, long diskBytes) {

    public double valueOf(ResourceKind kind) {
        return switch (kind) {
            case MEMORY -> memoryBytes;
            case CPU -> cpuPercent;
            case DISK -> diskBytes;
        };
    }
}
