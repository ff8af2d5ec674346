package com.keystone.core.resources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads heap usage from the JVM runtime, CPU from the system load average relative to the
 * processor count, and disk from the file store holding the working directory.
 */
public class JvmResourceSampler implements ResourceSampler {

    private static final Logger log = LoggerFactory.getLogger(JvmResourceSampler.class);

    private final Path workingDirectory;
    private final Runtime runtime;
    private final OperatingSystemMXBean os;

    public JvmResourceSampler(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
        this.runtime = Runtime.getRuntime();
        this.os = ManagementFactory.getOperatingSystemMXBean();
    }

    @Override
    public ResourceUsage sample() {
        long usedMemory = runtime.totalMemory() - runtime.freeMemory();
        return new ResourceUsage(usedMemory, cpuPercent(), diskUsed());
    }

    private double cpuPercent() {
        double load = os.getSystemLoadAverage();
        if (load < 0) {
            return 0.0; // not available on this platform
        }
        return Math.min(100.0, load / os.getAvailableProcessors() * 100.0);
    }

    private long diskUsed() {
        try {
            var store = Files.getFileStore(workingDirectory);
            return store.getTotalSpace() - store.getUsableSpace();
        } catch (IOException e) {
            log.debug("Unable to read file store for {}: {}", workingDirectory, e.getMessage());
            return 0L;
        }
    }
}
