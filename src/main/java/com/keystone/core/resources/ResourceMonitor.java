package com.keystone.core.resources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Samples memory, CPU and disk usage against configured limits.
 * <p>
 * One monitor is created per orchestration run and shared by the scheduler and the
 * chunker; all access goes through the synchronized accessors below. Sampling is
 * rate-limited to {@code sampleInterval}.
 */
public class ResourceMonitor {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    private final ResourceSampler sampler;
    private final ResourceLimits limits;
    private final Duration sampleInterval;
    private final Clock clock;

    private ResourceSample current;
    private final EnumMap<ResourceKind, Double> highWatermarks = new EnumMap<>(ResourceKind.class);

    public ResourceMonitor(ResourceSampler sampler, ResourceLimits limits, Duration sampleInterval, Clock clock) {
        this.sampler = sampler;
        this.limits = limits;
        this.sampleInterval = sampleInterval;
        this.clock = clock;
    }

    /**
     * Takes a new sample unless the previous one is younger than the sample interval.
     *
     * @return true when a new sample was taken
     */
    public synchronized boolean update() {
        Instant now = clock.instant();
        if (current != null) {
            if (now.isBefore(current.timestamp().plus(sampleInterval))) {
                return false;
            }
            if (!now.isAfter(current.timestamp())) {
                return false;
            }
        }
        var usage = sampler.sample();
        current = new ResourceSample(now, usage, limits);
        for (var kind : ResourceKind.values()) {
            highWatermarks.merge(kind, usage.valueOf(kind), Math::max);
        }
        log.trace("Resource sample: memory={}%, cpu={}%, disk={}%",
                percentage(ResourceKind.MEMORY), percentage(ResourceKind.CPU), percentage(ResourceKind.DISK));
        return true;
    }

    /**
     * Updates the sample, then classifies each resource against its limit.
     */
    public synchronized Map<ResourceKind, LimitStatus> checkLimits() {
        update();
        var statuses = new EnumMap<ResourceKind, LimitStatus>(ResourceKind.class);
        for (var kind : ResourceKind.values()) {
            double used = current.usage().valueOf(kind);
            double limit = limits.limitOf(kind);
            LimitStatus status;
            if (used > limit) {
                status = LimitStatus.EXCEEDED;
            } else if (used > limit * limits.warningRatio()) {
                status = LimitStatus.WARNING;
            } else {
                status = LimitStatus.NORMAL;
            }
            statuses.put(kind, status);
        }
        return statuses;
    }

    public synchronized double percentage(ResourceKind kind) {
        if (current == null) {
            update();
        }
        return current.percentage(kind);
    }

    public double memoryPercentage() {
        return percentage(ResourceKind.MEMORY);
    }

    public double cpuPercentage() {
        return percentage(ResourceKind.CPU);
    }

    public double diskPercentage() {
        return percentage(ResourceKind.DISK);
    }

    public synchronized double highWatermark(ResourceKind kind) {
        return highWatermarks.getOrDefault(kind, 0.0);
    }

    public long memoryHighWatermark() {
        return (long) highWatermark(ResourceKind.MEMORY);
    }

    /** Latest sample, or null before the first update. */
    public synchronized ResourceSample current() {
        return current;
    }

    public ResourceLimits limits() {
        return limits;
    }
}
