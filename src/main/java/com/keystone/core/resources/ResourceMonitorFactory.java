package com.keystone.core.resources;

import com.keystone.core.config.KeystoneProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Creates a fresh {@link ResourceMonitor} per orchestration run from configuration.
 */
@Component
public class ResourceMonitorFactory {

    private final ResourceSampler sampler;
    private final KeystoneProperties properties;
    private final Clock clock;

    public ResourceMonitorFactory(ResourceSampler sampler, KeystoneProperties properties, Clock clock) {
        this.sampler = sampler;
        this.properties = properties;
        this.clock = clock;
    }

    public ResourceMonitor create() {
        var resources = properties.getResources();
        var limits = ResourceLimits.ofMegabytes(resources.getMemoryLimitMb(), resources.getCpuLimitPercent(),
                resources.getDiskLimitMb(), resources.getWarningRatio());
        return new ResourceMonitor(sampler, limits, Duration.ofMillis(resources.getSampleIntervalMs()), clock);
    }
}
