package com.keystone.core.resources;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for host resources.
 * <p>
 * Uses its own resource monitor. Reports DOWN when any resource exceeds its limit,
 * DEGRADED on a warning, UP otherwise, with per-resource percentages as details.
 */
@Component("resourceHealthIndicator")
public class ResourceHealthIndicator implements HealthIndicator {

    private final ResourceMonitor monitor;

    @Autowired
    public ResourceHealthIndicator(ResourceMonitorFactory monitorFactory) {
        this.monitor = monitorFactory.create();
    }

    ResourceHealthIndicator(ResourceMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        var statuses = monitor.checkLimits();
        var builder = Health.up();
        for (var entry : statuses.entrySet()) {
            builder.withDetail(entry.getKey().name().toLowerCase() + ".percent",
                    String.format("%.1f", monitor.percentage(entry.getKey())));
            builder.withDetail(entry.getKey().name().toLowerCase() + ".status", entry.getValue().name());
        }
        builder.withDetail("memory.highWatermarkBytes", monitor.memoryHighWatermark());

        if (statuses.containsValue(LimitStatus.EXCEEDED)) {
            return builder.down().build();
        }
        if (statuses.containsValue(LimitStatus.WARNING)) {
            return builder.status("DEGRADED").build();
        }
        return builder.build();
    }
}
