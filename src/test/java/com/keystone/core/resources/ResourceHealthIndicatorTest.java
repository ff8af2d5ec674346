package com.keystone.core.resources;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ResourceHealthIndicatorTest {

    private static final long MB = 1024L * 1024L;

    private ResourceHealthIndicator indicator(ResourceUsage usage) {
        var limits = ResourceLimits.ofMegabytes(1000, 80.0, 10_000, 0.9);
        return new ResourceHealthIndicator(new ResourceMonitor(() -> usage, limits, Duration.ZERO, new TickingClock()));
    }

    @Test
    @DisplayName("UP when every resource is below its warning level")
    void up() {
        var health = indicator(new ResourceUsage(100 * MB, 10.0, 100 * MB)).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("NORMAL", health.getDetails().get("memory.status"));
        assertEquals(100 * MB, health.getDetails().get("memory.highWatermarkBytes"));
    }

    @Test
    @DisplayName("DEGRADED when a resource is in the warning band")
    void degraded() {
        var health = indicator(new ResourceUsage(950 * MB, 10.0, 100 * MB)).health();

        assertEquals("DEGRADED", health.getStatus().getCode());
        assertEquals("WARNING", health.getDetails().get("memory.status"));
    }

    @Test
    @DisplayName("DOWN when a limit is exceeded")
    void down() {
        var health = indicator(new ResourceUsage(100 * MB, 95.0, 100 * MB)).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("EXCEEDED", health.getDetails().get("cpu.status"));
    }
}
