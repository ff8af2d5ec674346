package com.keystone.core.resources;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JvmResourceSamplerTest {

    @Test
    @DisplayName("Samples heap, CPU and disk of the running JVM")
    void samplesRunningJvm(@TempDir Path dir) {
        var usage = new JvmResourceSampler(dir).sample();

        assertTrue(usage.memoryBytes() > 0);
        assertTrue(usage.cpuPercent() >= 0.0 && usage.cpuPercent() <= 100.0);
        assertTrue(usage.diskBytes() >= 0);
    }

    @Test
    @DisplayName("An unreadable directory reports zero disk usage")
    void missingDirectory(@TempDir Path dir) {
        var usage = new JvmResourceSampler(dir.resolve("absent")).sample();

        assertEquals(0L, usage.diskBytes());
    }
}
