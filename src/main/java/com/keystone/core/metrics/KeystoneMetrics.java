package com.keystone.core.metrics;

import com.keystone.core.error.ErrorCategory;
import com.keystone.core.model.BlockStatus;
import com.keystone.core.recovery.FallbackType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for orchestration runs.
 */
@Service
public class KeystoneMetrics {

    private final MeterRegistry registry;

    public KeystoneMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBlockExecution(BlockStatus status, long ms) {
        Timer.builder("keystone.block.duration")
                .tag("status", status.name().toLowerCase())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(ErrorCategory category) {
        Counter.builder("keystone.recovery.retries")
                .tag("category", category.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordFallback(FallbackType fallback) {
        Counter.builder("keystone.recovery.fallbacks")
                .tag("action", fallback.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "created", "evicted" or "skipped"
     */
    public void recordCheckpoint(String outcome) {
        Counter.builder("keystone.checkpoints")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordChunkSize(int size) {
        DistributionSummary.builder("keystone.chunking.size")
                .description("Chunk size chosen for each adjustment")
                .baseUnit("chars")
                .register(registry)
                .record(size);
    }

    public void recordLayerExecution(int blockCount) {
        DistributionSummary.builder("keystone.scheduler.layer_size")
                .description("Number of blocks per execution layer")
                .register(registry)
                .record(blockCount);
    }

    /**
     * Records a block cancelled to bring resource usage back under its limits.
     */
    public void recordResourceCancellation(String resource) {
        Counter.builder("keystone.scheduler.resource_cancellations")
                .tag("resource", resource)
                .register(registry)
                .increment();
    }

    public void recordBranchScore(double overallScore) {
        DistributionSummary.builder("keystone.branch.score")
                .register(registry)
                .record(overallScore);
    }

    public void recordMerge(String strategy, boolean succeeded) {
        Counter.builder("keystone.branch.merges")
                .tag("strategy", strategy)
                .tag("result", succeeded ? "merged" : "rejected")
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status, long ms) {
        Counter.builder("keystone.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("keystone.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
