package com.keystone.core.config;

import com.keystone.core.branch.EvaluationWeights;
import com.keystone.core.branch.MergeStrategy;
import com.keystone.core.chunking.ChunkingSettings;
import com.keystone.core.error.ErrorCategory;
import com.keystone.core.recovery.BackoffStrategy;
import com.keystone.core.recovery.FallbackAction;
import com.keystone.core.recovery.FallbackType;
import com.keystone.core.recovery.RecoveryPolicies;
import com.keystone.core.recovery.RecoveryPolicy;
import com.keystone.core.scheduler.PriorityWeights;
import com.keystone.core.scheduler.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All {@code keystone.*} settings. Every value has a default so the core runs unconfigured.
 */
@Component
@ConfigurationProperties(prefix = "keystone")
public class KeystoneProperties {

    private Checkpoint checkpoint = new Checkpoint();
    private Resources resources = new Resources();
    private Chunking chunking = new Chunking();
    private Scheduler scheduler = new Scheduler();
    private Recovery recovery = new Recovery();
    private Branches branches = new Branches();

    public Checkpoint getCheckpoint() { return checkpoint; }
    public void setCheckpoint(Checkpoint checkpoint) { this.checkpoint = checkpoint; }
    public Resources getResources() { return resources; }
    public void setResources(Resources resources) { this.resources = resources; }
    public Chunking getChunking() { return chunking; }
    public void setChunking(Chunking chunking) { this.chunking = chunking; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }
    public Branches getBranches() { return branches; }
    public void setBranches(Branches branches) { this.branches = branches; }

    public static class Checkpoint {
        private int maxCheckpoints = 20;
        /** Unset means in-memory storage. */
        private String directory;

        public int getMaxCheckpoints() { return maxCheckpoints; }
        public void setMaxCheckpoints(int maxCheckpoints) { this.maxCheckpoints = maxCheckpoints; }
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class Resources {
        private long memoryLimitMb = 2048;
        private double cpuLimitPercent = 90.0;
        private long diskLimitMb = 512000;
        private double warningRatio = 0.9;
        private long sampleIntervalMs = 1000;

        public long getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(long memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public double getCpuLimitPercent() { return cpuLimitPercent; }
        public void setCpuLimitPercent(double cpuLimitPercent) { this.cpuLimitPercent = cpuLimitPercent; }
        public long getDiskLimitMb() { return diskLimitMb; }
        public void setDiskLimitMb(long diskLimitMb) { this.diskLimitMb = diskLimitMb; }
        public double getWarningRatio() { return warningRatio; }
        public void setWarningRatio(double warningRatio) { this.warningRatio = warningRatio; }
        public long getSampleIntervalMs() { return sampleIntervalMs; }
        public void setSampleIntervalMs(long sampleIntervalMs) { this.sampleIntervalMs = sampleIntervalMs; }
    }

    public static class Chunking {
        private int initialSize = 4096;
        private int minSize = 1024;
        private int maxSize = 16384;
        private int overlap = 128;
        private double adjustmentFactor = 0.5;
        private double targetUsagePercent = 80.0;
        private int readBufferSize = 8192;

        public int getInitialSize() { return initialSize; }
        public void setInitialSize(int initialSize) { this.initialSize = initialSize; }
        public int getMinSize() { return minSize; }
        public void setMinSize(int minSize) { this.minSize = minSize; }
        public int getMaxSize() { return maxSize; }
        public void setMaxSize(int maxSize) { this.maxSize = maxSize; }
        public int getOverlap() { return overlap; }
        public void setOverlap(int overlap) { this.overlap = overlap; }
        public double getAdjustmentFactor() { return adjustmentFactor; }
        public void setAdjustmentFactor(double adjustmentFactor) { this.adjustmentFactor = adjustmentFactor; }
        public double getTargetUsagePercent() { return targetUsagePercent; }
        public void setTargetUsagePercent(double targetUsagePercent) { this.targetUsagePercent = targetUsagePercent; }
        public int getReadBufferSize() { return readBufferSize; }
        public void setReadBufferSize(int readBufferSize) { this.readBufferSize = readBufferSize; }

        public ChunkingSettings toSettings() {
            return new ChunkingSettings(initialSize, minSize, maxSize, overlap, adjustmentFactor,
                    targetUsagePercent, readBufferSize);
        }
    }

    public static class Scheduler {
        private int maxParallelPaths = Runtime.getRuntime().availableProcessors();
        private double timeoutMultiplier = 2.0;
        private double criticalPathBonus = 10.0;
        private double dependentCountBonus = 2.0;
        private double riskWeight = 5.0;
        private double softDependentWeight = 0.5;
        private long resourcePollMs = 250;

        public int getMaxParallelPaths() { return maxParallelPaths; }
        public void setMaxParallelPaths(int maxParallelPaths) { this.maxParallelPaths = maxParallelPaths; }
        public double getTimeoutMultiplier() { return timeoutMultiplier; }
        public void setTimeoutMultiplier(double timeoutMultiplier) { this.timeoutMultiplier = timeoutMultiplier; }
        public double getCriticalPathBonus() { return criticalPathBonus; }
        public void setCriticalPathBonus(double criticalPathBonus) { this.criticalPathBonus = criticalPathBonus; }
        public double getDependentCountBonus() { return dependentCountBonus; }
        public void setDependentCountBonus(double dependentCountBonus) { this.dependentCountBonus = dependentCountBonus; }
        public double getRiskWeight() { return riskWeight; }
        public void setRiskWeight(double riskWeight) { this.riskWeight = riskWeight; }
        public double getSoftDependentWeight() { return softDependentWeight; }
        public void setSoftDependentWeight(double softDependentWeight) { this.softDependentWeight = softDependentWeight; }
        public long getResourcePollMs() { return resourcePollMs; }
        public void setResourcePollMs(long resourcePollMs) { this.resourcePollMs = resourcePollMs; }

        public PriorityWeights toWeights() {
            return new PriorityWeights(criticalPathBonus, dependentCountBonus, riskWeight, softDependentWeight);
        }

        public SchedulerSettings toSettings() {
            return new SchedulerSettings(maxParallelPaths, timeoutMultiplier, Duration.ofMillis(resourcePollMs));
        }
    }

    public static class Recovery {
        private PolicyProperties defaultPolicy = PolicyProperties.conservative();
        /** Per-category overrides, merged over the built-in defaults. */
        private Map<ErrorCategory, PolicyProperties> policies = new LinkedHashMap<>();

        public PolicyProperties getDefaultPolicy() { return defaultPolicy; }
        public void setDefaultPolicy(PolicyProperties defaultPolicy) { this.defaultPolicy = defaultPolicy; }
        public Map<ErrorCategory, PolicyProperties> getPolicies() { return policies; }
        public void setPolicies(Map<ErrorCategory, PolicyProperties> policies) { this.policies = policies; }

        public Map<ErrorCategory, RecoveryPolicy> resolvePolicies() {
            var resolved = new EnumMap<ErrorCategory, RecoveryPolicy>(RecoveryPolicies.defaults());
            policies.forEach((category, props) -> resolved.put(category, props.toPolicy()));
            return resolved;
        }
    }

    public static class PolicyProperties {
        private int maxRetries = 1;
        private Backoff backoff = new Backoff();
        private FallbackType fallback = FallbackType.ABORT;
        private String alternateId;

        static PolicyProperties conservative() {
            return new PolicyProperties();
        }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Backoff getBackoff() { return backoff; }
        public void setBackoff(Backoff backoff) { this.backoff = backoff; }
        public FallbackType getFallback() { return fallback; }
        public void setFallback(FallbackType fallback) { this.fallback = fallback; }
        public String getAlternateId() { return alternateId; }
        public void setAlternateId(String alternateId) { this.alternateId = alternateId; }

        public RecoveryPolicy toPolicy() {
            return new RecoveryPolicy(maxRetries, backoff.toStrategy(), new FallbackAction(fallback, alternateId));
        }
    }

    public static class Backoff {
        public enum Type { FIXED, EXPONENTIAL, LINEAR }

        private Type type = Type.FIXED;
        private long initialMs = 500;
        private double factor = 2.0;
        private long incrementMs = 500;
        private long maxMs = 30000;

        public Type getType() { return type; }
        public void setType(Type type) { this.type = type; }
        public long getInitialMs() { return initialMs; }
        public void setInitialMs(long initialMs) { this.initialMs = initialMs; }
        public double getFactor() { return factor; }
        public void setFactor(double factor) { this.factor = factor; }
        public long getIncrementMs() { return incrementMs; }
        public void setIncrementMs(long incrementMs) { this.incrementMs = incrementMs; }
        public long getMaxMs() { return maxMs; }
        public void setMaxMs(long maxMs) { this.maxMs = maxMs; }

        public BackoffStrategy toStrategy() {
            return switch (type) {
                case FIXED -> new BackoffStrategy.Fixed(Duration.ofMillis(initialMs));
                case EXPONENTIAL -> new BackoffStrategy.Exponential(Duration.ofMillis(initialMs), factor,
                        Duration.ofMillis(maxMs));
                case LINEAR -> new BackoffStrategy.Linear(Duration.ofMillis(initialMs), Duration.ofMillis(incrementMs),
                        Duration.ofMillis(maxMs));
            };
        }
    }

    public static class Branches {
        private Weights weights = new Weights();
        private MergeStrategy mergeStrategy = MergeStrategy.SINGLE_BRANCH;
        private int maxConcurrent = 2;

        public Weights getWeights() { return weights; }
        public void setWeights(Weights weights) { this.weights = weights; }
        public MergeStrategy getMergeStrategy() { return mergeStrategy; }
        public void setMergeStrategy(MergeStrategy mergeStrategy) { this.mergeStrategy = mergeStrategy; }
        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
    }

    public static class Weights {
        private double quality = 0.3;
        private double functionality = 0.3;
        private double performance = 0.2;
        private double maintainability = 0.2;

        public double getQuality() { return quality; }
        public void setQuality(double quality) { this.quality = quality; }
        public double getFunctionality() { return functionality; }
        public void setFunctionality(double functionality) { this.functionality = functionality; }
        public double getPerformance() { return performance; }
        public void setPerformance(double performance) { this.performance = performance; }
        public double getMaintainability() { return maintainability; }
        public void setMaintainability(double maintainability) { this.maintainability = maintainability; }

        public EvaluationWeights toWeights() {
            return new EvaluationWeights(quality, functionality, performance, maintainability);
        }
    }
}
