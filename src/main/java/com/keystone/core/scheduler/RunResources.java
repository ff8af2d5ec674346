package com.keystone.core.scheduler;

import com.keystone.core.chunking.AdaptiveChunker;
import com.keystone.core.persistence.CheckpointStore;
import com.keystone.core.recovery.RecoveryManager;
import com.keystone.core.resources.ResourceMonitor;

/**
 * Per-run components. None of them is shared between runs or branches.
 */
public record RunResources(
    ResourceMonitor monitor,
    AdaptiveChunker chunker,
    CheckpointStore checkpoints,
    RecoveryManager recovery
) {}
