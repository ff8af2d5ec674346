package com.keystone.core.persistence;

import com.keystone.core.config.KeystoneProperties;
import com.keystone.core.metrics.KeystoneMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates one {@link CheckpointStore} per lineage (run or branch) over the configured storage.
 */
@Component
public class CheckpointStoreFactory {

    private final CheckpointStorageProvider storageProvider;
    private final CheckpointCodec codec;
    private final int maxCheckpoints;
    private final Clock clock;
    private final KeystoneMetrics metrics;

    @Autowired
    public CheckpointStoreFactory(CheckpointStorageProvider storageProvider, KeystoneProperties properties,
                                  Clock clock, @Autowired(required = false) KeystoneMetrics metrics) {
        this(storageProvider, properties.getCheckpoint().getMaxCheckpoints(), clock, metrics);
    }

    public CheckpointStoreFactory(CheckpointStorageProvider storageProvider, int maxCheckpoints, Clock clock,
                                  KeystoneMetrics metrics) {
        this.storageProvider = storageProvider;
        this.codec = new CheckpointCodec();
        this.maxCheckpoints = maxCheckpoints;
        this.clock = clock;
        this.metrics = metrics;
    }

    public CheckpointStore create(String lineage) {
        return new CheckpointStore(lineage, storageProvider.forLineage(lineage), codec, maxCheckpoints, clock, metrics);
    }
}
