package com.keystone.core.persistence;

import com.keystone.core.config.KeystoneProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spring {@link Configuration} that selects where checkpoint documents are stored.
 * <p>
 * When {@code keystone.checkpoint.directory} is set, each lineage gets a subdirectory of
 * it and checkpoints survive restarts. Otherwise an in-memory store is used, suitable
 * for tests and single-process runs; a lineage opened twice sees the same documents.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "keystone.checkpoint", name = "directory")
    public CheckpointStorageProvider fileSystemCheckpointStorage(KeystoneProperties properties) {
        Path root = Path.of(properties.getCheckpoint().getDirectory());
        log.info("Configuring file-system checkpoint storage under {}", root.toAbsolutePath());
        return lineage -> new FileSystemCheckpointStorage(root.resolve(lineage));
    }

    @Bean
    @ConditionalOnMissingBean(CheckpointStorageProvider.class)
    public CheckpointStorageProvider memoryCheckpointStorage() {
        log.info("No checkpoint directory configured; using in-memory checkpoint storage (state will not persist across restarts)");
        var storages = new ConcurrentHashMap<String, InMemoryCheckpointStorage>();
        return lineage -> storages.computeIfAbsent(lineage, InMemoryCheckpointStorage::new);
    }
}
