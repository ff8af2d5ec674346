package com.keystone.core.persistence;

/**
 * Hands out isolated storage per checkpoint lineage (one per run or branch).
 */
@FunctionalInterface
public interface CheckpointStorageProvider {

    CheckpointStorage forLineage(String lineage);
}
