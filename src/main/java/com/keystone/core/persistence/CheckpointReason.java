package com.keystone.core.persistence;

/**
 * Why a checkpoint was taken.
 */
public enum CheckpointReason {
    RUN_START,
    BEFORE_BLOCK,
    AFTER_BLOCK,
    ADJUSTMENT,
    BRANCH_START,
    RUN_END
}
