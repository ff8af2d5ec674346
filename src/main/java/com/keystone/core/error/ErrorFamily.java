package com.keystone.core.error;

/**
 * Top-level grouping of orchestration failures; decides how a failure propagates.
 */
public enum ErrorFamily {
    STRUCTURAL,
    RESOURCE,
    EXECUTION,
    PERSISTENCE,
    MERGE
}
