package com.keystone.core.recovery;

public enum FallbackType {
    SKIP,
    SIMPLIFY,
    REVERT,
    USE_ALTERNATE,
    SUBDIVIDE,
    ABORT
}
