package com.keystone.core.resources;

import com.keystone.core.error.ErrorCategory;

public enum ResourceKind {
    MEMORY(ErrorCategory.MEMORY_LIMIT_EXCEEDED),
    CPU(ErrorCategory.CPU_LIMIT_EXCEEDED),
    DISK(ErrorCategory.DISK_LIMIT_EXCEEDED);

    private final ErrorCategory exceededCategory;

    ResourceKind(ErrorCategory exceededCategory) {
        this.exceededCategory = exceededCategory;
    }

    public ErrorCategory exceededCategory() {
        return exceededCategory;
    }
}
