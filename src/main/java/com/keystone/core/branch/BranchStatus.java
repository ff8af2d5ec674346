package com.keystone.core.branch;

public enum BranchStatus {
    CREATED,
    IMPLEMENTING,
    IMPLEMENTED,
    FAILED,
    EVALUATED,
    SELECTED,
    REJECTED
}
