package com.keystone.core.model;

/**
 * Kind of edge between a dependent block and its prerequisite.
 * Only {@link #REQUIRED_BEFORE} and {@link #REQUIRED_FOR_COMPLETION} gate execution.
 */
public enum DependencyKind {
    REQUIRED_BEFORE,
    REQUIRED_FOR_COMPLETION,
    INFLUENCES,
    PROVIDES_INFORMATION,
    ALTERNATIVE;

    public boolean isGating() {
        return this == REQUIRED_BEFORE || this == REQUIRED_FOR_COMPLETION;
    }

    public boolean isSoft() {
        return this == INFLUENCES || this == PROVIDES_INFORMATION;
    }
}
