package com.keystone.core.branch;

/**
 * How the winning result is assembled from evaluated branches.
 */
public enum MergeStrategy {
    /** Adopt the best-scoring branch wholesale. */
    SINGLE_BRANCH,
    /** Take every component (artifact path) from the branch that scored best on it. */
    SELECTIVE
}
