package com.keystone.core.error;

import java.util.List;

/**
 * Failure of the branch merge step. Branches are left intact for manual resolution.
 */
public class MergeException extends OrchestrationException {

    private final List<String> details;

    public MergeException(ErrorCategory category, String message, List<String> details) {
        super(requireMerge(category), message);
        this.details = List.copyOf(details);
    }

    public static MergeException branchNotFound(String branchId) {
        return new MergeException(ErrorCategory.BRANCH_NOT_FOUND, "Branch not found: " + branchId, List.of(branchId));
    }

    public static MergeException noBranchesAvailable() {
        return new MergeException(ErrorCategory.NO_BRANCHES_AVAILABLE,
                "No branch reached IMPLEMENTED; nothing to merge", List.of());
    }

    /** Conflict descriptions for {@link ErrorCategory#MERGE_CONFLICT}, branch ids otherwise. */
    public List<String> details() {
        return details;
    }

    private static ErrorCategory requireMerge(ErrorCategory category) {
        if (category.family() != ErrorFamily.MERGE) {
            throw new IllegalArgumentException("Not a merge category: " + category);
        }
        return category;
    }
}
