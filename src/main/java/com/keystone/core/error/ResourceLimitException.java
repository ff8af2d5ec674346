package com.keystone.core.error;

/**
 * A resource limit was exceeded while a block was running.
 */
public class ResourceLimitException extends OrchestrationException {

    public ResourceLimitException(ErrorCategory category, String message) {
        super(requireResource(category), message);
    }

    private static ErrorCategory requireResource(ErrorCategory category) {
        if (category.family() != ErrorFamily.RESOURCE) {
            throw new IllegalArgumentException("Not a resource category: " + category);
        }
        return category;
    }
}
