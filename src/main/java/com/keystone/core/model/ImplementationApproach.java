package com.keystone.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Descriptor of one candidate strategy explored as an isolated branch.
 */
public record ImplementationApproach(
    String id,
    String description,
    Map<String, String> parameters
) implements Serializable {

    public ImplementationApproach {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static ImplementationApproach named(String id, String description) {
        return new ImplementationApproach(id, description, Map.of());
    }
}
