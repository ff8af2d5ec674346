package com.keystone.core.collaborator;

import com.keystone.core.model.ImplementationApproach;
import com.keystone.core.model.ImplementationPlan;

/**
 * Supplies the blocks and dependencies for an approach. Block ids must be unique and
 * dependency references must resolve within the same plan.
 */
@FunctionalInterface
public interface PlanningCollaborator {

    ImplementationPlan plan(ImplementationApproach approach);
}
