package com.keystone.core.branch;

import com.keystone.core.collaborator.Collaborators;
import com.keystone.core.collaborator.PlanningCollaborator;
import com.keystone.core.model.ImplementationApproach;
import com.keystone.core.model.ImplementationPlan;

import java.util.function.Function;

/**
 * The shared workload every branch implements, parameterized by the branch's approach.
 */
public interface BranchWorkload {

    ImplementationPlan planFor(ImplementationApproach approach);

    Collaborators collaboratorsFor(ImplementationApproach approach);

    static BranchWorkload of(PlanningCollaborator planner, Function<ImplementationApproach, Collaborators> collaborators) {
        return new BranchWorkload() {
            @Override
            public ImplementationPlan planFor(ImplementationApproach approach) {
                return planner.plan(approach);
            }

            @Override
            public Collaborators collaboratorsFor(ImplementationApproach approach) {
                return collaborators.apply(approach);
            }
        };
    }
}
