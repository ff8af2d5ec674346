package com.keystone.core.branch;

import com.keystone.core.collaborator.Collaborators;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.ImplementationApproach;
import com.keystone.core.model.ImplementationPlan;
import com.keystone.core.model.RunReport;
import com.keystone.core.persistence.CheckpointStore;
import com.keystone.core.scheduler.DependencyGraph;

import java.util.Map;

/**
 * One isolated candidate execution: its own plan, graph and checkpoint lineage.
 * Status, report and metrics are written by the {@link BranchCoordinator} only.
 */
public class ImplementationBranch {

    private final String id;
    private final ImplementationApproach approach;
    private final ImplementationPlan plan;
    private final DependencyGraph graph;
    private final Collaborators collaborators;
    private final CheckpointStore checkpoints;

    private BranchStatus status = BranchStatus.CREATED;
    private String statusReason;
    private RunReport report;
    private BranchMetrics metrics;

    ImplementationBranch(String id, ImplementationApproach approach, ImplementationPlan plan, DependencyGraph graph,
                         Collaborators collaborators, CheckpointStore checkpoints) {
        this.id = id;
        this.approach = approach;
        this.plan = plan;
        this.graph = graph;
        this.collaborators = collaborators;
        this.checkpoints = checkpoints;
    }

    public String id() {
        return id;
    }

    public ImplementationApproach approach() {
        return approach;
    }

    public ImplementationPlan plan() {
        return plan;
    }

    /** Null when the plan did not form a valid graph. */
    public DependencyGraph graph() {
        return graph;
    }

    public Collaborators collaborators() {
        return collaborators;
    }

    public CheckpointStore checkpoints() {
        return checkpoints;
    }

    public synchronized BranchStatus status() {
        return status;
    }

    public synchronized String statusReason() {
        return statusReason;
    }

    public synchronized RunReport report() {
        return report;
    }

    /** Null until the branch has been evaluated. */
    public synchronized BranchMetrics metrics() {
        return metrics;
    }

    /** Artifacts of the branch's run, keyed by path; empty before the run. */
    public synchronized Map<String, Artifact> artifacts() {
        return report != null ? report.artifacts() : Map.of();
    }

    synchronized void updateStatus(BranchStatus newStatus, String reason) {
        this.status = newStatus;
        this.statusReason = reason;
    }

    synchronized void recordReport(RunReport runReport) {
        this.report = runReport;
    }

    synchronized void recordMetrics(BranchMetrics branchMetrics) {
        this.metrics = branchMetrics;
    }

    @Override
    public String toString() {
        return "ImplementationBranch[" + id + ", " + status() + "]";
    }
}
