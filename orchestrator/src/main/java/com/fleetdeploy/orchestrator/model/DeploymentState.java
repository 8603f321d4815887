package com.fleetdeploy.orchestrator.model;

import com.fleetdeploy.orchestrator.pipeline.Verdict;

/**
 * Lifecycle of a submitted deployment row.
 *
 * Transitions:
 *   PENDING → RUNNING (picked up by a worker)
 *   RUNNING → COMPLETED | ABORTED | TARGET_NOT_FOUND (pipeline finished)
 *   PENDING | RUNNING → INTERRUPTED (process restarted mid-run)
 */
public enum DeploymentState {
    PENDING,
    RUNNING,
    COMPLETED,
    ABORTED,
    TARGET_NOT_FOUND,
    INTERRUPTED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public static DeploymentState of(Verdict verdict) {
        return switch (verdict.kind()) {
            case COMPLETED        -> COMPLETED;
            case ABORTED_AT_STAGE -> ABORTED;
            case TARGET_NOT_FOUND -> TARGET_NOT_FOUND;
        };
    }
}
