package com.fleetdeploy.orchestrator.stage;

/**
 * The four deployment stages, in the only order they ever run.
 */
public enum StageName {
    DEPENDENCY_CHECK,   // container runtime present and answering
    ARTIFACT_PULL,      // image pulled from the registry onto the target
    DEPLOY_SWAP,        // old container removed, new one started on the service port
    HEALTH_CHECK;       // bounded probes against the running service

    /** 1-based position in the pipeline. */
    public int index() {
        return ordinal() + 1;
    }
}
