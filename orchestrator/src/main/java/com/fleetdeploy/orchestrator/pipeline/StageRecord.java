package com.fleetdeploy.orchestrator.pipeline;

import com.fleetdeploy.orchestrator.executor.CommandOutcome;
import com.fleetdeploy.orchestrator.stage.StageName;

import java.time.Duration;

/**
 * One (stage, outcome) entry of a pipeline run.
 */
public record StageRecord(StageName stage, CommandOutcome outcome, boolean passed, Duration elapsed) {

    public int index() {
        return stage.index();
    }
}
