package com.fleetdeploy.orchestrator.stage;

import com.fleetdeploy.orchestrator.executor.CommandOutcome;

/**
 * What the stage runner hands back: the raw outcome and the PASS/FAIL call.
 */
public record StageResult(CommandOutcome outcome, boolean passed) {}
