package com.fleetdeploy.orchestrator.stage;

import com.fleetdeploy.orchestrator.executor.CommandOutcome;

/**
 * Decides whether a terminal outcome counts as PASS for a stage.
 */
@FunctionalInterface
public interface SuccessPredicate {

    boolean passes(CommandOutcome outcome);

    /** SUCCESS, and the marker line is present in the output when one is given. */
    static SuccessPredicate successWithMarker(String expectedMarker) {
        if (expectedMarker == null || expectedMarker.isBlank()) {
            return CommandOutcome::isSuccess;
        }
        return outcome -> outcome.isSuccess() && outcome.output().contains(expectedMarker);
    }
}
