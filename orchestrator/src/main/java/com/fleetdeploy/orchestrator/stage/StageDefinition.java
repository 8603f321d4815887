package com.fleetdeploy.orchestrator.stage;

import java.time.Duration;
import java.util.Objects;

/**
 * One unit of the pipeline: which template to run, how long to wait for it,
 * and what counts as success. Holds no state between runs.
 */
public record StageDefinition(StageName name, String templateName, Duration timeout,
                              SuccessPredicate successPredicate) {

    public StageDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(templateName, "templateName");
        Objects.requireNonNull(timeout, "timeout");
        successPredicate = successPredicate == null
                ? SuccessPredicate.successWithMarker(null)
                : successPredicate;
    }

    public int index() {
        return name.index();
    }
}
