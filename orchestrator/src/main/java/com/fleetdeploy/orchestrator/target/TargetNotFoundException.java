package com.fleetdeploy.orchestrator.target;

/**
 * No target satisfies the selector: either nothing carries the labels, or the
 * matching instances are not in the required liveness state.
 */
public class TargetNotFoundException extends RuntimeException {

    private final TargetSelector selector;

    public TargetNotFoundException(TargetSelector selector, String reason) {
        super("No target for " + selector + ": " + reason);
        this.selector = selector;
    }

    public TargetSelector getSelector() { return selector; }
}
