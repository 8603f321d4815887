package com.fleetdeploy.orchestrator.target;

import java.util.Map;
import java.util.TreeMap;

/**
 * Fleet selection predicate: label equality plus a required liveness state.
 *
 * Labels are kept sorted so the selector prints (and persists) the same way
 * on every run.
 */
public record TargetSelector(Map<String, String> labels, Liveness requiredLiveness) {

    public TargetSelector {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("selector needs at least one label");
        }
        labels = Map.copyOf(labels);
        requiredLiveness = requiredLiveness == null ? Liveness.ALIVE : requiredLiveness;
    }

    public static TargetSelector alive(Map<String, String> labels) {
        return new TargetSelector(labels, Liveness.ALIVE);
    }

    public boolean matches(Target target) {
        return target.hasLabels(labels) && target.liveness() == requiredLiveness;
    }

    @Override
    public String toString() {
        return new TreeMap<>(labels) + "@" + requiredLiveness;
    }
}
