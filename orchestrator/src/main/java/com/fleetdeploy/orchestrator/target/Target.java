package com.fleetdeploy.orchestrator.target;

import java.util.Map;
import java.util.Objects;

/**
 * One addressable compute instance eligible to receive a deployment.
 *
 * @param id       inventory id of the instance (what the execution agent addresses)
 * @param liveness liveness observed by the inventory when it was queried
 * @param labels   selection labels, e.g. {@code fleet=web}
 */
public record Target(String id, Liveness liveness, Map<String, String> labels) {

    public Target {
        Objects.requireNonNull(id, "id");
        liveness = liveness == null ? Liveness.UNKNOWN : liveness;
        labels   = labels == null ? Map.of() : Map.copyOf(labels);
    }

    /** True if every selector label is present on this target with the same value. */
    public boolean hasLabels(Map<String, String> required) {
        return required.entrySet().stream()
                .allMatch(e -> e.getValue().equals(labels.get(e.getKey())));
    }
}
