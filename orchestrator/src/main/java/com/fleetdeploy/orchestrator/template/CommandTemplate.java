package com.fleetdeploy.orchestrator.template;

import java.util.Objects;

/**
 * A named script body containing {@code {{placeholder}}} markers.
 *
 * Versionless: the body loaded at startup is the one every run renders.
 */
public record CommandTemplate(String name, String body) {

    public CommandTemplate {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
    }
}
