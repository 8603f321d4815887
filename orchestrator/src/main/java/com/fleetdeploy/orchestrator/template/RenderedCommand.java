package com.fleetdeploy.orchestrator.template;

import java.nio.charset.StandardCharsets;

/**
 * Script produced by rendering one template for one target and run.
 *
 * Never shared between targets or runs; the stage runner renders a fresh one
 * for every dispatch.
 */
public record RenderedCommand(String templateName, String script) {

    /** UTF-8 bytes of the script. Returns a new array on every call. */
    public byte[] bytes() {
        return script.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "RenderedCommand[" + templateName + ", " + script.length() + " chars]";
    }
}
