package com.fleetdeploy.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from GET /v1/commands/{commandId}.
 *
 * status is one of PENDING, IN_PROGRESS, SUCCESS, FAILED, CANCELLED,
 * TIMED_OUT, UNDELIVERABLE.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandStatusResponse(
        String  status,
        Integer exit_code,
        String  output
) {
    public boolean inFlight() {
        return "PENDING".equals(status) || "IN_PROGRESS".equals(status);
    }
}
