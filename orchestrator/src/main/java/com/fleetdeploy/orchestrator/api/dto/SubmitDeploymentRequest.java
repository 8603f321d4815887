package com.fleetdeploy.orchestrator.api.dto;

import com.fleetdeploy.orchestrator.target.Liveness;

import java.util.Map;

/**
 * Request body for POST /deployments.
 *
 * Required: labels (at least one), imageRef
 * Optional: liveness, defaults to ALIVE.
 */
public record SubmitDeploymentRequest(Map<String, String> labels, Liveness liveness, String imageRef) {

    public SubmitDeploymentRequest {
        if (liveness == null) liveness = Liveness.ALIVE;
    }
}
