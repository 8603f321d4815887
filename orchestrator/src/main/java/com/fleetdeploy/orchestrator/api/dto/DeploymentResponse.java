package com.fleetdeploy.orchestrator.api.dto;

import com.fleetdeploy.orchestrator.model.Deployment;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /deployments and GET /deployments/{id}.
 */
public record DeploymentResponse(
        UUID    id,
        String  state,
        String  selector,
        String  imageRef,
        String  targetId,
        String  verdict,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {
    public static DeploymentResponse from(Deployment d) {
        return new DeploymentResponse(
                d.getId(),
                d.getState().name(),
                d.getSelector(),
                d.getImageRef(),
                d.getTargetId(),
                d.getVerdict(),
                d.getCreatedAt(),
                d.getStartedAt(),
                d.getFinishedAt()
        );
    }
}
