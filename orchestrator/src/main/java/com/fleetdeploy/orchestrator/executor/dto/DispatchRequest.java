package com.fleetdeploy.orchestrator.executor.dto;

/**
 * Request body for POST /v1/targets/{targetId}/commands on the execution agent.
 */
public record DispatchRequest(
        String run_id,
        String template,
        String script
) {}
