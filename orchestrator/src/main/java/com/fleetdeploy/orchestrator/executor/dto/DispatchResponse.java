package com.fleetdeploy.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /v1/targets/{targetId}/commands.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DispatchResponse(String command_id) {}
