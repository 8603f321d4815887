package com.fleetdeploy.orchestrator.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetdeploy.orchestrator.api.dto.DeploymentResponse;
import com.fleetdeploy.orchestrator.api.dto.SubmitDeploymentRequest;
import com.fleetdeploy.orchestrator.model.Deployment;
import com.fleetdeploy.orchestrator.service.DeploymentService;
import com.fleetdeploy.orchestrator.service.DeploymentService.CancelResult;
import com.fleetdeploy.orchestrator.target.TargetSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for deployment runs.
 *
 * POST /deployments              : submit a deployment (runs asynchronously)
 * GET  /deployments              : most recent deployments, newest first
 * GET  /deployments/{id}         : current state of one deployment
 * GET  /deployments/{id}/report  : per-stage run report once finished
 * POST /deployments/{id}/cancel  : stop before the next stage
 */
@RestController
@RequestMapping("/deployments")
public class DeploymentController {

    private static final Logger log = LoggerFactory.getLogger(DeploymentController.class);

    private final DeploymentService deploymentService;
    private final ObjectMapper      objectMapper;

    public DeploymentController(DeploymentService deploymentService, ObjectMapper objectMapper) {
        this.deploymentService = deploymentService;
        this.objectMapper      = objectMapper;
    }

    /**
     * Submit a deployment.
     *
     * Example:
     *   curl -X POST http://localhost:8080/deployments \
     *     -H "Content-Type: application/json" \
     *     -d '{"labels":{"env":"prod","fleet":"web"},"imageRef":"registry.example.com/web:1.4.2"}'
     */
    @PostMapping
    public ResponseEntity<DeploymentResponse> submit(@RequestBody SubmitDeploymentRequest req) {
        if (req.imageRef() == null || req.imageRef().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "imageRef is required");
        }
        if (req.labels() == null || req.labels().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "at least one label is required");
        }
        if (req.labels().containsValue(null)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "label values must not be null");
        }
        TargetSelector selector = new TargetSelector(req.labels(), req.liveness());
        Deployment deployment = deploymentService.submit(selector, req.imageRef().strip());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(DeploymentResponse.from(deployment));
    }

    @GetMapping
    public List<DeploymentResponse> recent() {
        return deploymentService.recent().stream()
                .map(DeploymentResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    public DeploymentResponse get(@PathVariable UUID id) {
        return DeploymentResponse.from(require(id));
    }

    /**
     * HTTP 200 : deployment finished; body is the run report
     * HTTP 202 : deployment still pending or running
     * HTTP 404 : unknown id
     */
    @GetMapping("/{id}/report")
    public ResponseEntity<Map<String, Object>> report(@PathVariable UUID id) {
        Deployment deployment = require(id);

        if (!deployment.getState().isTerminal()) {
            return ResponseEntity.accepted()
                    .body(Map.of("status", "pending", "state", deployment.getState().name()));
        }

        if (deployment.getReportJson() != null) {
            try {
                return ResponseEntity.ok(objectMapper.readValue(
                        deployment.getReportJson(), new TypeReference<Map<String, Object>>() {}));
            } catch (Exception e) {
                log.warn("Stored report for deployment {} is not valid JSON: {}", id, e.getMessage());
            }
        }

        // Interrupted or aborted by an unexpected error: no run report exists.
        Map<String, Object> body = new HashMap<>();
        body.put("deploymentId", id.toString());
        body.put("state",        deployment.getState().name());
        body.put("verdict",      deployment.getVerdict());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable UUID id) {
        CancelResult result = deploymentService.cancel(id);
        return switch (result) {
            case CANCELLED        -> ResponseEntity.accepted()
                                             .body(Map.of("id", id.toString(), "status", "cancelling"));
            case NOT_FOUND        -> throw new ResponseStatusException(
                                             HttpStatus.NOT_FOUND, "Deployment not found: " + id);
            case ALREADY_FINISHED -> throw new ResponseStatusException(
                                             HttpStatus.CONFLICT, "Deployment already finished: " + id);
        };
    }

    private Deployment require(UUID id) {
        return deploymentService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Deployment not found: " + id));
    }
}
