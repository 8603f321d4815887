package com.fleetdeploy.orchestrator.stage;

import com.fleetdeploy.orchestrator.config.DeployProperties;
import com.fleetdeploy.orchestrator.target.Target;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Builds the template binding set for one run on one target.
 *
 * Called fresh for every run so image and path values never leak from a
 * previous deployment.
 */
@Component
public class RunBindings {

    private final DeployProperties.Deploy deploy;

    public RunBindings(DeployProperties properties) {
        this.deploy = properties.getDeploy();
    }

    public Map<String, String> forRun(UUID runId, Target target, String imageRef) {
        return Map.of(
                "run_id",             runId.toString(),
                "target_id",          target.id(),
                "image_ref",          imageRef,
                "deploy_path",        deploy.getDeployPath(),
                "container_name",     deploy.getContainerName(),
                "host_port",          String.valueOf(deploy.getHostPort()),
                "container_port",     String.valueOf(deploy.getContainerPort()),
                "health_url",         "http://localhost:" + deploy.getHostPort() + deploy.getHealthPath(),
                "probe_count",        String.valueOf(deploy.getProbeCount()),
                "probe_interval_sec", String.valueOf(deploy.getProbeIntervalSec()));
    }
}
