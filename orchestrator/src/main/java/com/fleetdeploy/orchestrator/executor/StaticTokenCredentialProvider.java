package com.fleetdeploy.orchestrator.executor;

import com.fleetdeploy.orchestrator.config.DeployProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hands out the bearer token from {@code fleetdeploy.execution.token}
 * (normally injected through the FLEETDEPLOY_AGENT_TOKEN environment variable).
 */
@Component
public class StaticTokenCredentialProvider implements CredentialProvider {

    private static final Logger log = LoggerFactory.getLogger(StaticTokenCredentialProvider.class);

    private final ExecutionCredential credential;

    public StaticTokenCredentialProvider(DeployProperties properties) {
        this.credential = new ExecutionCredential(properties.getExecution().getToken());
        if (!credential.isPresent()) {
            log.warn("No execution agent token configured; dispatch calls will be unauthenticated");
        }
    }

    @Override
    public ExecutionCredential acquire() {
        return credential;
    }
}
