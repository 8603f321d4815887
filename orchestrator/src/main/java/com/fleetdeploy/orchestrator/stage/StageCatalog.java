package com.fleetdeploy.orchestrator.stage;

import com.fleetdeploy.orchestrator.config.DeployProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The fixed, ordered stage list built from {@code fleetdeploy.stages.*}.
 */
@Component
public class StageCatalog {

    private final List<StageDefinition> stages;

    @Autowired
    public StageCatalog(DeployProperties properties) {
        DeployProperties.Stages cfg = properties.getStages();
        this.stages = List.of(
                define(StageName.DEPENDENCY_CHECK, cfg.getDependencyCheck()),
                define(StageName.ARTIFACT_PULL,    cfg.getArtifactPull()),
                define(StageName.DEPLOY_SWAP,      cfg.getDeploySwap()),
                define(StageName.HEALTH_CHECK,     cfg.getHealthCheck()));
    }

    public StageCatalog(List<StageDefinition> stages) {
        this.stages = List.copyOf(stages);
    }

    /** Stages in execution order. */
    public List<StageDefinition> stages() {
        return stages;
    }

    private static StageDefinition define(StageName name, DeployProperties.Stage cfg) {
        return new StageDefinition(name, cfg.getTemplate(), cfg.getTimeout(),
                SuccessPredicate.successWithMarker(cfg.getExpectedMarker()));
    }
}
