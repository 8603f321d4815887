package com.fleetdeploy.orchestrator.target;

import com.fleetdeploy.orchestrator.config.DeployProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Inventory backed by the {@code fleetdeploy.fleet.targets} list in application.yml.
 *
 * Useful for small fixed fleets and for local runs. Liveness is whatever the
 * operator wrote down, so prefer {@link HttpFleetInventory} for real fleets.
 */
@Component
@ConditionalOnProperty(name = "fleetdeploy.fleet.source", havingValue = "static", matchIfMissing = true)
public class StaticFleetInventory implements FleetInventory {

    private static final Logger log = LoggerFactory.getLogger(StaticFleetInventory.class);

    private final List<Target> targets;

    @Autowired
    public StaticFleetInventory(DeployProperties properties) {
        this(properties.getFleet().getTargets().stream()
                .map(t -> new Target(t.getId(), t.getLiveness(), t.getLabels()))
                .toList());
    }

    public StaticFleetInventory(List<Target> targets) {
        this.targets = List.copyOf(targets);
        log.info("Static fleet inventory with {} target(s)", this.targets.size());
    }

    @Override
    public List<Target> query(Map<String, String> labels) {
        return targets.stream()
                .filter(t -> t.hasLabels(labels))
                .toList();
    }
}
