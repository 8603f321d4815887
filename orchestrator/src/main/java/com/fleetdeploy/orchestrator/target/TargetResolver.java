package com.fleetdeploy.orchestrator.target;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Picks exactly one target out of the fleet for a selector.
 *
 * Tie-break: when several live instances match, the lexicographically
 * smallest id wins, so repeated runs against the same fleet state always
 * land on the same instance.
 *
 * The resolver never retries. Retry with backoff is the orchestrator's call.
 */
@Component
public class TargetResolver {

    private static final Logger log = LoggerFactory.getLogger(TargetResolver.class);

    private final FleetInventory inventory;

    public TargetResolver(FleetInventory inventory) {
        this.inventory = inventory;
    }

    /**
     * @throws TargetNotFoundException if no instance matches in the required liveness state
     * @throws FleetInventoryException if the inventory itself fails
     */
    public Target resolve(TargetSelector selector) {
        List<Target> labelled = inventory.query(selector.labels()).stream()
                .filter(t -> t.hasLabels(selector.labels()))
                .toList();
        if (labelled.isEmpty()) {
            throw new TargetNotFoundException(selector, "no instance carries the labels");
        }

        List<Target> candidates = labelled.stream()
                .filter(selector::matches)
                .sorted(Comparator.comparing(Target::id))
                .toList();
        if (candidates.isEmpty()) {
            throw new TargetNotFoundException(selector,
                    labelled.size() + " labelled instance(s), none " + selector.requiredLiveness());
        }

        Target chosen = candidates.get(0);
        if (candidates.size() > 1) {
            log.info("Selector {} matched {} targets, picked {} (smallest id)",
                    selector, candidates.size(), chosen.id());
        }
        return chosen;
    }
}
