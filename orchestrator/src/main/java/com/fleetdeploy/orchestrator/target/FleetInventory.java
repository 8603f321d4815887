package com.fleetdeploy.orchestrator.target;

import java.util.List;
import java.util.Map;

/**
 * Fleet-query capability the resolver reads from.
 *
 * Implementations must be idempotent and side-effect-free. They may return
 * instances in any liveness state; the resolver applies the liveness filter
 * itself so it can tell "nothing matched" apart from "matched but not alive".
 */
public interface FleetInventory {

    /**
     * @param labels label-equality predicate; every pair must match
     * @throws FleetInventoryException if the inventory cannot be read
     */
    List<Target> query(Map<String, String> labels);
}
