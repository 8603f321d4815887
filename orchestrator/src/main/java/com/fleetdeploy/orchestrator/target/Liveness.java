package com.fleetdeploy.orchestrator.target;

/**
 * Liveness of a fleet instance as reported by the inventory at query time.
 *
 * Never cached across runs: every resolution asks the inventory again.
 */
public enum Liveness {
    ALIVE,
    UNREACHABLE,
    UNKNOWN
}
