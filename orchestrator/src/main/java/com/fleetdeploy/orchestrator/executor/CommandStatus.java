package com.fleetdeploy.orchestrator.executor;

/**
 * Terminal status of a dispatched command.
 */
public enum CommandStatus {
    SUCCESS,
    FAILURE,
    TIMED_OUT,
    TARGET_UNREACHABLE
}
