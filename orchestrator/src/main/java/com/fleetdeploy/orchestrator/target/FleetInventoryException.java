package com.fleetdeploy.orchestrator.target;

/**
 * Thrown when the fleet inventory cannot be read (network error, bad response).
 */
public class FleetInventoryException extends RuntimeException {

    public FleetInventoryException(String message) {
        super(message);
    }

    public FleetInventoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
