package com.fleetdeploy.orchestrator.executor;

/**
 * Short-lived credential used to authenticate dispatch and poll calls.
 *
 * Acquired once per run and read-only for the rest of it. toString never
 * prints the token.
 */
public record ExecutionCredential(String token) {

    public static final ExecutionCredential NONE = new ExecutionCredential("");

    public boolean isPresent() {
        return token != null && !token.isBlank();
    }

    @Override
    public String toString() {
        return isPresent() ? "ExecutionCredential[***]" : "ExecutionCredential[none]";
    }
}
