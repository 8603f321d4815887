package com.fleetdeploy.orchestrator.executor;

/**
 * Source of execution credentials. Refreshing an expired credential is the
 * provider's business; the orchestrator calls {@link #acquire()} once per run.
 */
@FunctionalInterface
public interface CredentialProvider {

    ExecutionCredential acquire();
}
