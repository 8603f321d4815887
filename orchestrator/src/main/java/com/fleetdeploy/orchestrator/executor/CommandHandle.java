package com.fleetdeploy.orchestrator.executor;

import java.time.Instant;

/**
 * Correlates a poll to the dispatch that created it. One handle per dispatch;
 * a client-side poll timeout does not invalidate it.
 *
 * The handle keeps the credential it was dispatched with, so polling uses the
 * same identity as the dispatch.
 */
public record CommandHandle(String commandId, String targetId, Instant dispatchedAt,
                            ExecutionCredential credential) {

    @Override
    public String toString() {
        return "CommandHandle[" + commandId + " on " + targetId + "]";
    }
}
