package com.fleetdeploy.orchestrator.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-scoped cancellation signal. The orchestrator checks it between stages;
 * a stage already dispatched is allowed to finish.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** A fresh token nobody else holds, i.e. one that is never cancelled. */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /** @return true if this call flipped the token, false if it was already cancelled */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
