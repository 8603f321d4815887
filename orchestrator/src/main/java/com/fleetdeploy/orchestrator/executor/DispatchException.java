package com.fleetdeploy.orchestrator.executor;

/**
 * A command could not be handed to its target.
 *
 * TARGET_UNREACHABLE means the target cannot accept commands right now;
 * REJECTED means the agent refused the request itself (bad payload, auth).
 */
public class DispatchException extends RuntimeException {

    public enum Kind { TARGET_UNREACHABLE, REJECTED }

    private final Kind   kind;
    private final String targetId;

    public DispatchException(Kind kind, String targetId, String message) {
        super("[" + kind + "] " + message);
        this.kind     = kind;
        this.targetId = targetId;
    }

    public DispatchException(Kind kind, String targetId, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind     = kind;
        this.targetId = targetId;
    }

    public Kind getKind()        { return kind; }
    public String getTargetId()  { return targetId; }
}
