package com.fleetdeploy.orchestrator.executor;

/**
 * Thrown when the execution agent returns an unusable response or cannot be
 * talked to at all (outside the dispatch path, which uses {@link DispatchException}).
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
