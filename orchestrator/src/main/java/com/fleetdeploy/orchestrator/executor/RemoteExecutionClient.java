package com.fleetdeploy.orchestrator.executor;

import com.fleetdeploy.orchestrator.target.Target;
import com.fleetdeploy.orchestrator.template.RenderedCommand;

import java.time.Duration;

/**
 * Asynchronous, non-interactive command channel to fleet instances.
 *
 * Dispatch and poll are separate so a caller can bound its wait and report
 * progress without holding a connection open for the whole command.
 */
public interface RemoteExecutionClient {

    /**
     * Send a command for asynchronous execution. Does not wait for completion.
     *
     * @throws DispatchException if the target cannot accept the command
     */
    CommandHandle dispatch(Target target, RenderedCommand command, ExecutionCredential credential);

    /**
     * Wait until the command reaches a terminal state or {@code timeout} elapses.
     *
     * Returns {@link CommandStatus#TIMED_OUT} on timeout instead of throwing.
     * Once a terminal outcome has been seen, later calls for the same handle
     * return that identical outcome.
     */
    CommandOutcome poll(CommandHandle handle, Duration timeout);
}
