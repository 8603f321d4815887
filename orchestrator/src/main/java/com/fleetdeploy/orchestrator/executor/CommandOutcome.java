package com.fleetdeploy.orchestrator.executor;

import java.util.Objects;

/**
 * Terminal result of one dispatched command. Immutable.
 *
 * Execution problems (a failed script, a timeout, an unreachable target) are
 * returned as outcomes rather than thrown: they are expected results of a
 * remote operation and the pipeline records them.
 *
 * @param status    terminal status
 * @param output    captured stdout/stderr, possibly truncated to its tail
 * @param exitCode  script exit code, null when the script never ran or never finished
 * @param truncated true if {@code output} was cut down
 */
public record CommandOutcome(CommandStatus status, String output, Integer exitCode, boolean truncated) {

    public CommandOutcome {
        Objects.requireNonNull(status, "status");
        output = output == null ? "" : output;
    }

    public static CommandOutcome success(String output, Integer exitCode) {
        return new CommandOutcome(CommandStatus.SUCCESS, output, exitCode, false);
    }

    public static CommandOutcome failure(String output, Integer exitCode) {
        return new CommandOutcome(CommandStatus.FAILURE, output, exitCode, false);
    }

    public static CommandOutcome timedOut(String output) {
        return new CommandOutcome(CommandStatus.TIMED_OUT, output, null, false);
    }

    public static CommandOutcome targetUnreachable(String output) {
        return new CommandOutcome(CommandStatus.TARGET_UNREACHABLE, output, null, false);
    }

    public boolean isSuccess() {
        return status == CommandStatus.SUCCESS;
    }

    /** Keep the last {@code maxChars} characters of the output. */
    public CommandOutcome truncatedTo(int maxChars) {
        if (output.length() <= maxChars) return this;
        return new CommandOutcome(status, output.substring(output.length() - maxChars), exitCode, true);
    }
}
