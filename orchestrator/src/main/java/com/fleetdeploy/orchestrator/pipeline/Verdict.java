package com.fleetdeploy.orchestrator.pipeline;

/**
 * Final verdict of a pipeline run.
 *
 * String forms (what the run report and the deployments table carry):
 * <pre>
 *   Completed
 *   AbortedAtStage(n)                 a stage did not pass
 *   AbortedAtStage(n):cancelled       cancellation seen before stage n started
 *   AbortedAtStage(n):render-error    stage n's template could not be rendered
 *   TargetNotFound
 * </pre>
 *
 * @param kind   which terminal state
 * @param stage  1-based stage index for ABORTED_AT_STAGE, otherwise null
 * @param reason why the run aborted, null unless ABORTED_AT_STAGE
 * @param detail human-readable cause, may be empty
 */
public record Verdict(Kind kind, Integer stage, AbortReason reason, String detail) {

    public enum Kind { COMPLETED, ABORTED_AT_STAGE, TARGET_NOT_FOUND }

    public enum AbortReason { STAGE_FAILED, CANCELLED, RENDER_ERROR }

    public Verdict {
        detail = detail == null ? "" : detail;
    }

    public static Verdict completed() {
        return new Verdict(Kind.COMPLETED, null, null, "");
    }

    public static Verdict abortedAt(int stage, AbortReason reason, String detail) {
        return new Verdict(Kind.ABORTED_AT_STAGE, stage, reason, detail);
    }

    public static Verdict targetNotFound(String detail) {
        return new Verdict(Kind.TARGET_NOT_FOUND, null, null, detail);
    }

    public boolean isCompleted() {
        return kind == Kind.COMPLETED;
    }

    public String describe() {
        return switch (kind) {
            case COMPLETED        -> "Completed";
            case TARGET_NOT_FOUND -> "TargetNotFound";
            case ABORTED_AT_STAGE -> "AbortedAtStage(" + stage + ")" + switch (reason) {
                case STAGE_FAILED -> "";
                case CANCELLED    -> ":cancelled";
                case RENDER_ERROR -> ":render-error";
            };
        };
    }

    @Override
    public String toString() {
        return describe();
    }
}
