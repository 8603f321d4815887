package com.fleetdeploy.orchestrator.pipeline;

import java.time.Instant;
import java.util.List;

/**
 * Externally visible form of a {@link PipelineRun}, serialised to JSON for
 * the deployments table and the REST API.
 *
 * Field names are the wire names.
 */
public record RunReport(
        String run_id,
        String target_id,
        String image_ref,
        String verdict,
        boolean attempted,
        String detail,
        Instant started_at,
        Instant finished_at,
        List<StageEntry> stages
) {
    public record StageEntry(
            String  stage_name,
            String  outcome,
            Integer exit_code,
            boolean passed,
            boolean truncated,
            long    elapsed_ms,
            String  captured_output
    ) {}

    public static RunReport from(PipelineRun run) {
        return new RunReport(
                run.runId().toString(),
                run.targetId(),
                run.imageRef(),
                run.verdict().describe(),
                run.attempted(),
                run.verdict().detail(),
                run.startedAt(),
                run.finishedAt(),
                run.stages().stream()
                        .map(s -> new StageEntry(
                                s.stage().name(),
                                s.outcome().status().name(),
                                s.outcome().exitCode(),
                                s.passed(),
                                s.outcome().truncated(),
                                s.elapsed().toMillis(),
                                s.outcome().output()))
                        .toList());
    }
}
