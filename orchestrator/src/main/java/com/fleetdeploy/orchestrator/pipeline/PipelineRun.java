package com.fleetdeploy.orchestrator.pipeline;

import com.fleetdeploy.orchestrator.target.TargetSelector;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one orchestration attempt against one target.
 *
 * Only {@link PipelineOrchestrator} builds these. A new deployment always
 * produces a new run; past runs are never touched.
 *
 * @param targetId null when no target was resolved
 * @param stages   stages that were dispatched, in order
 */
public record PipelineRun(UUID runId,
                          TargetSelector selector,
                          String imageRef,
                          String targetId,
                          List<StageRecord> stages,
                          Verdict verdict,
                          Instant startedAt,
                          Instant finishedAt) {

    public PipelineRun {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(verdict, "verdict");
        stages = List.copyOf(stages);
    }

    /**
     * True once at least one stage was dispatched to the target. False for
     * TargetNotFound, render errors and runs cancelled before stage 1, where
     * remediation differs from a stage that ran and failed.
     */
    public boolean attempted() {
        return !stages.isEmpty();
    }

    public RunReport toReport() {
        return RunReport.from(this);
    }
}
