package com.fleetdeploy.orchestrator.pipeline;

import com.fleetdeploy.orchestrator.config.DeployProperties;
import com.fleetdeploy.orchestrator.executor.CredentialProvider;
import com.fleetdeploy.orchestrator.executor.ExecutionCredential;
import com.fleetdeploy.orchestrator.pipeline.Verdict.AbortReason;
import com.fleetdeploy.orchestrator.stage.RunBindings;
import com.fleetdeploy.orchestrator.stage.StageCatalog;
import com.fleetdeploy.orchestrator.stage.StageDefinition;
import com.fleetdeploy.orchestrator.stage.StageResult;
import com.fleetdeploy.orchestrator.stage.StageRunner;
import com.fleetdeploy.orchestrator.target.FleetInventoryException;
import com.fleetdeploy.orchestrator.target.Target;
import com.fleetdeploy.orchestrator.target.TargetNotFoundException;
import com.fleetdeploy.orchestrator.target.TargetResolver;
import com.fleetdeploy.orchestrator.target.TargetSelector;
import com.fleetdeploy.orchestrator.template.RenderException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one deployment run against one resolved target.
 *
 * Sequence:
 *   1. Resolve the target (whole resolution retried with exponential backoff)
 *   2. Acquire the execution credential once for the run
 *   3. Pre-render every stage template, so a configuration defect aborts
 *      before anything is sent to the target
 *   4. DEPENDENCY_CHECK -> ARTIFACT_PULL -> DEPLOY_SWAP -> HEALTH_CHECK,
 *      strictly in order, stopping at the first stage that does not pass
 *
 * No rollback happens here. Rolling back is a new run with the previous
 * image reference.
 */
@Component
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final TargetResolver     resolver;
    private final StageRunner        stageRunner;
    private final StageCatalog       catalog;
    private final RunBindings        runBindings;
    private final CredentialProvider credentials;
    private final MeterRegistry      meterRegistry;
    private final int                resolveAttempts;
    private final Duration           initialBackoff;

    public PipelineOrchestrator(TargetResolver resolver,
                                StageRunner stageRunner,
                                StageCatalog catalog,
                                RunBindings runBindings,
                                CredentialProvider credentials,
                                MeterRegistry meterRegistry,
                                DeployProperties properties) {
        this.resolver        = resolver;
        this.stageRunner     = stageRunner;
        this.catalog         = catalog;
        this.runBindings     = runBindings;
        this.credentials     = credentials;
        this.meterRegistry   = meterRegistry;
        this.resolveAttempts = Math.max(1, properties.getResolution().getMaxAttempts());
        this.initialBackoff  = properties.getResolution().getInitialBackoff();
    }

    public PipelineRun deploy(TargetSelector selector, String imageRef) {
        return deploy(UUID.randomUUID(), selector, imageRef, CancellationToken.none());
    }

    /**
     * Run the full pipeline. Always returns a run, whether it completed or
     * aborted; stage failures are data in the run, not exceptions.
     */
    public PipelineRun deploy(UUID runId, TargetSelector selector, String imageRef,
                              CancellationToken cancellation) {
        MDC.put("runId", runId.toString());
        try {
            Instant startedAt = Instant.now();
            log.info("Deploy run {} started: image={} selector={}", runId, imageRef, selector);

            // ── 1. Target resolution ─────────────────────────────────────────
            Target target;
            try {
                Optional<Target> resolved = resolveWithRetry(selector, cancellation);
                if (resolved.isEmpty()) {
                    return finish(runId, selector, imageRef, null, List.of(),
                            Verdict.abortedAt(1, AbortReason.CANCELLED, "cancelled during target resolution"),
                            startedAt);
                }
                target = resolved.get();
            } catch (TargetNotFoundException | FleetInventoryException e) {
                return finish(runId, selector, imageRef, null, List.of(),
                        Verdict.targetNotFound(e.getMessage()), startedAt);
            }
            MDC.put("targetId", target.id());

            // ── 2-3. Credential and pre-flight render ────────────────────────
            Map<String, String> bindings = runBindings.forRun(runId, target, imageRef);
            for (StageDefinition stage : catalog.stages()) {
                try {
                    stageRunner.render(stage, bindings);
                } catch (RenderException e) {
                    log.error("Stage {} template is not renderable, nothing dispatched: {}",
                            stage.name(), e.getMessage());
                    return finish(runId, selector, imageRef, target.id(), List.of(),
                            Verdict.abortedAt(stage.index(), AbortReason.RENDER_ERROR, e.getMessage()),
                            startedAt);
                }
            }
            ExecutionCredential credential = credentials.acquire();

            // ── 4. Stages, fail-fast ─────────────────────────────────────────
            List<StageRecord> records = new ArrayList<>();
            Verdict verdict = Verdict.completed();
            for (StageDefinition stage : catalog.stages()) {
                if (cancellation.isCancelled()) {
                    log.warn("Run {} cancelled before stage {}", runId, stage.name());
                    verdict = Verdict.abortedAt(stage.index(), AbortReason.CANCELLED,
                            "cancelled before " + stage.name());
                    break;
                }

                MDC.put("stage", stage.name().name());
                long t0 = System.nanoTime();
                Timer.Sample sample = Timer.start(meterRegistry);
                StageResult result;
                try {
                    result = stageRunner.run(target, stage, bindings, credential);
                } catch (RenderException e) {
                    verdict = Verdict.abortedAt(stage.index(), AbortReason.RENDER_ERROR, e.getMessage());
                    break;
                } finally {
                    MDC.remove("stage");
                }
                sample.stop(meterRegistry.timer("fleetdeploy.stage.duration",
                        "stage", stage.name().name(),
                        "status", result.outcome().status().name()));

                records.add(new StageRecord(stage.name(), result.outcome(), result.passed(),
                        Duration.ofNanos(System.nanoTime() - t0)));

                if (!result.passed()) {
                    verdict = Verdict.abortedAt(stage.index(), AbortReason.STAGE_FAILED,
                            stage.name() + " returned " + result.outcome().status());
                    break;
                }
            }

            return finish(runId, selector, imageRef, target.id(), records, verdict, startedAt);
        } finally {
            MDC.remove("runId");
            MDC.remove("targetId");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Resolve, retrying the whole lookup with doubling backoff.
     *
     * @return empty if the run was cancelled between attempts
     * @throws TargetNotFoundException or FleetInventoryException from the last attempt
     */
    private Optional<Target> resolveWithRetry(TargetSelector selector, CancellationToken cancellation) {
        Duration backoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            if (cancellation.isCancelled()) {
                return Optional.empty();
            }
            try {
                Target target = resolver.resolve(selector);
                log.info("Resolved {} to target {} (attempt {}/{})",
                        selector, target.id(), attempt, resolveAttempts);
                return Optional.of(target);
            } catch (TargetNotFoundException | FleetInventoryException e) {
                if (attempt >= resolveAttempts) {
                    log.error("Target resolution gave up after {} attempt(s): {}", attempt, e.getMessage());
                    throw e;
                }
                log.warn("Target resolution attempt {}/{} failed, retrying in {}: {}",
                        attempt, resolveAttempts, backoff, e.getMessage());
                if (!sleep(backoff)) {
                    throw e;
                }
                backoff = backoff.multipliedBy(2);
            }
        }
    }

    private static boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) return true;
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private PipelineRun finish(UUID runId, TargetSelector selector, String imageRef, String targetId,
                               List<StageRecord> records, Verdict verdict, Instant startedAt) {
        PipelineRun run = new PipelineRun(runId, selector, imageRef, targetId, records, verdict,
                startedAt, Instant.now());
        meterRegistry.counter("fleetdeploy.pipeline.runs",
                "verdict", verdict.kind().name().toLowerCase()).increment();
        if (verdict.isCompleted()) {
            log.info("Deploy run {} Completed on {} ({} stages)", runId, targetId, records.size());
        } else {
            log.warn("Deploy run {} ended {}: {}", runId, verdict.describe(), verdict.detail());
        }
        return run;
    }
}
