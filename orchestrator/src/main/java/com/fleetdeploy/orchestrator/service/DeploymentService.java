package com.fleetdeploy.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fleetdeploy.orchestrator.config.DeployProperties;
import com.fleetdeploy.orchestrator.model.Deployment;
import com.fleetdeploy.orchestrator.model.DeploymentState;
import com.fleetdeploy.orchestrator.pipeline.CancellationToken;
import com.fleetdeploy.orchestrator.pipeline.PipelineOrchestrator;
import com.fleetdeploy.orchestrator.pipeline.PipelineRun;
import com.fleetdeploy.orchestrator.repository.DeploymentRepository;
import com.fleetdeploy.orchestrator.target.TargetSelector;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Submission, tracking and cancellation of deployment runs.
 *
 * Runs execute on a fixed worker pool so a burst of submissions cannot
 * overwhelm the execution agent. Each run gets its own cancellation token;
 * runs share nothing else.
 */
@Service
public class DeploymentService {

    private static final Logger log = LoggerFactory.getLogger(DeploymentService.class);

    public enum CancelResult { CANCELLED, NOT_FOUND, ALREADY_FINISHED }

    private final DeploymentRepository  repo;
    private final PipelineOrchestrator  orchestrator;
    private final ObjectMapper          objectMapper;
    private final Executor              workers;

    // Tokens of runs submitted by this process and not yet finished.
    private final Map<UUID, CancellationToken> active = new ConcurrentHashMap<>();

    @Autowired
    public DeploymentService(DeploymentRepository repo,
                             PipelineOrchestrator orchestrator,
                             ObjectMapper objectMapper,
                             DeployProperties properties) {
        this(repo, orchestrator, objectMapper,
                Executors.newFixedThreadPool(Math.max(1, properties.getWorkers())));
    }

    public DeploymentService(DeploymentRepository repo,
                             PipelineOrchestrator orchestrator,
                             ObjectMapper objectMapper,
                             Executor workers) {
        this.repo         = repo;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.workers      = workers;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Persist a PENDING deployment and hand it to the worker pool.
     *
     * Returns immediately; callers poll {@link #findById} or {@link #report}.
     */
    public Deployment submit(TargetSelector selector, String imageRef) {
        UUID id = UUID.randomUUID();
        Deployment deployment = repo.save(new Deployment(id, selector.toString(), imageRef));
        CancellationToken token = new CancellationToken();
        active.put(id, token);
        log.info("Deployment {} submitted: image={} selector={}", id, imageRef, selector);

        try {
            workers.execute(() -> execute(id, selector, imageRef, token));
        } catch (RejectedExecutionException e) {
            active.remove(id);
            log.error("Worker pool rejected deployment {}", id, e);
            deployment.setState(DeploymentState.ABORTED);
            deployment.setVerdict("Rejected: worker pool is not accepting work");
            deployment.setFinishedAt(Instant.now());
            return repo.save(deployment);
        }
        return deployment;
    }

    public Optional<Deployment> findById(UUID id) {
        return repo.findById(id);
    }

    public List<Deployment> recent() {
        return repo.findTop50ByOrderByCreatedAtDesc();
    }

    /** Run report JSON, present once the deployment reached a terminal state with a report. */
    public Optional<String> report(UUID id) {
        return repo.findById(id).map(Deployment::getReportJson);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Ask a running deployment to stop. A stage already dispatched finishes;
     * no later stage starts.
     */
    public CancelResult cancel(UUID id) {
        Optional<Deployment> deployment = repo.findById(id);
        if (deployment.isEmpty()) {
            return CancelResult.NOT_FOUND;
        }
        CancellationToken token = active.get(id);
        if (deployment.get().getState().isTerminal() || token == null) {
            return CancelResult.ALREADY_FINISHED;
        }
        if (token.cancel()) {
            log.warn("Cancellation requested for deployment {}", id);
        }
        return CancelResult.CANCELLED;
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    // Runs on a pool thread outside any transaction; each repository save commits on its own.

    void execute(UUID id, TargetSelector selector, String imageRef, CancellationToken token) {
        try {
            markRunning(id);
            PipelineRun run = orchestrator.deploy(id, selector, imageRef, token);
            recordResult(id, run);
        } catch (Exception e) {
            log.error("Unhandled error in deployment {}: {}", id, e.getMessage(), e);
            markAborted(id, "Unhandled exception: " + e.getMessage());
        } finally {
            active.remove(id);
        }
    }

    private void markRunning(UUID id) {
        Deployment deployment = repo.findById(id).orElseThrow();
        deployment.setState(DeploymentState.RUNNING);
        deployment.setStartedAt(Instant.now());
        repo.save(deployment);
    }

    private void recordResult(UUID id, PipelineRun run) {
        Deployment deployment = repo.findById(id).orElseThrow();
        deployment.setState(DeploymentState.of(run.verdict()));
        deployment.setTargetId(run.targetId());
        deployment.setVerdict(run.verdict().describe());
        deployment.setReportJson(toJson(run));
        deployment.setFinishedAt(run.finishedAt());
        repo.save(deployment);
        log.info("Deployment {} → {} ({})", id, deployment.getState(), deployment.getVerdict());
    }

    private void markAborted(UUID id, String reason) {
        repo.findById(id).ifPresent(deployment -> {
            deployment.setState(DeploymentState.ABORTED);
            deployment.setVerdict(reason);
            deployment.setFinishedAt(Instant.now());
            repo.save(deployment);
            log.error("Deployment {} marked ABORTED: {}", id, reason);
        });
    }

    // ------------------------------------------------------------------
    // Startup recovery
    // ------------------------------------------------------------------

    /**
     * Rows left PENDING or RUNNING by a previous process can never finish:
     * the commands they dispatched are not re-attached. Mark them INTERRUPTED.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void recoverInterrupted() {
        List<Deployment> orphans = repo.findByStateIn(
                EnumSet.of(DeploymentState.PENDING, DeploymentState.RUNNING));
        for (Deployment deployment : orphans) {
            if (active.containsKey(deployment.getId())) continue;
            log.warn("Deployment {} was {} when the previous process stopped, marking INTERRUPTED",
                    deployment.getId(), deployment.getState());
            deployment.setState(DeploymentState.INTERRUPTED);
            deployment.setFinishedAt(Instant.now());
            repo.save(deployment);
        }
    }

    @PreDestroy
    void shutdown() {
        if (workers instanceof ExecutorService pool) {
            pool.shutdown();
        }
    }

    private String toJson(PipelineRun run) {
        try {
            return objectMapper.writeValueAsString(run.toReport());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise report for run {}: {}", run.runId(), e.getMessage());
            return null;
        }
    }
}
