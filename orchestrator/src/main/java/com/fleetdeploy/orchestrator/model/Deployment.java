package com.fleetdeploy.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One submitted deployment run.
 *
 * The id is also the pipeline run id, so log lines (MDC runId) and rows
 * line up. The run report is stored as JSON once the pipeline finishes.
 *
 * DB table: deployments  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "deployments")
public class Deployment {

    @Id
    private UUID id;

    // Printed selector, e.g. "{env=prod, fleet=web}@ALIVE".
    @Column(name = "selector", nullable = false)
    private String selector;

    @Column(name = "image_ref", nullable = false)
    private String imageRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeploymentState state = DeploymentState.PENDING;

    // Null until a target is resolved.
    @Column(name = "target_id")
    private String targetId;

    // Verdict string, e.g. "AbortedAtStage(2)". Null while running.
    @Column(name = "verdict")
    private String verdict;

    @Column(name = "report_json", columnDefinition = "TEXT")
    private String reportJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Deployment() {}   // required by JPA

    public Deployment(UUID id, String selector, String imageRef) {
        this.id       = id;
        this.selector = selector;
        this.imageRef = imageRef;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID            getId()          { return id; }
    public String          getSelector()    { return selector; }
    public String          getImageRef()    { return imageRef; }
    public DeploymentState getState()       { return state; }
    public String          getTargetId()    { return targetId; }
    public String          getVerdict()     { return verdict; }
    public String          getReportJson()  { return reportJson; }
    public Instant         getCreatedAt()   { return createdAt; }
    public Instant         getStartedAt()   { return startedAt; }
    public Instant         getFinishedAt()  { return finishedAt; }

    public void setState(DeploymentState state)      { this.state = state; }
    public void setTargetId(String targetId)         { this.targetId = targetId; }
    public void setVerdict(String verdict)           { this.verdict = verdict; }
    public void setReportJson(String reportJson)     { this.reportJson = reportJson; }
    public void setStartedAt(Instant t)              { this.startedAt = t; }
    public void setFinishedAt(Instant t)             { this.finishedAt = t; }
}
