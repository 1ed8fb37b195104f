package com.forgebot.worker.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One sub-unit of a Run: a dist-git branch, a build chroot or a test pipeline.
 *
 * Status changes never go through {@code save()}: the TargetStateMachine
 * issues status-conditioned UPDATEs so a live callback and a reconciliation
 * sweep cannot overwrite each other.
 *
 * DB table: targets  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "targets")
public class Target {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private Run run;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TargetKind kind;

    // Branch name, chroot or pipeline name.
    @Column(name = "target_key", nullable = false)
    private String targetKey;

    // Order inside the Run; Targets are processed in this order.
    @Column(nullable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TargetStatus status = TargetStatus.QUEUED;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Remote build id / pipeline id / downstream PR id.
    @Column(name = "correlation_id")
    private String correlationId;

    @Column(name = "result_url")
    private String resultUrl;

    @Column(name = "logs", columnDefinition = "TEXT")
    private String logs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Target() {}   // required by JPA

    public Target(Run run, TargetKind kind, String targetKey, int position) {
        this.run       = run;
        this.kind      = kind;
        this.targetKey = targetKey;
        this.position  = position;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()            { return id; }
    public Run          getRun()           { return run; }
    public TargetKind   getKind()          { return kind; }
    public String       getTargetKey()     { return targetKey; }
    public int          getPosition()      { return position; }
    public TargetStatus getStatus()        { return status; }
    public Instant      getCreatedAt()     { return createdAt; }
    public Instant      getSubmittedAt()   { return submittedAt; }
    public Instant      getStartedAt()     { return startedAt; }
    public Instant      getFinishedAt()    { return finishedAt; }
    public String       getCorrelationId() { return correlationId; }
    public String       getResultUrl()     { return resultUrl; }
    public String       getLogs()          { return logs; }
    public String       getErrorMessage()  { return errorMessage; }

    public boolean isTerminal() {
        return status.isTerminal(kind);
    }

    // In-memory mirrors of what the conditioned UPDATEs wrote, so callers
    // holding this instance see the new state without re-reading it.
    public void setStatus(TargetStatus status)        { this.status = status; }
    public void setSubmittedAt(Instant t)             { this.submittedAt = t; }
    public void setStartedAt(Instant t)               { this.startedAt = t; }
    public void setFinishedAt(Instant t)              { this.finishedAt = t; }
    public void setCorrelationId(String id)           { this.correlationId = id; }
    public void setResultUrl(String url)              { this.resultUrl = url; }
    public void setLogs(String logs)                  { this.logs = logs; }
    public void setErrorMessage(String message)       { this.errorMessage = message; }
}
