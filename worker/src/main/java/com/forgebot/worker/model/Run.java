package com.forgebot.worker.model;

import com.forgebot.worker.jobs.JobTrigger;
import com.forgebot.worker.jobs.JobType;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Parent record for one handler invocation triggered by one event.
 *
 * The package and job config snapshots let the reconciliation loop replay
 * the completion path long after the triggering event is gone.
 *
 * DB table: runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "runs")
public class Run {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "handler_name", nullable = false)
    private String handlerName;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", nullable = false)
    private JobType jobType;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_trigger", nullable = false)
    private JobTrigger trigger;

    @Column(name = "repo_url")
    private String repoUrl;

    @Column(name = "commit_sha")
    private String commitSha;

    @Column(name = "pr_id")
    private Integer prId;

    @Column(name = "tag_name")
    private String tagName;

    // Job identifier; result events are matched back to jobs by it.
    @Column(name = "identifier")
    private String identifier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.RUNNING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "package_config_json", columnDefinition = "TEXT")
    private String packageConfigJson;

    @Column(name = "job_config_json", columnDefinition = "TEXT")
    private String jobConfigJson;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Run() {}   // required by JPA

    public Run(String handlerName, JobType jobType, JobTrigger trigger) {
        this.handlerName = handlerName;
        this.jobType     = jobType;
        this.trigger     = trigger;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()                { return id; }
    public String     getHandlerName()       { return handlerName; }
    public JobType    getJobType()           { return jobType; }
    public JobTrigger getTrigger()           { return trigger; }
    public String     getRepoUrl()           { return repoUrl; }
    public String     getCommitSha()         { return commitSha; }
    public Integer    getPrId()              { return prId; }
    public String     getTagName()           { return tagName; }
    public String     getIdentifier()        { return identifier; }
    public RunStatus  getStatus()            { return status; }
    public Instant    getCreatedAt()         { return createdAt; }
    public Instant    getFinishedAt()        { return finishedAt; }
    public String     getPackageConfigJson() { return packageConfigJson; }
    public String     getJobConfigJson()     { return jobConfigJson; }

    public void setRepoUrl(String repoUrl)                  { this.repoUrl = repoUrl; }
    public void setCommitSha(String commitSha)              { this.commitSha = commitSha; }
    public void setPrId(Integer prId)                       { this.prId = prId; }
    public void setTagName(String tagName)                  { this.tagName = tagName; }
    public void setIdentifier(String identifier)            { this.identifier = identifier; }
    public void setStatus(RunStatus status)                 { this.status = status; }
    public void setFinishedAt(Instant t)                    { this.finishedAt = t; }
    public void setPackageConfigJson(String json)           { this.packageConfigJson = json; }
    public void setJobConfigJson(String json)               { this.jobConfigJson = json; }
}
