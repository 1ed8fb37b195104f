package com.forgebot.worker.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgebot.worker.event.Event;
import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.PackageConfig;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.model.TargetStatus;
import com.forgebot.worker.repository.RunRepository;
import com.forgebot.worker.repository.TargetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates Runs with their Targets and reads them back.
 *
 * Status changes are not made here; see {@link TargetStateMachine}.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final RunRepository    runRepository;
    private final TargetRepository targetRepository;
    private final ObjectMapper     json;
    private final String           dashboardUrl;

    public RunService(RunRepository runRepository,
                      TargetRepository targetRepository,
                      ObjectMapper objectMapper,
                      @Value("${forgebot.dashboard-url:http://localhost:8080}") String dashboardUrl) {
        this.runRepository    = runRepository;
        this.targetRepository = targetRepository;
        this.json             = objectMapper;
        this.dashboardUrl     = dashboardUrl.endsWith("/")
                ? dashboardUrl.substring(0, dashboardUrl.length() - 1) : dashboardUrl;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Persist a new RUNNING Run with one QUEUED Target per key, in key order.
     */
    @Transactional
    public Run createRun(String handlerName, PackageConfig packageConfig, JobConfig jobConfig,
                         Event event, TargetKind kind, List<String> targetKeys) {
        Run run = new Run(handlerName, jobConfig.type(), jobConfig.trigger());
        run.setRepoUrl(event.repoUrl());
        run.setCommitSha(event.commitSha());
        run.setPrId(event.prId());
        run.setTagName(event.tagName());
        run.setIdentifier(jobConfig.identifier());
        run.setPackageConfigJson(toJson(packageConfig));
        run.setJobConfigJson(toJson(jobConfig));
        run = runRepository.save(run);

        List<Target> targets = new ArrayList<>();
        for (int i = 0; i < targetKeys.size(); i++) {
            targets.add(new Target(run, kind, targetKeys.get(i), i));
        }
        targetRepository.saveAll(targets);

        log.info("Created run {} for {} with {} target(s): {}",
                run.getId(), handlerName, targetKeys.size(), targetKeys);
        return run;
    }

    /**
     * Resume the Run an earlier attempt created, or create a fresh one when
     * there is none (first attempt, or the Run has disappeared).
     */
    @Transactional
    public Run resumeOrCreate(UUID runId, String handlerName, PackageConfig packageConfig,
                              JobConfig jobConfig, Event event, TargetKind kind,
                              List<String> targetKeys) {
        if (runId != null) {
            Optional<Run> existing = runRepository.findById(runId);
            if (existing.isPresent()) {
                log.info("Resuming run {}", runId);
                return existing.get();
            }
            log.warn("Run {} to resume not found, creating a new one", runId);
        }
        return createRun(handlerName, packageConfig, jobConfig, event, kind, targetKeys);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Run> findRun(UUID runId) {
        return runRepository.findById(runId);
    }

    @Transactional(readOnly = true)
    public List<Target> targets(UUID runId) {
        return targetRepository.findByRunIdOrderByPositionAsc(runId);
    }

    @Transactional(readOnly = true)
    public Optional<Target> findTarget(UUID targetId) {
        return targetRepository.findById(targetId);
    }

    /** Targets sharing one external job id, e.g. every chroot of one build. */
    @Transactional(readOnly = true)
    public List<Target> targetsByCorrelationId(TargetKind kind, String correlationId) {
        return targetRepository.findByKindAndCorrelationId(kind, correlationId);
    }

    /** Targets of one kind in any of the given statuses, oldest first, with their Run loaded. */
    @Transactional(readOnly = true)
    public List<Target> targetsInStatus(TargetKind kind, Collection<TargetStatus> statuses) {
        return targetRepository.findByKindAndStatusIn(kind, statuses);
    }

    /** Dashboard link for a Target. */
    public String resultUrl(Target target) {
        return dashboardUrl + "/runs/targets/" + target.getId();
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    public PackageConfig packageConfigOf(Run run) {
        return fromJson(run.getPackageConfigJson(), PackageConfig.class);
    }

    public JobConfig jobConfigOf(Run run) {
        return fromJson(run.getJobConfigJson(), JobConfig.class);
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String value, Class<T> type) {
        if (value == null) {
            throw new IllegalStateException("Run carries no " + type.getSimpleName() + " snapshot");
        }
        try {
            return json.readValue(value, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read " + type.getSimpleName() + " snapshot", e);
        }
    }
}
