package com.forgebot.worker.service;

import com.forgebot.worker.event.JobOutcome;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.RunStatus;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetStatus;
import com.forgebot.worker.repository.RunRepository;
import com.forgebot.worker.repository.TargetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The only writer of Target status.
 *
 * Every move is a single UPDATE conditioned on the Target's allowed
 * predecessor statuses (see {@link TargetStatus#predecessors}). When the
 * UPDATE touches no row, somebody else (a live callback, a sweep, a
 * duplicate invocation) already moved the Target; the move is skipped and
 * the method returns false. Callers never overwrite a terminal status.
 *
 * On success the passed-in {@link Target} instance is updated in memory too.
 */
@Service
public class TargetStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TargetStateMachine.class);

    private final TargetRepository targetRepository;
    private final RunRepository    runRepository;
    private final Clock            clock;

    public TargetStateMachine(TargetRepository targetRepository,
                              RunRepository runRepository,
                              Clock clock) {
        this.targetRepository = targetRepository;
        this.runRepository    = runRepository;
        this.clock            = clock;
    }

    // ------------------------------------------------------------------
    // Target transitions
    // ------------------------------------------------------------------

    /** QUEUED / RETRY / RUNNING → RUNNING. */
    @Transactional
    public boolean start(Target target) {
        Instant now = clock.instant();
        int rows = targetRepository.markStarted(target.getId(),
                TargetStatus.RUNNING.predecessors(target.getKind()), now);
        if (rows == 0) {
            return skipped(target, TargetStatus.RUNNING);
        }
        target.setStatus(TargetStatus.RUNNING);
        target.setStartedAt(now);
        return true;
    }

    /** RUNNING → SUBMITTED: the external system accepted the work. */
    @Transactional
    public boolean submit(Target target, String correlationId, String resultUrl) {
        Instant now = clock.instant();
        int rows = targetRepository.markSubmitted(target.getId(),
                TargetStatus.SUBMITTED.predecessors(target.getKind()), correlationId, resultUrl, now);
        if (rows == 0) {
            return skipped(target, TargetStatus.SUBMITTED);
        }
        target.setStatus(TargetStatus.SUBMITTED);
        target.setSubmittedAt(now);
        target.setCorrelationId(correlationId);
        target.setResultUrl(resultUrl);
        return true;
    }

    /** RUNNING → RETRY: a recognized transient condition; the next attempt re-enters the Target. */
    @Transactional
    public boolean retry(Target target) {
        int rows = targetRepository.transition(target.getId(),
                TargetStatus.RETRY.predecessors(target.getKind()), TargetStatus.RETRY);
        if (rows == 0) {
            return skipped(target, TargetStatus.RETRY);
        }
        target.setStatus(TargetStatus.RETRY);
        return true;
    }

    /** Any non-terminal status → ERROR, recording the error text. */
    @Transactional
    public boolean fail(Target target, String errorMessage) {
        return terminal(target, TargetStatus.ERROR, errorMessage);
    }

    /** Completion reported by the external system for a tracked Target. */
    @Transactional
    public boolean complete(Target target, JobOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> terminal(target, TargetStatus.SUCCESS, null);
            case FAILURE -> terminal(target, TargetStatus.FAILURE, null);
            case ERROR   -> terminal(target, TargetStatus.ERROR, "External job ended in error");
        };
    }

    /** Stamp the finish time and store captured logs, whatever status the Target ended in. */
    @Transactional
    public void finish(Target target, String logs) {
        Instant now = clock.instant();
        targetRepository.recordFinish(target.getId(), logs, now);
        target.setFinishedAt(now);
        target.setLogs(logs);
    }

    // ------------------------------------------------------------------
    // Run aggregation
    // ------------------------------------------------------------------

    /**
     * Recompute and store the Run's aggregate status from its Targets.
     */
    @Transactional
    public RunStatus aggregate(Run run) {
        List<Target> targets = targetRepository.findByRunIdOrderByPositionAsc(run.getId());
        RunStatus status = aggregateOf(targets);
        Instant finishedAt = status == RunStatus.RUNNING ? null : clock.instant();
        runRepository.updateStatus(run.getId(), status, finishedAt);
        run.setStatus(status);
        run.setFinishedAt(finishedAt);
        log.info("Run {} aggregate status: {}", run.getId(), status);
        return status;
    }

    /**
     * RUNNING while any Target waits in RETRY or is not terminal yet;
     * otherwise ERROR if any Target ended in ERROR, else FINISHED.
     */
    public static RunStatus aggregateOf(List<Target> targets) {
        boolean anyError = false;
        for (Target t : targets) {
            if (t.getStatus() == TargetStatus.RETRY || !t.isTerminal()) {
                return RunStatus.RUNNING;
            }
            anyError |= t.getStatus() == TargetStatus.ERROR;
        }
        return anyError ? RunStatus.ERROR : RunStatus.FINISHED;
    }

    private boolean terminal(Target target, TargetStatus to, String errorMessage) {
        Instant now = clock.instant();
        int rows = targetRepository.markTerminal(target.getId(),
                to.predecessors(target.getKind()), to, errorMessage, now);
        if (rows == 0) {
            return skipped(target, to);
        }
        target.setStatus(to);
        target.setFinishedAt(now);
        target.setErrorMessage(errorMessage);
        return true;
    }

    private static boolean skipped(Target target, TargetStatus to) {
        UUID id = target.getId();
        log.info("Target {} ({}) not moved to {}: status changed concurrently (last seen {})",
                id, target.getTargetKey(), to, target.getStatus());
        return false;
    }
}
