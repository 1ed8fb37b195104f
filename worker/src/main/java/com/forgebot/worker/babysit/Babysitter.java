package com.forgebot.worker.babysit;

import com.forgebot.worker.dispatch.Dispatcher;
import com.forgebot.worker.event.Event;
import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.event.JobOutcome;
import com.forgebot.worker.external.CommitState;
import com.forgebot.worker.external.ExternalJobStatus;
import com.forgebot.worker.external.JobSystemOfRecord;
import com.forgebot.worker.external.StatusReporter;
import com.forgebot.worker.handler.CheckNames;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.model.TargetStatus;
import com.forgebot.worker.service.RunService;
import com.forgebot.worker.service.TargetStateMachine;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Periodic reconciliation of tracked Targets whose completion callback never
 * arrived.
 *
 * Sweep 1 (builds): SUBMITTED build Targets are grouped by build id and the
 * build farm is asked once per build. Sweep 2 (test runs): QUEUED, RUNNING
 * and SUBMITTED test Targets are checked one by one.
 *
 * Anything submitted before the staleness cutoff is forced to ERROR without
 * asking. A job the external system no longer knows is forced to ERROR too.
 * Completed jobs are replayed through the {@link Dispatcher} as BUILD_END /
 * TEST_RESULTS events, i.e. the same handlers a live callback reaches.
 *
 * Runs concurrently with live callbacks; every write goes through the
 * status-conditioned {@link TargetStateMachine}, so a Target a callback has
 * already finished is skipped.
 */
@Component
@EnableScheduling
public class Babysitter {

    private static final Logger log = LoggerFactory.getLogger(Babysitter.class);

    private static final EnumSet<TargetStatus> BUILD_PENDING = EnumSet.of(TargetStatus.SUBMITTED);
    private static final EnumSet<TargetStatus> TEST_PENDING  =
            EnumSet.of(TargetStatus.QUEUED, TargetStatus.RUNNING, TargetStatus.SUBMITTED);

    private final RunService         runService;
    private final TargetStateMachine stateMachine;
    private final Dispatcher         dispatcher;
    private final JobSystemOfRecord  buildFarm;
    private final JobSystemOfRecord  testFarm;
    private final StatusReporter     reporter;
    private final MeterRegistry      meterRegistry;
    private final Clock              clock;
    private final Duration           staleAfter;

    public Babysitter(RunService runService,
                      TargetStateMachine stateMachine,
                      Dispatcher dispatcher,
                      @Qualifier("buildFarm") JobSystemOfRecord buildFarm,
                      @Qualifier("testFarm") JobSystemOfRecord testFarm,
                      StatusReporter reporter,
                      MeterRegistry meterRegistry,
                      Clock clock,
                      @Value("${forgebot.babysit.stale-after:P14D}") Duration staleAfter) {
        this.runService    = runService;
        this.stateMachine  = stateMachine;
        this.dispatcher    = dispatcher;
        this.buildFarm     = buildFarm;
        this.testFarm      = testFarm;
        this.reporter      = reporter;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.staleAfter    = staleAfter;
    }

    @Scheduled(fixedDelayString = "${forgebot.babysit.interval-ms:600000}",
               initialDelayString = "${forgebot.babysit.initial-delay-ms:60000}")
    public void sweep() {
        log.info("Reconciliation sweep started");
        checkPendingBuilds();
        checkPendingTestRuns();
    }

    // ------------------------------------------------------------------
    // Sweep 1: builds
    // ------------------------------------------------------------------

    public void checkPendingBuilds() {
        List<Target> pending = runService.targetsInStatus(TargetKind.BUILD, BUILD_PENDING);
        Map<String, List<Target>> byBuild = pending.stream()
                .filter(t -> t.getCorrelationId() != null)
                .collect(Collectors.groupingBy(Target::getCorrelationId, LinkedHashMap::new,
                        Collectors.toList()));
        log.info("{} pending build(s) to check", byBuild.size());

        // nothing to query for these, so only age can resolve them
        List<Target> unidentified = pending.stream()
                .filter(t -> t.getCorrelationId() == null && isStale(t.getSubmittedAt()))
                .toList();
        if (!unidentified.isEmpty()) {
            log.info("{} stale build target(s) without a build id, marking as error", unidentified.size());
            forceError(unidentified, "Build has no id and did not finish within "
                    + staleAfter.toDays() + " days", "builds");
        }

        byBuild.forEach((buildId, targets) -> {
            try {
                updateBuilds(buildId, targets);
            } catch (RuntimeException e) {
                log.warn("Checking build {} failed, will try on the next sweep: {}", buildId, e.getMessage());
            }
        });
    }

    /**
     * Reconcile every Target of one build.
     *
     * @return true if the build was resolved (errored or replayed), false if still pending
     */
    public boolean updateBuilds(String buildId, List<Target> targets) {
        Instant submitted = targets.stream()
                .map(Target::getSubmittedAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
        if (isStale(submitted)) {
            log.info("Build {} submitted at {} is too old, marking as error", buildId, submitted);
            forceError(targets, "Build not finished within " + staleAfter.toDays() + " days", "builds");
            return true;
        }

        ExternalJobStatus status = buildFarm.query(buildId);
        switch (status.state()) {
            case NOT_FOUND -> {
                log.info("Build {} not found by the build farm, marking as error", buildId);
                forceError(targets, "Build " + buildId + " not found", "builds");
                return true;
            }
            case PENDING -> {
                log.debug("Build {} still in progress", buildId);
                return false;
            }
            default -> {
                for (Target target : targets) {
                    replay(target, EventKind.BUILD_END, status);
                }
                return true;
            }
        }
    }

    /** Check a single build on demand. */
    public boolean checkBuild(String buildId) {
        List<Target> targets = runService.targetsByCorrelationId(TargetKind.BUILD, buildId).stream()
                .filter(t -> t.getStatus() == TargetStatus.SUBMITTED)
                .toList();
        if (targets.isEmpty()) {
            log.info("No pending targets for build {}", buildId);
            return false;
        }
        return updateBuilds(buildId, targets);
    }

    // ------------------------------------------------------------------
    // Sweep 2: test runs
    // ------------------------------------------------------------------

    public void checkPendingTestRuns() {
        List<Target> targets = runService.targetsInStatus(TargetKind.TEST_RUN, TEST_PENDING);
        log.info("{} pending test run(s) to check", targets.size());
        for (Target target : targets) {
            try {
                updateTestRun(target);
            } catch (RuntimeException e) {
                log.warn("Checking test run {} failed, will try on the next sweep: {}",
                        target.getCorrelationId(), e.getMessage());
            }
        }
    }

    private void updateTestRun(Target target) {
        Instant since = target.getSubmittedAt();
        if (since == null && target.getCorrelationId() == null) {
            // never submitted: only the creation time tells how long it has waited
            since = target.getCreatedAt();
        }
        if (isStale(since)) {
            log.info("Test run {} ({}) is too old, marking as error",
                    target.getCorrelationId(), target.getTargetKey());
            forceError(List.of(target), "Test run not finished within " + staleAfter.toDays() + " days",
                    "test_runs");
            return;
        }
        if (target.getCorrelationId() == null) {
            return;
        }

        ExternalJobStatus status = testFarm.query(target.getCorrelationId());
        switch (status.state()) {
            case NOT_FOUND -> forceError(List.of(target),
                    "Test run " + target.getCorrelationId() + " not found", "test_runs");
            case PENDING   -> log.debug("Test run {} still in progress", target.getCorrelationId());
            default        -> replay(target, EventKind.TEST_RESULTS, status);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private boolean isStale(Instant since) {
        return since != null && !since.isAfter(clock.instant().minus(staleAfter));
    }

    /** Feed a completed external job back through the normal completion handlers. */
    private void replay(Target target, EventKind kind, ExternalJobStatus status) {
        Run run = target.getRun();
        JobOutcome outcome = status.outcomeFor(target.getTargetKey());
        Event event = Event.builder(kind)
                .trigger(run.getTrigger())
                .repoUrl(run.getRepoUrl())
                .commitSha(run.getCommitSha())
                .prId(run.getPrId())
                .tagName(run.getTagName())
                .identifier(run.getIdentifier())
                .correlationId(target.getCorrelationId())
                .targetKey(target.getTargetKey())
                .outcome(outcome)
                .resultUrl(status.url())
                .build();

        List<TaskResult> results = dispatcher.dispatchInline(event, runService.packageConfigOf(run));
        if (results.isEmpty()) {
            log.warn("No handler took the replayed {} for {} {}", kind,
                    target.getCorrelationId(), target.getTargetKey());
        } else {
            log.info("Replayed {} for {} {}: {}", kind, target.getCorrelationId(),
                    target.getTargetKey(), outcome);
        }
    }

    private void forceError(List<Target> targets, String reason, String sweep) {
        Map<UUID, Run> runs = new LinkedHashMap<>();
        for (Target target : targets) {
            if (!stateMachine.fail(target, reason)) {
                continue;
            }
            meterRegistry.counter("forgebot.babysit.forced_errors", "sweep", sweep).increment();
            Run run = target.getRun();
            runs.put(run.getId(), run);
            String prefix = target.getKind() == TargetKind.BUILD ? CheckNames.RPM_BUILD : CheckNames.TESTING_FARM;
            reporter.report(run.getRepoUrl(), run.getCommitSha(),
                    CheckNames.of(prefix, target.getTargetKey(), run.getIdentifier()),
                    CommitState.FAILURE, reason, runService.resultUrl(target));
        }
        runs.values().forEach(stateMachine::aggregate);
    }
}
