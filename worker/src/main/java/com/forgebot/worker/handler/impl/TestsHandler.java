package com.forgebot.worker.handler.impl;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.external.ArtifactNotReadyException;
import com.forgebot.worker.external.CommitState;
import com.forgebot.worker.external.ExternalServiceException;
import com.forgebot.worker.external.OperationExecutor;
import com.forgebot.worker.external.StatusReporter;
import com.forgebot.worker.external.Submission;
import com.forgebot.worker.handler.CheckNames;
import com.forgebot.worker.handler.HandlerContext;
import com.forgebot.worker.handler.HandlerDescriptor;
import com.forgebot.worker.handler.JobHandler;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.logging.TargetLogCapture;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.model.TargetStatus;
import com.forgebot.worker.service.RunService;
import com.forgebot.worker.service.TargetStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Submits one test run per chroot.
 *
 * Chroots are submitted one after another and fail independently. Chroots
 * that hit a transient failure wait in RETRY; once the loop is done a single
 * retry is scheduled for all of them, carrying the Run id.
 */
@Component
public class TestsHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(TestsHandler.class);

    public static final String NAME = "tests";

    static final HandlerDescriptor DESCRIPTOR = HandlerDescriptor.builder(NAME)
            .configuredAs(JobType.TESTS)
            .reactsTo(EventKind.PULL_REQUEST, EventKind.PUSH, EventKind.PULL_REQUEST_COMMENT,
                    EventKind.CHECK_RERUN_PULL_REQUEST, EventKind.CHECK_RERUN_COMMIT)
            .commentCommands("test")
            .checkRerunPrefixes(CheckNames.TESTING_FARM)
            .build();

    private static final Set<TargetStatus> PENDING =
            EnumSet.of(TargetStatus.QUEUED, TargetStatus.RUNNING, TargetStatus.RETRY);

    private final RunService         runService;
    private final TargetStateMachine stateMachine;
    private final OperationExecutor  operations;
    private final StatusReporter     reporter;

    public TestsHandler(RunService runService, TargetStateMachine stateMachine,
                        OperationExecutor operations, StatusReporter reporter) {
        this.runService   = runService;
        this.stateMachine = stateMachine;
        this.operations   = operations;
        this.reporter     = reporter;
    }

    @Override
    public HandlerDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public boolean preCheck(HandlerContext ctx) {
        if (ctx.jobConfig().targets().isEmpty() || ctx.event().commitSha() == null) {
            log.info("No chroots or no commit to test, skipping");
            return false;
        }
        return true;
    }

    @Override
    public TaskResult run(HandlerContext ctx) {
        Event event = ctx.event();
        Run run = runService.resumeOrCreate(ctx.resumeRunId(), NAME, ctx.packageConfig(),
                ctx.jobConfig(), event, TargetKind.TEST_RUN, ctx.jobConfig().targets());

        List<String> failed = new ArrayList<>();
        RuntimeException transientError = null;
        for (Target target : runService.targets(run.getId())) {
            if (!PENDING.contains(target.getStatus()) || !stateMachine.start(target)) {
                continue;
            }
            String checkName = CheckNames.of(CheckNames.TESTING_FARM, target.getTargetKey(),
                    ctx.jobConfig().identifier());
            try (TargetLogCapture capture = TargetLogCapture.start(target.getId())) {
                try {
                    Submission pipeline = operations.submitTestRun(ctx.packageConfig(), event.commitSha(),
                            target.getTargetKey());
                    stateMachine.submit(target, pipeline.correlationId(), pipeline.url());
                    reporter.report(event.repoUrl(), event.commitSha(), checkName, CommitState.RUNNING,
                            "Tests have been submitted.", pipeline.url());
                    log.info("Test run {} submitted for {}", pipeline.correlationId(), target.getTargetKey());

                } catch (ArtifactNotReadyException | ExternalServiceException e) {
                    if (ctx.retry().isLastTry()) {
                        fail(ctx, target, checkName, e, failed);
                    } else {
                        log.info("Test run for {} will be retried: {}", target.getTargetKey(), e.getMessage());
                        stateMachine.retry(target);
                        transientError = e;
                    }

                } catch (RuntimeException e) {
                    fail(ctx, target, checkName, e, failed);

                } finally {
                    stateMachine.finish(target, capture.logs());
                }
            }
        }

        if (transientError != null) {
            ctx.retry().retry(transientError, Map.of(HandlerContext.RUN_ID, run.getId().toString()));
            return TaskResult.retrying("Some test runs will be retried: " + transientError.getMessage());
        }
        stateMachine.aggregate(run);
        return failed.isEmpty()
                ? TaskResult.ok("Test runs submitted for run " + run.getId())
                : TaskResult.failure("Test run submission failed for " + failed);
    }

    private void fail(HandlerContext ctx, Target target, String checkName, RuntimeException e,
                      List<String> failed) {
        log.error("Submitting tests for {} failed: {}", target.getTargetKey(), e.getMessage(), e);
        stateMachine.fail(target, e.getMessage());
        failed.add(target.getTargetKey());
        reporter.report(ctx.event().repoUrl(), ctx.event().commitSha(), checkName, CommitState.FAILURE,
                "Failed to submit tests: " + e.getMessage(), runService.resultUrl(target));
    }
}
