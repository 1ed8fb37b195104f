package com.forgebot.worker.handler.impl;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.external.CommitState;
import com.forgebot.worker.external.OperationException;
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
 * Submits one external build covering every configured chroot.
 *
 * Each chroot gets its own Target; all of them share the build id as their
 * correlation id, so the reconciliation loop queries the build farm once per
 * build. Completion arrives later through {@link BuildEndHandler}.
 *
 * Also runs as a prerequisite when only a tests job is configured.
 */
@Component
public class BuildHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(BuildHandler.class);

    public static final String NAME = "build";

    static final HandlerDescriptor DESCRIPTOR = HandlerDescriptor.builder(NAME)
            .configuredAs(JobType.BUILD)
            .requiredFor(JobType.TESTS)
            .reactsTo(EventKind.PULL_REQUEST, EventKind.PUSH, EventKind.RELEASE,
                    EventKind.PULL_REQUEST_COMMENT, EventKind.CHECK_RERUN)
            .commentCommands("build", "copr-build")
            .checkRerunPrefixes(CheckNames.RPM_BUILD)
            .build();

    private static final Set<TargetStatus> PENDING =
            EnumSet.of(TargetStatus.QUEUED, TargetStatus.RUNNING, TargetStatus.RETRY);

    private final RunService         runService;
    private final TargetStateMachine stateMachine;
    private final OperationExecutor  operations;
    private final StatusReporter     reporter;

    public BuildHandler(RunService runService, TargetStateMachine stateMachine,
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
        if (ctx.jobConfig().targets().isEmpty()) {
            log.info("No chroots configured for the build job, skipping");
            return false;
        }
        if (ctx.event().commitSha() == null) {
            log.info("Event carries no commit to build, skipping");
            return false;
        }
        return true;
    }

    @Override
    public TaskResult run(HandlerContext ctx) {
        Event event = ctx.event();
        Run run = runService.resumeOrCreate(ctx.resumeRunId(), NAME, ctx.packageConfig(),
                ctx.jobConfig(), event, TargetKind.BUILD, ctx.jobConfig().targets());

        List<Target> pending = new ArrayList<>();
        for (Target target : runService.targets(run.getId())) {
            if (PENDING.contains(target.getStatus()) && stateMachine.start(target)) {
                pending.add(target);
            }
        }
        if (pending.isEmpty()) {
            return TaskResult.ok("Nothing left to build in run " + run.getId());
        }
        List<String> chroots = pending.stream().map(Target::getTargetKey).toList();

        Submission build = null;
        RuntimeException error = null;
        try {
            build = operations.submitBuild(ctx.packageConfig(), event.commitSha(),
                    chroots, ctx.jobConfig().scratch());
            log.info("Build {} submitted for {}", build.correlationId(), chroots);
        } catch (RuntimeException e) {
            error = e;
        }
        // rejected submissions are final; anything else is tried again on the same run
        boolean retrying = error != null && !(error instanceof OperationException)
                && !ctx.retry().isLastTry();

        for (Target target : pending) {
            try (TargetLogCapture capture = TargetLogCapture.start(target.getId())) {
                try {
                    if (error == null) {
                        submitted(ctx, target, build);
                    } else if (retrying) {
                        retried(ctx, target, error);
                    } else {
                        failed(ctx, target, error);
                    }
                } finally {
                    stateMachine.finish(target, capture.logs());
                }
            }
        }

        if (retrying) {
            ctx.retry().retry(error, Map.of(HandlerContext.RUN_ID, run.getId().toString()));
            return TaskResult.retrying("Build submission failed, task will be retried: " + error.getMessage());
        }
        stateMachine.aggregate(run);
        return error == null
                ? TaskResult.ok("Build " + build.correlationId() + " submitted for " + chroots)
                : TaskResult.failure("Build submission failed: " + error.getMessage());
    }

    private void submitted(HandlerContext ctx, Target target, Submission build) {
        stateMachine.submit(target, build.correlationId(), build.url());
        report(ctx, target, CommitState.RUNNING, "Build submitted, waiting for results.", build.url());
        log.info("Chroot {} is part of build {}", target.getTargetKey(), build.correlationId());
    }

    private void retried(HandlerContext ctx, Target target, RuntimeException e) {
        log.info("Build for {} will be retried: {}", target.getTargetKey(), e.getMessage());
        stateMachine.retry(target);
        report(ctx, target, CommitState.PENDING, "Build submission will be retried.",
                runService.resultUrl(target));
    }

    private void failed(HandlerContext ctx, Target target, RuntimeException e) {
        log.error("Build submission for {} failed: {}", target.getTargetKey(), e.getMessage(), e);
        stateMachine.fail(target, e.getMessage());
        report(ctx, target, CommitState.FAILURE, "Submit of the build failed: " + e.getMessage(),
                runService.resultUrl(target));
    }

    private void report(HandlerContext ctx, Target target, CommitState state, String description, String url) {
        reporter.report(ctx.event().repoUrl(), ctx.event().commitSha(),
                CheckNames.of(CheckNames.RPM_BUILD, target.getTargetKey(), ctx.jobConfig().identifier()),
                state, description, url);
    }
}
