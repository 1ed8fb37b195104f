package com.forgebot.worker.handler.impl;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.external.ArtifactNotReadyException;
import com.forgebot.worker.external.CommitState;
import com.forgebot.worker.external.IssueNotifier;
import com.forgebot.worker.external.OperationExecutor;
import com.forgebot.worker.external.StatusReporter;
import com.forgebot.worker.external.Submission;
import com.forgebot.worker.handler.CheckNames;
import com.forgebot.worker.handler.HandlerContext;
import com.forgebot.worker.handler.HandlerDescriptor;
import com.forgebot.worker.handler.JobHandler;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.logging.TargetLogCapture;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.RunStatus;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.model.TargetStatus;
import com.forgebot.worker.service.RunService;
import com.forgebot.worker.service.TargetStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Syncs an upstream release into every configured dist-git branch.
 *
 * One Run per release, one Target per branch, processed in branch order.
 * A branch whose source archive is not downloadable yet puts its Target in
 * RETRY and asks for another attempt carrying the Run id; that attempt
 * resumes the same Run and skips Targets that already reached a terminal
 * status. Any other failure is recorded on its Target and the loop carries
 * on with the next branch. Failed branches are reported in one issue.
 */
@Component
public class ProposeDownstreamHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(ProposeDownstreamHandler.class);

    public static final String NAME = "propose_downstream";

    static final HandlerDescriptor DESCRIPTOR = HandlerDescriptor.builder(NAME)
            .configuredAs(JobType.PROPOSE_DOWNSTREAM)
            .reactsTo(EventKind.RELEASE, EventKind.ISSUE_COMMENT, EventKind.CHECK_RERUN_RELEASE)
            .commentCommands("propose-downstream", "propose-update")
            .checkRerunPrefixes(CheckNames.PROPOSE_DOWNSTREAM)
            .build();

    // Targets a (re-)invocation still has to work on; SUBMITTED and ERROR are done.
    private static final Set<TargetStatus> PENDING =
            EnumSet.of(TargetStatus.QUEUED, TargetStatus.RUNNING, TargetStatus.RETRY);

    private final RunService         runService;
    private final TargetStateMachine stateMachine;
    private final OperationExecutor  operations;
    private final StatusReporter     reporter;
    private final IssueNotifier      issues;
    private final String             defaultBranch;
    private final String             commentPrefix;

    public ProposeDownstreamHandler(
            RunService runService,
            TargetStateMachine stateMachine,
            OperationExecutor operations,
            StatusReporter reporter,
            IssueNotifier issues,
            @Value("${forgebot.propose-downstream.default-branch:main}") String defaultBranch,
            @Value("${forgebot.comment-prefix:/packit}") String commentPrefix) {
        this.runService    = runService;
        this.stateMachine  = stateMachine;
        this.operations    = operations;
        this.reporter      = reporter;
        this.issues        = issues;
        this.defaultBranch = defaultBranch;
        this.commentPrefix = commentPrefix;
    }

    @Override
    public HandlerDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public boolean preCheck(HandlerContext ctx) {
        if (ctx.event().tagName() == null) {
            log.info("No release tag to propose downstream, skipping");
            return false;
        }
        if (branches(ctx.jobConfig(), ctx.event()).isEmpty()) {
            log.info("None of the configured branches is in the requested override {}",
                    ctx.event().branchesOverride());
            return false;
        }
        return true;
    }

    @Override
    public TaskResult run(HandlerContext ctx) {
        Event event = ctx.event();
        Run run = runService.resumeOrCreate(ctx.resumeRunId(), NAME, ctx.packageConfig(),
                ctx.jobConfig(), event, TargetKind.PROPOSE_DOWNSTREAM,
                branches(ctx.jobConfig(), event));

        Map<String, String> errors = new LinkedHashMap<>();
        for (Target target : runService.targets(run.getId())) {
            if (!PENDING.contains(target.getStatus())) {
                log.debug("Branch {} already {}, skipping", target.getTargetKey(), target.getStatus());
                continue;
            }
            if (processTarget(ctx, run, target, errors)) {
                return TaskResult.retrying("Not able to download the archive yet, task will be retried.");
            }
        }

        if (!errors.isEmpty()) {
            reportFailedBranches(ctx, errors);
        }
        RunStatus status = stateMachine.aggregate(run);

        return errors.isEmpty()
                ? TaskResult.ok("Propose downstream finished, run " + run.getId() + " " + status)
                : TaskResult.failure("Propose downstream failed for branches " + errors.keySet());
    }

    // ------------------------------------------------------------------
    // Per-target processing
    // ------------------------------------------------------------------

    /** @return true if a retry of the whole invocation has been scheduled */
    private boolean processTarget(HandlerContext ctx, Run run, Target target, Map<String, String> errors) {
        Event  event     = ctx.event();
        String branch    = target.getTargetKey();
        String checkName = CheckNames.of(CheckNames.PROPOSE_DOWNSTREAM, branch, ctx.jobConfig().identifier());
        String url       = runService.resultUrl(target);

        if (!stateMachine.start(target)) {
            return false;
        }
        try (TargetLogCapture capture = TargetLogCapture.start(target.getId())) {
            try {
                reporter.report(event.repoUrl(), event.commitSha(), checkName, CommitState.RUNNING,
                        "Starting propose downstream...", url);

                Submission submission = operations.proposeDownstream(ctx.packageConfig(),
                        event.tagName(), branch);
                stateMachine.submit(target, submission.correlationId(), submission.url());
                reporter.report(event.repoUrl(), event.commitSha(), checkName, CommitState.SUCCESS,
                        "Propose downstream finished successfully.",
                        submission.url() != null ? submission.url() : url);
                log.info("Branch {} proposed: {}", branch, submission.url());

            } catch (ArtifactNotReadyException e) {
                if (!ctx.retry().isLastTry()) {
                    log.info("Archive not available yet for {}: {}", branch, e.getMessage());
                    stateMachine.retry(target);
                    reporter.report(event.repoUrl(), event.commitSha(), checkName, CommitState.PENDING,
                            "Propose downstream is being retried because we were not able yet "
                                    + "to download the archive.", url);
                    ctx.retry().retry(e, Map.of(HandlerContext.RUN_ID, run.getId().toString()));
                    return true;
                }
                recordError(ctx, target, checkName, url, e, errors);

            } catch (RuntimeException e) {
                recordError(ctx, target, checkName, url, e, errors);

            } finally {
                stateMachine.finish(target, capture.logs());
            }
        }
        return false;
    }

    private void recordError(HandlerContext ctx, Target target, String checkName, String url,
                             RuntimeException e, Map<String, String> errors) {
        log.error("Propose downstream to {} failed: {}", target.getTargetKey(), e.getMessage(), e);
        stateMachine.fail(target, e.getMessage());
        errors.put(target.getTargetKey(), String.valueOf(e.getMessage()));
        reporter.report(ctx.event().repoUrl(), ctx.event().commitSha(), checkName, CommitState.FAILURE,
                "Propose downstream failed: " + e.getMessage(), url);
    }

    private void reportFailedBranches(HandlerContext ctx, Map<String, String> errors) {
        StringBuilder body = new StringBuilder();
        body.append("Propose downstream of release ").append(ctx.event().tagName())
                .append(" failed for the following branches:\n\n")
                .append("| dist-git branch | error |\n")
                .append("| --------------- | ----- |\n");
        errors.forEach((branch, error) -> body.append("| `").append(branch).append("` | ```")
                .append(error.replace("\n", " ")).append("``` |\n"));
        body.append("\nYou can retrigger the update by adding a comment (`")
                .append(commentPrefix).append(" propose-downstream`) into this issue.\n");

        String repo = ctx.packageConfig().upstreamRepoUrl() != null
                ? ctx.packageConfig().upstreamRepoUrl() : ctx.event().repoUrl();
        issues.openIssue(repo,
                "[forgebot] Propose downstream failed for release " + ctx.event().tagName(),
                body.toString());
    }

    /** Configured branches (or the default one), narrowed by the event's override, sorted. */
    List<String> branches(JobConfig job, Event event) {
        Set<String> branches = job.targets().isEmpty()
                ? new TreeSet<>(List.of(defaultBranch))
                : new TreeSet<>(job.targets());
        if (!event.branchesOverride().isEmpty()) {
            branches.retainAll(event.branchesOverride());
        }
        return List.copyOf(branches);
    }
}
