package com.forgebot.worker.handler.impl;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.event.EventKind;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Starts a downstream build when a configured dist-git branch is pushed to,
 * or on a {@code koji-build} comment in a dist-git pull-request.
 *
 * Pushes that come from a merged pull-request are allowed when the PR author
 * is on the job's allow-list; direct pushes when the committer is. Comment
 * authors may be on either list.
 */
@Component
public class KojiBuildHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(KojiBuildHandler.class);

    public static final String NAME = "koji_build";

    static final HandlerDescriptor DESCRIPTOR = HandlerDescriptor.builder(NAME)
            .configuredAs(JobType.KOJI_BUILD)
            .reactsTo(EventKind.DIST_GIT_PUSH, EventKind.DIST_GIT_PR_COMMENT)
            .commentCommands("koji-build")
            .build();

    private final OperationExecutor operations;
    private final StatusReporter    reporter;
    private final IssueNotifier     issues;

    public KojiBuildHandler(OperationExecutor operations, StatusReporter reporter, IssueNotifier issues) {
        this.operations = operations;
        this.reporter   = reporter;
        this.issues     = issues;
    }

    @Override
    public HandlerDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public boolean preCheck(HandlerContext ctx) {
        Event     event = ctx.event();
        JobConfig job   = ctx.jobConfig();

        if (event.gitRef() == null || !job.targets().contains(event.gitRef())) {
            log.info("Skipping build on '{}', not configured in {}", event.gitRef(), job.targets());
            return false;
        }

        if (event.kind().isComment()) {
            boolean allowed = job.allowedPrAuthors().contains(event.actor())
                    || job.allowedCommitters().contains(event.actor());
            if (!allowed) {
                log.info("Comment author '{}' may not trigger a build", event.actor());
            }
            return allowed;
        }

        if (event.prAuthor() != null) {
            if (!job.allowedPrAuthors().contains(event.prAuthor())) {
                log.info("Push from a pull-request by '{}' not in allowed authors {}",
                        event.prAuthor(), job.allowedPrAuthors());
                return false;
            }
        } else if (!job.allowedCommitters().contains(event.actor())) {
            log.info("Direct push by '{}' not in allowed committers {}",
                    event.actor(), job.allowedCommitters());
            return false;
        }
        return true;
    }

    @Override
    public TaskResult run(HandlerContext ctx) {
        Event  event     = ctx.event();
        String branch    = event.gitRef();
        String checkName = CheckNames.of(CheckNames.KOJI_BUILD, branch, ctx.jobConfig().identifier());
        try {
            Submission build = operations.kojiBuild(ctx.packageConfig(), branch, event.commitSha(),
                    ctx.jobConfig().scratch());
            reporter.report(event.repoUrl(), event.commitSha(), checkName, CommitState.RUNNING,
                    "Build submitted.", build.url());
            return TaskResult.ok("Build " + build.correlationId() + " submitted from " + branch);

        } catch (RuntimeException e) {
            if (ctx.retry().isLastTry()) {
                reporter.report(event.repoUrl(), event.commitSha(), checkName, CommitState.FAILURE,
                        "Build failed to be submitted: " + e.getMessage(), null);
                String repo = ctx.jobConfig().issueRepository();
                if (repo != null) {
                    issues.openIssue(repo,
                            "[forgebot] Build of " + ctx.packageConfig().packageName() + " from "
                                    + branch + " failed",
                            "Submitting the build of commit `" + event.commitSha() + "` from branch `"
                                    + branch + "` failed:\n\n```\n" + e.getMessage() + "\n```\n");
                }
            }
            throw e;
        }
    }
}
