package com.forgebot.worker.handler.impl;

import com.forgebot.worker.RecordingTaskContext;
import com.forgebot.worker.event.Event;
import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.external.CommitState;
import com.forgebot.worker.external.IssueNotifier;
import com.forgebot.worker.external.OperationException;
import com.forgebot.worker.external.OperationExecutor;
import com.forgebot.worker.external.StatusReporter;
import com.forgebot.worker.external.Submission;
import com.forgebot.worker.handler.HandlerContext;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.JobTrigger;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.jobs.PackageConfig;
import com.forgebot.worker.retry.RetryController;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KojiBuildHandlerTest {

    private static final String DIST_GIT = "https://src.fedoraproject.org/rpms/hello";

    @Mock OperationExecutor operations;
    @Mock StatusReporter    reporter;
    @Mock IssueNotifier     issues;

    @InjectMocks KojiBuildHandler handler;

    final JobConfig job = new JobConfig(JobType.KOJI_BUILD, JobTrigger.COMMIT, List.of("f40", "rawhide"),
            null, Set.of("packit"), Set.of("maintainer"), false, "https://github.com/org/hello", null);
    final PackageConfig pkg = PackageConfig.of("hello", job);

    private static Event push(String branch, String actor, String prAuthor) {
        return Event.builder(EventKind.DIST_GIT_PUSH).repoUrl(DIST_GIT).commitSha("def456")
                .gitRef(branch).actor(actor).prAuthor(prAuthor).build();
    }

    private HandlerContext context(Event event, int attempt) {
        RecordingTaskContext task = new RecordingTaskContext(attempt);
        return new HandlerContext(pkg, job, event, new RetryController(task, 2, 120), task.state());
    }

    @Test
    void preCheck_branchMustBeConfigured() {
        assertThat(handler.preCheck(context(push("f39", "maintainer", null), 0))).isFalse();
        assertThat(handler.preCheck(context(push("f40", "maintainer", null), 0))).isTrue();
    }

    @Test
    void preCheck_pushFromPullRequest_checksPrAuthor() {
        assertThat(handler.preCheck(context(push("f40", "merger", "packit"), 0))).isTrue();
        assertThat(handler.preCheck(context(push("f40", "merger", "stranger"), 0))).isFalse();
    }

    @Test
    void preCheck_directPush_checksCommitter() {
        assertThat(handler.preCheck(context(push("rawhide", "stranger", null), 0))).isFalse();
    }

    @Test
    void preCheck_comment_acceptsEitherAllowList() {
        Event byAuthor = Event.builder(EventKind.DIST_GIT_PR_COMMENT).gitRef("f40").actor("packit").build();
        Event byCommitter = Event.builder(EventKind.DIST_GIT_PR_COMMENT).gitRef("f40").actor("maintainer").build();
        Event byStranger = Event.builder(EventKind.DIST_GIT_PR_COMMENT).gitRef("f40").actor("stranger").build();

        assertThat(handler.preCheck(context(byAuthor, 0))).isTrue();
        assertThat(handler.preCheck(context(byCommitter, 0))).isTrue();
        assertThat(handler.preCheck(context(byStranger, 0))).isFalse();
    }

    @Test
    void run_submitsBuildAndReportsRunning() {
        when(operations.kojiBuild(pkg, "f40", "def456", false)).thenReturn(new Submission("9001", "https://koji/9001"));

        TaskResult result = handler.run(context(push("f40", "maintainer", null), 0));

        assertThat(result.success()).isTrue();
        verify(reporter).report(DIST_GIT, "def456", "koji-build:f40", CommitState.RUNNING,
                "Build submitted.", "https://koji/9001");
    }

    @Test
    void run_failureBeforeLastTry_rethrowsWithoutNotifying() {
        when(operations.kojiBuild(any(), anyString(), anyString(), anyBoolean()))
                .thenThrow(new OperationException("koji unreachable"));

        assertThatThrownBy(() -> handler.run(context(push("f40", "maintainer", null), 0)))
                .isInstanceOf(OperationException.class);

        verify(issues, never()).openIssue(anyString(), anyString(), anyString());
        verify(reporter, never()).report(anyString(), anyString(), anyString(), eq(CommitState.FAILURE),
                anyString(), any());
    }

    @Test
    void run_failureOnLastTry_reportsAndOpensIssue() {
        when(operations.kojiBuild(any(), anyString(), anyString(), anyBoolean()))
                .thenThrow(new OperationException("koji unreachable"));

        assertThatThrownBy(() -> handler.run(context(push("f40", "maintainer", null), 2)))
                .isInstanceOf(OperationException.class);

        verify(reporter).report(eq(DIST_GIT), eq("def456"), eq("koji-build:f40"), eq(CommitState.FAILURE),
                contains("koji unreachable"), isNull());
        verify(issues).openIssue(eq("https://github.com/org/hello"), contains("hello"), contains("koji unreachable"));
    }
}
