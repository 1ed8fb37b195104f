package com.forgebot.worker.handler.impl;

import com.forgebot.worker.Fixtures;
import com.forgebot.worker.event.Event;
import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.event.JobOutcome;
import com.forgebot.worker.external.CommitState;
import com.forgebot.worker.external.StatusReporter;
import com.forgebot.worker.handler.HandlerContext;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.JobTrigger;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.jobs.PackageConfig;
import com.forgebot.worker.model.Run;
import com.forgebot.worker.model.RunStatus;
import com.forgebot.worker.model.Target;
import com.forgebot.worker.model.TargetKind;
import com.forgebot.worker.model.TargetStatus;
import com.forgebot.worker.service.RunService;
import com.forgebot.worker.service.TargetStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompletionHandlerTest {

    @Mock RunService         runService;
    @Mock TargetStateMachine stateMachine;
    @Mock StatusReporter     reporter;

    BuildEndHandler    buildEnd;
    TestResultsHandler testResults;

    final JobConfig     buildJob = Fixtures.job(JobType.BUILD, JobTrigger.PULL_REQUEST, "f39", "f40");
    final PackageConfig pkg      = PackageConfig.of("hello", buildJob);

    Run          run;
    List<Target> builds;

    @BeforeEach
    void setUp() {
        buildEnd    = new BuildEndHandler(runService, stateMachine, reporter);
        testResults = new TestResultsHandler(runService, stateMachine, reporter);
        run = Fixtures.run(BuildHandler.NAME, JobType.BUILD, JobTrigger.PULL_REQUEST);
        builds = List.of(
                Fixtures.target(run, TargetKind.BUILD, "f39", 0, TargetStatus.SUBMITTED),
                Fixtures.target(run, TargetKind.BUILD, "f40", 1, TargetStatus.SUBMITTED));
        builds.forEach(t -> t.setCorrelationId("4242"));

        StateMachineStubs.realistic(stateMachine, r -> builds);
        lenient().when(runService.resultUrl(any())).thenReturn("https://dash.example.org/runs/targets/x");
    }

    private static Event buildEnd(String chroot, JobOutcome outcome) {
        return Event.builder(EventKind.BUILD_END).correlationId("4242").targetKey(chroot)
                .outcome(outcome).resultUrl("https://copr/build/4242").build();
    }

    private HandlerContext context(Event event) {
        return new HandlerContext(pkg, buildJob, event, null, null);
    }

    @Test
    void buildEnd_completesOnlyTheMatchingChroot() {
        when(runService.targetsByCorrelationId(TargetKind.BUILD, "4242")).thenReturn(builds);

        TaskResult result = buildEnd.run(context(buildEnd("f40", JobOutcome.FAILURE)));

        assertThat(result.success()).isTrue();
        assertThat(builds).extracting(Target::getStatus)
                .containsExactly(TargetStatus.SUBMITTED, TargetStatus.FAILURE);
        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        verify(reporter).report(Fixtures.REPO, "abc123", "rpm-build:f40", CommitState.FAILURE,
                "RPMs failed to be built.", "https://copr/build/4242");
    }

    @Test
    void buildEnd_lastChrootCompletes_runFinishes() {
        builds.get(0).setStatus(TargetStatus.SUCCESS);
        when(runService.targetsByCorrelationId(TargetKind.BUILD, "4242")).thenReturn(builds);

        buildEnd.run(context(buildEnd("f40", JobOutcome.SUCCESS)));

        assertThat(run.getStatus()).isEqualTo(RunStatus.FINISHED);
    }

    @Test
    void buildEnd_targetAlreadyTerminal_resultIgnored() {
        builds.get(1).setStatus(TargetStatus.ERROR);
        when(runService.targetsByCorrelationId(TargetKind.BUILD, "4242")).thenReturn(builds);

        buildEnd.run(context(buildEnd("f40", JobOutcome.SUCCESS)));

        assertThat(builds.get(1).getStatus()).isEqualTo(TargetStatus.ERROR);
        verify(stateMachine, never()).complete(any(), any());
        verify(reporter, never()).report(anyString(), anyString(), anyString(), any(), anyString(), anyString());
    }

    @Test
    void buildEnd_withoutOutcome_countsAsError() {
        when(runService.targetsByCorrelationId(TargetKind.BUILD, "4242")).thenReturn(builds);

        buildEnd.run(context(buildEnd(null, null)));

        assertThat(builds).extracting(Target::getStatus).containsOnly(TargetStatus.ERROR);
        assertThat(run.getStatus()).isEqualTo(RunStatus.ERROR);
    }

    @Test
    void testResults_unknownCorrelationId_isSkipped() {
        when(runService.targetsByCorrelationId(TargetKind.TEST_RUN, "nope")).thenReturn(List.of());
        Event event = Event.builder(EventKind.TEST_RESULTS).correlationId("nope").outcome(JobOutcome.SUCCESS).build();

        TaskResult result = testResults.run(new HandlerContext(pkg,
                Fixtures.job(JobType.TESTS, JobTrigger.PULL_REQUEST, "f39"), event, null, null));

        assertThat(result.outcome()).isEqualTo(TaskResult.Outcome.SKIPPED);
        verify(stateMachine, never()).aggregate(any());
    }
}
