package com.forgebot.worker.dispatch;

import com.forgebot.worker.Fixtures;
import com.forgebot.worker.RecordingTaskContext;
import com.forgebot.worker.event.Event;
import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.handler.HandlerContext;
import com.forgebot.worker.handler.HandlerRegistry;
import com.forgebot.worker.handler.JobHandler;
import com.forgebot.worker.handler.TaskResult;
import com.forgebot.worker.jobs.JobTrigger;
import com.forgebot.worker.jobs.JobType;
import com.forgebot.worker.jobs.PackageConfig;
import com.forgebot.worker.retry.RetriesExhaustedException;
import com.forgebot.worker.retry.RetryControllerFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HandlerRunnerTest {

    @Mock HandlerRegistry registry;
    @Mock JobHandler      handler;

    SimpleMeterRegistry meters;
    HandlerRunner       runner;

    final HandlerInvocation invocation = new HandlerInvocation("build",
            PackageConfig.of("hello"),
            Fixtures.job(JobType.BUILD, JobTrigger.PULL_REQUEST, "fedora-40-x86_64"),
            Event.builder(EventKind.PULL_REQUEST).repoUrl(Fixtures.REPO).commitSha("abc123").build(),
            Map.of("run_id", "0b6f0d5c-0a8e-4a8c-9d69-0c0d8f7f4d11"));

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        runner = new HandlerRunner(registry, new RetryControllerFactory(2, 120), meters);
        when(registry.get("build")).thenReturn(handler);
    }

    private double runs(String status) {
        var counter = meters.find("forgebot.handler.runs").tags("handler", "build", "status", status).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void run_preCheckFails_handlerNotRun() {
        when(handler.preCheck(any())).thenReturn(false);

        TaskResult result = runner.run(invocation, new RecordingTaskContext(0));

        assertThat(result.outcome()).isEqualTo(TaskResult.Outcome.SKIPPED);
        verify(handler, never()).run(any());
        assertThat(runs("skipped")).isEqualTo(1.0);
    }

    @Test
    void run_passesStateAndEventToHandler() {
        when(handler.preCheck(any())).thenReturn(true);
        when(handler.run(any())).thenReturn(TaskResult.ok("done"));

        TaskResult result = runner.run(invocation, new RecordingTaskContext(1, invocation.state()));

        ArgumentCaptor<HandlerContext> ctx = ArgumentCaptor.forClass(HandlerContext.class);
        verify(handler).run(ctx.capture());
        assertThat(ctx.getValue().resumeRunId()).hasToString("0b6f0d5c-0a8e-4a8c-9d69-0c0d8f7f4d11");
        assertThat(ctx.getValue().retry().retries()).isEqualTo(1);
        assertThat(result.success()).isTrue();
        assertThat(runs("success")).isEqualTo(1.0);
        assertThat(meters.find("forgebot.handler.duration").tag("handler", "build").timer().count()).isEqualTo(1);
        assertThat(MDC.get("handler")).isNull();
    }

    @Test
    void run_unclassifiedError_retriedWithDefaultBackoff() {
        when(handler.preCheck(any())).thenReturn(true);
        when(handler.run(any())).thenThrow(new IllegalStateException("boom"));
        RecordingTaskContext task = new RecordingTaskContext(0);

        TaskResult result = runner.run(invocation, task);

        assertThat(result.outcome()).isEqualTo(TaskResult.Outcome.RETRYING);
        assertThat(task.countdowns).containsExactly(Duration.ofSeconds(120));
        assertThat(runs("retrying")).isEqualTo(1.0);
    }

    @Test
    void run_unclassifiedErrorOnLastTry_reportedAsFailure() {
        when(handler.preCheck(any())).thenReturn(true);
        when(handler.run(any())).thenThrow(new IllegalStateException("boom"));
        RecordingTaskContext task = new RecordingTaskContext(2);

        TaskResult result = runner.run(invocation, task);

        assertThat(result.outcome()).isEqualTo(TaskResult.Outcome.FAILURE);
        assertThat(result.details()).isEqualTo("boom");
        assertThat(task.countdowns).isEmpty();
        assertThat(runs("error")).isEqualTo(1.0);
    }

    @Test
    void run_errorAfterHandlerScheduledRetry_noSecondReschedule() {
        when(handler.preCheck(any())).thenReturn(true);
        when(handler.run(any())).thenAnswer(inv -> {
            HandlerContext ctx = inv.getArgument(0);
            ctx.retry().retry(new RuntimeException("not yet"), Map.of("run_id", "x"));
            throw new IllegalStateException("late failure");
        });
        RecordingTaskContext task = new RecordingTaskContext(0);

        TaskResult result = runner.run(invocation, task);

        assertThat(result.outcome()).isEqualTo(TaskResult.Outcome.RETRYING);
        assertThat(task.countdowns).hasSize(1);
    }

    @Test
    void run_retriesExhausted_reportedAsFailure() {
        when(handler.preCheck(any())).thenReturn(true);
        when(handler.run(any())).thenThrow(new RetriesExhaustedException(3, new RuntimeException("archive missing")));

        TaskResult result = runner.run(invocation, new RecordingTaskContext(2));

        assertThat(result.outcome()).isEqualTo(TaskResult.Outcome.FAILURE);
    }
}
