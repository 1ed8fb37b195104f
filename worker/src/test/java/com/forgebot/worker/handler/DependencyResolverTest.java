package com.forgebot.worker.handler;

import com.forgebot.worker.event.EventKind;
import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.JobTrigger;
import com.forgebot.worker.jobs.JobType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.forgebot.worker.Fixtures.job;
import static org.assertj.core.api.Assertions.assertThat;

class DependencyResolverTest {

    private static final HandlerDescriptor BUILD = HandlerDescriptor.builder("build")
            .configuredAs(JobType.BUILD).requiredFor(JobType.TESTS).reactsTo(EventKind.PULL_REQUEST).build();
    private static final HandlerDescriptor BUILD_END = HandlerDescriptor.builder("build_end")
            .configuredAs(JobType.BUILD).requiredFor(JobType.TESTS).reactsTo(EventKind.BUILD_END).build();

    private final DependencyResolver resolver = new DependencyResolver();

    @Test
    void missingPrerequisite_isSynthesizedOnceFromTheFirstDependent() {
        JobConfig smoke = job(JobType.TESTS, JobTrigger.PULL_REQUEST, "fedora-39-x86_64").withIdentifier("smoke");
        JobConfig full  = job(JobType.TESTS, JobTrigger.PULL_REQUEST, "fedora-40-x86_64").withIdentifier("full");

        List<JobConfig> result = resolver.resolve(List.of(smoke, full),
                Map.of(JobType.TESTS, List.of(BUILD, BUILD_END)));

        assertThat(result).hasSize(1);
        JobConfig build = result.get(0);
        assertThat(build.type()).isEqualTo(JobType.BUILD);
        assertThat(build.trigger()).isEqualTo(JobTrigger.PULL_REQUEST);
        assertThat(build.targets()).containsExactly("fedora-39-x86_64");
        assertThat(build.derivedFrom()).isEqualTo(JobType.TESTS);
    }

    @Test
    void configuredPrerequisite_isNotSynthesized() {
        List<JobConfig> result = resolver.resolve(
                List.of(job(JobType.TESTS, JobTrigger.PULL_REQUEST, "f39"),
                        job(JobType.BUILD, JobTrigger.PULL_REQUEST, "f39")),
                Map.of(JobType.TESTS, List.of(BUILD)));

        assertThat(result).isEmpty();
    }

    @Test
    void noDependentConfigured_nothingToSynthesize() {
        List<JobConfig> result = resolver.resolve(
                List.of(job(JobType.PROPOSE_DOWNSTREAM, JobTrigger.RELEASE, "f39")),
                Map.of(JobType.TESTS, List.of(BUILD)));

        assertThat(result).isEmpty();
    }
}
