package com.forgebot.worker.handler;

import com.forgebot.worker.jobs.JobConfig;
import com.forgebot.worker.jobs.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Adds prerequisite jobs nobody configured.
 *
 * If a package only configures {@code tests} but the build handlers declare
 * themselves required-for {@code tests}, a {@code build} job is synthesized
 * by cloning the tests job's trigger, targets and scratch flag. A prerequisite
 * type is synthesized at most once per package and never when a job of that
 * type is already configured.
 */
@Component
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * @param jobs        the package's jobs, in declaration order
     * @param requiredFor job type → descriptors that are a prerequisite of that type
     * @return synthesized jobs, ordered by the dependent job they were cloned from
     */
    public List<JobConfig> resolve(List<JobConfig> jobs,
                                   Map<JobType, List<HandlerDescriptor>> requiredFor) {
        Set<JobType> configured = jobs.stream()
                .map(JobConfig::type)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(JobType.class)));

        Set<JobType> synthesized = EnumSet.noneOf(JobType.class);
        List<JobConfig> result = new ArrayList<>();

        for (JobConfig dependent : jobs) {
            for (HandlerDescriptor prerequisite : requiredFor.getOrDefault(dependent.type(), List.of())) {
                // sorted for a stable order when a descriptor claims several types
                for (JobType type : prerequisite.configuredAs().stream().sorted().toList()) {
                    if (configured.contains(type) || !synthesized.add(type)) {
                        continue;
                    }
                    log.debug("Synthesizing {} job as prerequisite of configured {} job",
                            type, dependent.type());
                    result.add(dependent.asPrerequisite(type));
                }
            }
        }
        return result;
    }
}
