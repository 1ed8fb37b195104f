package com.forgebot.worker.jobs;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One configured job of a package.
 *
 * @param type              job type; many handlers may be configured for one type
 * @param trigger           repository activity this job reacts to
 * @param targets           dist-git branches or build chroots, depending on the type
 * @param identifier        optional name telling apart several jobs of the same type
 * @param allowedPrAuthors  authors whose merged pull-requests may trigger the job
 * @param allowedCommitters committers whose direct pushes may trigger the job
 * @param scratch           scratch build instead of a real one
 * @param issueRepository   repository where failures are reported as issues (optional)
 * @param derivedFrom       set on configs synthesized for a prerequisite: the job type
 *                          of the configured job they were cloned from, null otherwise
 */
public record JobConfig(
        JobType      type,
        JobTrigger   trigger,
        List<String> targets,
        String       identifier,
        Set<String>  allowedPrAuthors,
        Set<String>  allowedCommitters,
        boolean      scratch,
        String       issueRepository,
        JobType      derivedFrom) {

    public JobConfig {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(trigger, "trigger");
        targets           = targets == null ? List.of() : List.copyOf(targets);
        allowedPrAuthors  = allowedPrAuthors == null ? Set.of() : Set.copyOf(allowedPrAuthors);
        allowedCommitters = allowedCommitters == null ? Set.of() : Set.copyOf(allowedCommitters);
    }

    /** Shorthand for the common case: a plain job with targets and nothing else. */
    public static JobConfig of(JobType type, JobTrigger trigger, String... targets) {
        return new JobConfig(type, trigger, List.of(targets), null, null, null, false, null, null);
    }

    public JobConfig withIdentifier(String identifier) {
        return new JobConfig(type, trigger, targets, identifier, allowedPrAuthors,
                allowedCommitters, scratch, issueRepository, derivedFrom);
    }

    /**
     * Clone this job's trigger, targets and scratch settings into a job of another type.
     * Used for prerequisite jobs nobody configured explicitly.
     */
    public JobConfig asPrerequisite(JobType prerequisite) {
        return new JobConfig(prerequisite, trigger, targets, identifier, allowedPrAuthors,
                allowedCommitters, scratch, issueRepository, type);
    }

    @JsonIgnore
    public boolean isSynthesized() {
        return derivedFrom != null;
    }
}
