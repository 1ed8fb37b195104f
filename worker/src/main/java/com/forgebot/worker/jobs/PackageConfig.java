package com.forgebot.worker.jobs;

import java.util.List;

/**
 * Snapshot of a package's configuration as delivered with the event.
 * Jobs keep their declaration order.
 */
public record PackageConfig(String packageName, String upstreamRepoUrl, List<JobConfig> jobs) {

    public PackageConfig {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public static PackageConfig of(String packageName, JobConfig... jobs) {
        return new PackageConfig(packageName, null, List.of(jobs));
    }
}
