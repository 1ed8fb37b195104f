package com.forgebot.worker.external;

import com.forgebot.worker.jobs.PackageConfig;

import java.util.List;

/**
 * Performs the actual packaging operations. The core only tells success
 * from the typed failures below.
 *
 * Every method may throw:
 * <ul>
 *   <li>{@link ArtifactNotReadyException}: transient, try again later</li>
 *   <li>{@link OperationException}: the request was rejected for good</li>
 *   <li>{@link ExternalServiceException}: anything else</li>
 * </ul>
 */
public interface OperationExecutor {

    /** Open (or update) a pull-request syncing the release into one dist-git branch. */
    Submission proposeDownstream(PackageConfig packageConfig, String tagName, String branch);

    /** Submit one build covering all chroots; every chroot shares the returned id. */
    Submission submitBuild(PackageConfig packageConfig, String commitSha,
                           List<String> chroots, boolean scratch);

    /** Submit one test run for one chroot against a finished build. */
    Submission submitTestRun(PackageConfig packageConfig, String commitSha, String chroot);

    /** Start a production (or scratch) build from a dist-git branch. */
    Submission kojiBuild(PackageConfig packageConfig, String branch, String commitSha, boolean scratch);
}
