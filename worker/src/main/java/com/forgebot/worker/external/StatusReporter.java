package com.forgebot.worker.external;

/**
 * Publishes commit statuses / check runs. Fire-and-forget: implementations
 * log failures and never throw.
 */
public interface StatusReporter {

    void report(String repoUrl, String commitSha, String checkName,
                CommitState state, String description, String url);
}
