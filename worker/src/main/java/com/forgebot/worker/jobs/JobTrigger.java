package com.forgebot.worker.jobs;

/**
 * What kind of repository activity a job is configured to react to.
 * An event is only paired with JobConfigs whose trigger equals the event's.
 */
public enum JobTrigger {
    PULL_REQUEST,
    COMMIT,
    RELEASE
}
