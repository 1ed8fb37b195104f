package com.forgebot.worker.jobs;

/**
 * Kinds of jobs a package can configure.
 *
 * One JobConfig names exactly one type; several JobConfigs of the same type
 * may coexist and are told apart by their identifier.
 */
public enum JobType {
    BUILD,
    TESTS,
    PROPOSE_DOWNSTREAM,
    KOJI_BUILD
}
