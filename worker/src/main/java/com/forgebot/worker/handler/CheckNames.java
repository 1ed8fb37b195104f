package com.forgebot.worker.handler;

/**
 * Commit-status names: {@code <prefix>:<branch|chroot>[:<identifier>]}.
 * The prefix doubles as the check-rerun prefix the registry matches on.
 */
public final class CheckNames {

    public static final String PROPOSE_DOWNSTREAM = "propose-downstream";
    public static final String RPM_BUILD          = "rpm-build";
    public static final String TESTING_FARM       = "testing-farm";
    public static final String KOJI_BUILD         = "koji-build";

    private CheckNames() {}

    public static String of(String prefix, String key, String identifier) {
        String name = prefix + ":" + key;
        return identifier == null || identifier.isBlank() ? name : name + ":" + identifier;
    }
}
