package com.forgebot.worker.handler;

/**
 * A unit of logic executed for one (event, job) pairing.
 *
 * Implementations are Spring beans; the {@link HandlerRegistry} collects them
 * at startup and indexes them by their {@link #descriptor()}.
 */
public interface JobHandler {

    HandlerDescriptor descriptor();

    /**
     * Gate evaluated before {@link #run}. Returning false skips the invocation
     * silently: no Target is created and nothing is recorded as failed.
     */
    default boolean preCheck(HandlerContext ctx) {
        return true;
    }

    /**
     * Do the work. Failures that belong to a single Target are recorded on it;
     * anything thrown out of here is handed to the retry controller.
     */
    TaskResult run(HandlerContext ctx);
}
