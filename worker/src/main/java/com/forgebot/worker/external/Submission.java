package com.forgebot.worker.external;

/** What an external system hands back when it accepts work. */
public record Submission(String correlationId, String url) {}
