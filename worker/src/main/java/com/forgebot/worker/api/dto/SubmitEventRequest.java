package com.forgebot.worker.api.dto;

import com.forgebot.worker.event.Event;
import com.forgebot.worker.jobs.PackageConfig;

/**
 * Request body for POST /events: an already-normalized event plus the
 * configuration of the package it concerns.
 */
public record SubmitEventRequest(Event event, PackageConfig packageConfig) {}
