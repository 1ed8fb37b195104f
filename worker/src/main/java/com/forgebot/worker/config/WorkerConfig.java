package com.forgebot.worker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/** Beans with no better home. */
@Configuration
public class WorkerConfig {

    /** Every timestamp the worker writes comes from here, so tests can pin time. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
