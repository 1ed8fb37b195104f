package com.forgebot.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the forgebot worker.
 *
 * Receives normalized repository events over HTTP, runs the matching
 * handlers on an in-process worker pool and periodically reconciles
 * external builds and test runs whose completion was never reported.
 */
@SpringBootApplication
public class WorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkerApplication.class, args);
    }
}
