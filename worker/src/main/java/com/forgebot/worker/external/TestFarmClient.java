package com.forgebot.worker.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** System of record for test pipelines; one pipeline per chroot. */
@Component("testFarm")
public class TestFarmClient extends FarmClient {

    public TestFarmClient(
            @Value("${forgebot.test-farm.base-url:http://localhost:8084}") String baseUrl,
            ObjectMapper objectMapper) {
        super(baseUrl, "requests", objectMapper);
    }
}
