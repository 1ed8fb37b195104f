package com.forgebot.worker.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** System of record for builds; one build id covers every chroot of a Run. */
@Component("buildFarm")
public class BuildFarmClient extends FarmClient {

    public BuildFarmClient(
            @Value("${forgebot.build-farm.base-url:http://localhost:8083}") String baseUrl,
            ObjectMapper objectMapper) {
        super(baseUrl, "builds", objectMapper);
    }
}
