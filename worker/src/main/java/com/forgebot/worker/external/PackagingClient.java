package com.forgebot.worker.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgebot.worker.jobs.PackageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.http.HttpResponse;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the packaging service that performs the real work
 * (syncing releases into dist-git, submitting builds and test runs).
 *
 * Status codes map to the failure taxonomy:
 *   409, 424  → {@link ArtifactNotReadyException} (upstream artifact not published yet)
 *   other 4xx → {@link OperationException}
 *   5xx / I/O → {@link ExternalServiceException}
 */
@Component
public class PackagingClient extends JsonHttpClient implements OperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(PackagingClient.class);

    public PackagingClient(
            @Value("${forgebot.packaging.base-url:http://localhost:8081}") String baseUrl,
            ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
    }

    @Override
    public Submission proposeDownstream(PackageConfig packageConfig, String tagName, String branch) {
        log.info("Proposing {} @ {} to dist-git branch {}", packageConfig.packageName(), tagName, branch);
        Map<String, Object> body = base(packageConfig);
        body.put("tag", tagName);
        body.put("branch", branch);
        return submit("/propose-downstream", body, "proposeDownstream to " + branch);
    }

    @Override
    public Submission submitBuild(PackageConfig packageConfig, String commitSha,
                                  List<String> chroots, boolean scratch) {
        log.info("Submitting build of {} @ {} for {}", packageConfig.packageName(), commitSha, chroots);
        Map<String, Object> body = base(packageConfig);
        body.put("commit_sha", commitSha);
        body.put("chroots", chroots);
        body.put("scratch", scratch);
        return submit("/builds", body, "submitBuild");
    }

    @Override
    public Submission submitTestRun(PackageConfig packageConfig, String commitSha, String chroot) {
        log.info("Submitting test run of {} @ {} in {}", packageConfig.packageName(), commitSha, chroot);
        Map<String, Object> body = base(packageConfig);
        body.put("commit_sha", commitSha);
        body.put("chroot", chroot);
        return submit("/test-runs", body, "submitTestRun in " + chroot);
    }

    @Override
    public Submission kojiBuild(PackageConfig packageConfig, String branch, String commitSha,
                                boolean scratch) {
        log.info("Starting {}build of {} from {}", scratch ? "scratch " : "",
                packageConfig.packageName(), branch);
        Map<String, Object> body = base(packageConfig);
        body.put("branch", branch);
        body.put("commit_sha", commitSha);
        body.put("scratch", scratch);
        return submit("/koji-builds", body, "kojiBuild from " + branch);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Submission submit(String path, Map<String, Object> body, String opName) {
        HttpResponse<String> resp = post(path, body, opName);
        int code = resp.statusCode();
        if (code == 409 || code == 424) {
            throw new ArtifactNotReadyException(opName + ": " + resp.body());
        }
        if (code >= 400 && code < 500) {
            throw new OperationException(opName + " rejected (HTTP " + code + "): " + resp.body());
        }
        JsonNode node = readTree(requireSuccess(resp, opName), opName);
        String id = node.path("id").asText(null);
        if (id == null || id.isBlank()) {
            // without an id the submission can never be reconciled
            throw new ExternalServiceException(opName + " accepted but returned no id: " + resp.body(), code);
        }
        return new Submission(id, node.path("url").asText(null));
    }

    private static Map<String, Object> base(PackageConfig packageConfig) {
        Map<String, Object> body = new HashMap<>();
        body.put("package", packageConfig.packageName());
        if (packageConfig.upstreamRepoUrl() != null) {
            body.put("upstream_repo", packageConfig.upstreamRepoUrl());
        }
        return body;
    }
}
