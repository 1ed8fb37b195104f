package com.forgebot.worker.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * HTTP client for the code-review forge: commit statuses and issues.
 *
 * Both operations are best effort. A failure is logged at WARN and
 * swallowed so it never turns a successful Target into a failed one.
 */
@Component
public class ForgeClient extends JsonHttpClient implements StatusReporter, IssueNotifier {

    private static final Logger log = LoggerFactory.getLogger(ForgeClient.class);

    public ForgeClient(
            @Value("${forgebot.forge.base-url:http://localhost:8082}") String baseUrl,
            ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
    }

    @Override
    public void report(String repoUrl, String commitSha, String checkName,
                       CommitState state, String description, String url) {
        Map<String, Object> body = new HashMap<>();
        body.put("repo", repoUrl);
        body.put("commit_sha", commitSha);
        body.put("context", checkName);
        body.put("state", state.name().toLowerCase());
        body.put("description", description);
        if (url != null) body.put("target_url", url);
        try {
            requireSuccess(post("/statuses", body, "report " + checkName), "report " + checkName);
            log.debug("Reported {} = {} on {}", checkName, state, commitSha);
        } catch (ExternalServiceException e) {
            log.warn("Failed to report status {} for {}: {}", checkName, commitSha, e.getMessage());
        }
    }

    @Override
    public void openIssue(String repoUrl, String title, String body) {
        try {
            requireSuccess(post("/issues", Map.of("repo", repoUrl, "title", title, "body", body),
                    "openIssue"), "openIssue");
            log.info("Opened issue '{}' in {}", title, repoUrl);
        } catch (ExternalServiceException e) {
            log.warn("Failed to open issue '{}' in {}: {}", title, repoUrl, e.getMessage());
        }
    }
}
