package com.forgebot.worker.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgebot.worker.event.JobOutcome;

import java.net.http.HttpResponse;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Queries a build or test farm for the state of a job it accepted.
 *
 * Expected response for {@code GET <base>/<collection>/<id>}:
 * <pre>
 *   {"state": "pending|completed", "outcome": "success|failure|error",
 *    "url": "...", "results": {"fedora-39-x86_64": "success", ...}}
 * </pre>
 * HTTP 404 means the farm no longer knows the job.
 */
abstract class FarmClient extends JsonHttpClient implements JobSystemOfRecord {

    private final String collection;

    protected FarmClient(String baseUrl, String collection, ObjectMapper objectMapper) {
        super(baseUrl, objectMapper);
        this.collection = collection;
    }

    @Override
    public ExternalJobStatus query(String correlationId) {
        String opName = "query " + collection + "/" + correlationId;
        HttpResponse<String> resp = get("/" + collection + "/" + correlationId, opName);
        if (resp.statusCode() == 404) {
            return ExternalJobStatus.notFound();
        }
        JsonNode node = readTree(requireSuccess(resp, opName), opName);
        if (!"completed".equalsIgnoreCase(node.path("state").asText())) {
            return ExternalJobStatus.pending();
        }

        Map<String, JobOutcome> results = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.path("results").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            results.put(e.getKey(), outcome(e.getValue().asText()));
        }
        return new ExternalJobStatus(ExternalJobStatus.State.COMPLETED,
                outcome(node.path("outcome").asText()), results, node.path("url").asText(null));
    }

    private static JobOutcome outcome(String value) {
        try {
            return JobOutcome.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            // unknown outcome strings are treated as an infrastructure error
            return JobOutcome.ERROR;
        }
    }
}
