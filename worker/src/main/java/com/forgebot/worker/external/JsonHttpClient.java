package com.forgebot.worker.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Shared plumbing for the JSON-over-HTTP collaborators.
 *
 * Uses java.net.http.HttpClient directly; every call blocks, which is fine
 * because callers run on worker or scheduler threads.
 */
abstract class JsonHttpClient {

    protected final HttpClient   http;
    protected final ObjectMapper json;
    protected final String       baseUrl;

    protected JsonHttpClient(String baseUrl, ObjectMapper objectMapper) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** POST a JSON body; returns the raw response, whatever its status. */
    protected HttpResponse<String> post(String path, Object body, String opName) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(60))
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build();
        return send(req, opName);
    }

    protected HttpResponse<String> get(String path, String opName) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(req, opName);
    }

    /** Throws {@link ExternalServiceException} unless the response is 2xx. */
    protected static String requireSuccess(HttpResponse<String> resp, String opName) {
        if (!isSuccess(resp)) {
            throw new ExternalServiceException(
                    opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                    resp.statusCode());
        }
        return resp.body();
    }

    protected static boolean isSuccess(HttpResponse<String> resp) {
        return resp.statusCode() >= 200 && resp.statusCode() < 300;
    }

    protected JsonNode readTree(String body, String opName) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Failed to parse " + opName + " response", e);
        }
    }

    protected String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("JSON serialization failed", e);
        }
    }

    private HttpResponse<String> send(HttpRequest req, String opName) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExternalServiceException(opName + " failed", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
