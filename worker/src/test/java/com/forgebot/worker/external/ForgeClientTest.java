package com.forgebot.worker.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThatCode;

class ForgeClientTest {

    WireMockServer server;
    ForgeClient    client;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        client = new ForgeClient(server.baseUrl(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void report_postsCommitStatus() {
        server.stubFor(post(urlEqualTo("/statuses")).willReturn(aResponse().withStatus(201)));

        client.report("https://github.com/org/hello", "abc123", "rpm-build:fedora-40-x86_64",
                CommitState.PENDING, "Build submission will be retried.", null);

        server.verify(postRequestedFor(urlEqualTo("/statuses")).withRequestBody(equalToJson("""
                {"repo": "https://github.com/org/hello", "commit_sha": "abc123",
                 "context": "rpm-build:fedora-40-x86_64", "state": "pending",
                 "description": "Build submission will be retried."}
                """)));
    }

    @Test
    void report_forgeDown_doesNotThrow() {
        server.stubFor(post(urlEqualTo("/statuses")).willReturn(aResponse().withStatus(502)));

        assertThatCode(() -> client.report("https://github.com/org/hello", "abc123", "koji-build:f40",
                CommitState.FAILURE, "failed", "https://koji/1")).doesNotThrowAnyException();
    }

    @Test
    void openIssue_forgeDown_doesNotThrow() {
        server.stubFor(post(urlEqualTo("/issues")).willReturn(aResponse().withStatus(500)));

        assertThatCode(() -> client.openIssue("https://github.com/org/hello", "title", "body"))
                .doesNotThrowAnyException();
    }
}
