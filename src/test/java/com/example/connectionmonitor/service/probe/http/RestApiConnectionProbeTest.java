package com.example.connectionmonitor.service.probe.http;

import com.example.connectionmonitor.config.ConnectionMonitorProperties;
import com.example.connectionmonitor.config.WebClientConfig;
import com.example.connectionmonitor.domain.enums.ConnectionType;
import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import com.example.connectionmonitor.service.probe.ProbeTarget;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RestApiConnectionProbe Tests")
class RestApiConnectionProbeTest {

    private WireMockServer wireMockServer;
    private RestApiConnectionProbe probe;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();

        var properties = new ConnectionMonitorProperties();
        properties.setApiProbeTimeoutSeconds(5);
        var webClient = new WebClientConfig().probeWebClient(WebClient.builder(), properties);
        probe = new RestApiConnectionProbe(webClient);
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    private ProbeTarget target(String path, String apiKey) {
        return ProbeTarget.builder()
                .type(ConnectionType.REST_API)
                .apiBaseUrl(wireMockServer.baseUrl() + path)
                .apiKey(apiKey)
                .build();
    }

    @Nested
    @DisplayName("Response Tests")
    class ResponseTests {

        @Test
        @DisplayName("Should succeed on 2xx and send a bearer token")
        void shouldSucceedOn2xx() {
            // Given
            wireMockServer.stubFor(get(urlEqualTo("/health"))
                    .willReturn(aResponse().withStatus(204)));

            // When
            var outcome = probe.test(target("/health", "key-123"), Duration.ofSeconds(5));

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            assertThat(outcome.getMessage()).isEqualTo("REST API connection successful");
            assertThat(outcome.getMetadata()).containsEntry("StatusCode", 204);
            wireMockServer.verify(getRequestedFor(urlEqualTo("/health"))
                    .withHeader("Authorization", equalTo("Bearer key-123")));
        }

        @Test
        @DisplayName("Should not send Authorization without an API key")
        void shouldOmitAuthorizationWithoutKey() {
            // Given
            wireMockServer.stubFor(get(urlEqualTo("/")).willReturn(aResponse().withStatus(200)));

            // When
            var outcome = probe.test(target("/", null), Duration.ofSeconds(5));

            // Then
            assertThat(outcome.isSuccess()).isTrue();
            wireMockServer.verify(getRequestedFor(urlEqualTo("/")).withoutHeader("Authorization"));
        }

        @ParameterizedTest
        @CsvSource({
                "401, UNAUTHORIZED",
                "403, UNAUTHORIZED",
                "404, NOT_FOUND_RESOURCE",
                "429, RATE_LIMITED",
                "400, INVALID_CONFIG",
                "500, UNKNOWN",
                "503, UNKNOWN"
        })
        @DisplayName("Should map non-2xx statuses")
        void shouldMapStatuses(int status, ProbeErrorKind expectedKind) {
            // Given
            wireMockServer.stubFor(get(urlEqualTo("/api")).willReturn(aResponse().withStatus(status)));

            // When
            var outcome = probe.test(target("/api", null), Duration.ofSeconds(5));

            // Then
            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.getErrorKind()).isEqualTo(expectedKind);
            assertThat(outcome.getErrorCode()).isEqualTo("HTTP_" + status);
            assertThat(outcome.getMessage()).startsWith("REST API connection failed: " + status);
        }
    }

    @Nested
    @DisplayName("Transport Tests")
    class TransportTests {

        @Test
        @DisplayName("Should classify a slow response as TIMEOUT")
        void shouldTimeOut() {
            // Given
            wireMockServer.stubFor(get(urlEqualTo("/slow"))
                    .willReturn(aResponse().withStatus(200).withFixedDelay(2000)));

            // When
            var outcome = probe.test(target("/slow", null), Duration.ofMillis(300));

            // Then
            assertThat(outcome.isSuccess()).isFalse();
            assertThat(outcome.getErrorKind()).isEqualTo(ProbeErrorKind.TIMEOUT);
            assertThat(outcome.getErrorCode()).isEqualTo("TIMEOUT");
        }

        @Test
        @DisplayName("Should classify a refused connection as NETWORK_UNREACHABLE")
        void shouldClassifyRefusedConnection() throws IOException {
            // Given
            int closedPort;
            try (var socket = new ServerSocket(0)) {
                closedPort = socket.getLocalPort();
            }
            var target = ProbeTarget.builder()
                    .type(ConnectionType.REST_API)
                    .apiBaseUrl("http://localhost:" + closedPort + "/health")
                    .build();

            // When
            var outcome = probe.test(target, Duration.ofSeconds(5));

            // Then
            assertThat(outcome.getErrorKind()).isEqualTo(ProbeErrorKind.NETWORK_UNREACHABLE);
            assertThat(outcome.getErrorCode()).isEqualTo("NETWORK_UNREACHABLE");
        }

        @Test
        @DisplayName("Should return INVALID_CONFIG for a missing or relative base URL")
        void shouldRejectBadUrl() {
            var missing = probe.test(ProbeTarget.builder().type(ConnectionType.REST_API).build(), Duration.ofSeconds(1));
            var relative = probe.test(ProbeTarget.builder().type(ConnectionType.REST_API).apiBaseUrl("/just/a/path").build(),
                    Duration.ofSeconds(1));

            assertThat(missing.getErrorKind()).isEqualTo(ProbeErrorKind.INVALID_CONFIG);
            assertThat(missing.getMessage()).isEqualTo("Invalid connection configuration: API base URL is required");
            assertThat(relative.getErrorKind()).isEqualTo(ProbeErrorKind.INVALID_CONFIG);
        }
    }
}
