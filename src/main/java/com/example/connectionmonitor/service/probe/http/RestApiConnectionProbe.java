package com.example.connectionmonitor.service.probe.http;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import com.example.connectionmonitor.service.probe.ProbeOutcome;
import com.example.connectionmonitor.service.probe.ProbeTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.Set;

/**
 * Generic REST API probe: GET the base URL, bearer token when an API key is set.
 * Any 2xx counts as reachable.
 */
@Slf4j
@Component
public class RestApiConnectionProbe extends HttpConnectionProbe {

    public RestApiConnectionProbe(@Qualifier("probeWebClient") WebClient webClient) {
        super(webClient);
    }

    @Override
    public Set<ConnectionType> supportedTypes() {
        return Set.of(ConnectionType.REST_API);
    }

    @Override
    public ProbeOutcome test(ProbeTarget target, Duration timeout) {
        URI uri;
        try {
            uri = parseUrl(target.getApiBaseUrl());
        } catch (IllegalArgumentException e) {
            return ProbeOutcome.invalidConfig(e.getMessage());
        }

        var apiKey = target.getApiKey();
        log.debug("Probing REST API connection {} at {}", target.getConnectionId(), uri.getHost());

        try {
            var response = get(uri, headers -> {
                if (apiKey != null && !apiKey.isBlank()) {
                    headers.setBearerAuth(apiKey);
                }
            }, timeout);

            var status = response.getStatusCode().value();
            if (response.getStatusCode().is2xxSuccessful()) {
                return ProbeOutcome.success("REST API connection successful")
                        .withMetadata("ApiEndpoint", uri.getScheme() + "://" + uri.getAuthority())
                        .withMetadata("StatusCode", status);
            }

            return ProbeOutcome.failure(kindForStatus(status), "HTTP_" + status,
                    "REST API connection failed: " + describeStatus(status))
                    .withMetadata("StatusCode", status);
        } catch (RuntimeException e) {
            return transportFailure("REST API", e);
        }
    }
}
