package com.example.connectionmonitor.service.probe.http;

import com.example.connectionmonitor.config.ConnectionMonitorProperties;
import com.example.connectionmonitor.domain.enums.ConnectionType;
import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import com.example.connectionmonitor.service.probe.ProbeOutcome;
import com.example.connectionmonitor.service.probe.ProbeTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;
import java.util.Set;

/**
 * GitHub API probe: authenticated "who am I" call against {base}/user.
 * <p>
 * The token comes from the GitHub token field, falling back to the API key.
 */
@Slf4j
@Component
public class GitHubApiConnectionProbe extends HttpConnectionProbe {

    static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";

    private final ConnectionMonitorProperties properties;

    public GitHubApiConnectionProbe(@Qualifier("probeWebClient") WebClient webClient, ConnectionMonitorProperties properties) {
        super(webClient);
        this.properties = properties;
    }

    @Override
    public Set<ConnectionType> supportedTypes() {
        return Set.of(ConnectionType.GITHUB_API);
    }

    @Override
    public ProbeOutcome test(ProbeTarget target, Duration timeout) {
        var token = resolveToken(target);
        if (token == null) {
            return ProbeOutcome.failure(ProbeErrorKind.UNAUTHORIZED, "GITHUB_NO_TOKEN",
                    "GitHub token is required for authentication");
        }

        URI uri;
        try {
            uri = parseUrl(stripTrailingSlash(properties.getGithubApiBaseUrl()) + "/user");
        } catch (IllegalArgumentException e) {
            return ProbeOutcome.invalidConfig(e.getMessage());
        }

        log.debug("Probing GitHub API connection {}", target.getConnectionId());

        try {
            var response = get(uri, headers -> headers.set(HttpHeaders.AUTHORIZATION, "token " + token), timeout);
            var status = response.getStatusCode().value();
            var remaining = headerOrUnknown(response.getHeaders(), RATE_LIMIT_REMAINING);

            if (response.getStatusCode().is2xxSuccessful()) {
                var outcome = ProbeOutcome.success("GitHub API connection successful")
                        .withMetadata("ApiEndpoint", properties.getGithubApiBaseUrl())
                        .withMetadata("AuthenticationMethod", "Personal Access Token")
                        .withMetadata("RateLimitRemaining", remaining)
                        .withMetadata("RateLimitReset", headerOrUnknown(response.getHeaders(), RATE_LIMIT_RESET));
                if (target.getGitHubOrganization() != null && !target.getGitHubOrganization().isBlank()) {
                    outcome.withMetadata("Organization", target.getGitHubOrganization());
                }
                if (target.getGitHubRepository() != null && !target.getGitHubRepository().isBlank()) {
                    outcome.withMetadata("Repository", target.getGitHubRepository());
                }
                return outcome;
            }

            log.warn("GitHub API connection test failed for connection {} with status {}", target.getConnectionId(), status);

            var kind = kindForStatus(status);
            if (status == 403 && "0".equals(remaining)) {
                kind = ProbeErrorKind.RATE_LIMITED;
            }
            return ProbeOutcome.failure(kind, errorCodeFor(status),
                    "GitHub API authentication failed: " + describeStatus(status))
                    .withMetadata("StatusCode", status);
        } catch (RuntimeException e) {
            return transportFailure("GitHub API", e);
        }
    }

    static String errorCodeFor(int status) {
        if (status == 401) {
            return "GITHUB_UNAUTHORIZED";
        }
        if (status == 403) {
            return "GITHUB_FORBIDDEN";
        }
        if (status == 404) {
            return "GITHUB_NOT_FOUND";
        }
        return "GITHUB_HTTP_" + status;
    }

    private static String resolveToken(ProbeTarget target) {
        if (target.getGitHubToken() != null && !target.getGitHubToken().isBlank()) {
            return target.getGitHubToken();
        }
        if (target.getApiKey() != null && !target.getApiKey().isBlank()) {
            return target.getApiKey();
        }
        return null;
    }

    private static String headerOrUnknown(HttpHeaders headers, String name) {
        var value = headers.getFirst(name);
        return value != null ? value : "Unknown";
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
