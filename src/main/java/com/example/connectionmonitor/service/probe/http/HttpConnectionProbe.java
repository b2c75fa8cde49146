package com.example.connectionmonitor.service.probe.http;

import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import com.example.connectionmonitor.service.probe.ConnectionProbe;
import com.example.connectionmonitor.service.probe.ErrorSanitizer;
import com.example.connectionmonitor.service.probe.ProbeOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Base for probes that issue a single authenticated GET.
 * <p>
 * Non-2xx responses are returned, not thrown, so subclasses can map status
 * codes and read headers. Transport failures are classified here.
 */
@RequiredArgsConstructor
public abstract class HttpConnectionProbe implements ConnectionProbe {

    static final String TIMEOUT_MESSAGE =
            "The connection attempt timed out. Please check your network connectivity and server availability.";

    protected final WebClient webClient;

    /**
     * GET the URL and return status and headers, bounded by the timeout.
     */
    protected ResponseEntity<Void> get(URI uri, Consumer<HttpHeaders> headers, Duration timeout) {
        return webClient.get()
                .uri(uri)
                .headers(headers)
                .exchangeToMono(ClientResponse::toBodilessEntity)
                .timeout(timeout)
                .block();
    }

    /**
     * Parse and check an absolute http(s) URL.
     *
     * @throws IllegalArgumentException when the URL is unusable
     */
    protected static URI parseUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("API base URL is required");
        }
        var uri = URI.create(url.trim());
        var scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")) || uri.getHost() == null) {
            throw new IllegalArgumentException("API base URL must be an absolute http(s) URL");
        }
        return uri;
    }

    /**
     * Kind for a non-2xx status
     */
    protected static ProbeErrorKind kindForStatus(int status) {
        if (status == 401 || status == 403) {
            return ProbeErrorKind.UNAUTHORIZED;
        }
        if (status == 404 || status == 410) {
            return ProbeErrorKind.NOT_FOUND_RESOURCE;
        }
        if (status == 429) {
            return ProbeErrorKind.RATE_LIMITED;
        }
        if (status == 408 || status == 504) {
            return ProbeErrorKind.TIMEOUT;
        }
        if (status >= 400 && status < 500) {
            return ProbeErrorKind.INVALID_CONFIG;
        }
        return ProbeErrorKind.UNKNOWN;
    }

    protected static String describeStatus(int status) {
        var resolved = HttpStatus.resolve(status);
        return resolved != null ? status + " " + resolved.getReasonPhrase() : String.valueOf(status);
    }

    /**
     * Classify an exception thrown while sending the request or waiting for the response.
     *
     * @param label user-facing name, e.g. "REST API"
     */
    protected static ProbeOutcome transportFailure(String label, Throwable error) {
        var unwrapped = Exceptions.unwrap(error);
        var details = ErrorSanitizer.sanitize(rootMessage(unwrapped));

        if (hasCause(unwrapped, TimeoutException.class, SocketTimeoutException.class,
                io.netty.handler.timeout.TimeoutException.class, io.netty.channel.ConnectTimeoutException.class)) {
            return ProbeOutcome.failure(ProbeErrorKind.TIMEOUT, "TIMEOUT", "Connection timeout: " + TIMEOUT_MESSAGE, details);
        }
        if (hasCause(unwrapped, UnknownHostException.class, UnresolvedAddressException.class,
                ConnectException.class, NoRouteToHostException.class)) {
            return ProbeOutcome.failure(ProbeErrorKind.NETWORK_UNREACHABLE, "NETWORK_UNREACHABLE",
                    label + " connection failed: Unable to reach the server. Please check the URL and network connectivity.", details);
        }
        return ProbeOutcome.failure(ProbeErrorKind.UNKNOWN, "HTTP_ERROR",
                label + " connection test failed: " + details, details);
    }

    @SafeVarargs
    private static boolean hasCause(Throwable error, Class<? extends Throwable>... types) {
        var current = error;
        while (current != null) {
            for (var type : types) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        var current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
