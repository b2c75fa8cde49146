package com.example.connectionmonitor.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Technology-independent classification of a probe failure.
 * Every native driver or HTTP error is mapped onto exactly one of these.
 */
@Getter
@RequiredArgsConstructor
public enum ProbeErrorKind {

    TIMEOUT("timeout"),
    UNAUTHORIZED("unauthorized"),
    INVALID_CONFIG("invalid-config"),
    NOT_FOUND_RESOURCE("not-found-resource"),
    NETWORK_UNREACHABLE("network-unreachable"),
    RATE_LIMITED("rate-limited"),
    UNKNOWN("unknown");

    private final String code;
}
