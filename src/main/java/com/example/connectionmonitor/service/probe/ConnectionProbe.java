package com.example.connectionmonitor.service.probe;

import com.example.connectionmonitor.domain.enums.ConnectionType;

import java.time.Duration;
import java.util.Set;

/**
 * Connectivity check for one family of connection types.
 * <p>
 * Implementations should:
 * - Be stateless
 * - Bound every network call by the given timeout
 * - Translate native failures into a {@link ProbeOutcome} instead of throwing
 * <p>
 * Duration and sanitization are applied by {@link ConnectionTestService}.
 */
public interface ConnectionProbe {

    /**
     * Connection types this probe handles
     */
    Set<ConnectionType> supportedTypes();

    /**
     * Attempt a minimal round-trip against the target.
     *
     * @param target  decrypted connection definition
     * @param timeout upper bound for the network work
     * @return the outcome; never null
     */
    ProbeOutcome test(ProbeTarget target, Duration timeout);

    default boolean supports(ConnectionType type) {
        return supportedTypes().contains(type);
    }
}
