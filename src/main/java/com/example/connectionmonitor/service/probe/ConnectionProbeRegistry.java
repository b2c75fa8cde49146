package com.example.connectionmonitor.service.probe;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of connection probes.
 * <p>
 * Collects every ConnectionProbe bean and indexes it by each type it supports.
 */
@Slf4j
@Component
public class ConnectionProbeRegistry {

    private final Map<ConnectionType, ConnectionProbe> probes = new EnumMap<>(ConnectionType.class);
    private final List<ConnectionProbe> probeBeans;

    public ConnectionProbeRegistry(List<ConnectionProbe> probeBeans) {
        this.probeBeans = probeBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var probe : probeBeans) {
            for (var type : probe.supportedTypes()) {
                if (probes.containsKey(type)) {
                    log.warn("Duplicate probe for connection type {}: {} will override {}",
                            type, probe.getClass().getSimpleName(),
                            probes.get(type).getClass().getSimpleName());
                }
                probes.put(type, probe);
                log.info("Registered probe for connection type {}: {}", type, probe.getClass().getSimpleName());
            }
        }

        for (var type : ConnectionType.values()) {
            if (!probes.containsKey(type)) {
                log.debug("No probe registered for connection type: {}", type);
            }
        }
    }

    public Optional<ConnectionProbe> getProbe(ConnectionType type) {
        return Optional.ofNullable(probes.get(type));
    }

    public boolean hasProbe(ConnectionType type) {
        return probes.containsKey(type);
    }

    public Set<ConnectionType> getRegisteredTypes() {
        return probes.keySet();
    }
}
