package com.example.connectionmonitor.service.probe;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConnectionProbeRegistry Tests")
class ConnectionProbeRegistryTest {

    @Mock
    private ConnectionProbe sqlServerProbe;

    @Mock
    private ConnectionProbe restApiProbe;

    private ConnectionProbeRegistry registry;

    @BeforeEach
    void setUp() {
        when(sqlServerProbe.supportedTypes()).thenReturn(Set.of(ConnectionType.SQL_SERVER, ConnectionType.AZURE_SQL));
        when(restApiProbe.supportedTypes()).thenReturn(Set.of(ConnectionType.REST_API));

        registry = new ConnectionProbeRegistry(List.of(sqlServerProbe, restApiProbe));
        registry.initialize();
    }

    @Test
    @DisplayName("Should index a probe under every type it supports")
    void shouldIndexEverySupportedType() {
        assertThat(registry.getProbe(ConnectionType.SQL_SERVER)).contains(sqlServerProbe);
        assertThat(registry.getProbe(ConnectionType.AZURE_SQL)).contains(sqlServerProbe);
        assertThat(registry.getProbe(ConnectionType.REST_API)).contains(restApiProbe);
    }

    @Test
    @DisplayName("Should return empty for types without a probe")
    void shouldReturnEmptyForMissingType() {
        assertThat(registry.getProbe(ConnectionType.MONGODB)).isEmpty();
        assertThat(registry.hasProbe(ConnectionType.MONGODB)).isFalse();
    }

    @Test
    @DisplayName("Should report registered types")
    void shouldReportRegisteredTypes() {
        assertThat(registry.getRegisteredTypes())
                .containsExactlyInAnyOrder(ConnectionType.SQL_SERVER, ConnectionType.AZURE_SQL, ConnectionType.REST_API);
    }
}
