package com.example.connectionmonitor.service.probe.jdbc;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Oracle probe (thin driver). Errors are keyed on the ORA number, zero-padded to five digits.
 */
@Component
public class OracleConnectionProbe extends JdbcConnectionProbe {

    private static final Map<String, ErrorEntry> ERRORS = Map.of(
            "01017", entry(ProbeErrorKind.UNAUTHORIZED, "Invalid username or password. Please check your credentials."),
            "28000", entry(ProbeErrorKind.UNAUTHORIZED, "The account is locked. Please contact the database administrator."),
            "12505", entry(ProbeErrorKind.NOT_FOUND_RESOURCE, "The listener does not know the requested SID. Please verify the database name."),
            "12514", entry(ProbeErrorKind.NOT_FOUND_RESOURCE, "The listener does not know the requested service. Please verify the service name."),
            "12541", entry(ProbeErrorKind.NETWORK_UNREACHABLE, "No listener at the given address. Please check the server address and port."),
            "17002", entry(ProbeErrorKind.NETWORK_UNREACHABLE, "Network error while connecting to Oracle. The server may be down or unreachable.")
    );

    public OracleConnectionProbe(ConnectionStringBuilder connectionStringBuilder) {
        super(connectionStringBuilder);
    }

    @Override
    public Set<ConnectionType> supportedTypes() {
        return Set.of(ConnectionType.ORACLE);
    }

    @Override
    protected String vendorName() {
        return "Oracle";
    }

    @Override
    protected String errorCodePrefix() {
        return "ORA_";
    }

    @Override
    protected String vendorErrorKey(SQLException e) {
        return e.getErrorCode() != 0 ? String.format("%05d", e.getErrorCode()) : null;
    }

    @Override
    protected Map<String, ErrorEntry> errorCatalog() {
        return ERRORS;
    }

    @Override
    protected String validationQuery() {
        return "SELECT 1 FROM DUAL";
    }

    @Override
    protected void applyTimeouts(Properties properties, Duration timeout) {
        var millis = String.valueOf(timeoutSeconds(timeout) * 1000L);
        properties.putIfAbsent("oracle.net.CONNECT_TIMEOUT", millis);
        properties.putIfAbsent("oracle.jdbc.ReadTimeout", millis);
    }
}
