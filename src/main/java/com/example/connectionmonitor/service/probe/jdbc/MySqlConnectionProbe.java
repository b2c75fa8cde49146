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
 * MySQL probe. Errors are keyed on the server error number;
 * client-side link failures carry number 0 and fall back to SQLState.
 */
@Component
public class MySqlConnectionProbe extends JdbcConnectionProbe {

    private static final Map<String, ErrorEntry> ERRORS = Map.of(
            "1042", entry(ProbeErrorKind.NETWORK_UNREACHABLE, "Unable to connect to MySQL server. Please check the server address."),
            "1044", entry(ProbeErrorKind.UNAUTHORIZED, "Access denied to database. Please check your permissions."),
            "1045", entry(ProbeErrorKind.UNAUTHORIZED, "Access denied. Please check your username and password."),
            "1049", entry(ProbeErrorKind.NOT_FOUND_RESOURCE, "Unknown database. Please verify the database name.")
    );

    public MySqlConnectionProbe(ConnectionStringBuilder connectionStringBuilder) {
        super(connectionStringBuilder);
    }

    @Override
    public Set<ConnectionType> supportedTypes() {
        return Set.of(ConnectionType.MYSQL);
    }

    @Override
    protected String vendorName() {
        return "MySQL";
    }

    @Override
    protected String errorCodePrefix() {
        return "MYSQL_";
    }

    @Override
    protected String vendorErrorKey(SQLException e) {
        return e.getErrorCode() != 0 ? String.valueOf(e.getErrorCode()) : null;
    }

    @Override
    protected Map<String, ErrorEntry> errorCatalog() {
        return ERRORS;
    }

    @Override
    protected void applyTimeouts(Properties properties, Duration timeout) {
        var millis = String.valueOf(timeoutSeconds(timeout) * 1000L);
        properties.putIfAbsent("connectTimeout", millis);
        properties.putIfAbsent("socketTimeout", millis);
    }
}
