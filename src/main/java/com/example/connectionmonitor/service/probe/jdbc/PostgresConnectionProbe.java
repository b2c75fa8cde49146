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
 * PostgreSQL probe. Errors are keyed on SQLState.
 */
@Component
public class PostgresConnectionProbe extends JdbcConnectionProbe {

    private static final Map<String, ErrorEntry> ERRORS = Map.of(
            "28P01", entry(ProbeErrorKind.UNAUTHORIZED, "Authentication failed. Please check your username and password."),
            "28000", entry(ProbeErrorKind.UNAUTHORIZED, "Authorization rejected. Please check the user's access to this database."),
            "3D000", entry(ProbeErrorKind.NOT_FOUND_RESOURCE, "Database does not exist. Please verify the database name."),
            "08001", entry(ProbeErrorKind.NETWORK_UNREACHABLE, "Unable to connect to PostgreSQL server. Please check the server address and port."),
            "08006", entry(ProbeErrorKind.NETWORK_UNREACHABLE, "Connection failure. The server may be down or unreachable.")
    );

    public PostgresConnectionProbe(ConnectionStringBuilder connectionStringBuilder) {
        super(connectionStringBuilder);
    }

    @Override
    public Set<ConnectionType> supportedTypes() {
        return Set.of(ConnectionType.POSTGRESQL);
    }

    @Override
    protected String vendorName() {
        return "PostgreSQL";
    }

    @Override
    protected String errorCodePrefix() {
        return "PG_";
    }

    @Override
    protected String vendorErrorKey(SQLException e) {
        return e.getSQLState();
    }

    @Override
    protected Map<String, ErrorEntry> errorCatalog() {
        return ERRORS;
    }

    @Override
    protected void applyTimeouts(Properties properties, Duration timeout) {
        var seconds = String.valueOf(timeoutSeconds(timeout));
        properties.putIfAbsent("connectTimeout", seconds);
        properties.putIfAbsent("loginTimeout", seconds);
        properties.putIfAbsent("socketTimeout", seconds);
    }
}
