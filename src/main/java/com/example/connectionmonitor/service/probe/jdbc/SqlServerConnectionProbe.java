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
 * SQL Server and Azure SQL probe. Errors are keyed on the server error number.
 */
@Component
public class SqlServerConnectionProbe extends JdbcConnectionProbe {

    private static final Map<String, ErrorEntry> ERRORS = Map.of(
            "-1", entry(ProbeErrorKind.NETWORK_UNREACHABLE, "Cannot connect to SQL Server. Please verify the server address and network connectivity."),
            "2", entry(ProbeErrorKind.NETWORK_UNREACHABLE, "SQL Server not found or network error. Please check the server name and instance."),
            "4060", entry(ProbeErrorKind.NOT_FOUND_RESOURCE, "Cannot open database. Please verify the database name exists."),
            "18456", entry(ProbeErrorKind.UNAUTHORIZED, "Login failed. Please check your username and password.")
    );

    public SqlServerConnectionProbe(ConnectionStringBuilder connectionStringBuilder) {
        super(connectionStringBuilder);
    }

    @Override
    public Set<ConnectionType> supportedTypes() {
        return Set.of(ConnectionType.SQL_SERVER, ConnectionType.AZURE_SQL);
    }

    @Override
    protected String vendorName() {
        return "SQL Server";
    }

    @Override
    protected String errorCodePrefix() {
        return "SQL_";
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
        var seconds = timeoutSeconds(timeout);
        properties.putIfAbsent("loginTimeout", String.valueOf(seconds));
        properties.putIfAbsent("socketTimeout", String.valueOf(seconds * 1000L));
    }
}
