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
 * SQLite probe. The database field holds the file path; errors are keyed on the
 * SQLite result code.
 */
@Component
public class SqliteConnectionProbe extends JdbcConnectionProbe {

    private static final Map<String, ErrorEntry> ERRORS = Map.of(
            "5", entry(ProbeErrorKind.TIMEOUT, "The database file is locked by another process."),
            "8", entry(ProbeErrorKind.UNAUTHORIZED, "The database file is read-only for this process."),
            "14", entry(ProbeErrorKind.NOT_FOUND_RESOURCE, "Unable to open the database file. Please verify the path."),
            "26", entry(ProbeErrorKind.INVALID_CONFIG, "The file is not a SQLite database.")
    );

    public SqliteConnectionProbe(ConnectionStringBuilder connectionStringBuilder) {
        super(connectionStringBuilder);
    }

    @Override
    public Set<ConnectionType> supportedTypes() {
        return Set.of(ConnectionType.SQLITE);
    }

    @Override
    protected String vendorName() {
        return "SQLite";
    }

    @Override
    protected String errorCodePrefix() {
        return "SQLITE_";
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
        properties.putIfAbsent("busy_timeout", String.valueOf(timeoutSeconds(timeout) * 1000L));
    }
}
