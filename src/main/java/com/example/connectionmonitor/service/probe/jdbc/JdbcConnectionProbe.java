package com.example.connectionmonitor.service.probe.jdbc;

import com.example.connectionmonitor.domain.enums.ProbeErrorKind;
import com.example.connectionmonitor.service.probe.ConnectionProbe;
import com.example.connectionmonitor.service.probe.ErrorSanitizer;
import com.example.connectionmonitor.service.probe.ProbeOutcome;
import com.example.connectionmonitor.service.probe.ProbeTarget;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketTimeoutException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeoutException;

/**
 * Base for relational database probes.
 * <p>
 * Opens a connection with driver-level timeouts, runs a trivial validation query
 * under {@code setQueryTimeout}, and reports server metadata. Failures are
 * classified through a per-flavor table keyed on the vendor's error number or
 * SQLState; anything not in the table falls back to the SQLState class.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class JdbcConnectionProbe implements ConnectionProbe {

    static final String TIMEOUT_MESSAGE =
            "The connection attempt timed out. Please check your network connectivity and server availability.";

    protected final ConnectionStringBuilder connectionStringBuilder;

    /**
     * Vendor name used in fallback messages, e.g. "PostgreSQL"
     */
    protected abstract String vendorName();

    /**
     * Prefix for diagnostic error codes, e.g. "PG_"
     */
    protected abstract String errorCodePrefix();

    /**
     * Key into {@link #errorCatalog()} for this exception, or null when the
     * driver reported nothing specific
     */
    protected abstract String vendorErrorKey(SQLException e);

    /**
     * Well-known native errors mapped to a kind and a user-safe message
     */
    protected abstract Map<String, ErrorEntry> errorCatalog();

    /**
     * Put the driver's connect/socket timeout properties, without overriding
     * values the connection's additional settings already provide
     */
    protected abstract void applyTimeouts(Properties properties, Duration timeout);

    protected String validationQuery() {
        return "SELECT 1";
    }

    @Override
    public ProbeOutcome test(ProbeTarget target, Duration timeout) {
        JdbcConnectionSpec spec;
        try {
            spec = connectionStringBuilder.build(target);
        } catch (IllegalArgumentException e) {
            return ProbeOutcome.invalidConfig(e.getMessage());
        }

        var properties = spec.getProperties();
        applyTimeouts(properties, timeout);

        log.debug("Probing {} connection {}", vendorName(), target.getConnectionId());

        try (var connection = openConnection(spec.getUrl(), properties)) {
            try (var statement = connection.createStatement()) {
                statement.setQueryTimeout(timeoutSeconds(timeout));
                statement.execute(validationQuery());
            }

            var outcome = ProbeOutcome.success(target.getType().getDisplayName() + " connection successful");
            collectMetadata(connection, outcome);
            return outcome;
        } catch (SQLException e) {
            return classify(e);
        }
    }

    /**
     * Seam for tests; production code goes through DriverManager
     */
    protected Connection openConnection(String url, Properties properties) throws SQLException {
        return DriverManager.getConnection(url, properties);
    }

    /**
     * Map a driver exception onto the normalized taxonomy.
     */
    public ProbeOutcome classify(SQLException e) {
        var details = ErrorSanitizer.sanitize(e.getMessage());

        if (isTimeout(e)) {
            return ProbeOutcome.failure(ProbeErrorKind.TIMEOUT, "TIMEOUT",
                    "Connection timeout: " + TIMEOUT_MESSAGE, details);
        }

        if (isMissingDriver(e)) {
            return ProbeOutcome.failure(ProbeErrorKind.INVALID_CONFIG, "INVALID_CONFIG",
                    "Invalid connection configuration: no " + vendorName() + " driver accepts this connection string", details);
        }

        var key = vendorErrorKey(e);
        var entry = key != null ? errorCatalog().get(key) : null;
        var errorCode = errorCode(key, e.getSQLState());

        if (entry != null) {
            return ProbeOutcome.failure(entry.getKind(), errorCode,
                    "Database connection failed: " + entry.getMessage(), details);
        }

        var kind = kindFromSqlState(e.getSQLState());
        return ProbeOutcome.failure(kind, errorCode,
                "Database connection failed: " + vendorName() + " error: " + details, details);
    }

    protected static ErrorEntry entry(ProbeErrorKind kind, String message) {
        return new ErrorEntry(kind, message);
    }

    protected static int timeoutSeconds(Duration timeout) {
        return (int) Math.max(1, timeout.toSeconds());
    }

    private String errorCode(String key, String sqlState) {
        if (key != null && !key.isBlank()) {
            return errorCodePrefix() + key;
        }
        if (sqlState != null && !sqlState.isBlank()) {
            return errorCodePrefix() + sqlState;
        }
        return errorCodePrefix() + "ERROR";
    }

    static ProbeErrorKind kindFromSqlState(String sqlState) {
        if (sqlState == null || sqlState.length() < 2) {
            return ProbeErrorKind.UNKNOWN;
        }
        if (sqlState.startsWith("HYT")) {
            return ProbeErrorKind.TIMEOUT;
        }
        var sqlClass = sqlState.substring(0, 2);
        if ("28".equals(sqlClass)) {
            return ProbeErrorKind.UNAUTHORIZED;
        }
        if ("08".equals(sqlClass)) {
            return ProbeErrorKind.NETWORK_UNREACHABLE;
        }
        if ("3D".equals(sqlClass)) {
            return ProbeErrorKind.NOT_FOUND_RESOURCE;
        }
        return ProbeErrorKind.UNKNOWN;
    }

    private static boolean isTimeout(SQLException e) {
        if (e instanceof SQLTimeoutException) {
            return true;
        }
        if (e.getSQLState() != null && e.getSQLState().startsWith("HYT")) {
            return true;
        }
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SocketTimeoutException || cause instanceof TimeoutException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static boolean isMissingDriver(SQLException e) {
        return e.getMessage() != null && e.getMessage().startsWith("No suitable driver");
    }

    private void collectMetadata(Connection connection, ProbeOutcome outcome) {
        try {
            var metaData = connection.getMetaData();
            outcome.withMetadata("Provider", metaData.getDatabaseProductName());
            outcome.withMetadata("ServerVersion", metaData.getDatabaseProductVersion());
            var catalog = connection.getCatalog();
            if (catalog != null) {
                outcome.withMetadata("Database", catalog);
            }
        } catch (SQLException e) {
            log.warn("Failed to read {} connection metadata: {}", vendorName(), ErrorSanitizer.sanitize(e.getMessage()));
        }
    }

    /**
     * Classification for one well-known native error
     */
    @Getter
    @RequiredArgsConstructor
    public static final class ErrorEntry {
        private final ProbeErrorKind kind;
        private final String message;
    }
}
