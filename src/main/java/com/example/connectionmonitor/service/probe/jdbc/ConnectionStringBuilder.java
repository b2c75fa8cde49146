package com.example.connectionmonitor.service.probe.jdbc;

import com.example.connectionmonitor.domain.enums.ConnectionType;
import com.example.connectionmonitor.service.probe.ProbeTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

/**
 * Builds JDBC URLs and driver properties from a connection's location fields.
 * <p>
 * A supplied connection string always wins over the individual fields.
 * Default ports: SQL Server 1433, MySQL 3306, PostgreSQL 5432, Oracle 1521.
 * {@code additionalSettings} ("k=v;k2=v2" or "k=v&amp;k2=v2") become driver properties.
 */
@Slf4j
@Component
public class ConnectionStringBuilder {

    private static final Map<ConnectionType, String> URL_PREFIXES = new EnumMap<>(ConnectionType.class);
    private static final Map<ConnectionType, Integer> DEFAULT_PORTS = new EnumMap<>(ConnectionType.class);

    static {
        URL_PREFIXES.put(ConnectionType.SQL_SERVER, "jdbc:sqlserver:");
        URL_PREFIXES.put(ConnectionType.AZURE_SQL, "jdbc:sqlserver:");
        URL_PREFIXES.put(ConnectionType.MYSQL, "jdbc:mysql:");
        URL_PREFIXES.put(ConnectionType.POSTGRESQL, "jdbc:postgresql:");
        URL_PREFIXES.put(ConnectionType.ORACLE, "jdbc:oracle:");
        URL_PREFIXES.put(ConnectionType.SQLITE, "jdbc:sqlite:");

        DEFAULT_PORTS.put(ConnectionType.SQL_SERVER, 1433);
        DEFAULT_PORTS.put(ConnectionType.AZURE_SQL, 1433);
        DEFAULT_PORTS.put(ConnectionType.MYSQL, 3306);
        DEFAULT_PORTS.put(ConnectionType.POSTGRESQL, 5432);
        DEFAULT_PORTS.put(ConnectionType.ORACLE, 1521);
    }

    /**
     * Build the URL and base properties (credentials, additional settings) for a target.
     *
     * @throws IllegalArgumentException when required location fields are missing
     *                                  or the type is not a JDBC flavor
     */
    public JdbcConnectionSpec build(ProbeTarget target) {
        var type = target.getType();
        if (!URL_PREFIXES.containsKey(type)) {
            throw new IllegalArgumentException("Connection type " + type.getDisplayName() + " has no JDBC URL format");
        }

        var properties = new Properties();
        if (target.hasUsername()) {
            properties.setProperty("user", target.getUsername());
            if (target.getPassword() != null) {
                properties.setProperty("password", target.getPassword());
            }
        }

        String url;
        if (target.hasConnectionString()) {
            url = target.getConnectionString().trim();
        } else {
            url = buildUrl(target);
            if ((type == ConnectionType.SQL_SERVER || type == ConnectionType.AZURE_SQL) && !target.hasUsername()) {
                properties.setProperty("integratedSecurity", "true");
            }
        }

        properties.putAll(parseSettings(target.getAdditionalSettings()));

        return JdbcConnectionSpec.builder().url(url).properties(properties).build();
    }

    String buildUrl(ProbeTarget target) {
        var type = target.getType();

        if (type == ConnectionType.SQLITE) {
            require(target.getDatabaseName(), "database file path is required");
            return "jdbc:sqlite:" + target.getDatabaseName().trim();
        }

        require(target.getServer(), "server is required");
        var server = target.getServer().trim();
        var port = effectivePort(target);
        var database = target.getDatabaseName() != null ? target.getDatabaseName().trim() : "";

        if (type == ConnectionType.SQL_SERVER || type == ConnectionType.AZURE_SQL) {
            var sb = new StringBuilder("jdbc:sqlserver://").append(server);
            if (port != 1433) {
                sb.append(':').append(port);
            }
            if (!database.isEmpty()) {
                sb.append(";databaseName=").append(database);
            }
            return sb.toString();
        }
        if (type == ConnectionType.MYSQL) {
            return "jdbc:mysql://" + server + ":" + port + "/" + database;
        }
        if (type == ConnectionType.POSTGRESQL) {
            return "jdbc:postgresql://" + server + ":" + port + "/" + database;
        }
        // Oracle: service name in the database field
        require(target.getDatabaseName(), "service name (database) is required");
        return "jdbc:oracle:thin:@//" + server + ":" + port + "/" + database;
    }

    /**
     * Format check for a user-supplied connection string.
     *
     * @return null when valid, otherwise the reason it is not
     */
    public String validate(ConnectionType type, String connectionString) {
        if (connectionString == null || connectionString.isBlank()) {
            return "Connection string cannot be empty";
        }
        var prefix = URL_PREFIXES.get(type);
        if (prefix == null) {
            return "Connection strings are not supported for " + type.getDisplayName();
        }
        var trimmed = connectionString.trim();
        if (!trimmed.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return "Expected a JDBC URL starting with '" + prefix + "'";
        }
        if (trimmed.length() == prefix.length()) {
            return "Connection string has no location after '" + prefix + "'";
        }
        return null;
    }

    public boolean supports(ConnectionType type) {
        return URL_PREFIXES.containsKey(type);
    }

    int effectivePort(ProbeTarget target) {
        if (target.getPort() != null && target.getPort() > 0) {
            return target.getPort();
        }
        return DEFAULT_PORTS.getOrDefault(target.getType(), 0);
    }

    static Properties parseSettings(String settings) {
        var properties = new Properties();
        if (settings == null || settings.isBlank()) {
            return properties;
        }
        for (var pair : settings.split("[;&]")) {
            var trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            var idx = trimmed.indexOf('=');
            if (idx <= 0) {
                log.debug("Ignoring malformed additional setting without '='");
                continue;
            }
            properties.setProperty(trimmed.substring(0, idx).trim(), trimmed.substring(idx + 1).trim());
        }
        return properties;
    }

    private static void require(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}
