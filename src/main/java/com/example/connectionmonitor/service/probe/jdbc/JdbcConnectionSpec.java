package com.example.connectionmonitor.service.probe.jdbc;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Properties;

/**
 * JDBC URL plus driver properties for one probe attempt
 */
@Getter
@Builder
@ToString
public class JdbcConnectionSpec {

    private final String url;

    @ToString.Exclude
    private final Properties properties;
}
