package com.example.connectionmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Connection Monitor Service Application
 * <p>
 * Periodically verifies that the external connections registered for each
 * application (relational databases, REST APIs, GitHub) are reachable.
 * <p>
 * Features:
 * - Cron-driven health-check schedules, one per application
 * - Per-technology probes with a normalized error taxonomy
 * - Credentials encrypted at rest, decrypted only at probe time
 * - Distributed polling lock so only one instance dispatches
 * - Slack alerting when a scheduled run fails
 */
@EnableScheduling
@SpringBootApplication
public class ConnectionMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConnectionMonitorApplication.class, args);
    }
}
