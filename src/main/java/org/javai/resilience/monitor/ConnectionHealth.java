package org.javai.resilience.monitor;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * The connection service's own view of its health.
 *
 * @param status Free-form status, e.g. {@code "healthy"}
 * @param uptime Time since the service initialised
 * @param memoryWarnings Warnings the service raises about its own bookkeeping
 */
public record ConnectionHealth(String status, Duration uptime, List<String> memoryWarnings) {

    public ConnectionHealth {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(uptime, "uptime must not be null");
        memoryWarnings = memoryWarnings == null ? List.of() : List.copyOf(memoryWarnings);
    }

    public static ConnectionHealth healthy(Duration uptime) {
        return new ConnectionHealth("healthy", uptime, List.of());
    }
}
