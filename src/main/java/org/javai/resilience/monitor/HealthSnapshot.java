package org.javai.resilience.monitor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One immutable sample of process and connection service state.
 *
 * @param timestamp When the sample was taken
 * @param process Process memory and CPU counters
 * @param connections Connection service statistics
 * @param health Connection service health summary
 * @param heapGrowth Growth relative to the baseline; null when no baseline exists
 */
public record HealthSnapshot(
        Instant timestamp,
        ProcessSample process,
        ConnectionStats connections,
        ConnectionHealth health,
        HeapGrowth heapGrowth
) {

    public HealthSnapshot {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(process, "process must not be null");
        Objects.requireNonNull(connections, "connections must not be null");
        Objects.requireNonNull(health, "health must not be null");
    }

    public Optional<HeapGrowth> growth() {
        return Optional.ofNullable(heapGrowth);
    }

    /**
     * The fields logged alongside alerts.
     */
    public Map<String, Object> excerpt() {
        Map<String, Object> excerpt = new LinkedHashMap<>();
        excerpt.put("timestamp", timestamp.toString());
        excerpt.put("connections", connections.activeConnections());
        excerpt.put("heapUsed", process.heapUsed());
        excerpt.put("warnings", health.memoryWarnings());
        return excerpt;
    }
}
