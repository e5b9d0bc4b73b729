package org.javai.resilience.monitor;

/**
 * The conditions the monitor alerts on, in evaluation order.
 */
public enum AlertKind {
    HIGH_CONNECTION_COUNT("high_connection_count"),
    HIGH_PROCESSING_JOBS("high_processing_jobs"),
    HIGH_MEMORY_GROWTH("high_memory_growth"),
    HIGH_INACTIVE_RATIO("high_inactive_ratio");

    private final String wireName;

    AlertKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
