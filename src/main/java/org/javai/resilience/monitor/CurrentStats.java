package org.javai.resilience.monitor;

import java.time.Instant;

/**
 * Live figures read on demand, without recording a snapshot.
 *
 * @param timestamp When the figures were read
 * @param heapUsedMb Heap in use, in megabytes
 * @param heapTotalMb Heap committed, in megabytes
 * @param externalMb Off-heap memory, in megabytes
 * @param residentSetMb Resident set size, in megabytes
 * @param connections Connection service statistics
 * @param state Monitor state
 * @param historySize Snapshots currently held
 * @param thresholds Thresholds in force
 */
public record CurrentStats(
        Instant timestamp,
        double heapUsedMb,
        double heapTotalMb,
        double externalMb,
        double residentSetMb,
        ConnectionStats connections,
        MonitorState state,
        int historySize,
        AlertThresholds thresholds
) {

    public boolean isRunning() {
        return state == MonitorState.RUNNING;
    }
}
