package org.javai.resilience.monitor;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * What {@link ResourceHealthMonitor#getReport()} returns: either {@link Empty} when nothing
 * has been sampled yet, or {@link Available} with a summary of the rolling history.
 */
public sealed interface MonitoringReport permits MonitoringReport.Empty, MonitoringReport.Available {

    boolean isAvailable();

    /**
     * No snapshots have been recorded.
     *
     * @param reason Why no data is available
     */
    record Empty(String reason) implements MonitoringReport {

        public Empty {
            Objects.requireNonNull(reason, "reason must not be null");
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    }

    /**
     * @param summary Aggregates over the whole rolling history
     * @param recentHistory The most recent snapshots, oldest first
     * @param thresholds The thresholds in force
     * @param recentWarnings Warnings from the latest connection health check
     */
    record Available(
            Summary summary,
            List<HealthSnapshot> recentHistory,
            AlertThresholds thresholds,
            List<String> recentWarnings
    ) implements MonitoringReport {

        public Available {
            Objects.requireNonNull(summary, "summary must not be null");
            Objects.requireNonNull(thresholds, "thresholds must not be null");
            recentHistory = List.copyOf(recentHistory);
            recentWarnings = List.copyOf(recentWarnings);
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }

    /**
     * @param monitoringDuration Time between the oldest and the latest snapshot
     * @param snapshotCount Snapshots in the rolling history
     * @param latest The latest snapshot
     * @param averages Arithmetic means over the rolling history
     * @param trends Latest minus oldest
     */
    record Summary(
            Duration monitoringDuration,
            int snapshotCount,
            HealthSnapshot latest,
            Averages averages,
            Trends trends
    ) {}

    record Averages(double heapUsed, double activeConnections, double processingJobs) {}

    /**
     * @param heapUsedChange Heap bytes used, latest minus oldest
     * @param connectionChange Active connections, latest minus oldest
     * @param timeSpan Time between oldest and latest
     */
    record Trends(long heapUsedChange, int connectionChange, Duration timeSpan) {}
}
