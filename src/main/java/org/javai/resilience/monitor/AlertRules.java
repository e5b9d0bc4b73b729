package org.javai.resilience.monitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a snapshot against thresholds. Rules are independent; a single snapshot may
 * raise several alerts, always in {@link AlertKind} order.
 */
final class AlertRules {

    private AlertRules() {
    }

    static List<Alert> evaluate(HealthSnapshot snapshot, AlertThresholds thresholds) {
        List<Alert> alerts = new ArrayList<>(AlertKind.values().length);
        ConnectionStats stats = snapshot.connections();

        if (stats.activeConnections() > thresholds.maxConnections()) {
            alerts.add(new Alert(AlertKind.HIGH_CONNECTION_COUNT,
                    stats.activeConnections(), thresholds.maxConnections()));
        }

        if (stats.processingJobs() > thresholds.maxProcessingJobs()) {
            alerts.add(new Alert(AlertKind.HIGH_PROCESSING_JOBS,
                    stats.processingJobs(), thresholds.maxProcessingJobs()));
        }

        HeapGrowth growth = snapshot.heapGrowth();
        if (growth != null && growth.percent() > thresholds.maxMemoryGrowthPercent()) {
            alerts.add(new Alert(AlertKind.HIGH_MEMORY_GROWTH,
                    growth.percent(), thresholds.maxMemoryGrowthPercent()));
        }

        double inactiveRatio = stats.inactiveRatio();
        if (inactiveRatio > thresholds.maxInactiveRatio()) {
            alerts.add(new Alert(AlertKind.HIGH_INACTIVE_RATIO,
                    inactiveRatio, thresholds.maxInactiveRatio()));
        }

        return alerts;
    }
}
