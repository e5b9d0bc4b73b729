package org.javai.resilience.monitor;

/**
 * Limits evaluated by every sampling cycle. Each alert fires when the observed value is
 * strictly greater than its limit.
 *
 * @param maxConnections Maximum active connections
 * @param maxProcessingJobs Maximum in-flight jobs
 * @param maxMemoryGrowthPercent Maximum heap growth over the baseline, in percent
 * @param maxInactiveRatio Maximum inactive-to-active connection ratio
 */
public record AlertThresholds(
        int maxConnections,
        int maxProcessingJobs,
        double maxMemoryGrowthPercent,
        double maxInactiveRatio
) {

    public static final AlertThresholds DEFAULTS = new AlertThresholds(1000, 100, 50.0, 0.4);

    public AlertThresholds {
        if (maxConnections < 0) {
            throw new IllegalArgumentException("maxConnections must not be negative: " + maxConnections);
        }
        if (maxProcessingJobs < 0) {
            throw new IllegalArgumentException("maxProcessingJobs must not be negative: " + maxProcessingJobs);
        }
        if (Double.isNaN(maxMemoryGrowthPercent) || maxMemoryGrowthPercent < 0) {
            throw new IllegalArgumentException("maxMemoryGrowthPercent must be a non-negative number: " + maxMemoryGrowthPercent);
        }
        if (Double.isNaN(maxInactiveRatio) || maxInactiveRatio < 0) {
            throw new IllegalArgumentException("maxInactiveRatio must be a non-negative number: " + maxInactiveRatio);
        }
    }

    /**
     * Returns these thresholds with the fields present in {@code update} replaced.
     */
    public AlertThresholds merge(ThresholdUpdate update) {
        if (update == null) {
            return this;
        }
        return new AlertThresholds(
                update.maxConnections() != null ? update.maxConnections() : maxConnections,
                update.maxProcessingJobs() != null ? update.maxProcessingJobs() : maxProcessingJobs,
                update.maxMemoryGrowthPercent() != null ? update.maxMemoryGrowthPercent() : maxMemoryGrowthPercent,
                update.maxInactiveRatio() != null ? update.maxInactiveRatio() : maxInactiveRatio
        );
    }
}
