package org.javai.resilience.monitor;

/**
 * A partial change to {@link AlertThresholds}. Null fields are left unchanged.
 */
public record ThresholdUpdate(
        Integer maxConnections,
        Integer maxProcessingJobs,
        Double maxMemoryGrowthPercent,
        Double maxInactiveRatio
) {

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return maxConnections == null && maxProcessingJobs == null
                && maxMemoryGrowthPercent == null && maxInactiveRatio == null;
    }

    public static final class Builder {
        private Integer maxConnections;
        private Integer maxProcessingJobs;
        private Double maxMemoryGrowthPercent;
        private Double maxInactiveRatio;

        private Builder() {}

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder maxProcessingJobs(int maxProcessingJobs) {
            this.maxProcessingJobs = maxProcessingJobs;
            return this;
        }

        public Builder maxMemoryGrowthPercent(double maxMemoryGrowthPercent) {
            this.maxMemoryGrowthPercent = maxMemoryGrowthPercent;
            return this;
        }

        public Builder maxInactiveRatio(double maxInactiveRatio) {
            this.maxInactiveRatio = maxInactiveRatio;
            return this;
        }

        public ThresholdUpdate build() {
            return new ThresholdUpdate(maxConnections, maxProcessingJobs, maxMemoryGrowthPercent, maxInactiveRatio);
        }
    }
}
