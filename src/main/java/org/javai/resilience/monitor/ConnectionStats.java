package org.javai.resilience.monitor;

/**
 * Aggregate statistics of the connection service at one point in time.
 *
 * @param activeConnections Open connections
 * @param inactiveConnections Open connections with no activity for the service's idle window
 * @param processingJobs Jobs currently in flight
 * @param rateLimitedClients Clients with rate-limit bookkeeping
 * @param activeSubscriptions Subscriptions across all connections
 */
public record ConnectionStats(
        int activeConnections,
        int inactiveConnections,
        int processingJobs,
        int rateLimitedClients,
        int activeSubscriptions
) {

    public ConnectionStats {
        requireNonNegative(activeConnections, "activeConnections");
        requireNonNegative(inactiveConnections, "inactiveConnections");
        requireNonNegative(processingJobs, "processingJobs");
        requireNonNegative(rateLimitedClients, "rateLimitedClients");
        requireNonNegative(activeSubscriptions, "activeSubscriptions");
    }

    public static ConnectionStats of(int activeConnections, int inactiveConnections, int processingJobs) {
        return new ConnectionStats(activeConnections, inactiveConnections, processingJobs, 0, 0);
    }

    /**
     * Inactive connections divided by active connections, or 0 with no active connections.
     */
    public double inactiveRatio() {
        return activeConnections > 0 ? (double) inactiveConnections / activeConnections : 0.0;
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }
}
