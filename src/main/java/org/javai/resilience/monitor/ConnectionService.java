package org.javai.resilience.monitor;

import java.time.Duration;

/**
 * The long-lived connection service observed by {@link ResourceHealthMonitor}.
 *
 * <p>The service owns its connection and job registries and all locking around them. The
 * monitor only reads aggregate statistics and issues coarse remediation commands. Any of
 * these calls may throw; the monitor classifies and reports such failures. Calls that can
 * block indefinitely must enforce their own timeout.
 */
public interface ConnectionService {

    ConnectionStats getConnectionStats();

    ConnectionHealth healthCheck();

    /**
     * Disconnects connections idle for longer than {@code inactiveThreshold}.
     *
     * @return The number of connections closed
     */
    int disconnectInactiveConnections(Duration inactiveThreshold);

    /**
     * Drops stale in-flight job bookkeeping and long-dead connections.
     */
    void performPeriodicCleanup();

    /**
     * Drops expired rate-limit bookkeeping.
     */
    void cleanupRateLimits();
}
