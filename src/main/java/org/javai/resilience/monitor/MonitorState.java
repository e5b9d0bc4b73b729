package org.javai.resilience.monitor;

/**
 * Lifecycle of a {@link ResourceHealthMonitor}.
 */
public enum MonitorState {
    /** Created, never started. */
    IDLE,
    /** Sampling on a fixed period. */
    RUNNING,
    /** Stopped; may be started again. */
    STOPPED
}
