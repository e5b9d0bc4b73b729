package org.javai.resilience.monitor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.ClassifiedError;
import org.javai.resilience.classify.ClassificationContext;
import org.javai.resilience.classify.ErrorClassifier;
import org.javai.resilience.report.ErrorReporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Issues the corrective call for each alert against the connection service.
 *
 * <ul>
 *   <li>{@code high_inactive_ratio} → disconnect connections idle for more than 5 minutes</li>
 *   <li>{@code high_processing_jobs} → periodic cleanup of stale job bookkeeping</li>
 *   <li>{@code high_connection_count} → cleanup of expired rate-limit bookkeeping</li>
 *   <li>{@code high_memory_growth} → garbage collection request</li>
 * </ul>
 *
 * <p>Each action runs in its own failure boundary: anything it throws, errors included, is
 * classified and reported, and the remaining actions still run.
 */
final class RemediationDispatcher {

    static final Duration INACTIVE_GRACE_PERIOD = Duration.ofMinutes(5);

    private static final Logger LOG = LogManager.getLogger(RemediationDispatcher.class);
    private static final Marker REMEDIATION_MARKER = MarkerManager.getMarker("REMEDIATION");

    private final ConnectionService connectionService;
    private final Runnable garbageCollector;
    private final ErrorClassifier classifier;
    private final ErrorReporter reporter;

    RemediationDispatcher(ConnectionService connectionService, Runnable garbageCollector,
                          ErrorClassifier classifier, ErrorReporter reporter) {
        this.connectionService = Objects.requireNonNull(connectionService, "connectionService must not be null");
        this.garbageCollector = Objects.requireNonNull(garbageCollector, "garbageCollector must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    List<RemediationOutcome> dispatch(List<Alert> alerts) {
        LOG.info(REMEDIATION_MARKER, "Performing auto-recovery for {} alert(s)", alerts.size());

        List<RemediationOutcome> outcomes = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            outcomes.add(remediate(alert));
        }
        return outcomes;
    }

    private RemediationOutcome remediate(Alert alert) {
        String action = actionFor(alert.kind());
        try {
            switch (alert.kind()) {
                case HIGH_INACTIVE_RATIO -> {
                    int disconnected = connectionService.disconnectInactiveConnections(INACTIVE_GRACE_PERIOD);
                    LOG.info(REMEDIATION_MARKER, "Disconnected {} inactive connection(s)", disconnected);
                }
                case HIGH_PROCESSING_JOBS -> {
                    connectionService.performPeriodicCleanup();
                    LOG.info(REMEDIATION_MARKER, "Performed periodic cleanup for processing jobs");
                }
                case HIGH_CONNECTION_COUNT -> {
                    connectionService.cleanupRateLimits();
                    LOG.info(REMEDIATION_MARKER, "Cleaned up rate limit records");
                }
                case HIGH_MEMORY_GROWTH -> {
                    garbageCollector.run();
                    LOG.info(REMEDIATION_MARKER, "Requested garbage collection");
                }
            }
            return new RemediationOutcome(alert, action, null);
        } catch (Throwable t) {
            ClassifiedError error = classifier.classify(t, ClassificationContext.forOperation(action));
            error.withMetadata("alert", alert.kind().wireName());
            reporter.report(error, Map.of("operation", action, "alert", alert.toString()));
            return new RemediationOutcome(alert, action, error);
        }
    }

    static String actionFor(AlertKind kind) {
        return switch (kind) {
            case HIGH_INACTIVE_RATIO -> "ConnectionService.disconnectInactiveConnections";
            case HIGH_PROCESSING_JOBS -> "ConnectionService.performPeriodicCleanup";
            case HIGH_CONNECTION_COUNT -> "ConnectionService.cleanupRateLimits";
            case HIGH_MEMORY_GROWTH -> "Runtime.gc";
        };
    }
}
