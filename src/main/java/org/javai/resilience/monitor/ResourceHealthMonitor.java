package org.javai.resilience.monitor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.ClassifiedError;
import org.javai.resilience.classify.ClassificationContext;
import org.javai.resilience.classify.ErrorClassifier;
import org.javai.resilience.classify.HeuristicErrorClassifier;
import org.javai.resilience.report.ErrorReporter;
import org.javai.resilience.report.Log4jErrorReporter;
import org.javai.resilience.report.UncaughtFailureHandler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Periodically samples process memory and the statistics of a {@link ConnectionService},
 * keeps a bounded rolling history, raises alerts when thresholds are exceeded, and issues
 * coarse remediation commands to the service.
 *
 * <pre>{@code
 * ResourceHealthMonitor monitor = ResourceHealthMonitor.builder()
 *         .connectionService(service)
 *         .thresholds(settings.thresholds())
 *         .build();
 *
 * monitor.start(Duration.ofSeconds(30));
 * ...
 * MonitoringReport report = monitor.getReport();
 * monitor.stop();
 * }</pre>
 *
 * <p>Cycles run on a single daemon thread and never overlap: a tick that finds the previous
 * cycle still running is skipped. A failing cycle is classified and reported, whatever it
 * threw, and the schedule continues. {@link #stop()} does not wait for an in-flight cycle.
 */
public final class ResourceHealthMonitor {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_HISTORY_CAPACITY = 100;
    public static final int REPORT_HISTORY_SIZE = 20;
    public static final String NO_DATA_MESSAGE = "No monitoring data available";

    static final int SNAPSHOT_LOG_EVERY = 10;
    static final String CHECK_OPERATION = "ResourceHealthMonitor.performCheck";

    private static final Logger LOG = LogManager.getLogger(ResourceHealthMonitor.class);
    private static final Marker MONITOR_ALERT_MARKER = MarkerManager.getMarker("MONITOR_ALERT");

    private final ConnectionService connectionService;
    private final ProcessSampler processSampler;
    private final Clock clock;
    private final int historyCapacity;
    private final ErrorClassifier classifier;
    private final ErrorReporter reporter;
    private final RemediationDispatcher remediation;
    private final Supplier<ScheduledExecutorService> schedulerFactory;

    private final Deque<HealthSnapshot> history = new ArrayDeque<>();
    private final AtomicReference<AlertThresholds> thresholds;
    private final AtomicBoolean cycleInProgress = new AtomicBoolean(false);
    private final AtomicLong recordedCycles = new AtomicLong();

    private volatile ProcessSample baseline;
    private volatile MonitorState state = MonitorState.IDLE;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> schedule;

    private ResourceHealthMonitor(Builder builder) {
        this.connectionService = Objects.requireNonNull(builder.connectionService, "connectionService must not be null");
        this.processSampler = builder.processSampler;
        this.clock = builder.clock;
        this.historyCapacity = builder.historyCapacity;
        this.classifier = builder.classifier;
        this.reporter = builder.reporter;
        this.thresholds = new AtomicReference<>(builder.thresholds);
        this.remediation = new RemediationDispatcher(connectionService, builder.garbageCollector, classifier, reporter);
        this.schedulerFactory = builder.schedulerFactory != null
                ? builder.schedulerFactory
                : () -> Executors.newSingleThreadScheduledExecutor(
                        new UncaughtFailureHandler(classifier, reporter).threadFactory("resource-health-monitor", true));
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        start(DEFAULT_INTERVAL);
    }

    /**
     * Captures the baseline, runs one cycle on the calling thread, then schedules further
     * cycles every {@code interval}. The first scheduled cycle cannot start before the
     * immediate one has finished. Does nothing but log a warning if already running.
     */
    public void start(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }

        synchronized (this) {
            if (state == MonitorState.RUNNING) {
                LOG.warn("Resource health monitoring is already running");
                return;
            }
            baseline = captureBaseline();
            long periodMs = interval.toMillis();
            LOG.info("Starting resource health monitoring every {} ms", periodMs);

            performCheck();

            scheduler = schedulerFactory.get();
            schedule = scheduler.scheduleAtFixedRate(this::performCheck, periodMs, periodMs, TimeUnit.MILLISECONDS);
            state = MonitorState.RUNNING;
        }
    }

    /**
     * Cancels the schedule. An in-flight cycle is allowed to finish. Idempotent.
     */
    public synchronized void stop() {
        if (state != MonitorState.RUNNING) {
            return;
        }
        schedule.cancel(false);
        scheduler.shutdown();
        schedule = null;
        scheduler = null;
        state = MonitorState.STOPPED;
        LOG.info("Resource health monitoring stopped");
    }

    /**
     * Runs one sampling cycle. Never throws: whatever the collaborators throw, errors
     * included, is classified and reported, so a scheduled run never cancels the schedule.
     *
     * @return The recorded snapshot with its alerts and remediation outcomes, or empty if
     *         the cycle was skipped or failed
     */
    public Optional<CheckResult> performCheck() {
        if (!cycleInProgress.compareAndSet(false, true)) {
            LOG.debug("Skipping health check: previous cycle still in progress");
            return Optional.empty();
        }
        try {
            HealthSnapshot snapshot = takeSnapshot();
            List<Alert> alerts = AlertRules.evaluate(snapshot, thresholds.get());
            record(snapshot);

            List<RemediationOutcome> remediations = List.of();
            if (!alerts.isEmpty()) {
                LOG.warn(MONITOR_ALERT_MARKER, "Resource health alerts triggered: alerts={}, snapshot={}",
                        alerts, snapshot.excerpt());
                remediations = remediation.dispatch(alerts);
            }
            CheckResult result = new CheckResult(snapshot, alerts, remediations);
            List<RemediationOutcome> failed = result.failedRemediations();
            if (!failed.isEmpty()) {
                LOG.warn("{} of {} remediation(s) failed: {}", failed.size(), remediations.size(),
                        failed.stream().map(RemediationOutcome::action).toList());
            }

            if (recordedCycles.incrementAndGet() % SNAPSHOT_LOG_EVERY == 0) {
                logSnapshot(snapshot);
            }
            return Optional.of(result);
        } catch (Throwable t) {
            reportCycleFailure(t);
            return Optional.empty();
        } finally {
            cycleInProgress.set(false);
        }
    }

    public MonitoringReport getReport() {
        List<HealthSnapshot> snapshots;
        synchronized (history) {
            snapshots = new ArrayList<>(history);
        }
        if (snapshots.isEmpty()) {
            return new MonitoringReport.Empty(NO_DATA_MESSAGE);
        }

        HealthSnapshot oldest = snapshots.get(0);
        HealthSnapshot latest = snapshots.get(snapshots.size() - 1);
        Duration timeSpan = Duration.between(oldest.timestamp(), latest.timestamp());

        double heapUsed = 0;
        double activeConnections = 0;
        double processingJobs = 0;
        for (HealthSnapshot snapshot : snapshots) {
            heapUsed += snapshot.process().heapUsed();
            activeConnections += snapshot.connections().activeConnections();
            processingJobs += snapshot.connections().processingJobs();
        }
        int count = snapshots.size();

        MonitoringReport.Summary summary = new MonitoringReport.Summary(
                timeSpan,
                count,
                latest,
                new MonitoringReport.Averages(heapUsed / count, activeConnections / count, processingJobs / count),
                new MonitoringReport.Trends(
                        latest.process().heapUsed() - oldest.process().heapUsed(),
                        latest.connections().activeConnections() - oldest.connections().activeConnections(),
                        timeSpan));

        List<HealthSnapshot> recent = snapshots.subList(Math.max(0, count - REPORT_HISTORY_SIZE), count);
        return new MonitoringReport.Available(summary, recent, thresholds.get(), latest.health().memoryWarnings());
    }

    /**
     * Replaces the thresholds named in {@code update}. The next cycle evaluates against them.
     */
    public AlertThresholds updateThresholds(ThresholdUpdate update) {
        Objects.requireNonNull(update, "update must not be null");
        AlertThresholds updated = thresholds.updateAndGet(current -> current.merge(update));
        LOG.info("Resource health thresholds updated: {}", updated);
        return updated;
    }

    /**
     * Empties the history and re-captures the heap baseline.
     */
    public void clearHistory() {
        ProcessSample newBaseline = captureBaseline();
        synchronized (history) {
            history.clear();
            recordedCycles.set(0);
            baseline = newBaseline;
        }
        LOG.info("Resource health history cleared");
    }

    /**
     * Reads live figures without recording a snapshot.
     *
     * @throws ClassifiedError if the process or the connection service cannot be read
     */
    public CurrentStats getCurrentStats() {
        try {
            ProcessSample process = processSampler.sample();
            ConnectionStats connections = connectionService.getConnectionStats();
            return new CurrentStats(
                    clock.instant(),
                    process.heapUsedMb(),
                    process.heapTotalMb(),
                    process.externalMb(),
                    process.residentSetMb(),
                    connections,
                    state,
                    historySize(),
                    thresholds.get());
        } catch (RuntimeException e) {
            throw classifier.classify(e, ClassificationContext.forOperation("ResourceHealthMonitor.getCurrentStats"));
        }
    }

    public MonitorState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == MonitorState.RUNNING;
    }

    public AlertThresholds getThresholds() {
        return thresholds.get();
    }

    public int historySize() {
        synchronized (history) {
            return history.size();
        }
    }

    public List<HealthSnapshot> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    private HealthSnapshot takeSnapshot() {
        Instant timestamp = clock.instant();
        ProcessSample process = processSampler.sample();
        ConnectionStats connections = connectionService.getConnectionStats();
        ConnectionHealth health = connectionService.healthCheck();

        ProcessSample base = baseline;
        HeapGrowth growth = base != null ? HeapGrowth.between(base, process) : null;
        return new HealthSnapshot(timestamp, process, connections, health, growth);
    }

    private void record(HealthSnapshot snapshot) {
        synchronized (history) {
            history.addLast(snapshot);
            while (history.size() > historyCapacity) {
                history.removeFirst();
            }
        }
    }

    private ProcessSample captureBaseline() {
        try {
            return processSampler.sample();
        } catch (RuntimeException e) {
            throw classifier.classify(e, ClassificationContext.forOperation("ResourceHealthMonitor.captureBaseline"));
        }
    }

    private void reportCycleFailure(Throwable failure) {
        try {
            ClassifiedError error = classifier.classify(failure, ClassificationContext.forOperation(CHECK_OPERATION));
            reporter.report(error, Map.of("operation", CHECK_OPERATION));
        } catch (RuntimeException reportingFailure) {
            reportingFailure.addSuppressed(failure);
            LOG.error("Failed to report health check failure", reportingFailure);
        }
    }

    private void logSnapshot(HealthSnapshot snapshot) {
        ProcessSample process = snapshot.process();
        ConnectionStats connections = snapshot.connections();
        LOG.info("Resource health snapshot: connections={}, inactive={}, processingJobs={}, rateLimitedClients={}, "
                        + "subscriptions={}, heapUsedMb={}, heapTotalMb={}, externalMb={}, warnings={}",
                connections.activeConnections(),
                connections.inactiveConnections(),
                connections.processingJobs(),
                connections.rateLimitedClients(),
                connections.activeSubscriptions(),
                process.heapUsedMb(),
                process.heapTotalMb(),
                process.externalMb(),
                snapshot.health().memoryWarnings());
    }

    public static final class Builder {
        private ConnectionService connectionService;
        private ProcessSampler processSampler = ProcessSampler.jvm();
        private Clock clock = Clock.systemUTC();
        private AlertThresholds thresholds = AlertThresholds.DEFAULTS;
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private ErrorClassifier classifier = new HeuristicErrorClassifier();
        private ErrorReporter reporter = new Log4jErrorReporter();
        private Runnable garbageCollector = System::gc;
        private Supplier<ScheduledExecutorService> schedulerFactory;

        private Builder() {}

        public Builder connectionService(ConnectionService connectionService) {
            this.connectionService = Objects.requireNonNull(connectionService, "connectionService must not be null");
            return this;
        }

        public Builder processSampler(ProcessSampler processSampler) {
            this.processSampler = Objects.requireNonNull(processSampler, "processSampler must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder thresholds(AlertThresholds thresholds) {
            this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
            return this;
        }

        public Builder historyCapacity(int historyCapacity) {
            if (historyCapacity < 1) {
                throw new IllegalArgumentException("historyCapacity must be at least 1: " + historyCapacity);
            }
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder reporter(ErrorReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * The hook invoked on {@code high_memory_growth}. Defaults to {@link System#gc()}.
         */
        public Builder garbageCollector(Runnable garbageCollector) {
            this.garbageCollector = Objects.requireNonNull(garbageCollector, "garbageCollector must not be null");
            return this;
        }

        /**
         * Supplies the executor for each {@link #start(Duration)}. It is shut down on {@link #stop()}.
         */
        public Builder schedulerFactory(Supplier<ScheduledExecutorService> schedulerFactory) {
            this.schedulerFactory = Objects.requireNonNull(schedulerFactory, "schedulerFactory must not be null");
            return this;
        }

        public ResourceHealthMonitor build() {
            return new ResourceHealthMonitor(this);
        }
    }
}
