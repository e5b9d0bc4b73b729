package org.javai.resilience.monitor;

import org.javai.resilience.ClassifiedError;
import org.javai.resilience.ErrorCode;
import org.javai.resilience.LogCapture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class ResourceHealthMonitorTest {

    private static final long MB = 1024L * 1024L;

    private FakeConnectionService service;
    private AtomicLong heapUsed;
    private MutableClock clock;
    private AtomicInteger gcRequests;
    private List<ClassifiedError> reported;
    private List<Map<String, Object>> contexts;
    private LogCapture capture;
    private ResourceHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        service = new FakeConnectionService();
        heapUsed = new AtomicLong(100 * MB);
        clock = new MutableClock(Instant.parse("2024-01-20T10:00:00Z"));
        gcRequests = new AtomicInteger();
        reported = new CopyOnWriteArrayList<>();
        contexts = new CopyOnWriteArrayList<>();
        capture = LogCapture.attach(ResourceHealthMonitor.class);
        monitor = monitorWith(AlertThresholds.DEFAULTS, ResourceHealthMonitor.DEFAULT_HISTORY_CAPACITY);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
        capture.close();
    }

    @Test
    void report_beforeAnyCycle_isEmpty() {
        MonitoringReport report = monitor.getReport();

        assertThat(report).isInstanceOf(MonitoringReport.Empty.class);
        assertThat(report.isAvailable()).isFalse();
        assertThat(((MonitoringReport.Empty) report).reason()).isEqualTo("No monitoring data available");
        assertThat(monitor.getState()).isEqualTo(MonitorState.IDLE);
    }

    @Test
    void connectionCountBreach_raisesOneAlertAndCleansRateLimits() {
        monitor.updateThresholds(ThresholdUpdate.builder().maxConnections(5).build());
        service.stats = ConnectionStats.of(6, 0, 0);

        CheckResult result = monitor.performCheck().orElseThrow();

        assertThat(result.alerts()).extracting(Alert::kind).containsExactly(AlertKind.HIGH_CONNECTION_COUNT);
        assertThat(result.remediations()).singleElement().satisfies(outcome -> {
            assertThat(outcome.action()).isEqualTo("ConnectionService.cleanupRateLimits");
            assertThat(outcome.succeeded()).isTrue();
        });
        assertThat(service.calls).containsExactly("cleanupRateLimits");
        assertThat(capture.withMarker("MONITOR_ALERT")).hasSize(1);
        assertThat(capture.withMarker("MONITOR_ALERT").get(0).getMessage().getFormattedMessage())
                .contains("high_connection_count(value=6.0, threshold=5.0)");
        assertThat(reported).isEmpty();
    }

    @Test
    void healthyCycle_issuesNoRemediation() {
        service.stats = ConnectionStats.of(10, 1, 2);

        CheckResult result = monitor.performCheck().orElseThrow();

        assertThat(result.healthy()).isTrue();
        assertThat(result.remediations()).isEmpty();
        assertThat(service.calls).isEmpty();
        assertThat(capture.withMarker("MONITOR_ALERT")).isEmpty();
        assertThat(monitor.historySize()).isEqualTo(1);
    }

    @Test
    void history_evictsOldestBeyondCapacity() {
        monitor = monitorWith(AlertThresholds.DEFAULTS, 3);

        for (int i = 0; i < 5; i++) {
            monitor.performCheck();
            clock.advance(Duration.ofSeconds(30));
        }

        List<HealthSnapshot> history = monitor.history();
        assertThat(history).hasSize(3);
        assertThat(history.get(0).timestamp()).isEqualTo(Instant.parse("2024-01-20T10:01:00Z"));
        assertThat(history.get(2).timestamp()).isEqualTo(Instant.parse("2024-01-20T10:02:00Z"));
    }

    @Test
    void report_summarisesWholeHistoryAndReturnsRecentTwenty() {
        service.warnings = List.of("rate limit map large");
        for (int i = 0; i < 25; i++) {
            service.stats = ConnectionStats.of(i, 0, 1);
            heapUsed.set((100 + i) * MB);
            monitor.performCheck();
            clock.advance(Duration.ofSeconds(10));
        }

        MonitoringReport.Available report = (MonitoringReport.Available) monitor.getReport();

        assertThat(report.recentHistory()).hasSize(20);
        assertThat(report.recentHistory().get(19).connections().activeConnections()).isEqualTo(24);
        assertThat(report.recentWarnings()).containsExactly("rate limit map large");
        assertThat(report.thresholds()).isEqualTo(AlertThresholds.DEFAULTS);

        MonitoringReport.Summary summary = report.summary();
        assertThat(summary.snapshotCount()).isEqualTo(25);
        assertThat(summary.monitoringDuration()).isEqualTo(Duration.ofSeconds(240));
        assertThat(summary.averages().activeConnections()).isEqualTo(12.0);
        assertThat(summary.averages().processingJobs()).isEqualTo(1.0);
        assertThat(summary.trends().connectionChange()).isEqualTo(24);
        assertThat(summary.trends().heapUsedChange()).isEqualTo(24 * MB);
        assertThat(summary.trends().timeSpan()).isEqualTo(Duration.ofSeconds(240));
    }

    @Test
    void failingRemediation_doesNotStopTheOthers() {
        monitor.updateThresholds(ThresholdUpdate.builder()
                .maxConnections(1).maxProcessingJobs(1).maxInactiveRatio(0.1).build());
        service.stats = ConnectionStats.of(4, 2, 3);
        service.cleanupFailure = new IllegalStateException("job registry busy");

        CheckResult result = monitor.performCheck().orElseThrow();

        assertThat(result.failedRemediations()).extracting(RemediationOutcome::action)
                .containsExactly("ConnectionService.performPeriodicCleanup");
        assertThat(result.remediations()).hasSize(3);
        assertThat(service.calls).containsExactly(
                "cleanupRateLimits", "performPeriodicCleanup", "disconnectInactiveConnections");
        assertThat(service.disconnectThresholds).containsExactly(Duration.ofMinutes(5));
        assertThat(reported).hasSize(1);
        assertThat(reported.get(0).code()).isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR);
        assertThat(reported.get(0).metadata()).containsEntry("alert", "high_processing_jobs");
        assertThat(contexts.get(0)).containsEntry("operation", "ConnectionService.performPeriodicCleanup");
        assertThat(monitor.historySize()).isEqualTo(1);
    }

    @Test
    void errorFromRemediation_isReportedAndLaterActionsStillRun() {
        monitor.updateThresholds(ThresholdUpdate.builder().maxConnections(1).maxInactiveRatio(0.1).build());
        service.stats = ConnectionStats.of(4, 2, 0);
        service.onCleanupRateLimits = () -> {
            throw new AssertionError("rate limit store corrupted");
        };

        CheckResult result = monitor.performCheck().orElseThrow();

        assertThat(service.calls).containsExactly("cleanupRateLimits", "disconnectInactiveConnections");
        assertThat(reported).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR);
            assertThat(error.getCause()).isInstanceOf(AssertionError.class);
            assertThat(error.metadata()).containsEntry("alert", "high_connection_count");
        });
        assertThat(result.failedRemediations()).extracting(RemediationOutcome::action)
                .containsExactly("ConnectionService.cleanupRateLimits");
        assertThat(monitor.historySize()).isEqualTo(1);
    }

    @Test
    void failingStatsRead_isReportedAndNotRecorded() {
        service.statsFailure = new RuntimeException("database is locked");

        Optional<CheckResult> failed = monitor.performCheck();

        assertThat(failed).isEmpty();
        assertThat(monitor.historySize()).isZero();
        assertThat(reported).hasSize(1);
        assertThat(reported.get(0).code()).isEqualTo(ErrorCode.DATABASE_TIMEOUT);
        assertThat(contexts.get(0)).containsEntry("operation", "ResourceHealthMonitor.performCheck");

        service.statsFailure = null;
        assertThat(monitor.performCheck()).isPresent();
        assertThat(monitor.historySize()).isEqualTo(1);
    }

    @Test
    void memoryGrowthOverBaseline_requestsGarbageCollection() {
        monitor.clearHistory();
        heapUsed.set(200 * MB);

        HealthSnapshot snapshot = monitor.performCheck().orElseThrow().snapshot();

        assertThat(snapshot.growth()).isPresent();
        assertThat(snapshot.heapGrowth().percent()).isEqualTo(100.0);
        assertThat(snapshot.heapGrowth().megabytes()).isEqualTo(100.0);
        assertThat(gcRequests.get()).isEqualTo(1);
    }

    @Test
    void withoutBaseline_snapshotHasNoGrowth() {
        assertThat(monitor.performCheck().orElseThrow().snapshot().growth()).isEmpty();
    }

    @Test
    void clearHistory_emptiesAndRecapturesBaseline() {
        monitor.performCheck();
        heapUsed.set(300 * MB);

        monitor.clearHistory();

        assertThat(monitor.getReport().isAvailable()).isFalse();
        HealthSnapshot next = monitor.performCheck().orElseThrow().snapshot();
        assertThat(next.heapGrowth().bytes()).isZero();
    }

    @Test
    void updatedThresholds_applyToNextCycle() {
        service.stats = ConnectionStats.of(0, 0, 3);
        monitor.performCheck();
        assertThat(service.calls).isEmpty();

        AlertThresholds updated = monitor.updateThresholds(ThresholdUpdate.builder().maxProcessingJobs(2).build());
        monitor.performCheck();

        assertThat(updated.maxProcessingJobs()).isEqualTo(2);
        assertThat(monitor.getThresholds()).isEqualTo(updated);
        assertThat(service.calls).containsExactly("performPeriodicCleanup");
    }

    @Test
    void overlappingCycle_isSkipped() {
        AtomicReference<Optional<CheckResult>> nested = new AtomicReference<>();
        monitor.updateThresholds(ThresholdUpdate.builder().maxConnections(0).build());
        service.stats = ConnectionStats.of(1, 0, 0);
        service.onCleanupRateLimits = () -> nested.set(monitor.performCheck());

        monitor.performCheck();

        assertThat(nested.get()).isEmpty();
        assertThat(monitor.historySize()).isEqualTo(1);
    }

    @Test
    void everyTenthCycle_logsSnapshot() {
        for (int i = 0; i < 20; i++) {
            monitor.performCheck();
        }

        assertThat(capture.messages()).filteredOn(m -> m.startsWith("Resource health snapshot")).hasSize(2);
    }

    @Test
    void currentStats_doesNotRecord() {
        service.stats = ConnectionStats.of(3, 1, 0);

        CurrentStats stats = monitor.getCurrentStats();

        assertThat(stats.heapUsedMb()).isEqualTo(100.0);
        assertThat(stats.connections().activeConnections()).isEqualTo(3);
        assertThat(stats.isRunning()).isFalse();
        assertThat(stats.historySize()).isZero();
        assertThat(stats.thresholds()).isEqualTo(AlertThresholds.DEFAULTS);
        assertThat(monitor.historySize()).isZero();
    }

    @Test
    void currentStats_failureIsClassified() {
        service.statsFailure = new RuntimeException("connect ECONNREFUSED");

        assertThatThrownBy(() -> monitor.getCurrentStats()).isInstanceOf(ClassifiedError.class);
    }

    @Test
    void start_runsFirstCycleImmediatelyThenOnSchedule() throws Exception {
        CountDownLatch cycles = new CountDownLatch(3);
        monitor.updateThresholds(ThresholdUpdate.builder().maxConnections(0).build());
        service.stats = ConnectionStats.of(1, 0, 0);
        service.onCleanupRateLimits = () -> {
            cycles.countDown();
            throw new IllegalStateException("rate limit store unavailable");
        };

        monitor.start(Duration.ofMillis(20));

        assertThat(monitor.historySize()).isGreaterThanOrEqualTo(1);
        assertThat(monitor.isRunning()).isTrue();
        assertThat(cycles.await(5, TimeUnit.SECONDS)).isTrue();

        monitor.stop();
        assertThat(monitor.getState()).isEqualTo(MonitorState.STOPPED);
        assertThat(reported).isNotEmpty();
        assertThat(reported).allSatisfy(e -> assertThat(e.metadata()).containsEntry("alert", "high_connection_count"));
    }

    @Test
    void errorDuringScheduledCycle_doesNotStopLaterCycles() throws Exception {
        CountDownLatch laterCycles = new CountDownLatch(2);
        service.onStatsRead = read -> {
            if (read == 2) {
                throw new StackOverflowError();
            }
            if (read > 2) {
                laterCycles.countDown();
            }
        };

        monitor.start(Duration.ofMillis(20));

        assertThat(laterCycles.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(monitor.isRunning()).isTrue();
        assertThat(reported).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR);
            assertThat(error.getCause()).isInstanceOf(StackOverflowError.class);
        });
        assertThat(contexts.get(0)).containsEntry("operation", "ResourceHealthMonitor.performCheck");
    }

    @Test
    void start_recordsFirstCycleBeforeSchedulingTheRest() {
        AtomicInteger historyWhenScheduled = new AtomicInteger(-1);
        monitor = builderWith(AlertThresholds.DEFAULTS, ResourceHealthMonitor.DEFAULT_HISTORY_CAPACITY)
                .schedulerFactory(() -> {
                    historyWhenScheduled.set(monitor.historySize());
                    return Executors.newSingleThreadScheduledExecutor();
                })
                .build();

        monitor.start(Duration.ofMillis(1));

        assertThat(historyWhenScheduled.get()).isEqualTo(1);
        assertThat(monitor.isRunning()).isTrue();
    }

    @Test
    void start_whileRunning_isIgnored() {
        monitor.start(Duration.ofHours(1));
        monitor.start(Duration.ofHours(1));

        assertThat(monitor.historySize()).isEqualTo(1);
        assertThat(capture.messages()).contains("Resource health monitoring is already running");
    }

    @Test
    void stop_isIdempotentAndMonitorCanRestart() {
        monitor.stop();
        assertThat(monitor.getState()).isEqualTo(MonitorState.IDLE);

        monitor.start(Duration.ofHours(1));
        monitor.stop();
        monitor.stop();
        assertThat(monitor.getState()).isEqualTo(MonitorState.STOPPED);

        monitor.start(Duration.ofHours(1));
        assertThat(monitor.isRunning()).isTrue();
        assertThat(monitor.historySize()).isEqualTo(2);
    }

    @Test
    void start_rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> monitor.start(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThat(monitor.getState()).isEqualTo(MonitorState.IDLE);
    }

    private ResourceHealthMonitor monitorWith(AlertThresholds thresholds, int capacity) {
        return builderWith(thresholds, capacity).build();
    }

    private ResourceHealthMonitor.Builder builderWith(AlertThresholds thresholds, int capacity) {
        return ResourceHealthMonitor.builder()
                .connectionService(service)
                .processSampler(() -> ProcessSample.ofHeap(heapUsed.get(), 512 * MB))
                .clock(clock)
                .thresholds(thresholds)
                .historyCapacity(capacity)
                .garbageCollector(gcRequests::incrementAndGet)
                .reporter((error, context) -> {
                    reported.add(error);
                    contexts.add(new LinkedHashMap<>(context));
                });
    }

    private static final class MutableClock extends Clock {
        private final AtomicReference<Instant> now;

        MutableClock(Instant start) {
            this.now = new AtomicReference<>(start);
        }

        void advance(Duration duration) {
            now.updateAndGet(instant -> instant.plus(duration));
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    }
}
