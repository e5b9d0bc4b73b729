package org.javai.resilience.report;

import org.javai.resilience.ClassifiedError;
import org.javai.resilience.classify.ClassificationContext;
import org.javai.resilience.classify.ErrorClassifier;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Classifies and reports throwables that escape a thread, before the thread dies.
 *
 * <pre>{@code
 * UncaughtFailureHandler handler = new UncaughtFailureHandler(classifier, reporter);
 * handler.installAsDefault();
 *
 * ScheduledExecutorService scheduler =
 *         Executors.newSingleThreadScheduledExecutor(handler.threadFactory("health-monitor", true));
 * }</pre>
 */
public final class UncaughtFailureHandler implements UncaughtExceptionHandler {

    private final ErrorClassifier classifier;
    private final ErrorReporter reporter;
    private final Supplier<String> correlationIdSupplier;

    public UncaughtFailureHandler(ErrorClassifier classifier, ErrorReporter reporter) {
        this(classifier, reporter, () -> null);
    }

    public UncaughtFailureHandler(
            ErrorClassifier classifier,
            ErrorReporter reporter,
            Supplier<String> correlationIdSupplier
    ) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.correlationIdSupplier = Objects.requireNonNull(correlationIdSupplier, "correlationIdSupplier must not be null");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        String operation = "UncaughtException:" + thread.getName();

        ClassifiedError error = classifier.classify(throwable, ClassificationContext.forOperation(operation));
        error.withMetadata("thread.name", thread.getName())
                .withMetadata("thread.id", String.valueOf(thread.getId()));

        String correlationId = correlationIdSupplier.get();
        if (correlationId != null && !error.hasCorrelationId()) {
            error.withCorrelationId(correlationId);
        }

        reporter.report(error, Map.of("operation", operation));
    }

    public void installAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
    }

    public void installOn(Thread thread) {
        thread.setUncaughtExceptionHandler(this);
    }

    /**
     * Creates a named ThreadFactory that installs this handler on all created threads.
     *
     * @param namePrefix Thread name prefix; threads are numbered from 1
     * @param daemon Whether the threads are daemon threads
     */
    public ThreadFactory threadFactory(String namePrefix, boolean daemon) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
                thread.setDaemon(daemon);
                thread.setUncaughtExceptionHandler(UncaughtFailureHandler.this);
                return thread;
            }
        };
    }
}
