package org.javai.resilience.boundary;

import org.javai.resilience.ClassifiedError;
import org.javai.resilience.ErrorFactory;
import org.javai.resilience.classify.ClassificationContext;
import org.javai.resilience.classify.ErrorClassifier;
import org.javai.resilience.classify.HeuristicErrorClassifier;
import org.javai.resilience.report.ErrorReporter;
import org.javai.resilience.report.Log4jErrorReporter;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The single point where arbitrary failures become logged records and outward-facing
 * responses. Surrounding layers never build error response bodies themselves.
 *
 * <p>Example usage in a request handler:</p>
 * <pre>{@code
 * ErrorBoundary boundary = ErrorBoundary.withReporter(new Log4jErrorReporter());
 *
 * try {
 *     return service.generate(request);
 * } catch (Exception e) {
 *     ErrorResponse response = boundary.handle(e,
 *             CorrelationIds.resolve(request.header(CorrelationIds.HEADER)),
 *             Map.of("path", request.path(), "method", request.method()),
 *             settings.verboseErrors());
 *     return reply(response.status(), response.toJson());
 * }
 * }</pre>
 */
public final class ErrorBoundary {

    /** Health-check service name for the relational store. */
    public static final String DATABASE_SERVICE = "database";
    /** Health-check service name for the live connection service. */
    public static final String CONNECTION_SERVICE = "connections";

    private static final ErrorClassifier DEFAULT_CLASSIFIER = new HeuristicErrorClassifier();
    private static final String UNKNOWN_SERVICE = "unknown";
    private static final String UNKNOWN_CONNECTION_ERROR = "Unknown connection error";

    private final ErrorClassifier classifier;
    private final ErrorReporter reporter;

    /**
     * A boundary that classifies and formats but does not log.
     */
    public static ErrorBoundary silent() {
        return new ErrorBoundary(DEFAULT_CLASSIFIER, ErrorReporter.noOp());
    }

    /**
     * A boundary with the default classifier and Log4j2 reporting.
     */
    public static ErrorBoundary standard() {
        return new ErrorBoundary(DEFAULT_CLASSIFIER, new Log4jErrorReporter());
    }

    public static ErrorBoundary withReporter(ErrorReporter reporter) {
        return new ErrorBoundary(DEFAULT_CLASSIFIER, reporter);
    }

    public static ErrorBoundary of(ErrorClassifier classifier, ErrorReporter reporter) {
        return new ErrorBoundary(classifier, reporter);
    }

    public ErrorBoundary(ErrorClassifier classifier, ErrorReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    public ErrorClassifier classifier() {
        return classifier;
    }

    public ClassifiedError classify(Throwable failure, ClassificationContext context) {
        return classifier.classify(failure, context);
    }

    /**
     * Sends the error to the logging sink. The sink picks the level from the severity.
     */
    public void logFailure(ClassifiedError error, Map<String, ?> context) {
        Objects.requireNonNull(error, "error must not be null");
        reporter.report(error, context == null ? Map.of() : context);
    }

    /**
     * Renders any failure for the transport layer. Unclassified failures are classified
     * first.
     *
     * @param verbose {@code true} only for non-production deployments; adds the developer
     *                message, the stack and the cause chain
     */
    public Map<String, Object> formatForTransport(Throwable failure, boolean verbose) {
        ClassifiedError error = classifier.classify(failure, ClassificationContext.empty());
        return verbose ? error.toVerboseView() : error.toPublicView();
    }

    /**
     * Runs the whole boundary step for a failed request: classify, attach the correlation
     * id, record the request context as metadata, log, and render.
     *
     * @param failure The failure caught by the transport layer
     * @param correlationId The request-scoped correlation id; kept only if the error has none yet
     * @param requestContext Request details such as path and method (may be empty)
     * @param verbose Whether to render the verbose view
     */
    public ErrorResponse handle(Throwable failure, String correlationId, Map<String, ?> requestContext,
                                boolean verbose) {
        Map<String, ?> request = requestContext == null ? Map.of() : requestContext;
        ClassifiedError error = classifier.classify(failure, contextFrom(request));

        if (correlationId != null && !error.hasCorrelationId()) {
            error.withCorrelationId(correlationId);
        }
        request.forEach(error::withMetadata);

        Map<String, Object> logContext = new LinkedHashMap<>(request);
        if (error.hasCorrelationId()) {
            logContext.put("correlationId", error.correlationId());
        }
        logFailure(error, logContext);

        Map<String, Object> body = verbose ? error.toVerboseView() : error.toPublicView();
        return new ErrorResponse(error.status(), body, error);
    }

    /**
     * Executes work, turning any failure into a logged {@link ClassifiedError}.
     *
     * @param operation The operation name, used for classification and logging
     * @param work The work to execute
     * @return The result of the work
     * @throws ClassifiedError if the work fails
     */
    public <T> T call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return work.get();
        } catch (Exception e) {
            ClassifiedError error = classifier.classify(e, ClassificationContext.forOperation(operation));
            logFailure(error, Map.of("operation", operation));
            throw error;
        }
    }

    /**
     * Classifies a failure on a live client connection. Failures whose message mentions
     * sending or emitting become {@code CONNECTION_SEND_FAILED}; everything else is
     * {@code CONNECTION_FAILED}. Already classified failures are kept as they are.
     * Does not log; pass the result to {@link #logFailure} or rethrow it.
     *
     * @param failure The failure raised by the connection layer
     * @param messageType The type of the outbound message, if one was being sent (may be null)
     * @param correlationId The request or session id; kept only if the error has none yet
     */
    public ClassifiedError classifyConnectionFailure(Throwable failure, String messageType, String correlationId) {
        ClassifiedError error;
        if (failure instanceof ClassifiedError classified) {
            error = classified;
        } else {
            String message = failure == null ? null : failure.getMessage();
            if (message != null && isSendFailure(message)) {
                error = ErrorFactory.connectionSendFailed(messageType);
            } else {
                error = ErrorFactory.connectionFailed(message != null ? message : UNKNOWN_CONNECTION_ERROR);
                error.withMetadata("messageType", messageType);
            }
        }
        if (correlationId != null && !error.hasCorrelationId()) {
            error.withCorrelationId(correlationId);
        }
        return error;
    }

    /**
     * Classifies the failure of one health check by the service it checked:
     * <ul>
     *   <li>{@value #DATABASE_SERVICE} → {@code DATABASE_CONNECTION_FAILED}, wrapping the failure</li>
     *   <li>a dependency the classifier knows by name → {@code DEPENDENCY_NOT_AVAILABLE}</li>
     *   <li>{@value #CONNECTION_SERVICE} → {@code CONNECTION_FAILED}</li>
     *   <li>anything else → {@code SERVICE_UNAVAILABLE}</li>
     * </ul>
     * Already classified failures are returned unchanged. Does not log.
     *
     * @param service The checked service; null counts as {@code "unknown"}
     */
    public ClassifiedError classifyHealthCheckFailure(Throwable failure, String service) {
        if (failure instanceof ClassifiedError classified) {
            return classified;
        }
        String name = service == null || service.isBlank() ? UNKNOWN_SERVICE : service.trim();
        String reason = failure == null ? null : failure.getMessage();

        if (DATABASE_SERVICE.equalsIgnoreCase(name)) {
            return ErrorFactory.databaseConnectionFailed(failure);
        }
        if (classifier.dependencies().stream().anyMatch(name::equalsIgnoreCase)) {
            return ErrorFactory.dependencyNotAvailable(name, reason);
        }
        if (CONNECTION_SERVICE.equalsIgnoreCase(name)) {
            return ErrorFactory.connectionFailed(reason != null ? reason : UNKNOWN_CONNECTION_ERROR);
        }
        return ErrorFactory.serviceUnavailable(name, reason);
    }

    private static boolean isSendFailure(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return !lower.contains("connection") && (lower.contains("send") || lower.contains("emit"));
    }

    private static ClassificationContext contextFrom(Map<String, ?> request) {
        Object path = request.get("path");
        Object method = request.get("method");
        return ClassificationContext.builder()
                .path(path == null ? null : path.toString())
                .endpoint(path == null ? null : path.toString())
                .action(method == null ? null : method.toString())
                .build();
    }
}
