package org.javai.resilience;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A failure normalised into the fixed taxonomy.
 *
 * <p>Code, type, severity, status, developer message, cause and timestamp are fixed at
 * construction. As the error travels up to the boundary it may be enriched with
 * metadata, a replacement user message, and a correlation id. The correlation id can be
 * assigned once; the boundary layer owns it.
 *
 * <p>The wrapped cause is only read, never modified.
 */
public class ClassifiedError extends RuntimeException {

    private final ErrorCode code;
    private final Instant timestamp;
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();
    private volatile String userMessage;
    private volatile String correlationId;

    public ClassifiedError(ErrorCode code, String developerMessage) {
        this(code, developerMessage, null, Map.of());
    }

    public ClassifiedError(ErrorCode code, String developerMessage, Throwable cause) {
        this(code, developerMessage, cause, Map.of());
    }

    public ClassifiedError(ErrorCode code, String developerMessage, Throwable cause, Map<String, ?> metadata) {
        this(code, developerMessage, cause, metadata, Instant.now());
    }

    public ClassifiedError(ErrorCode code, String developerMessage, Throwable cause,
                           Map<String, ?> metadata, Instant timestamp) {
        super(developerMessage, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.userMessage = ErrorTaxonomy.userMessageOf(code);
        if (metadata != null) {
            metadata.forEach(this::putMetadata);
        }
    }

    public ErrorCode code() {
        return code;
    }

    public ErrorType type() {
        return ErrorTaxonomy.typeOf(code);
    }

    public Severity severity() {
        return ErrorTaxonomy.severityOf(code);
    }

    public int status() {
        return ErrorTaxonomy.statusOf(code);
    }

    public String developerMessage() {
        return getMessage();
    }

    public String userMessage() {
        return userMessage;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String correlationId() {
        return correlationId;
    }

    public boolean hasCorrelationId() {
        return correlationId != null;
    }

    /**
     * Returns a read-only view of the metadata.
     */
    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(metadata);
    }

    /**
     * Assigns the correlation id. Re-assigning the same id is allowed; assigning a
     * different one is not.
     *
     * @throws IllegalStateException if a different correlation id was already assigned
     */
    public synchronized ClassifiedError withCorrelationId(String correlationId) {
        Objects.requireNonNull(correlationId, "correlationId must not be null");
        if (this.correlationId != null && !this.correlationId.equals(correlationId)) {
            throw new IllegalStateException(
                    "Correlation id already set to " + this.correlationId + " for " + code.id());
        }
        this.correlationId = correlationId;
        return this;
    }

    /**
     * Adds a metadata entry. A {@code null} value is ignored.
     */
    public ClassifiedError withMetadata(String key, Object value) {
        putMetadata(key, value);
        return this;
    }

    public ClassifiedError withUserMessage(String userMessage) {
        this.userMessage = Objects.requireNonNull(userMessage, "userMessage must not be null");
        return this;
    }

    private void putMetadata(String key, Object value) {
        Objects.requireNonNull(key, "metadata key must not be null");
        if (value != null) {
            metadata.put(key, value);
        }
    }

    /**
     * The outward-facing view. Contains no developer message, stack or cause.
     */
    public Map<String, Object> toPublicView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("error", userMessage);
        view.put("code", code.id());
        view.put("type", type().wireName());
        view.put("severity", severity().wireName());
        view.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(timestamp));
        view.put("correlationId", correlationId);
        if (!metadata.isEmpty()) {
            view.put("metadata", new LinkedHashMap<>(metadata));
        }
        return view;
    }

    /**
     * The public view plus developer message, this error's stack and the cause chain.
     * Only for deployments explicitly running in a non-production mode.
     */
    public Map<String, Object> toVerboseView() {
        Map<String, Object> view = toPublicView();
        view.put("details", developerMessage());
        view.put("stack", CauseTrace.framesOf(this));
        if (getCause() != null) {
            view.put("originalError", CauseTrace.fromThrowable(getCause()).toMap());
        }
        return view;
    }

    @Override
    public String toString() {
        return "ClassifiedError[" + code.id() + "]: " + getMessage();
    }
}
