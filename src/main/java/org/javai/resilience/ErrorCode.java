package org.javai.resilience;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of error codes. Every code is mapped to exactly one {@link ErrorType},
 * {@link Severity}, transport status and default user message by {@link ErrorTaxonomy}.
 *
 * <p>Codes are stable identifiers exposed to clients; never rename one without a
 * migration path for consumers that match on it.
 */
public enum ErrorCode {

    // Validation
    VALIDATION_FAILED,
    INVALID_INPUT,
    MISSING_REQUIRED_FIELD,
    INVALID_FORMAT,

    // Authentication / authorization
    AUTHENTICATION_FAILED,
    TOKEN_EXPIRED,
    TOKEN_INVALID,
    AUTHORIZATION_FAILED,
    ACCESS_DENIED,

    // Resources
    RESOURCE_NOT_FOUND,
    ENDPOINT_NOT_FOUND,
    RESOURCE_CONFLICT,
    DUPLICATE_ENTRY,
    RATE_LIMIT_EXCEEDED,

    // System
    INTERNAL_SERVER_ERROR,
    SERVICE_UNAVAILABLE,
    CONFIGURATION_ERROR,

    // Storage
    DATABASE_CONNECTION_FAILED,
    DATABASE_QUERY_FAILED,
    DATABASE_TIMEOUT,

    // External dependencies
    EXTERNAL_SERVICE_ERROR,
    DEPENDENCY_ERROR,
    DEPENDENCY_TIMEOUT,
    DEPENDENCY_NOT_AVAILABLE,
    DEPENDENCY_AUTH_FAILED,

    // Network and live connections
    NETWORK_ERROR,
    CONNECTION_TIMEOUT,
    CONNECTION_REFUSED,
    CONNECTION_FAILED,
    CONNECTION_SEND_FAILED,

    UNKNOWN_ERROR;

    private static final Map<String, ErrorCode> BY_ID = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ErrorCode::id, Function.identity()));

    /**
     * The identifier clients see in the {@code code} field.
     */
    public String id() {
        return name();
    }

    /**
     * Resolves an identifier received from outside the process.
     *
     * @return the code, or empty if the identifier is not part of the taxonomy
     */
    public static Optional<ErrorCode> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ID.get(id));
    }

    public ErrorType type() {
        return ErrorTaxonomy.typeOf(this);
    }

    public Severity severity() {
        return ErrorTaxonomy.severityOf(this);
    }

    public int status() {
        return ErrorTaxonomy.statusOf(this);
    }

    public String userMessage() {
        return ErrorTaxonomy.userMessageOf(this);
    }
}
