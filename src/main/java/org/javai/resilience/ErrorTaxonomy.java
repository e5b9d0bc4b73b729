package org.javai.resilience;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.javai.resilience.ErrorCode.*;

/**
 * The fixed mapping tables from {@link ErrorCode} to type, severity, transport status
 * and default user message.
 *
 * <p>The tables are built once when this class initialises and are never mutated.
 * Initialisation fails if any code is missing from any table, so an incomplete
 * taxonomy cannot reach production.
 *
 * <p>Lookups are total. A {@code null} code, or an identifier that is not part of the
 * taxonomy, resolves to {@link ErrorType#UNKNOWN}, {@link Severity#MEDIUM}, status 500
 * and a generic message. Reporting a failure must never fail.
 */
public final class ErrorTaxonomy {

    public static final ErrorType FALLBACK_TYPE = ErrorType.UNKNOWN;
    public static final Severity FALLBACK_SEVERITY = Severity.MEDIUM;
    public static final int FALLBACK_STATUS = 500;
    public static final String FALLBACK_MESSAGE = "An unexpected error occurred";

    private static final Map<ErrorCode, ErrorType> TYPES;
    private static final Map<ErrorCode, Severity> SEVERITIES;
    private static final Map<ErrorCode, Integer> STATUSES;
    private static final Map<ErrorCode, String> MESSAGES;

    static {
        Map<ErrorCode, ErrorType> types = new EnumMap<>(ErrorCode.class);
        Map<ErrorCode, Severity> severities = new EnumMap<>(ErrorCode.class);
        Map<ErrorCode, Integer> statuses = new EnumMap<>(ErrorCode.class);
        Map<ErrorCode, String> messages = new EnumMap<>(ErrorCode.class);

        Table t = new Table(types, severities, statuses, messages);

        t.put(VALIDATION_FAILED, ErrorType.VALIDATION, Severity.LOW, 400,
                "The request contains invalid data");
        t.put(INVALID_INPUT, ErrorType.VALIDATION, Severity.LOW, 400,
                "One of the provided values is invalid");
        t.put(MISSING_REQUIRED_FIELD, ErrorType.VALIDATION, Severity.LOW, 400,
                "A required field is missing");
        t.put(INVALID_FORMAT, ErrorType.VALIDATION, Severity.LOW, 400,
                "One of the provided values has an invalid format");

        t.put(AUTHENTICATION_FAILED, ErrorType.AUTHENTICATION, Severity.MEDIUM, 401,
                "Authentication failed, please sign in again");
        t.put(TOKEN_EXPIRED, ErrorType.AUTHENTICATION, Severity.LOW, 401,
                "Your session has expired, please sign in again");
        t.put(TOKEN_INVALID, ErrorType.AUTHENTICATION, Severity.MEDIUM, 401,
                "Your credentials are invalid");
        t.put(AUTHORIZATION_FAILED, ErrorType.AUTHORIZATION, Severity.MEDIUM, 403,
                "You are not allowed to perform this action");
        t.put(ACCESS_DENIED, ErrorType.AUTHORIZATION, Severity.MEDIUM, 403,
                "Access to this resource is denied");

        t.put(RESOURCE_NOT_FOUND, ErrorType.NOT_FOUND, Severity.LOW, 404,
                "The requested resource was not found");
        t.put(ENDPOINT_NOT_FOUND, ErrorType.NOT_FOUND, Severity.LOW, 404,
                "The requested endpoint does not exist");
        t.put(RESOURCE_CONFLICT, ErrorType.CONFLICT, Severity.MEDIUM, 409,
                "The request conflicts with the current state of the resource");
        t.put(DUPLICATE_ENTRY, ErrorType.CONFLICT, Severity.LOW, 409,
                "This entry already exists");
        t.put(RATE_LIMIT_EXCEEDED, ErrorType.RATE_LIMIT, Severity.LOW, 429,
                "Too many requests, please try again later");

        t.put(INTERNAL_SERVER_ERROR, ErrorType.SYSTEM, Severity.HIGH, 500,
                "An internal error occurred, please try again later");
        t.put(SERVICE_UNAVAILABLE, ErrorType.SYSTEM, Severity.HIGH, 503,
                "The service is temporarily unavailable");
        t.put(CONFIGURATION_ERROR, ErrorType.SYSTEM, Severity.CRITICAL, 500,
                "The service is misconfigured, please contact support");

        t.put(DATABASE_CONNECTION_FAILED, ErrorType.STORAGE, Severity.CRITICAL, 503,
                "The data store is unavailable");
        t.put(DATABASE_QUERY_FAILED, ErrorType.STORAGE, Severity.HIGH, 500,
                "The data could not be retrieved");
        t.put(DATABASE_TIMEOUT, ErrorType.TIMEOUT, Severity.MEDIUM, 504,
                "The data store is busy, please try again");

        t.put(EXTERNAL_SERVICE_ERROR, ErrorType.EXTERNAL_SERVICE, Severity.HIGH, 502,
                "An external service failed to respond correctly");
        t.put(DEPENDENCY_ERROR, ErrorType.EXTERNAL_SERVICE, Severity.HIGH, 502,
                "A required service reported an error");
        t.put(DEPENDENCY_TIMEOUT, ErrorType.TIMEOUT, Severity.MEDIUM, 504,
                "A required service took too long to respond");
        t.put(DEPENDENCY_NOT_AVAILABLE, ErrorType.EXTERNAL_SERVICE, Severity.CRITICAL, 503,
                "A required service is not available");
        t.put(DEPENDENCY_AUTH_FAILED, ErrorType.EXTERNAL_SERVICE, Severity.CRITICAL, 502,
                "A required service rejected our credentials");

        t.put(NETWORK_ERROR, ErrorType.NETWORK, Severity.HIGH, 502,
                "A network error occurred");
        t.put(CONNECTION_TIMEOUT, ErrorType.TIMEOUT, Severity.MEDIUM, 504,
                "The connection timed out");
        t.put(CONNECTION_REFUSED, ErrorType.NETWORK, Severity.HIGH, 503,
                "The connection was refused");
        t.put(CONNECTION_FAILED, ErrorType.NETWORK, Severity.MEDIUM, 500,
                "The live connection could not be established");
        t.put(CONNECTION_SEND_FAILED, ErrorType.NETWORK, Severity.LOW, 500,
                "The message could not be delivered");

        t.put(UNKNOWN_ERROR, ErrorType.UNKNOWN, Severity.MEDIUM, 500,
                FALLBACK_MESSAGE);

        TYPES = Collections.unmodifiableMap(types);
        SEVERITIES = Collections.unmodifiableMap(severities);
        STATUSES = Collections.unmodifiableMap(statuses);
        MESSAGES = Collections.unmodifiableMap(messages);

        Set<ErrorCode> missing = findIncomplete();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Error taxonomy is incomplete for codes: " + missing);
        }
    }

    private ErrorTaxonomy() {
    }

    public static ErrorType typeOf(ErrorCode code) {
        return code == null ? FALLBACK_TYPE : TYPES.getOrDefault(code, FALLBACK_TYPE);
    }

    public static Severity severityOf(ErrorCode code) {
        return code == null ? FALLBACK_SEVERITY : SEVERITIES.getOrDefault(code, FALLBACK_SEVERITY);
    }

    public static int statusOf(ErrorCode code) {
        return code == null ? FALLBACK_STATUS : STATUSES.getOrDefault(code, FALLBACK_STATUS);
    }

    public static String userMessageOf(ErrorCode code) {
        return code == null ? FALLBACK_MESSAGE : MESSAGES.getOrDefault(code, FALLBACK_MESSAGE);
    }

    public static ErrorType typeOf(String id) {
        return typeOf(ErrorCode.fromId(id).orElse(null));
    }

    public static Severity severityOf(String id) {
        return severityOf(ErrorCode.fromId(id).orElse(null));
    }

    public static int statusOf(String id) {
        return statusOf(ErrorCode.fromId(id).orElse(null));
    }

    public static String userMessageOf(String id) {
        return userMessageOf(ErrorCode.fromId(id).orElse(null));
    }

    /**
     * Returns the codes that are absent from at least one table. Empty for a valid taxonomy.
     */
    public static Set<ErrorCode> findIncomplete() {
        Set<ErrorCode> missing = EnumSet.noneOf(ErrorCode.class);
        for (ErrorCode code : ErrorCode.values()) {
            if (!TYPES.containsKey(code) || !SEVERITIES.containsKey(code)
                    || !STATUSES.containsKey(code) || !MESSAGES.containsKey(code)) {
                missing.add(code);
            }
        }
        return missing;
    }

    private record Table(
            Map<ErrorCode, ErrorType> types,
            Map<ErrorCode, Severity> severities,
            Map<ErrorCode, Integer> statuses,
            Map<ErrorCode, String> messages
    ) {
        void put(ErrorCode code, ErrorType type, Severity severity, int status, String message) {
            if (types.containsKey(code)) {
                throw new IllegalStateException("Duplicate taxonomy entry for " + code);
            }
            types.put(code, type);
            severities.put(code, severity);
            statuses.put(code, status);
            messages.put(code, message);
        }
    }
}
