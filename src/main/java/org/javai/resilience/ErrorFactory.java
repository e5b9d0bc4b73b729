package org.javai.resilience;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds {@link ClassifiedError}s for well-known situations, so call sites never need to
 * know which code, severity or metadata keys apply.
 *
 * <p>Parameters documented as optional may be {@code null}; they are simply left out of
 * the metadata.
 */
public final class ErrorFactory {

    private ErrorFactory() {
    }

    // === Validation ===

    public static ClassifiedError validation(String message, String field) {
        return error(ErrorCode.VALIDATION_FAILED, message, null, "field", field);
    }

    public static ClassifiedError invalidInput(String field, Object value) {
        return error(ErrorCode.INVALID_INPUT, "Invalid input for field: " + field, null,
                "field", field, "value", value);
    }

    public static ClassifiedError missingField(String field) {
        return error(ErrorCode.MISSING_REQUIRED_FIELD, "Missing required field: " + field, null,
                "field", field);
    }

    public static ClassifiedError invalidFormat(String field, String expectedFormat) {
        return error(ErrorCode.INVALID_FORMAT, "Invalid format for field: " + field, null,
                "field", field, "expectedFormat", expectedFormat);
    }

    // === Authentication / authorization ===

    public static ClassifiedError authenticationFailed(String reason) {
        return error(ErrorCode.AUTHENTICATION_FAILED, "Authentication failed", null, "reason", reason);
    }

    public static ClassifiedError tokenExpired(String tokenType) {
        return error(ErrorCode.TOKEN_EXPIRED, "Token has expired", null,
                "tokenType", tokenType == null ? "access" : tokenType);
    }

    public static ClassifiedError tokenInvalid(String tokenType) {
        return error(ErrorCode.TOKEN_INVALID, "Token is invalid", null,
                "tokenType", tokenType == null ? "access" : tokenType);
    }

    public static ClassifiedError authorizationFailed(String resource, String action) {
        return error(ErrorCode.AUTHORIZATION_FAILED, "Authorization failed", null,
                "resource", resource, "action", action);
    }

    public static ClassifiedError accessDenied(String resource) {
        return error(ErrorCode.ACCESS_DENIED, "Access denied", null, "resource", resource);
    }

    // === Resources ===

    public static ClassifiedError notFound(String resource, Object id) {
        return error(ErrorCode.RESOURCE_NOT_FOUND, resource + " not found", null,
                "resource", resource, "id", id);
    }

    public static ClassifiedError endpointNotFound(String path, String method) {
        return error(ErrorCode.ENDPOINT_NOT_FOUND, "Endpoint not found: " + method + " " + path, null,
                "path", path, "method", method);
    }

    public static ClassifiedError conflict(String resource, String reason) {
        return error(ErrorCode.RESOURCE_CONFLICT, "Resource conflict: " + resource, null,
                "resource", resource, "reason", reason);
    }

    public static ClassifiedError duplicateEntry(String field, Object value) {
        return error(ErrorCode.DUPLICATE_ENTRY, "Duplicate entry for field: " + field, null,
                "field", field, "value", value);
    }

    public static ClassifiedError rateLimitExceeded(Integer limit, Duration window, String endpoint) {
        return error(ErrorCode.RATE_LIMIT_EXCEEDED, "Rate limit exceeded", null,
                "limit", limit, "windowMs", window == null ? null : window.toMillis(), "endpoint", endpoint);
    }

    public static ClassifiedError timeout(String operation, Duration timeout) {
        return error(ErrorCode.CONNECTION_TIMEOUT, "Operation timed out: " + operation, null,
                "operation", operation, "timeoutMs", timeout == null ? null : timeout.toMillis());
    }

    // === System ===

    public static ClassifiedError internalError(String message, Throwable cause) {
        return error(ErrorCode.INTERNAL_SERVER_ERROR, message == null ? "Internal server error" : message, cause);
    }

    public static ClassifiedError serviceUnavailable(String service, String reason) {
        return error(ErrorCode.SERVICE_UNAVAILABLE, "Service unavailable", null,
                "service", service, "reason", reason);
    }

    public static ClassifiedError configurationError(String setting, Object value) {
        return error(ErrorCode.CONFIGURATION_ERROR, "Configuration error: " + setting, null,
                "setting", setting, "value", value);
    }

    public static ClassifiedError configurationError(String setting, Object value, Throwable cause) {
        return error(ErrorCode.CONFIGURATION_ERROR, "Configuration error: " + setting, cause,
                "setting", setting, "value", value);
    }

    // === Storage ===

    public static ClassifiedError databaseConnectionFailed(Throwable cause) {
        return error(ErrorCode.DATABASE_CONNECTION_FAILED, "Database connection failed", cause);
    }

    public static ClassifiedError databaseQueryFailed(String query, Throwable cause) {
        return error(ErrorCode.DATABASE_QUERY_FAILED, "Database query failed", cause, "query", query);
    }

    public static ClassifiedError databaseTimeout(String operation) {
        return error(ErrorCode.DATABASE_TIMEOUT, "Database operation timeout", null, "operation", operation);
    }

    // === External services ===

    public static ClassifiedError externalServiceError(String service, Throwable cause) {
        return error(ErrorCode.EXTERNAL_SERVICE_ERROR, "External service error: " + service, cause,
                "service", service);
    }

    public static ClassifiedError dependencyError(String dependency, String operation, Throwable cause) {
        return error(ErrorCode.DEPENDENCY_ERROR, dependency + " error", cause,
                "dependency", dependency, "operation", operation);
    }

    public static ClassifiedError dependencyTimeout(String dependency, Duration timeout) {
        return error(ErrorCode.DEPENDENCY_TIMEOUT, dependency + " timeout", null,
                "dependency", dependency, "timeoutMs", timeout == null ? null : timeout.toMillis());
    }

    public static ClassifiedError dependencyNotAvailable(String dependency, String reason) {
        return error(ErrorCode.DEPENDENCY_NOT_AVAILABLE, dependency + " not available", null,
                "dependency", dependency, "reason", reason);
    }

    public static ClassifiedError dependencyAuthFailed(String dependency, Throwable cause) {
        return error(ErrorCode.DEPENDENCY_AUTH_FAILED, dependency + " authentication failed", cause,
                "dependency", dependency);
    }

    // === Network and live connections ===

    public static ClassifiedError networkError(Throwable cause) {
        return error(ErrorCode.NETWORK_ERROR, "Network error", cause);
    }

    public static ClassifiedError connectionTimeout(Duration timeout, String host) {
        return error(ErrorCode.CONNECTION_TIMEOUT, "Connection timeout", null,
                "timeoutMs", timeout == null ? null : timeout.toMillis(), "host", host);
    }

    public static ClassifiedError connectionRefused(String host, Integer port) {
        return error(ErrorCode.CONNECTION_REFUSED, "Connection refused", null, "host", host, "port", port);
    }

    public static ClassifiedError connectionFailed(String reason) {
        return error(ErrorCode.CONNECTION_FAILED, "Connection failed", null, "reason", reason);
    }

    public static ClassifiedError connectionSendFailed(String messageType) {
        return error(ErrorCode.CONNECTION_SEND_FAILED, "Connection send failed", null,
                "messageType", messageType);
    }

    public static ClassifiedError unknown(String message, Throwable cause) {
        return error(ErrorCode.UNKNOWN_ERROR, message == null ? "Unknown error" : message, cause);
    }

    private static ClassifiedError error(ErrorCode code, String message, Throwable cause, Object... keyValues) {
        Map<String, Object> metadata = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                metadata.put((String) keyValues[i], value);
            }
        }
        return new ClassifiedError(code, message, cause, metadata);
    }
}
