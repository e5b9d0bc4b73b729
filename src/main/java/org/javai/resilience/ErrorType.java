package org.javai.resilience;

import java.util.Locale;

/**
 * Classifies errors by the part of the system that failed.
 * Drives log routing and client-side handling, never control flow.
 */
public enum ErrorType {
    VALIDATION,
    AUTHENTICATION,
    AUTHORIZATION,
    NOT_FOUND,
    CONFLICT,
    RATE_LIMIT,
    EXTERNAL_SERVICE,
    STORAGE,
    SYSTEM,
    NETWORK,
    TIMEOUT,
    UNKNOWN;

    /**
     * The lower-case form used in rendered responses (e.g. {@code "not_found"}).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
