package org.javai.resilience.boundary;

import java.util.UUID;

/**
 * Correlation ids tie one failure to its log records and to the response sent to the caller.
 */
public final class CorrelationIds {

    /** Request and response header carrying the correlation id. */
    public static final String HEADER = "X-Request-ID";

    private static final int MAX_LENGTH = 128;

    private CorrelationIds() {
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    /**
     * Reuses the id a caller sent, or generates a new one when the incoming value is absent,
     * blank, too long, or contains characters other than letters, digits, {@code -},
     * {@code _} and {@code .}.
     */
    public static String resolve(String incoming) {
        if (incoming == null) {
            return generate();
        }
        String trimmed = incoming.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH || !isSafe(trimmed)) {
            return generate();
        }
        return trimmed;
    }

    private static boolean isSafe(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.')) {
                return false;
            }
        }
        return true;
    }
}
