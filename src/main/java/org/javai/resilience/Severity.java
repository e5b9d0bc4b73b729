package org.javai.resilience;

import java.util.Locale;

/**
 * How serious an error is. Declaration order is significant: {@code LOW < MEDIUM < HIGH < CRITICAL}.
 */
public enum Severity {
    /**
     * Expected, client-caused conditions. Logged at debug.
     */
    LOW,

    /**
     * Worth watching but not actionable on its own. Logged at warn.
     */
    MEDIUM,

    /**
     * Something in the system is broken. Logged at error with the cause chain.
     */
    HIGH,

    /**
     * The service cannot do its job. Logged at fatal with the cause chain.
     */
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
