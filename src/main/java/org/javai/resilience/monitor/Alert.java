package org.javai.resilience.monitor;

import java.util.Objects;

/**
 * A threshold breach observed in one sampling cycle.
 *
 * @param kind Which rule fired
 * @param value The observed value
 * @param threshold The configured limit it exceeded
 */
public record Alert(AlertKind kind, double value, double threshold) {

    public Alert {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    @Override
    public String toString() {
        return kind.wireName() + "(value=" + value + ", threshold=" + threshold + ")";
    }
}
