package org.javai.resilience.monitor;

import java.util.List;
import java.util.Objects;

/**
 * What one completed sampling cycle recorded and did.
 *
 * @param snapshot The snapshot appended to the history
 * @param alerts The alerts raised against it, in evaluation order
 * @param remediations One outcome per alert, in the same order
 */
public record CheckResult(HealthSnapshot snapshot, List<Alert> alerts, List<RemediationOutcome> remediations) {

    public CheckResult {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        remediations = remediations == null ? List.of() : List.copyOf(remediations);
    }

    public boolean healthy() {
        return alerts.isEmpty();
    }

    public List<RemediationOutcome> failedRemediations() {
        return remediations.stream()
                .filter(outcome -> !outcome.succeeded())
                .toList();
    }
}
