package org.javai.resilience.monitor;

import org.javai.resilience.ClassifiedError;

import java.util.Objects;

/**
 * The result of one remediation action.
 *
 * @param alert The alert that triggered the action
 * @param action A short description of what was attempted
 * @param error The classified failure, or null if the action succeeded
 */
public record RemediationOutcome(Alert alert, String action, ClassifiedError error) {

    public RemediationOutcome {
        Objects.requireNonNull(alert, "alert must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }

    public boolean succeeded() {
        return error == null;
    }
}
