package org.javai.resilience.classify;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The narrow view of a raw failure that the classifier inspects.
 *
 * <p>Exceptions thrown by collaborators may implement this interface to expose a platform
 * error code, a transport status or endpoint details. Every accessor defaults to empty, so
 * implementors override only what they know. Exceptions that do not implement it are
 * adapted by {@link #of(Throwable)}.
 */
public interface NativeFailure {

    /**
     * Platform-specific error code, e.g. {@code ECONNREFUSED} or {@code BUSY}.
     */
    default Optional<String> failureCode() {
        return Optional.empty();
    }

    default Optional<String> failureMessage() {
        return Optional.empty();
    }

    /**
     * A short name for the kind of failure, e.g. {@code ValidationError}.
     */
    default Optional<String> failureName() {
        return Optional.empty();
    }

    /**
     * A transport status (HTTP-like) carried by the failure.
     */
    default OptionalInt status() {
        return OptionalInt.empty();
    }

    default Optional<String> host() {
        return Optional.empty();
    }

    default OptionalInt port() {
        return OptionalInt.empty();
    }

    default Optional<Duration> timeout() {
        return Optional.empty();
    }

    /**
     * Adapts any throwable. If it already implements {@code NativeFailure} its answers take
     * precedence; gaps are filled from the exception type and message.
     */
    static NativeFailure of(Throwable throwable) {
        return new ThrowableFailure(throwable);
    }
}
