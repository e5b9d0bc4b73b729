package org.javai.resilience.classify;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * An unchecked exception carrying the raw details of a platform or transport failure.
 * Collaborators that talk to sockets, stores or remote APIs throw it so the classifier can
 * see codes and statuses the JDK exception types do not carry.
 *
 * <pre>{@code
 * throw PlatformException.builder("connect failed")
 *         .code(PlatformCodes.ECONNREFUSED)
 *         .host("db.internal")
 *         .port(5432)
 *         .build();
 * }</pre>
 */
public class PlatformException extends RuntimeException implements NativeFailure {

    private final String code;
    private final Integer status;
    private final String host;
    private final Integer port;
    private final Duration timeout;

    private PlatformException(Builder builder) {
        super(builder.message, builder.cause);
        this.code = builder.code;
        this.status = builder.status;
        this.host = builder.host;
        this.port = builder.port;
        this.timeout = builder.timeout;
    }

    public static Builder builder(String message) {
        return new Builder(message);
    }

    @Override
    public Optional<String> failureCode() {
        return Optional.ofNullable(code);
    }

    @Override
    public OptionalInt status() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }

    @Override
    public Optional<String> host() {
        return Optional.ofNullable(host);
    }

    @Override
    public OptionalInt port() {
        return port == null ? OptionalInt.empty() : OptionalInt.of(port);
    }

    @Override
    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    public static final class Builder {
        private final String message;
        private Throwable cause;
        private String code;
        private Integer status;
        private String host;
        private Integer port;
        private Duration timeout;

        private Builder(String message) {
            this.message = message;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder status(int status) {
            this.status = status;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public PlatformException build() {
            return new PlatformException(this);
        }
    }
}
