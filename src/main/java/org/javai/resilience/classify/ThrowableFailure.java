package org.javai.resilience.classify;

import java.io.FileNotFoundException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;

/**
 * Adapts a {@link Throwable} to {@link NativeFailure}, deriving platform codes from
 * well-known JDK exception types.
 */
final class ThrowableFailure implements NativeFailure {

    private record CodeMapping(Class<? extends Throwable> type, String code) {}

    private static final List<CodeMapping> MAPPINGS = List.of(
            new CodeMapping(SQLIntegrityConstraintViolationException.class, PlatformCodes.CONSTRAINT),
            new CodeMapping(SQLTimeoutException.class, PlatformCodes.BUSY),
            new CodeMapping(SQLTransientException.class, PlatformCodes.BUSY),
            new CodeMapping(UnknownHostException.class, PlatformCodes.ENOTFOUND),
            new CodeMapping(ConnectException.class, PlatformCodes.ECONNREFUSED),
            new CodeMapping(NoRouteToHostException.class, PlatformCodes.EHOSTUNREACH),
            new CodeMapping(SocketTimeoutException.class, PlatformCodes.ETIMEDOUT),
            new CodeMapping(HttpTimeoutException.class, PlatformCodes.ETIMEDOUT),
            new CodeMapping(TimeoutException.class, PlatformCodes.ETIMEDOUT),
            new CodeMapping(NoSuchFileException.class, PlatformCodes.ENOENT),
            new CodeMapping(FileNotFoundException.class, PlatformCodes.ENOENT)
    );

    private final Throwable throwable;
    private final NativeFailure declared;

    ThrowableFailure(Throwable throwable) {
        this.throwable = Objects.requireNonNull(throwable, "throwable must not be null");
        this.declared = throwable instanceof NativeFailure nf ? nf : new NativeFailure() {};
    }

    @Override
    public Optional<String> failureCode() {
        return declared.failureCode().or(this::derivedCode);
    }

    @Override
    public Optional<String> failureMessage() {
        return declared.failureMessage().or(() -> Optional.ofNullable(throwable.getMessage()));
    }

    @Override
    public Optional<String> failureName() {
        return declared.failureName().or(() -> Optional.of(throwable.getClass().getSimpleName()));
    }

    @Override
    public OptionalInt status() {
        return declared.status();
    }

    @Override
    public Optional<String> host() {
        return declared.host();
    }

    @Override
    public OptionalInt port() {
        return declared.port();
    }

    @Override
    public Optional<Duration> timeout() {
        return declared.timeout();
    }

    private Optional<String> derivedCode() {
        return MAPPINGS.stream()
                .filter(m -> m.type().isInstance(throwable))
                .map(CodeMapping::code)
                .findFirst();
    }
}
