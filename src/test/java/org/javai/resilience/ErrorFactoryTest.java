package org.javai.resilience;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ErrorFactoryTest {

    @Test
    void notFound_recordsResourceAndId() {
        ClassifiedError error = ErrorFactory.notFound("Spec", 42);

        assertThat(error.code()).isEqualTo(ErrorCode.RESOURCE_NOT_FOUND);
        assertThat(error.developerMessage()).isEqualTo("Spec not found");
        assertThat(error.metadata()).containsEntry("resource", "Spec").containsEntry("id", 42);
    }

    @Test
    void optionalParameters_areLeftOutOfMetadata() {
        ClassifiedError error = ErrorFactory.rateLimitExceeded(null, null, "/api/generate");

        assertThat(error.code()).isEqualTo(ErrorCode.RATE_LIMIT_EXCEEDED);
        assertThat(error.metadata()).containsOnlyKeys("endpoint");
    }

    @Test
    void durations_areRecordedInMillis() {
        ClassifiedError error = ErrorFactory.dependencyTimeout("gemini", Duration.ofSeconds(30));

        assertThat(error.code()).isEqualTo(ErrorCode.DEPENDENCY_TIMEOUT);
        assertThat(error.type()).isEqualTo(ErrorType.TIMEOUT);
        assertThat(error.metadata()).containsEntry("dependency", "gemini").containsEntry("timeoutMs", 30_000L);
    }

    @Test
    void connectionRefused_recordsHostAndPort() {
        ClassifiedError error = ErrorFactory.connectionRefused("db.internal", 5432);

        assertThat(error.type()).isEqualTo(ErrorType.NETWORK);
        assertThat(error.status()).isEqualTo(503);
        assertThat(error.metadata()).containsEntry("host", "db.internal").containsEntry("port", 5432);
    }

    @Test
    void internalError_keepsCauseAndDefaultsMessage() {
        IOException cause = new IOException("disk");

        ClassifiedError error = ErrorFactory.internalError(null, cause);

        assertThat(error.getCause()).isSameAs(cause);
        assertThat(error.developerMessage()).isEqualTo("Internal server error");
        assertThat(error.severity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void configurationError_isCritical() {
        ClassifiedError error = ErrorFactory.configurationError("resilience.monitor.interval-ms", "abc");

        assertThat(error.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(error.metadata()).containsEntry("setting", "resilience.monitor.interval-ms")
                .containsEntry("value", "abc");
    }

    @Test
    void tokenErrors_defaultToAccessToken() {
        assertThat(ErrorFactory.tokenExpired(null).metadata()).containsEntry("tokenType", "access");
        assertThat(ErrorFactory.tokenInvalid("refresh").metadata()).containsEntry("tokenType", "refresh");
    }

    @Test
    void connectionSendFailed_isLowSeverityNetwork() {
        ClassifiedError error = ErrorFactory.connectionSendFailed("progress");

        assertThat(error.type()).isEqualTo(ErrorType.NETWORK);
        assertThat(error.severity()).isEqualTo(Severity.LOW);
        assertThat(error.metadata()).containsEntry("messageType", "progress");
    }
}
