package org.javai.resilience.classify;

import org.javai.resilience.ClassifiedError;
import org.javai.resilience.ErrorFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Classifies raw failures by inspecting their message, platform code and transport status.
 *
 * <p>Rules are evaluated in a fixed order and the first match wins:
 * <ol>
 *   <li>storage signatures (constraint violation, locked/busy store, missing table or column)</li>
 *   <li>network signatures (unknown host, connection refused, timed out)</li>
 *   <li>external dependency signatures (the message names a known dependency)</li>
 *   <li>declared validation failures</li>
 *   <li>transport status hints (404, 401, 403, 409, 429)</li>
 *   <li>file not found</li>
 *   <li>fallback: internal error wrapping the failure</li>
 * </ol>
 *
 * <p>The order matters for ambiguous messages. A message such as
 * {@code "gemini request timeout"} matches the network rule before the dependency rule
 * is consulted, and therefore classifies as a connection timeout.
 *
 * <p>This classifier never throws and never modifies the failure it inspects.
 */
public class HeuristicErrorClassifier implements ErrorClassifier {

    public static final List<String> DEFAULT_DEPENDENCIES = List.of("gemini");

    private static final String DEFAULT_MESSAGE = "Unknown error";

    private final List<String> dependencies;

    public HeuristicErrorClassifier() {
        this(DEFAULT_DEPENDENCIES);
    }

    /**
     * @param dependencies Names of external dependencies to recognise in failure messages,
     *                     matched case-insensitively
     */
    public HeuristicErrorClassifier(List<String> dependencies) {
        Objects.requireNonNull(dependencies, "dependencies must not be null");
        this.dependencies = dependencies.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(String::trim)
                .toList();
    }

    @Override
    public List<String> dependencies() {
        return dependencies;
    }

    @Override
    public ClassifiedError classify(Throwable failure, ClassificationContext context) {
        if (failure instanceof ClassifiedError classified) {
            return classified;
        }
        ClassificationContext ctx = context != null ? context : ClassificationContext.empty();
        if (failure == null) {
            return ErrorFactory.internalError(DEFAULT_MESSAGE, null);
        }
        try {
            return applyRules(failure, NativeFailure.of(failure), ctx);
        } catch (RuntimeException e) {
            // A misbehaving NativeFailure implementation must not break error reporting
            ClassifiedError fallback = ErrorFactory.internalError(messageOf(failure), failure);
            fallback.addSuppressed(e);
            return fallback;
        }
    }

    private ClassifiedError applyRules(Throwable failure, NativeFailure nf, ClassificationContext ctx) {
        String message = nf.failureMessage().orElse(DEFAULT_MESSAGE);
        String code = nf.failureCode().orElse(null);

        ClassifiedError result = classifyStorage(failure, code, message);
        if (result == null) {
            result = classifyNetwork(failure, nf, code, message);
        }
        if (result == null) {
            result = classifyDependency(failure, message, ctx);
        }
        if (result == null) {
            result = classifyValidation(nf, message, ctx);
        }
        if (result == null) {
            result = classifyStatus(nf, message, ctx);
        }
        if (result == null && PlatformCodes.ENOENT.equals(code)) {
            result = ErrorFactory.notFound("File", ctx.path());
        }
        if (result == null) {
            result = ErrorFactory.internalError(message, failure);
        }
        return result;
    }

    private static ClassifiedError classifyStorage(Throwable failure, String code, String message) {
        if (PlatformCodes.CONSTRAINT.equals(code) || message.contains("UNIQUE constraint")) {
            return ErrorFactory.duplicateEntry("unknown", null);
        }
        if (PlatformCodes.BUSY.equals(code) || message.contains("database is locked")) {
            return ErrorFactory.databaseTimeout("query");
        }
        if (message.contains("no such table") || message.contains("no such column")) {
            return ErrorFactory.databaseQueryFailed(message, failure);
        }
        return null;
    }

    private static ClassifiedError classifyNetwork(Throwable failure, NativeFailure nf, String code, String message) {
        if (PlatformCodes.ENOTFOUND.equals(code)) {
            return ErrorFactory.networkError(failure);
        }
        if (PlatformCodes.ECONNREFUSED.equals(code)) {
            return ErrorFactory.connectionRefused(nf.host().orElse(null), boxed(nf.port()));
        }
        if (PlatformCodes.ETIMEDOUT.equals(code) || message.contains("timeout")) {
            return ErrorFactory.connectionTimeout(nf.timeout().orElse(null), nf.host().orElse(null));
        }
        return null;
    }

    private ClassifiedError classifyDependency(Throwable failure, String message, ClassificationContext ctx) {
        String lower = message.toLowerCase(Locale.ROOT);
        String dependency = dependencies.stream()
                .filter(name -> lower.contains(name.toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElse(null);
        if (dependency == null) {
            return null;
        }
        if (message.contains("timeout")) {
            return ErrorFactory.dependencyTimeout(dependency, null);
        }
        if (message.contains("auth")) {
            return ErrorFactory.dependencyAuthFailed(dependency, failure);
        }
        if (message.contains("not found")) {
            return ErrorFactory.dependencyNotAvailable(dependency, "not installed");
        }
        return ErrorFactory.dependencyError(dependency, ctx.operation(), failure);
    }

    private static ClassifiedError classifyValidation(NativeFailure nf, String message, ClassificationContext ctx) {
        String name = nf.failureName().orElse("");
        if (name.equals("ValidationError") || name.endsWith("ValidationException")
                || message.contains("validation")) {
            return ErrorFactory.validation(message, ctx.field());
        }
        return null;
    }

    private static ClassifiedError classifyStatus(NativeFailure nf, String message, ClassificationContext ctx) {
        OptionalInt status = nf.status();
        if (status.isEmpty()) {
            return null;
        }
        return switch (status.getAsInt()) {
            case 404 -> ErrorFactory.notFound(resourceOrDefault(ctx), ctx.id());
            case 401 -> ErrorFactory.authenticationFailed(message);
            case 403 -> ErrorFactory.authorizationFailed(ctx.resource(), ctx.action());
            case 409 -> ErrorFactory.conflict(resourceOrDefault(ctx), message);
            case 429 -> ErrorFactory.rateLimitExceeded(null, null, ctx.endpoint());
            default -> null;
        };
    }

    private static String resourceOrDefault(ClassificationContext ctx) {
        return ctx.resource() != null ? ctx.resource() : "Resource";
    }

    private static Integer boxed(OptionalInt value) {
        return value.isPresent() ? value.getAsInt() : null;
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : DEFAULT_MESSAGE;
    }
}
