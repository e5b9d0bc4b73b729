package org.javai.resilience.report;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.ClassifiedError;
import org.javai.resilience.Severity;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports classified errors through Log4j2.
 *
 * <p>The log level follows the error's {@link Severity}:
 * <ul>
 *   <li>{@code LOW} → DEBUG</li>
 *   <li>{@code MEDIUM} → WARN</li>
 *   <li>{@code HIGH} → ERROR</li>
 *   <li>{@code CRITICAL} → FATAL</li>
 * </ul>
 *
 * <p>For {@code HIGH} and {@code CRITICAL} errors a second ERROR entry carries the stack
 * trace and the full cause chain.
 */
public class Log4jErrorReporter implements ErrorReporter {

	public static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.Errors";

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker STACK_MARKER = MarkerManager.getMarker("FAILURE_STACK");

	private final Logger logger;

	/**
	 * Logs to {@value #DEFAULT_LOGGER_NAME}.
	 */
	public Log4jErrorReporter() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Logs to the named logger, so errors can be routed per component.
	 *
	 * @param loggerName the Log4j2 logger name
	 */
	public Log4jErrorReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Logs to the given logger instance.
	 *
	 * @param logger the Log4j2 logger that receives the error entries
	 */
	public Log4jErrorReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(ClassifiedError error, Map<String, ?> context) {
		logger.atLevel(levelFor(error.severity()))
			.withMarker(FAILURE_MARKER)
			.log(formatMessage(error, context));

		if (error.severity().isAtLeast(Severity.HIGH)) {
			logger.atError()
				.withMarker(STACK_MARKER)
				.withThrowable(error)
				.log("Stack trace for [{}] correlationId={}", error.code().id(), correlationIdOf(error));
		}
	}

	static Level levelFor(Severity severity) {
		return switch (severity) {
			case LOW -> Level.DEBUG;
			case MEDIUM -> Level.WARN;
			case HIGH -> Level.ERROR;
			case CRITICAL -> Level.FATAL;
		};
	}

	private static String formatMessage(ClassifiedError error, Map<String, ?> context) {
		return """
			%s severity error [%s]: %s \
			| type=%s, status=%d, correlationId=%s%s%s%s\
			""".formatted(
				capitalize(error.severity().wireName()),
				error.code().id(),
				error.developerMessage(),
				error.type().wireName(),
				error.status(),
				correlationIdOf(error),
				formatMap("metadata", error.metadata()),
				formatMap("context", context),
				formatCause(error.getCause())
			).trim();
	}

	private static String correlationIdOf(ClassifiedError error) {
		return error.hasCorrelationId() ? error.correlationId() : "none";
	}

	private static String formatMap(String label, Map<String, ?> values) {
		if (values == null || values.isEmpty()) {
			return "";
		}
		return ", " + label + "={" + values.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.sorted()
				.collect(Collectors.joining(", ")) + "}";
	}

	private static String formatCause(Throwable cause) {
		return cause != null ? ", cause=" + cause.getClass().getName() : "";
	}

	private static String capitalize(String s) {
		return Character.toUpperCase(s.charAt(0)) + s.substring(1);
	}
}
