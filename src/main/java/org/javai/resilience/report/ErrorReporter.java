package org.javai.resilience.report;

import org.javai.resilience.ClassifiedError;

import java.util.Map;

/**
 * The logging sink for classified errors.
 * Implementations might write structured logs, emit metrics, or fan out to several sinks.
 *
 * <p>Implementations must not throw: reporting a failure must never cause another one.
 */
@FunctionalInterface
public interface ErrorReporter {

	/**
	 * Reports an error occurrence.
	 *
	 * @param error The classified error
	 * @param context Where and why it happened (operation, request details, ...); may be empty
	 */
	void report(ClassifiedError error, Map<String, ?> context);

	default void report(ClassifiedError error) {
		report(error, Map.of());
	}

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static ErrorReporter noOp() {
		return (error, context) -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 */
	static ErrorReporter composite(ErrorReporter... reporters) {
		return CompositeErrorReporter.of(reporters);
	}
}
