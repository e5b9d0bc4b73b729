package org.javai.resilience.report;

import org.javai.resilience.ClassifiedError;
import org.javai.resilience.ErrorJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports classified errors as JSON lines via SLF4J.
 *
 * <p>One JSON object is written per error, suitable for log shipping and aggregation
 * pipelines. An optional namespace prefixes the tracking key so several services can share
 * one index.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"specgen.CONNECTION_REFUSED","code":"CONNECTION_REFUSED",...}
 * }</pre>
 */
public class JsonLinesErrorReporter implements ErrorReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.ErrorEvents";

	private final String namespace;
	private final Logger logger;

	public JsonLinesErrorReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public JsonLinesErrorReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Package-private for testing.
	 */
	JsonLinesErrorReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(ClassifiedError error, Map<String, ?> context) {
		try {
			logger.info(ErrorJson.write(buildEvent(error, context)));
		} catch (RuntimeException e) {
			logger.warn("Could not write failure event for [{}]: {}", error.code().id(), e.getMessage());
		}
	}

	Map<String, Object> buildEvent(ClassifiedError error, Map<String, ?> context) {
		Map<String, Object> event = new LinkedHashMap<>();
		event.put("eventType", "failure");
		event.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(error.timestamp()));
		event.put("trackingKey", buildTrackingKey(error));
		event.put("code", error.code().id());
		event.put("type", error.type().wireName());
		event.put("severity", error.severity().wireName());
		event.put("status", error.status());
		event.put("message", error.developerMessage());
		if (error.hasCorrelationId()) {
			event.put("correlationId", error.correlationId());
		}
		if (!error.metadata().isEmpty()) {
			event.put("metadata", stringify(error.metadata()));
		}
		if (context != null && !context.isEmpty()) {
			event.put("context", stringify(context));
		}
		if (error.getCause() != null) {
			event.put("causeType", error.getCause().getClass().getName());
		}
		return event;
	}

	String buildTrackingKey(ClassifiedError error) {
		if (namespace == null) {
			return error.code().id();
		}
		return namespace + "." + error.code().id();
	}

	private static Map<String, String> stringify(Map<String, ?> values) {
		Map<String, String> out = new LinkedHashMap<>();
		values.forEach((k, v) -> out.put(k, String.valueOf(v)));
		return out;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
