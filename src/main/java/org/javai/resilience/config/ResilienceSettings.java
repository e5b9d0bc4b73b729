package org.javai.resilience.config;

import org.javai.resilience.ErrorFactory;
import org.javai.resilience.classify.HeuristicErrorClassifier;
import org.javai.resilience.monitor.AlertThresholds;
import org.javai.resilience.monitor.ResourceHealthMonitor;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Settings resolved from system properties, falling back to environment variables.
 *
 * <p>Each property key maps to an environment variable by upper-casing it and replacing
 * {@code .} and {@code -} with {@code _}, e.g. {@code resilience.monitor.max-connections}
 * becomes {@code RESILIENCE_MONITOR_MAX_CONNECTIONS}.
 *
 * <table>
 *   <caption>Recognised keys</caption>
 *   <tr><td>{@code resilience.env}</td><td>{@code development}</td></tr>
 *   <tr><td>{@code resilience.monitor.interval-ms}</td><td>30000</td></tr>
 *   <tr><td>{@code resilience.monitor.max-connections}</td><td>1000</td></tr>
 *   <tr><td>{@code resilience.monitor.max-processing-jobs}</td><td>100</td></tr>
 *   <tr><td>{@code resilience.monitor.max-memory-growth-percent}</td><td>50</td></tr>
 *   <tr><td>{@code resilience.monitor.max-inactive-ratio}</td><td>0.4</td></tr>
 *   <tr><td>{@code resilience.classifier.dependencies}</td><td>{@code gemini}</td></tr>
 * </table>
 */
public final class ResilienceSettings {

	public static final String ENV = "resilience.env";
	public static final String MONITOR_INTERVAL_MS = "resilience.monitor.interval-ms";
	public static final String MAX_CONNECTIONS = "resilience.monitor.max-connections";
	public static final String MAX_PROCESSING_JOBS = "resilience.monitor.max-processing-jobs";
	public static final String MAX_MEMORY_GROWTH_PERCENT = "resilience.monitor.max-memory-growth-percent";
	public static final String MAX_INACTIVE_RATIO = "resilience.monitor.max-inactive-ratio";
	public static final String CLASSIFIER_DEPENDENCIES = "resilience.classifier.dependencies";

	public static final String DEFAULT_ENVIRONMENT = "development";
	public static final String PRODUCTION = "production";

	private final Function<String, String> properties;
	private final Function<String, String> environment;

	private ResilienceSettings(Function<String, String> properties, Function<String, String> environment) {
		this.properties = Objects.requireNonNull(properties, "properties must not be null");
		this.environment = Objects.requireNonNull(environment, "environment must not be null");
	}

	/**
	 * Reads {@link System#getProperty(String)} and {@link System#getenv(String)}.
	 */
	public static ResilienceSettings fromSystem() {
		return new ResilienceSettings(System::getProperty, System::getenv);
	}

	/**
	 * Reads from the given lookups. Useful for testing.
	 */
	public static ResilienceSettings from(Function<String, String> properties, Function<String, String> environment) {
		return new ResilienceSettings(properties, environment);
	}

	public static String envVarFor(String key) {
		return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
	}

	public String environment() {
		String value = resolve(ENV);
		return value != null ? value.trim() : DEFAULT_ENVIRONMENT;
	}

	public boolean isProduction() {
		return PRODUCTION.equalsIgnoreCase(environment());
	}

	/**
	 * Whether transport bodies carry developer details, stack and cause chain.
	 */
	public boolean verboseErrors() {
		return !isProduction();
	}

	public Duration monitorInterval() {
		long millis = longValue(MONITOR_INTERVAL_MS, ResourceHealthMonitor.DEFAULT_INTERVAL.toMillis());
		if (millis <= 0) {
			throw ErrorFactory.configurationError(MONITOR_INTERVAL_MS, millis);
		}
		return Duration.ofMillis(millis);
	}

	/**
	 * Alert thresholds, with unset keys taken from {@link AlertThresholds#DEFAULTS}.
	 */
	public AlertThresholds thresholds() {
		AlertThresholds defaults = AlertThresholds.DEFAULTS;
		int maxConnections = intValue(MAX_CONNECTIONS, defaults.maxConnections());
		int maxProcessingJobs = intValue(MAX_PROCESSING_JOBS, defaults.maxProcessingJobs());
		double maxMemoryGrowthPercent = doubleValue(MAX_MEMORY_GROWTH_PERCENT, defaults.maxMemoryGrowthPercent());
		double maxInactiveRatio = doubleValue(MAX_INACTIVE_RATIO, defaults.maxInactiveRatio());
		try {
			return new AlertThresholds(maxConnections, maxProcessingJobs, maxMemoryGrowthPercent, maxInactiveRatio);
		} catch (IllegalArgumentException e) {
			throw ErrorFactory.configurationError("resilience.monitor.*", e.getMessage(), e);
		}
	}

	public List<String> classifierDependencies() {
		String value = resolve(CLASSIFIER_DEPENDENCIES);
		if (value == null) {
			return HeuristicErrorClassifier.DEFAULT_DEPENDENCIES;
		}
		return Arrays.stream(value.split(","))
				.map(String::trim)
				.filter(name -> !name.isEmpty())
				.toList();
	}

	public HeuristicErrorClassifier classifier() {
		return new HeuristicErrorClassifier(classifierDependencies());
	}

	/**
	 * The system property, else the environment variable, else null. Blank counts as unset.
	 */
	String resolve(String key) {
		String value = properties.apply(key);
		if (value == null || value.isBlank()) {
			value = environment.apply(envVarFor(key));
		}
		if (value == null || value.isBlank()) {
			return null;
		}
		return value;
	}

	private int intValue(String key, int defaultValue) {
		String value = resolve(key);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw ErrorFactory.configurationError(key, value, e);
		}
	}

	private long longValue(String key, long defaultValue) {
		String value = resolve(key);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Long.parseLong(value.trim());
		} catch (NumberFormatException e) {
			throw ErrorFactory.configurationError(key, value, e);
		}
	}

	private double doubleValue(String key, double defaultValue) {
		String value = resolve(key);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Double.parseDouble(value.trim());
		} catch (NumberFormatException e) {
			throw ErrorFactory.configurationError(key, value, e);
		}
	}
}
