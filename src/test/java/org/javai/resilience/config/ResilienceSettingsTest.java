package org.javai.resilience.config;

import org.javai.resilience.ClassifiedError;
import org.javai.resilience.ErrorCode;
import org.javai.resilience.monitor.AlertThresholds;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ResilienceSettingsTest {

	private final Map<String, String> properties = new HashMap<>();
	private final Map<String, String> environment = new HashMap<>();
	private final ResilienceSettings settings = ResilienceSettings.from(properties::get, environment::get);

	@Test
	void defaults_whenNothingIsSet() {
		assertThat(settings.environment()).isEqualTo("development");
		assertThat(settings.verboseErrors()).isTrue();
		assertThat(settings.monitorInterval()).isEqualTo(Duration.ofSeconds(30));
		assertThat(settings.thresholds()).isEqualTo(AlertThresholds.DEFAULTS);
		assertThat(settings.classifierDependencies()).containsExactly("gemini");
	}

	@Test
	void production_disablesVerboseErrors() {
		environment.put("RESILIENCE_ENV", "production");

		assertThat(settings.isProduction()).isTrue();
		assertThat(settings.verboseErrors()).isFalse();
	}

	@Test
	void systemProperty_winsOverEnvironment() {
		properties.put(ResilienceSettings.ENV, "staging");
		environment.put("RESILIENCE_ENV", "production");

		assertThat(settings.environment()).isEqualTo("staging");
		assertThat(settings.verboseErrors()).isTrue();
	}

	@Test
	void blankProperty_fallsBackToEnvironment() {
		properties.put(ResilienceSettings.MAX_CONNECTIONS, " ");
		environment.put("RESILIENCE_MONITOR_MAX_CONNECTIONS", "250");

		assertThat(settings.thresholds().maxConnections()).isEqualTo(250);
	}

	@Test
	void envVarName_isDerivedFromKey() {
		assertThat(ResilienceSettings.envVarFor(ResilienceSettings.MAX_MEMORY_GROWTH_PERCENT))
			.isEqualTo("RESILIENCE_MONITOR_MAX_MEMORY_GROWTH_PERCENT");
	}

	@Test
	void thresholds_readEveryKey() {
		properties.put(ResilienceSettings.MAX_CONNECTIONS, "10");
		properties.put(ResilienceSettings.MAX_PROCESSING_JOBS, "4");
		properties.put(ResilienceSettings.MAX_MEMORY_GROWTH_PERCENT, "25.5");
		properties.put(ResilienceSettings.MAX_INACTIVE_RATIO, "0.2");
		properties.put(ResilienceSettings.MONITOR_INTERVAL_MS, "5000");

		assertThat(settings.thresholds()).isEqualTo(new AlertThresholds(10, 4, 25.5, 0.2));
		assertThat(settings.monitorInterval()).isEqualTo(Duration.ofSeconds(5));
	}

	@Test
	void malformedNumber_isConfigurationError() {
		properties.put(ResilienceSettings.MAX_CONNECTIONS, "lots");

		assertThatThrownBy(settings::thresholds)
			.isInstanceOf(ClassifiedError.class)
			.satisfies(e -> {
				ClassifiedError error = (ClassifiedError) e;
				assertThat(error.code()).isEqualTo(ErrorCode.CONFIGURATION_ERROR);
				assertThat(error.metadata()).containsEntry("setting", ResilienceSettings.MAX_CONNECTIONS)
					.containsEntry("value", "lots");
				assertThat(error.getCause()).isInstanceOf(NumberFormatException.class);
			});
	}

	@Test
	void negativeThreshold_isConfigurationError() {
		properties.put(ResilienceSettings.MAX_INACTIVE_RATIO, "-1");

		assertThatThrownBy(settings::thresholds)
			.isInstanceOf(ClassifiedError.class)
			.extracting(e -> ((ClassifiedError) e).code())
			.isEqualTo(ErrorCode.CONFIGURATION_ERROR);
	}

	@Test
	void nonPositiveInterval_isConfigurationError() {
		properties.put(ResilienceSettings.MONITOR_INTERVAL_MS, "0");

		assertThatThrownBy(settings::monitorInterval).isInstanceOf(ClassifiedError.class);
	}

	@Test
	void dependencies_areCommaSeparatedAndTrimmed() {
		properties.put(ResilienceSettings.CLASSIFIER_DEPENDENCIES, " gemini, openai ,, ");

		assertThat(settings.classifierDependencies()).containsExactly("gemini", "openai");
		assertThat(settings.classifier().dependencies()).containsExactly("gemini", "openai");
	}
}
