package org.javai.resilience.report;

import org.javai.resilience.ClassifiedError;
import org.javai.resilience.ErrorFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CompositeErrorReporterTest {

	@Test
	void report_reachesEveryDelegate() {
		List<ClassifiedError> first = new ArrayList<>();
		List<ClassifiedError> second = new ArrayList<>();
		ErrorReporter composite = ErrorReporter.composite(
			(error, context) -> first.add(error),
			(error, context) -> second.add(error));

		ClassifiedError error = ErrorFactory.connectionFailed("reset");
		composite.report(error);

		assertThat(first).containsExactly(error);
		assertThat(second).containsExactly(error);
	}

	@Test
	void failingDelegate_doesNotStopOthers() {
		List<ClassifiedError> reached = new ArrayList<>();
		CompositeErrorReporter composite = CompositeErrorReporter.of(
			(error, context) -> {
				throw new IllegalStateException("sink down");
			},
			(error, context) -> reached.add(error));

		assertThatCode(() -> composite.report(ErrorFactory.internalError("boom", null), Map.of()))
			.doesNotThrowAnyException();
		assertThat(reached).hasSize(1);
	}

	@Test
	void ofCollection_copiesTheReporters() {
		List<ClassifiedError> reached = new ArrayList<>();
		List<ErrorReporter> reporters = new ArrayList<>();
		reporters.add((error, context) -> reached.add(error));

		CompositeErrorReporter composite = CompositeErrorReporter.of(reporters);
		reporters.add((error, context) -> reached.add(error));
		composite.report(ErrorFactory.connectionSendFailed("ping"));

		assertThat(composite.size()).isEqualTo(1);
		assertThat(reached).hasSize(1);
	}

	@Test
	void builder_skipsNullAndConditionalReporters() {
		CompositeErrorReporter composite = CompositeErrorReporter.builder()
			.add(ErrorReporter.noOp())
			.add(null)
			.addIf(false, ErrorReporter.noOp())
			.addIf(true, new Log4jErrorReporter())
			.addAll(List.of(ErrorReporter.noOp()))
			.build();

		assertThat(composite.size()).isEqualTo(3);
	}
}
