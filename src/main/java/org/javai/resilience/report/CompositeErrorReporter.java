package org.javai.resilience.report;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.resilience.ClassifiedError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * An {@link ErrorReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the exception is
 * logged and the remaining reporters still run.
 *
 * <pre>{@code
 * ErrorReporter reporter = CompositeErrorReporter.builder()
 *     .add(new Log4jErrorReporter())
 *     .addIf(shipEvents, new JsonLinesErrorReporter("specgen"))
 *     .build();
 * }</pre>
 */
public final class CompositeErrorReporter implements ErrorReporter {

	private static final Logger LOG = LogManager.getLogger(CompositeErrorReporter.class);

	private final List<ErrorReporter> reporters;

	private CompositeErrorReporter(List<ErrorReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Fans out to the given reporters, in order.
	 *
	 * @param reporters the reporters that receive every error
	 * @return a composite over {@code reporters}
	 */
	public static CompositeErrorReporter of(ErrorReporter... reporters) {
		return new CompositeErrorReporter(Arrays.asList(reporters));
	}

	/**
	 * Fans out to the reporters of a collection, in iteration order. Later changes to the
	 * collection are not seen.
	 *
	 * @param reporters the reporters that receive every error
	 * @return a composite over a copy of {@code reporters}
	 */
	public static CompositeErrorReporter of(Collection<? extends ErrorReporter> reporters) {
		return new CompositeErrorReporter(new ArrayList<>(reporters));
	}

	/**
	 * Starts a composite whose reporters are chosen one at a time, some conditionally.
	 *
	 * @return an empty builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(ClassifiedError error, Map<String, ?> context) {
		for (ErrorReporter reporter : reporters) {
			try {
				reporter.report(error, context);
			} catch (RuntimeException e) {
				LOG.warn("ErrorReporter {} failed for [{}]: {}",
					reporter.getClass().getName(), error.code().id(), e.getMessage());
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	/**
	 * Collects reporters for a {@link CompositeErrorReporter}. Null reporters are skipped.
	 */
	public static final class Builder {
		private final List<ErrorReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Appends a reporter.
		 *
		 * @param reporter the reporter to append; ignored if null
		 * @return this builder
		 */
		public Builder add(ErrorReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Appends every reporter of the collection.
		 *
		 * @param reporters the reporters to append
		 * @return this builder
		 */
		public Builder addAll(Collection<? extends ErrorReporter> reporters) {
			for (ErrorReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Appends the reporter only when {@code condition} holds, e.g. a sink enabled by
		 * configuration.
		 *
		 * @param condition whether to append
		 * @param reporter the reporter to append
		 * @return this builder
		 */
		public Builder addIf(boolean condition, ErrorReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeErrorReporter build() {
			return new CompositeErrorReporter(reporters);
		}
	}
}
