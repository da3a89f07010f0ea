package org.javai.pipeline.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.pipeline.Failure;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. A reporter that throws is logged and
 * skipped so that the remaining reporters still run and the pipeline is never broken
 * by its own observability.
 *
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.of(
 *     new Log4jOpReporter(),
 *     new MetricsOpReporter("catalog")
 * );
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger logger = LogManager.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	@Override
	public void report(Failure failure) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.report(failure);
			} catch (RuntimeException e) {
				logReporterError("report", reporter, e);
			}
		}
	}

	@Override
	public void reportSuppressed(Failure failure, String resolution) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.reportSuppressed(failure, resolution);
			} catch (RuntimeException e) {
				logReporterError("reportSuppressed", reporter, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, OpReporter reporter, RuntimeException e) {
		logger.error("OpReporter.{} failed for {}", method, reporter.getClass().getName(), e);
	}
}
