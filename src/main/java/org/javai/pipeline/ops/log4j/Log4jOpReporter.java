package org.javai.pipeline.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.pipeline.Failure;
import org.javai.pipeline.FailureType;
import org.javai.pipeline.ops.OpReporter;

import java.util.Map;

/**
 * Reports failures using Log4j2.
 *
 * <p>Surfaced failures are logged at a level derived from their {@link FailureType}:
 * <ul>
 *   <li>{@code COORDINATOR}, {@code MAPPING} → ERROR</li>
 *   <li>{@code TRANSPORT}, {@code CACHE}, {@code UNKNOWN} → WARN</li>
 * </ul>
 * Suppressed failures (absorbed by a fallback) are logged at INFO with the
 * {@code SUPPRESSED} marker, so the root cause stays discoverable even when the
 * user was shown a cached value.
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker SUPPRESSED_MARKER = MarkerManager.getMarker("SUPPRESSED");

	private final Logger logger;

	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.pipeline.OpReporter"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atLevel(levelFor(failure.type()))
			.withMarker(FAILURE_MARKER)
			.withThrowable(failure.exception())
			.log(formatFailureMessage(failure));
	}

	@Override
	public void reportSuppressed(Failure failure, String resolution) {
		logger.atInfo()
			.withMarker(SUPPRESSED_MARKER)
			.withThrowable(failure.exception())
			.log("Suppressed failure in operation [{}] ({}): {} | code={}",
				failure.operation(),
				resolution,
				failure.messageOrElse("<no message>"),
				failure.id());
	}

	private static String formatFailureMessage(Failure failure) {
		return "Failure in operation [%s]: %s | code=%s, type=%s%s".formatted(
				failure.operation(),
				failure.messageOrElse("<no message>"),
				failure.id(),
				failure.type(),
				formatTags(failure.tags()));
	}

	private static String formatTags(Map<String, String> tags) {
		if (tags == null || tags.isEmpty()) {
			return "";
		}
		return ", tags={" + tags.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.reduce((a, b) -> a + ", " + b)
				.orElse("") + "}";
	}

	private static Level levelFor(FailureType type) {
		return switch (type) {
			case COORDINATOR, MAPPING -> Level.ERROR;
			case TRANSPORT, CACHE, UNKNOWN -> Level.WARN;
		};
	}
}
