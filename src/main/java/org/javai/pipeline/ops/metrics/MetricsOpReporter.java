package org.javai.pipeline.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.pipeline.Failure;
import org.javai.pipeline.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Reports failures as JSON-lines metrics via SLF4J.
 *
 * <p>Each surfaced or suppressed failure becomes one JSON object, suitable for metrics
 * aggregation. The tracking key is the operation name, optionally prefixed by a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"catalog.ItemGateway.popularItems","code":"transport:timeout",...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.pipeline.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final Logger logger = LoggerFactory.getLogger(MetricsOpReporter.class);
	private final ObjectMapper objectMapper = new ObjectMapper();
	private final String namespace;
	private final Consumer<String> sink;

	public MetricsOpReporter() {
		this(null);
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME)::info);
	}

	/**
	 * Creates a reporter writing each JSON line to the given sink.
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Consumer<String> sink) {
		this.namespace = normalizeNamespace(namespace);
		this.sink = Objects.requireNonNull(sink, "sink must not be null");
	}

	@Override
	public void report(Failure failure) {
		emit(baseEvent("failure", failure));
	}

	@Override
	public void reportSuppressed(Failure failure, String resolution) {
		Map<String, Object> event = baseEvent("suppressed", failure);
		event.put("resolution", resolution);
		emit(event);
	}

	private Map<String, Object> baseEvent(String eventType, Failure failure) {
		Map<String, Object> event = new LinkedHashMap<>();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(failure.occurredAt()));
		event.put("trackingKey", buildTrackingKey(failure));
		event.put("code", failure.id().toString());
		event.put("type", failure.type().name());
		event.put("message", failure.message());
		event.put("operation", failure.operation());
		if (!failure.tags().isEmpty()) {
			event.put("tags", failure.tags());
		}
		return event;
	}

	private void emit(Map<String, Object> event) {
		try {
			sink.accept(objectMapper.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialise metrics event {}", event.get("eventType"), e);
		}
	}

	String buildTrackingKey(Failure failure) {
		if (namespace == null) {
			return failure.operation();
		}
		return namespace + "." + failure.operation();
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
