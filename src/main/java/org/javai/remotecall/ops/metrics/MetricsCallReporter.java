package org.javai.remotecall.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.remotecall.Failure;
import org.javai.remotecall.circuit.CircuitState;
import org.javai.remotecall.ops.CallReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Reports remote-call events as JSON-lines metrics via SLF4J.
 *
 * <p>Every event carries {@code eventType}, {@code timestamp} and a {@code trackingKey}
 * (the operation or breaker name, prefixed with the configured namespace).</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"classroom.Notifications.list","attempt":1,"delayMs":1000,"errorType":"org.javai.remotecall.NetworkError","message":"Server error"}
 * {"eventType":"circuit_transition","timestamp":"2024-01-20T10:30:05Z","trackingKey":"classroom.notifications","from":"CLOSED","to":"OPEN"}
 * }</pre>
 */
public class MetricsCallReporter implements CallReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.remotecall.Metrics";
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	public MetricsCallReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsCallReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	public MetricsCallReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsCallReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void report(Failure failure) {
		ObjectNode event = event("failure", failure.operation(), failure.occurredAt());
		event.put("code", failure.code().toString());
		event.put("retryable", failure.retryable());
		event.put("message", failure.message());
		emit(event);
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable error, int attemptNumber, Duration delay) {
		ObjectNode event = event("retry_attempt", operation, clock.instant());
		event.put("attempt", attemptNumber);
		event.put("delayMs", delay.toMillis());
		putError(event, error);
		emit(event);
	}

	@Override
	public void reportRetryExhausted(String operation, Throwable error, int totalAttempts, String reason) {
		ObjectNode event = event("retry_exhausted", operation, clock.instant());
		event.put("totalAttempts", totalAttempts);
		event.put("reason", reason);
		putError(event, error);
		emit(event);
	}

	@Override
	public void reportStateTransition(String breaker, CircuitState from, CircuitState to) {
		ObjectNode event = event("circuit_transition", breaker, clock.instant());
		event.put("from", from.name());
		event.put("to", to.name());
		emit(event);
	}

	@Override
	public void reportCallRejected(String breaker, Duration remainingOpen) {
		ObjectNode event = event("call_rejected", breaker, clock.instant());
		event.put("remainingOpenMs", remainingOpen.toMillis());
		emit(event);
	}

	private ObjectNode event(String eventType, String key, Instant timestamp) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", timestamp.toString());
		event.put("trackingKey", namespace.isEmpty() ? key : namespace + "." + key);
		return event;
	}

	private static void putError(ObjectNode event, Throwable error) {
		if (error == null) {
			return;
		}
		event.put("errorType", error.getClass().getName());
		event.put("message", error.getMessage());
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			// Reporting must not break the call it observes
			logger.debug("Could not serialize {} event", event.path("eventType").asText(), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return "";
		}
		String trimmed = namespace.trim();
		return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
	}
}
