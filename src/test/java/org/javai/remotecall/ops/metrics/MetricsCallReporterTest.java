package org.javai.remotecall.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.remotecall.Failure;
import org.javai.remotecall.FailureCode;
import org.javai.remotecall.NetworkError;
import org.javai.remotecall.circuit.CircuitState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.AbstractLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetricsCallReporterTest {

	private static final Instant NOW = Instant.parse("2024-01-20T10:30:00Z");
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private List<String> capturedMessages;
	private CapturingLogger capturingLogger;
	private MetricsCallReporter reporter;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		reporter = new MetricsCallReporter(null, capturingLogger, Clock.fixed(NOW, ZoneOffset.UTC));
	}

	private JsonNode onlyEvent() throws Exception {
		assertThat(capturedMessages).hasSize(1);
		return MAPPER.readTree(capturedMessages.get(0));
	}

	@Test
	void report_emitsFailureEventAsJsonLine() throws Exception {
		Failure failure = new Failure(FailureCode.of("http", "503"), "Service unavailable", true,
				"Notifications.list", NOW, NetworkError.of("Service unavailable", 503));

		reporter.report(failure);

		assertThat(capturedMessages.get(0)).doesNotContain("\n");
		JsonNode json = onlyEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("failure");
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(json.get("trackingKey").asText()).isEqualTo("Notifications.list");
		assertThat(json.get("code").asText()).isEqualTo("http:503");
		assertThat(json.get("retryable").asBoolean()).isTrue();
		assertThat(json.get("message").asText()).isEqualTo("Service unavailable");
	}

	@Test
	void report_withNamespace_prependsToTrackingKey() throws Exception {
		MetricsCallReporter namespaced = new MetricsCallReporter("classroom.", capturingLogger, Clock.fixed(NOW, ZoneOffset.UTC));

		namespaced.reportStateTransition("notifications", CircuitState.CLOSED, CircuitState.OPEN);

		JsonNode json = onlyEvent();
		assertThat(json.get("trackingKey").asText()).isEqualTo("classroom.notifications");
	}

	@Test
	void report_withBlankNamespace_usesKeyOnly() throws Exception {
		MetricsCallReporter blank = new MetricsCallReporter("  ", capturingLogger, Clock.fixed(NOW, ZoneOffset.UTC));

		blank.reportCallRejected("notifications", Duration.ofSeconds(2));

		assertThat(onlyEvent().get("trackingKey").asText()).isEqualTo("notifications");
	}

	@Test
	void reportRetryAttempt_includesAttemptDelayAndError() throws Exception {
		reporter.reportRetryAttempt("Notifications.list", NetworkError.of("Server error", 500), 2, Duration.ofMillis(2000));

		JsonNode json = onlyEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("retry_attempt");
		assertThat(json.get("attempt").asInt()).isEqualTo(2);
		assertThat(json.get("delayMs").asLong()).isEqualTo(2000);
		assertThat(json.get("errorType").asText()).isEqualTo(NetworkError.class.getName());
		assertThat(json.get("message").asText()).isEqualTo("Server error");
	}

	@Test
	void reportRetryExhausted_includesTotalAndReason() throws Exception {
		reporter.reportRetryExhausted("Notifications.list", NetworkError.of("Not found", 404), 1, "failure is not retryable");

		JsonNode json = onlyEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("retry_exhausted");
		assertThat(json.get("totalAttempts").asInt()).isEqualTo(1);
		assertThat(json.get("reason").asText()).isEqualTo("failure is not retryable");
	}

	@Test
	void reportStateTransition_includesFromAndTo() throws Exception {
		reporter.reportStateTransition("notifications", CircuitState.HALF_OPEN, CircuitState.CLOSED);

		JsonNode json = onlyEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("circuit_transition");
		assertThat(json.get("from").asText()).isEqualTo("HALF_OPEN");
		assertThat(json.get("to").asText()).isEqualTo("CLOSED");
	}

	@Test
	void reportCallRejected_includesRemainingOpen() throws Exception {
		reporter.reportCallRejected("notifications", Duration.ofMillis(1500));

		JsonNode json = onlyEvent();
		assertThat(json.get("eventType").asText()).isEqualTo("call_rejected");
		assertThat(json.get("remainingOpenMs").asLong()).isEqualTo(1500);
	}

	@Test
	void messageWithQuotes_isEscaped() throws Exception {
		reporter.reportRetryAttempt("op", NetworkError.of("said \"timeout\"\nthen gave up"), 1, Duration.ZERO);

		assertThat(onlyEvent().get("message").asText()).isEqualTo("said \"timeout\"\nthen gave up");
	}

	private static class CapturingLogger extends AbstractLogger {
		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.messages = messages;
			this.name = "test";
		}

		@Override
		protected String getFullyQualifiedCallerName() { return null; }

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
				Object[] arguments, Throwable throwable) {
			if (level == Level.INFO) {
				messages.add(messagePattern);
			}
		}

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public boolean isTraceEnabled(Marker marker) { return false; }

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public boolean isDebugEnabled(Marker marker) { return false; }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public boolean isInfoEnabled(Marker marker) { return true; }

		@Override
		public boolean isWarnEnabled() { return true; }

		@Override
		public boolean isWarnEnabled(Marker marker) { return true; }

		@Override
		public boolean isErrorEnabled() { return true; }

		@Override
		public boolean isErrorEnabled(Marker marker) { return true; }
	}
}
