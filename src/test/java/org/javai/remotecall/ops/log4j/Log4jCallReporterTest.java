package org.javai.remotecall.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.javai.remotecall.Failure;
import org.javai.remotecall.NetworkError;
import org.javai.remotecall.circuit.CircuitState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class Log4jCallReporterTest {

	private static final String LOGGER_NAME = "org.javai.remotecall.Log4jCallReporterTest";

	private CapturingAppender appender;
	private Log4jCallReporter reporter;

	@BeforeEach
	void setUp() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		appender = new CapturingAppender();
		appender.start();
		LoggerConfig loggerConfig = new LoggerConfig(LOGGER_NAME, Level.ALL, false);
		loggerConfig.addAppender(appender, null, null);
		configuration.addLogger(LOGGER_NAME, loggerConfig);
		context.updateLoggers();

		reporter = new Log4jCallReporter(LOGGER_NAME);
	}

	@AfterEach
	void tearDown() {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		context.getConfiguration().removeLogger(LOGGER_NAME);
		context.updateLoggers();
		appender.stop();
	}

	@Test
	void report_retryableFailure_logsInfoWithFailureMarker() {
		reporter.report(Failure.of("Notifications.list", NetworkError.of("Service unavailable", 503), true));

		LogEvent event = onlyEvent();
		assertThat(event.getLevel()).isEqualTo(Level.INFO);
		assertThat(event.getMarker()).isEqualTo(Log4jCallReporter.FAILURE_MARKER);
		assertThat(event.getMessage().getFormattedMessage())
				.contains("[Notifications.list]")
				.contains("code=http:503")
				.contains("cause=" + NetworkError.class.getName());
	}

	@Test
	void report_permanentFailure_logsWarn() {
		reporter.report(Failure.of("Notifications.list", NetworkError.of("Unauthorized", 401, false), false));

		assertThat(onlyEvent().getLevel()).isEqualTo(Level.WARN);
	}

	@Test
	void retryEvents_useRetryMarkers() {
		NetworkError error = NetworkError.of("Connection failed");

		reporter.reportRetryAttempt("Notifications.list", error, 1, Duration.ofMillis(1000));
		reporter.reportRetryExhausted("Notifications.list", error, 3, "max attempts reached");

		assertThat(appender.events).hasSize(2);
		LogEvent attempt = appender.events.get(0);
		assertThat(attempt.getLevel()).isEqualTo(Level.INFO);
		assertThat(attempt.getMarker()).isEqualTo(Log4jCallReporter.RETRY_MARKER);
		assertThat(attempt.getMessage().getFormattedMessage()).contains("retrying in 1000ms");
		LogEvent exhausted = appender.events.get(1);
		assertThat(exhausted.getLevel()).isEqualTo(Level.WARN);
		assertThat(exhausted.getMarker()).isEqualTo(Log4jCallReporter.RETRY_EXHAUSTED_MARKER);
		assertThat(exhausted.getMessage().getFormattedMessage()).contains("after 3 attempt(s)");
	}

	@Test
	void circuitOpening_logsWarn_otherTransitionsInfo() {
		reporter.reportStateTransition("notifications", CircuitState.CLOSED, CircuitState.OPEN);
		reporter.reportStateTransition("notifications", CircuitState.OPEN, CircuitState.HALF_OPEN);

		assertThat(appender.events).extracting(LogEvent::getLevel).containsExactly(Level.WARN, Level.INFO);
		assertThat(appender.events).allSatisfy(e -> assertThat(e.getMarker()).isEqualTo(Log4jCallReporter.CIRCUIT_MARKER));
	}

	@Test
	void rejectedCall_logsDebug() {
		reporter.reportCallRejected("notifications", Duration.ofSeconds(2));

		LogEvent event = onlyEvent();
		assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
		assertThat(event.getMessage().getFormattedMessage()).contains("2000ms");
	}

	private LogEvent onlyEvent() {
		assertThat(appender.events).hasSize(1);
		return appender.events.get(0);
	}

	private static final class CapturingAppender extends AbstractAppender {
		private final List<LogEvent> events = new CopyOnWriteArrayList<>();

		CapturingAppender() {
			super("capturing", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
