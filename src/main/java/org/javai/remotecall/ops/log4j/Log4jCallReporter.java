package org.javai.remotecall.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.remotecall.Failure;
import org.javai.remotecall.circuit.CircuitState;
import org.javai.remotecall.ops.CallReporter;

import java.time.Duration;

/**
 * Reports remote-call events using Log4j2 logging.
 *
 * <p>Levels:
 * <ul>
 *   <li>retryable failure, retry attempt → INFO</li>
 *   <li>non-retryable failure, retry exhausted, circuit opened → WARN</li>
 *   <li>other circuit transitions → INFO</li>
 *   <li>rejected call → DEBUG</li>
 * </ul>
 */
public class Log4jCallReporter implements CallReporter {

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	static final Marker CIRCUIT_MARKER = MarkerManager.getMarker("CIRCUIT");

	private final Logger logger;

	/**
	 * Creates a Log4jCallReporter using the default logger name.
	 */
	public Log4jCallReporter() {
		this(LogManager.getLogger("org.javai.remotecall.CallReporter"));
	}

	public Log4jCallReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jCallReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		Level level = failure.retryable() ? Level.INFO : Level.WARN;

		logger.atLevel(level)
			.withMarker(FAILURE_MARKER)
			.log("Failure in operation [{}]: {} | code={}, retryable={}{}",
				failure.operation(),
				failure.message(),
				failure.code(),
				failure.retryable(),
				formatCause(failure.exception()));
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable error, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} for operation [{}] failed, retrying in {}ms: {}",
				attemptNumber,
				operation,
				delay.toMillis(),
				error.getMessage());
	}

	@Override
	public void reportRetryExhausted(String operation, Throwable error, int totalAttempts, String reason) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.log("Giving up on operation [{}] after {} attempt(s) ({}): {}",
				operation,
				totalAttempts,
				reason,
				error.getMessage());
	}

	@Override
	public void reportStateTransition(String breaker, CircuitState from, CircuitState to) {
		Level level = to == CircuitState.OPEN ? Level.WARN : Level.INFO;
		logger.atLevel(level)
			.withMarker(CIRCUIT_MARKER)
			.log("Circuit breaker [{}] {} -> {}", breaker, from, to);
	}

	@Override
	public void reportCallRejected(String breaker, Duration remainingOpen) {
		logger.atDebug()
			.withMarker(CIRCUIT_MARKER)
			.log("Circuit breaker [{}] rejected call, open for another {}ms", breaker, remainingOpen.toMillis());
	}

	private static String formatCause(Throwable exception) {
		return exception != null ? ", cause=" + exception.getClass().getName() : "";
	}
}
