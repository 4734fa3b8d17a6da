package org.javai.remotecall.ops;

import org.javai.remotecall.Failure;
import org.javai.remotecall.circuit.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link CallReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is logged and the remaining reporters still run.
 *
 * <p>Example usage:
 * <pre>{@code
 * CallReporter reporter = CompositeCallReporter.of(
 *     new Log4jCallReporter(),
 *     new MetricsCallReporter("classroom")
 * );
 * }</pre>
 */
public final class CompositeCallReporter implements CallReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeCallReporter.class);

	private final List<CallReporter> reporters;

	private CompositeCallReporter(List<CallReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeCallReporter of(CallReporter... reporters) {
		return new CompositeCallReporter(Arrays.asList(reporters));
	}

	public static CompositeCallReporter of(Collection<? extends CallReporter> reporters) {
		return new CompositeCallReporter(new ArrayList<>(reporters));
	}

	@Override
	public void report(Failure failure) {
		fanOut("report", reporter -> reporter.report(failure));
	}

	@Override
	public void reportRetryAttempt(String operation, Throwable error, int attemptNumber, Duration delay) {
		fanOut("reportRetryAttempt", reporter -> reporter.reportRetryAttempt(operation, error, attemptNumber, delay));
	}

	@Override
	public void reportRetryExhausted(String operation, Throwable error, int totalAttempts, String reason) {
		fanOut("reportRetryExhausted", reporter -> reporter.reportRetryExhausted(operation, error, totalAttempts, reason));
	}

	@Override
	public void reportStateTransition(String breaker, CircuitState from, CircuitState to) {
		fanOut("reportStateTransition", reporter -> reporter.reportStateTransition(breaker, from, to));
	}

	@Override
	public void reportCallRejected(String breaker, Duration remainingOpen) {
		fanOut("reportCallRejected", reporter -> reporter.reportCallRejected(breaker, remainingOpen));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<CallReporter> call) {
		for (CallReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				log.warn("CallReporter.{} failed for {}", method, reporter.getClass().getName(), e);
			}
		}
	}
}
