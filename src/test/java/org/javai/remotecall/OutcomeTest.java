package org.javai.remotecall;

import org.javai.remotecall.circuit.CircuitOpenException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class OutcomeTest {

    private static Failure failure(String message) {
        return Failure.of("Notifications.list", NetworkError.of(message, 503), true);
    }

    @Test
    void ok_exposesValue() {
        Outcome<String> outcome = Outcome.ok("hello");

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.isFail()).isFalse();
        assertThat(outcome.getOrThrow()).isEqualTo("hello");
        assertThat(outcome.getOrElse("fallback")).isEqualTo("hello");
        assertThat(outcome.findFailure()).isEmpty();
        assertThat(outcome.isCircuitOpen()).isFalse();
        assertThat(outcome.isRetryable()).isFalse();
    }

    @Test
    void fail_getOrThrow_keepsOriginalExceptionAsCause() {
        Failure failure = failure("Service unavailable");
        Outcome<String> outcome = Outcome.fail(failure);

        assertThatThrownBy(outcome::getOrThrow)
                .isInstanceOf(OutcomeFailedException.class)
                .hasMessageContaining("Service unavailable")
                .hasCauseReference(failure.exception())
                .satisfies(e -> assertThat(((OutcomeFailedException) e).failure()).isSameAs(failure));
    }

    @Test
    void fail_getOrElse_returnsFallback() {
        Outcome<String> outcome = Outcome.fail(failure("down"));

        assertThat(outcome.isFail()).isTrue();
        assertThat(outcome.getOrElse("cached")).isEqualTo("cached");
    }

    @Test
    void fail_transientFailure_isRetryable() {
        Failure failure = failure("Service unavailable");
        Outcome<String> outcome = Outcome.fail(failure);

        assertThat(outcome.findFailure()).containsSame(failure);
        assertThat(outcome.isRetryable()).isTrue();
        assertThat(outcome.isCircuitOpen()).isFalse();
    }

    @Test
    void fail_rejectedByOpenCircuit_isCircuitOpenAndNotRetryable() {
        Failure rejected = Failure.of("Notifications.list",
                new CircuitOpenException("notifications", Duration.ofSeconds(30)), false);
        Outcome<String> outcome = Outcome.fail(rejected);

        assertThat(outcome.isCircuitOpen()).isTrue();
        assertThat(outcome.isRetryable()).isFalse();
    }

    @Test
    void fail_requiresFailure() {
        assertThatThrownBy(() -> Outcome.fail(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("failure");
    }

    @Test
    void failureCode_forThrowable() {
        assertThat(FailureCode.forThrowable(NetworkError.of("down")).toString()).isEqualTo("network:error");
        assertThat(FailureCode.forThrowable(NetworkError.builder("bad json").networkError(false).build()).toString())
                .isEqualTo("remote:error");
        assertThat(FailureCode.forThrowable(new IllegalStateException("x")).toString())
                .isEqualTo("exception:IllegalStateException");
    }

    @Test
    void failureCode_rejectsBlankParts() {
        assertThatThrownBy(() -> FailureCode.of(" ", "open")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FailureCode.of("circuit", "")).isInstanceOf(IllegalArgumentException.class);
    }
}
