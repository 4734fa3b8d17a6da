package org.javai.remotecall.circuit;

import org.javai.remotecall.NetworkError;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class CircuitBreakerRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-20T10:00:00Z"));

    @Test
    void breaker_sameName_returnsSameInstance() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();

        CircuitBreaker first = registry.breaker("notifications");
        CircuitBreaker second = registry.breaker("notifications");

        assertThat(first).isSameAs(second);
        assertThat(first.name()).isEqualTo("notifications");
        assertThat(first.config()).isEqualTo(CircuitBreakerConfig.defaults());
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void breaker_differentNames_areIndependent() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.builder()
                .defaults(new CircuitBreakerConfig(1, Duration.ofSeconds(30), 1))
                .clock(clock)
                .build();

        assertThatThrownBy(() -> registry.breaker("billing").execute(() -> {
            throw NetworkError.of("down");
        }));

        assertThat(registry.breaker("billing").getState()).isEqualTo(CircuitState.OPEN);
        assertThat(registry.breaker("notifications").getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void override_appliesOnlyToNamedBreaker() {
        CircuitBreakerConfig strict = new CircuitBreakerConfig(1, Duration.ofSeconds(5), 1);
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.builder()
                .override("payments", strict)
                .build();

        assertThat(registry.breaker("payments").config()).isEqualTo(strict);
        assertThat(registry.breaker("profiles").config()).isEqualTo(CircuitBreakerConfig.defaults());
    }

    @Test
    void find_beforeCreation_isEmpty() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();

        assertThat(registry.find("notifications")).isEmpty();
        registry.breaker("notifications");
        assertThat(registry.find("notifications")).isPresent();
    }

    @Test
    void states_sortedByName() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.builder()
                .defaults(new CircuitBreakerConfig(1, Duration.ofSeconds(30), 1))
                .clock(clock)
                .build();
        registry.breaker("search");
        registry.breaker("billing");
        assertThatThrownBy(() -> registry.breaker("search").execute(() -> {
            throw NetworkError.of("down");
        }));

        Map<String, CircuitState> states = registry.states();

        assertThat(states).containsExactly(
                entry("billing", CircuitState.CLOSED),
                entry("search", CircuitState.OPEN));
        assertThatThrownBy(() -> states.put("other", CircuitState.CLOSED))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void resetAll_closesEveryBreaker() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.builder()
                .defaults(new CircuitBreakerConfig(1, Duration.ofSeconds(30), 1))
                .clock(clock)
                .build();
        for (String name : new String[] {"a", "b"}) {
            assertThatThrownBy(() -> registry.breaker(name).execute(() -> {
                throw NetworkError.of("down");
            }));
        }

        registry.resetAll();

        assertThat(registry.states()).containsOnly(
                entry("a", CircuitState.CLOSED),
                entry("b", CircuitState.CLOSED));
    }
}
