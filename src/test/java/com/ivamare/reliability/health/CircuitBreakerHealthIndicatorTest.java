package com.ivamare.reliability.health;

import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.breaker.CircuitBreakerSnapshot;
import com.ivamare.reliability.breaker.CircuitState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CircuitBreakerHealthIndicator")
class CircuitBreakerHealthIndicatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("should return UP when no breakers registered")
    void shouldReturnUpWhenNoBreakersRegistered() {
        CircuitBreakerRegistry registry = mock(CircuitBreakerRegistry.class);
        when(registry.getAllStates()).thenReturn(List.of());

        Health health = new CircuitBreakerHealthIndicator(registry).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("No circuit breakers registered", health.getDetails().get("message"));
    }

    @Test
    @DisplayName("should return UP when no breaker is open")
    void shouldReturnUpWhenAllClosed() {
        CircuitBreakerRegistry registry = mock(CircuitBreakerRegistry.class);
        when(registry.getAllStates()).thenReturn(List.of(
            new CircuitBreakerSnapshot("db", CircuitState.CLOSED, 0, 0, null, NOW),
            new CircuitBreakerSnapshot("ledger", CircuitState.HALF_OPEN, 5, 1, NOW, NOW)
        ));

        Health health = new CircuitBreakerHealthIndicator(registry).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(0L, health.getDetails().get("openCount"));
        assertEquals(2, ((Map<?, ?>) health.getDetails().get("breakers")).size());
    }

    @Test
    @DisplayName("should return DOWN when a breaker is open")
    void shouldReturnDownWhenBreakerOpen() {
        CircuitBreakerRegistry registry = mock(CircuitBreakerRegistry.class);
        when(registry.getAllStates()).thenReturn(List.of(
            new CircuitBreakerSnapshot("db", CircuitState.OPEN, 5, 0, NOW, NOW),
            new CircuitBreakerSnapshot("ledger", CircuitState.CLOSED, 0, 0, null, NOW)
        ));

        Health health = new CircuitBreakerHealthIndicator(registry).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(1L, health.getDetails().get("openCount"));
        Map<?, ?> breakers = (Map<?, ?>) health.getDetails().get("breakers");
        assertEquals(new CircuitBreakerHealthIndicator.BreakerStatus(CircuitState.OPEN, 5), breakers.get("db"));
    }
}
