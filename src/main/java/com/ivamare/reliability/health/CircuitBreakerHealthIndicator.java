package com.ivamare.reliability.health;

import com.ivamare.reliability.breaker.CircuitBreakerRegistry;
import com.ivamare.reliability.breaker.CircuitBreakerSnapshot;
import com.ivamare.reliability.breaker.CircuitState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for circuit breakers.
 *
 * <p>Reports:
 * <ul>
 *   <li>State and failure count of each breaker by service</li>
 *   <li>DOWN when any breaker is OPEN</li>
 * </ul>
 */
public class CircuitBreakerHealthIndicator implements HealthIndicator {

    private final CircuitBreakerRegistry registry;

    public CircuitBreakerHealthIndicator(CircuitBreakerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        List<CircuitBreakerSnapshot> states = registry.getAllStates();
        if (states.isEmpty()) {
            return Health.up()
                .withDetail("message", "No circuit breakers registered")
                .build();
        }

        Map<String, BreakerStatus> breakers = new LinkedHashMap<>();
        for (CircuitBreakerSnapshot s : states) {
            breakers.put(s.serviceName(), new BreakerStatus(s.state(), s.failureCount()));
        }
        long open = states.stream().filter(s -> s.state() == CircuitState.OPEN).count();

        Health.Builder builder = open == 0 ? Health.up() : Health.down();

        return builder
            .withDetail("breakers", breakers)
            .withDetail("openCount", open)
            .build();
    }

    record BreakerStatus(CircuitState state, int failureCount) {}
}
