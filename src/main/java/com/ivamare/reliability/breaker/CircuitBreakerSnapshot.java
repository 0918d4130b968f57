package com.ivamare.reliability.breaker;

import java.time.Instant;

/**
 * Point-in-time view of a breaker, also the persisted form of its state.
 *
 * @param serviceName Service the breaker guards
 * @param state Current state
 * @param failureCount Consecutive failures
 * @param successCount Consecutive successes while HALF_OPEN
 * @param lastFailureTime Time of the last failure (nullable)
 * @param updatedAt When the snapshot was taken
 */
public record CircuitBreakerSnapshot(
    String serviceName,
    CircuitState state,
    int failureCount,
    int successCount,
    Instant lastFailureTime,
    Instant updatedAt
) {
    public boolean isHealthy() {
        return state != CircuitState.OPEN;
    }
}
