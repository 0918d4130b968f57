package com.ivamare.reliability.breaker;

import java.util.List;

/**
 * Aggregate breaker health. Healthy when no breaker is OPEN.
 *
 * @param healthy Whether every breaker is CLOSED or HALF_OPEN
 * @param services Per-service health
 */
public record BreakerHealth(boolean healthy, List<ServiceHealth> services) {

    /**
     * Health of one service's breaker.
     */
    public record ServiceHealth(String serviceName, CircuitState state, int failureCount, boolean healthy) {
    }
}
