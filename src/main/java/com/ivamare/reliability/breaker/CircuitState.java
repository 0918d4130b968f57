package com.ivamare.reliability.breaker;

/**
 * State of a circuit breaker.
 */
public enum CircuitState {
    /** Calls pass through; consecutive failures are counted */
    CLOSED,

    /** Calls are rejected until the recovery timeout has elapsed */
    OPEN,

    /** Trial calls pass through; one failure reopens, enough successes close */
    HALF_OPEN;

    /**
     * Health score reported as the {@code circuit_breaker.state_<service>} metric.
     */
    public double healthScore() {
        return switch (this) {
            case CLOSED -> 1.0;
            case HALF_OPEN -> 0.5;
            case OPEN -> 0.0;
        };
    }
}
