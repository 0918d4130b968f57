package com.ivamare.reliability.exception;

import java.time.Instant;

/**
 * Raised when a call is shed because the breaker for its service is OPEN.
 *
 * <p>The protected operation is never invoked. This rejection does not count
 * as a failure and callers should not retry it on a fixed schedule.
 */
public class CircuitBreakerOpenException extends ReliabilityException {

    private final String serviceName;
    private final Instant retryAfter;

    public CircuitBreakerOpenException(String serviceName, Instant retryAfter) {
        super("Circuit breaker is OPEN for service: " + serviceName);
        this.serviceName = serviceName;
        this.retryAfter = retryAfter;
    }

    public String getServiceName() {
        return serviceName;
    }

    /**
     * Earliest instant at which the breaker will let a trial call through.
     */
    public Instant getRetryAfter() {
        return retryAfter;
    }
}
