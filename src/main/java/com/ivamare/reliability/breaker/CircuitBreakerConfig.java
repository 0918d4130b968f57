package com.ivamare.reliability.breaker;

import java.time.Duration;

/**
 * Thresholds for one circuit breaker.
 *
 * @param failureThreshold Consecutive failures that open a CLOSED breaker
 * @param recoveryTimeout Time after the last failure before an OPEN breaker lets a trial call through
 * @param successThreshold Consecutive HALF_OPEN successes that close the breaker
 * @param operationTimeout Per-call timeout; exceeding it counts as a failure
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration recoveryTimeout,
    int successThreshold,
    Duration operationTimeout
) {
    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_SUCCESS_THRESHOLD = 3;
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(30);

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be at least 1");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must not be negative");
        }
        if (operationTimeout == null || operationTimeout.isNegative() || operationTimeout.isZero()) {
            throw new IllegalArgumentException("operationTimeout must be positive");
        }
    }

    /**
     * Creates a config with default values.
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(
            DEFAULT_FAILURE_THRESHOLD,
            DEFAULT_RECOVERY_TIMEOUT,
            DEFAULT_SUCCESS_THRESHOLD,
            DEFAULT_OPERATION_TIMEOUT
        );
    }

    public CircuitBreakerConfig withFailureThreshold(int threshold) {
        return new CircuitBreakerConfig(threshold, recoveryTimeout, successThreshold, operationTimeout);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration timeout) {
        return new CircuitBreakerConfig(failureThreshold, timeout, successThreshold, operationTimeout);
    }

    public CircuitBreakerConfig withSuccessThreshold(int threshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, threshold, operationTimeout);
    }

    public CircuitBreakerConfig withOperationTimeout(Duration timeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, timeout);
    }
}
