package com.ivamare.reliability.exception;

import java.time.Duration;

/**
 * Raised when a protected operation exceeds its timeout.
 *
 * <p>Counted as a failure by the breaker, same as a thrown error.
 */
public class OperationTimeoutException extends ReliabilityException {

    private final String serviceName;
    private final Duration timeout;

    public OperationTimeoutException(String serviceName, Duration timeout) {
        super("Operation timeout for service " + serviceName + ": " + timeout.toMillis() + "ms");
        this.serviceName = serviceName;
        this.timeout = timeout;
    }

    public String getServiceName() {
        return serviceName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
