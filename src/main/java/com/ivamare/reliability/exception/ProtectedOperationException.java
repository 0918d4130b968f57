package com.ivamare.reliability.exception;

/**
 * Wraps a checked exception thrown by an operation running under a circuit breaker.
 */
public class ProtectedOperationException extends ReliabilityException {

    private final String serviceName;

    public ProtectedOperationException(String serviceName, Throwable cause) {
        super("Protected operation failed for service " + serviceName + ": " + cause.getMessage(), cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
