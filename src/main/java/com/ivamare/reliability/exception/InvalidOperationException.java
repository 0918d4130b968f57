package com.ivamare.reliability.exception;

/**
 * Thrown when an invalid configuration or operation is attempted.
 */
public class InvalidOperationException extends ReliabilityException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
