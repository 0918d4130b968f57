package com.ivamare.reliability.exception;

/**
 * Base exception for all reliability core errors.
 */
public class ReliabilityException extends RuntimeException {

    public ReliabilityException(String message) {
        super(message);
    }

    public ReliabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
