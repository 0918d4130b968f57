package com.ivamare.reliability.batching;

/**
 * Lifecycle of a dead letter.
 */
public enum DeadLetterStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
