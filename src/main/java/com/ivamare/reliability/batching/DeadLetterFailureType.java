package com.ivamare.reliability.batching;

/**
 * Why work ended up in the dead-letter queue.
 */
public enum DeadLetterFailureType {
    VALIDATION_ERROR,
    PROCESSING_ERROR,
    SYSTEM_ERROR
}
