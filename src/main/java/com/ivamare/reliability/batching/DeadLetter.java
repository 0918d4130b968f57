package com.ivamare.reliability.batching;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Failed work held for inspection or replay.
 *
 * @param id Unique identifier
 * @param jobId Job the work belonged to
 * @param executionId Execution the work belonged to, if known
 * @param transactionId Transaction the work belonged to, if known
 * @param failureType Failure classification
 * @param failureReason Error message
 * @param payload Description of the failed work with a bounded sample of its records
 * @param retryCount Replays attempted so far
 * @param maxRetries Replays allowed
 * @param status Current status
 * @param createdAt When the letter was queued
 * @param processedAt When a replay last finished, if ever
 * @param nextRetryAt Earliest next replay, or null for immediately
 */
public record DeadLetter(
    String id,
    String jobId,
    String executionId,
    String transactionId,
    DeadLetterFailureType failureType,
    String failureReason,
    Map<String, Object> payload,
    int retryCount,
    int maxRetries,
    DeadLetterStatus status,
    Instant createdAt,
    Instant processedAt,
    Instant nextRetryAt
) {
    public DeadLetter {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /**
     * A new PENDING letter.
     */
    public static DeadLetter pending(
            String jobId,
            DeadLetterFailureType failureType,
            String failureReason,
            Map<String, Object> payload,
            int maxRetries,
            Instant createdAt) {
        return new DeadLetter(UUID.randomUUID().toString(), jobId, null, null, failureType,
            failureReason, payload, 0, maxRetries, DeadLetterStatus.PENDING, createdAt, null, null);
    }

    public boolean canRetry() {
        return status == DeadLetterStatus.PENDING && retryCount < maxRetries;
    }
}
