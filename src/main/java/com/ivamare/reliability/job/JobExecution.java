package com.ivamare.reliability.job;

import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view of a host job execution.
 *
 * @param id Execution id
 * @param jobId Job the execution belongs to
 * @param status Current status
 * @param startedAt When the execution started
 * @param processingStartTime When record processing started (nullable)
 * @param processingEndTime When record processing ended (nullable)
 * @param recordsProcessed Records processed so far
 * @param recordsFailed Records that failed so far
 */
public record JobExecution(
    String id,
    String jobId,
    ExecutionStatus status,
    Instant startedAt,
    Instant processingStartTime,
    Instant processingEndTime,
    long recordsProcessed,
    long recordsFailed
) {
    /**
     * Failed / processed, with processed floored at 1.
     */
    public double failureRate() {
        return (double) recordsFailed / Math.max(1, recordsProcessed);
    }

    /**
     * Processing time when processing ended, otherwise time since the execution started.
     */
    public Duration processingTime(Instant now) {
        if (processingEndTime != null) {
            Instant start = processingStartTime != null ? processingStartTime : startedAt;
            return Duration.between(start, processingEndTime);
        }
        return Duration.between(startedAt, now);
    }

    public boolean isRunning() {
        return status == ExecutionStatus.RUNNING;
    }
}
