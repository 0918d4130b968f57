package com.ivamare.reliability.job;

import com.ivamare.reliability.support.CanonicalJson;

import java.time.Instant;
import java.util.Map;

/**
 * Progress marker of a job execution. Immutable once stored.
 *
 * @param checkpointId Unique identifier
 * @param jobId Job the checkpoint belongs to
 * @param executionId Execution the checkpoint belongs to
 * @param stepName Step that reached the checkpoint
 * @param stepNumber Ordinal of the step
 * @param dataProcessed Records processed so far
 * @param totalData Records in the execution
 * @param timestamp When the checkpoint was taken, millisecond precision
 * @param checksum SHA-256 over the other fields
 * @param state State of the step
 * @param metadata Free-form step data
 */
public record JobCheckpoint(
    String checkpointId,
    String jobId,
    String executionId,
    String stepName,
    int stepNumber,
    long dataProcessed,
    long totalData,
    Instant timestamp,
    String checksum,
    CheckpointState state,
    Map<String, Object> metadata
) {
    public JobCheckpoint {
        metadata = CanonicalJson.immutableCopy(metadata);
    }

    public long remaining() {
        return Math.max(0, totalData - dataProcessed);
    }

    public boolean isCompleted() {
        return state == CheckpointState.COMPLETED;
    }

    public JobCheckpoint withChecksum(String newChecksum) {
        return new JobCheckpoint(checkpointId, jobId, executionId, stepName, stepNumber, dataProcessed,
            totalData, timestamp, newChecksum, state, metadata);
    }
}
