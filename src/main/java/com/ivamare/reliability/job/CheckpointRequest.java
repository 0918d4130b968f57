package com.ivamare.reliability.job;

import com.ivamare.reliability.exception.InvalidOperationException;

import java.util.Map;

/**
 * Caller-supplied part of a {@link JobCheckpoint}.
 *
 * @param jobId Job the checkpoint belongs to
 * @param executionId Execution the checkpoint belongs to
 * @param stepName Step that reached the checkpoint
 * @param stepNumber Ordinal of the step
 * @param dataProcessed Records processed so far
 * @param totalData Records in the execution
 * @param state State of the step
 * @param metadata Free-form step data (nullable)
 */
public record CheckpointRequest(
    String jobId,
    String executionId,
    String stepName,
    int stepNumber,
    long dataProcessed,
    long totalData,
    CheckpointState state,
    Map<String, Object> metadata
) {
    /**
     * @throws InvalidOperationException if a required field is missing or progress is out of range
     */
    public void validate() {
        if (jobId == null || jobId.isBlank()) {
            throw new InvalidOperationException("Checkpoint requires a jobId");
        }
        if (executionId == null || executionId.isBlank()) {
            throw new InvalidOperationException("Checkpoint requires an executionId");
        }
        if (stepName == null || stepName.isBlank()) {
            throw new InvalidOperationException("Checkpoint requires a stepName");
        }
        if (state == null) {
            throw new InvalidOperationException("Checkpoint requires a state");
        }
        if (dataProcessed < 0 || totalData < 0 || dataProcessed > totalData) {
            throw new InvalidOperationException(
                "Invalid checkpoint progress: " + dataProcessed + "/" + totalData);
        }
    }
}
