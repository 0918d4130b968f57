package com.ivamare.reliability.job;

/**
 * State of the step a checkpoint marks.
 */
public enum CheckpointState {
    STARTED,
    COMPLETED,
    FAILED,
    PARTIAL
}
