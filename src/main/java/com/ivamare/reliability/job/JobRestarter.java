package com.ivamare.reliability.job;

/**
 * Host hook that restarts job work during recovery.
 */
public interface JobRestarter {

    /**
     * Resume an execution after a checkpoint.
     */
    void restartFromCheckpoint(String jobId, String executionId, JobCheckpoint checkpoint);

    /**
     * Start the job again from the beginning.
     */
    void restartFull(String jobId, String executionId);
}
