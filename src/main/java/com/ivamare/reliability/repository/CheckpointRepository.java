package com.ivamare.reliability.repository;

import com.ivamare.reliability.job.CheckpointState;
import com.ivamare.reliability.job.JobCheckpoint;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for job checkpoints.
 */
public interface CheckpointRepository {

    /**
     * Store a new checkpoint. Must be atomic.
     */
    void save(JobCheckpoint checkpoint);

    Optional<JobCheckpoint> findById(String checkpointId);

    /**
     * Checkpoints of a job, newest first.
     *
     * @param jobId the job
     * @param executionId Restrict to one execution (nullable)
     * @param state Restrict to one state (nullable)
     * @param limit Maximum checkpoints returned
     */
    List<JobCheckpoint> findRecent(String jobId, String executionId, CheckpointState state, int limit);
}
