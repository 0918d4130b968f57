package com.ivamare.reliability.repository;

import com.ivamare.reliability.job.JobExecution;

import java.util.Optional;

/**
 * Read-only access to the host's job executions.
 */
public interface JobExecutionRepository {

    Optional<JobExecution> findById(String executionId);

    /**
     * Most recently started RUNNING execution of a job.
     */
    Optional<JobExecution> findLatestRunning(String jobId);
}
