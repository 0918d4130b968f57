package com.ivamare.reliability.support;

import com.ivamare.reliability.job.JobExecution;
import com.ivamare.reliability.repository.JobExecutionRepository;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Execution view backed by a map; tests put rows directly.
 */
public class InMemoryJobExecutionRepository implements JobExecutionRepository {

    private final Map<String, JobExecution> executions = new ConcurrentHashMap<>();

    public void put(JobExecution execution) {
        executions.put(execution.id(), execution);
    }

    @Override
    public Optional<JobExecution> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public Optional<JobExecution> findLatestRunning(String jobId) {
        return executions.values().stream()
            .filter(e -> e.jobId().equals(jobId) && e.isRunning())
            .max(Comparator.comparing(JobExecution::startedAt));
    }
}
