package com.ivamare.reliability.exception;

/**
 * Raised when an operation needs a job execution record that does not exist.
 */
public class ExecutionNotFoundException extends ReliabilityException {

    private final String jobId;
    private final String executionId;

    public ExecutionNotFoundException(String jobId, String executionId) {
        super("Execution not found: job=" + jobId + ", execution=" + executionId);
        this.jobId = jobId;
        this.executionId = executionId;
    }

    public String getJobId() {
        return jobId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
