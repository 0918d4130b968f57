package com.ivamare.reliability.job;

/**
 * Status of a job execution as recorded by the host.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Parse a stored status, case-insensitively.
     *
     * @throws IllegalArgumentException if the value is unknown
     */
    public static ExecutionStatus fromValue(String value) {
        for (ExecutionStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }
}
