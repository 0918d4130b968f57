package com.ivamare.reliability.job;

/**
 * Health of a job execution, from best to worst.
 */
public enum HealthStatus {
    HEALTHY(1.0),
    WARNING(0.7),
    CRITICAL(0.3),
    FAILED(0.0);

    private final double score;

    HealthStatus(double score) {
        this.score = score;
    }

    /**
     * Value emitted as {@code job_health_score}.
     */
    public double score() {
        return score;
    }

    /**
     * The worse of this status and {@code other}.
     */
    public HealthStatus atLeast(HealthStatus other) {
        return ordinal() >= other.ordinal() ? this : other;
    }
}
