package com.ivamare.reliability.job;

import java.time.Duration;

/**
 * Tunables of the {@link JobStateManager} and {@link JobHealthMonitor}.
 *
 * @param heartbeatInterval Interval between health checks of a monitored job
 * @param maxFailureRate Failure rate above which a job is CRITICAL; above half of it, WARNING
 * @param criticalProcessingTime Processing time above which a job is at least WARNING
 * @param minDataIntegrity Integrity below which a job is CRITICAL
 * @param stallThreshold Age after which a RUNNING execution without checkpoint progress is stalled
 * @param autoRecoveryDelay Delay before an automatically generated strategy is executed
 * @param recentCheckpointLimit Checkpoints considered by health checks and reports
 * @param prediction Failure prediction heuristic
 */
public record JobSettings(
    Duration heartbeatInterval,
    double maxFailureRate,
    Duration criticalProcessingTime,
    double minDataIntegrity,
    Duration stallThreshold,
    Duration autoRecoveryDelay,
    int recentCheckpointLimit,
    PredictionWeights prediction
) {
    public static JobSettings defaults() {
        return new JobSettings(Duration.ofSeconds(30), 0.05, Duration.ofMinutes(30), 0.95,
            Duration.ofHours(1), Duration.ofSeconds(5), 5, PredictionWeights.defaults());
    }

    public JobSettings withHeartbeatInterval(Duration interval) {
        return new JobSettings(interval, maxFailureRate, criticalProcessingTime, minDataIntegrity,
            stallThreshold, autoRecoveryDelay, recentCheckpointLimit, prediction);
    }

    public JobSettings withAutoRecoveryDelay(Duration delay) {
        return new JobSettings(heartbeatInterval, maxFailureRate, criticalProcessingTime, minDataIntegrity,
            stallThreshold, delay, recentCheckpointLimit, prediction);
    }
}
