package com.ivamare.reliability.job;

import java.util.List;

/**
 * Everything known about a job's state.
 *
 * @param health Current health
 * @param recentCheckpoints Newest first
 * @param prediction Failure prediction, null below the risk floor
 * @param recoveryStrategy Recovery plan, null when the job is healthy
 * @param recommendations Health findings, prevention actions and the available strategy
 */
public record JobStateReport(
    JobHealthStatus health,
    List<JobCheckpoint> recentCheckpoints,
    FailurePrediction prediction,
    RecoveryStrategy recoveryStrategy,
    List<String> recommendations
) {
    public JobStateReport {
        recentCheckpoints = List.copyOf(recentCheckpoints);
        recommendations = List.copyOf(recommendations);
    }
}
