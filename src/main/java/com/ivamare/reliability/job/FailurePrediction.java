package com.ivamare.reliability.job;

import java.time.Instant;
import java.util.List;

/**
 * Heuristic failure forecast for a job.
 *
 * @param jobId Job assessed
 * @param riskScore 0..100
 * @param predictedFailureType Cause of the highest-weighted contributing factor
 * @param confidence 0.3 + 0.65 x riskScore / 100
 * @param estimatedMinutesToFailure 15, 30, 45 or 60 by risk band
 * @param preventionActions Suggested actions, one per contributing factor
 * @param timestamp When the forecast was made
 */
public record FailurePrediction(
    String jobId,
    int riskScore,
    FailureCategory predictedFailureType,
    double confidence,
    int estimatedMinutesToFailure,
    List<String> preventionActions,
    Instant timestamp
) {
    public FailurePrediction {
        preventionActions = List.copyOf(preventionActions);
    }
}
