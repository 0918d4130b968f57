package com.ivamare.reliability.job;

import com.ivamare.reliability.model.RiskLevel;

import java.time.Instant;
import java.util.List;

/**
 * Result of one health check.
 *
 * @param jobId Job checked
 * @param executionId Execution checked, null when none was found
 * @param status Overall status
 * @param lastHeartbeat When the check ran
 * @param failureRate Failed / processed records
 * @param processingTimeMs Processing time of the execution so far
 * @param dataIntegrity Worst of checkpoint checksum pass ratio and audit chain integrity, 0..1
 * @param recommendations Findings, in the order they were detected
 * @param riskLevel Risk derived from the findings
 */
public record JobHealthStatus(
    String jobId,
    String executionId,
    HealthStatus status,
    Instant lastHeartbeat,
    double failureRate,
    long processingTimeMs,
    double dataIntegrity,
    List<String> recommendations,
    RiskLevel riskLevel
) {
    public JobHealthStatus {
        recommendations = List.copyOf(recommendations);
    }

    /**
     * A FAILED status with a single recommendation.
     */
    public static JobHealthStatus failed(String jobId, String executionId, Instant now, String reason) {
        return new JobHealthStatus(jobId, executionId, HealthStatus.FAILED, now, 1.0, 0, 0.0,
            List.of(reason), RiskLevel.CRITICAL);
    }
}
