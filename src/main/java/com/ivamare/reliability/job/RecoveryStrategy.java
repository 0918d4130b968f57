package com.ivamare.reliability.job;

import com.ivamare.reliability.model.RiskLevel;

import java.util.List;

/**
 * Recovery plan for a job. Generated on demand and never stored.
 *
 * @param jobId Job to recover
 * @param executionId Execution to recover, if known
 * @param strategy Chosen strategy
 * @param checkpointIds Checkpoints the plan resumes from
 * @param estimatedRecoveryMinutes Rough duration of the recovery
 * @param riskLevel LOW, MEDIUM or HIGH
 * @param preconditions What must hold before executing
 * @param steps Ordered steps
 */
public record RecoveryStrategy(
    String jobId,
    String executionId,
    RecoveryStrategyType strategy,
    List<String> checkpointIds,
    long estimatedRecoveryMinutes,
    RiskLevel riskLevel,
    List<String> preconditions,
    List<String> steps
) {
    public RecoveryStrategy {
        checkpointIds = List.copyOf(checkpointIds);
        preconditions = List.copyOf(preconditions);
        steps = List.copyOf(steps);
    }
}
