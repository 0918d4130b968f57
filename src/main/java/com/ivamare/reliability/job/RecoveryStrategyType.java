package com.ivamare.reliability.job;

/**
 * Ways to recover a job.
 */
public enum RecoveryStrategyType {
    RESTART_FROM_CHECKPOINT,
    FULL_RESTART,
    MANUAL_INTERVENTION,
    CIRCUIT_BREAKER_BYPASS
}
