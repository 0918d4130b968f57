package com.ivamare.reliability.job;

import java.time.Duration;

/**
 * Thresholds and weights of the failure prediction heuristic.
 *
 * <p>These are tunable, not a fitted model.
 *
 * @param failureRateThreshold Failure rate above which BUSINESS_LOGIC contributes
 * @param failureRateWeight Score added for BUSINESS_LOGIC
 * @param processingTimeThreshold Processing time above which MEMORY contributes
 * @param processingTimeWeight Score added for MEMORY
 * @param integrityThreshold Data integrity below which DATABASE contributes
 * @param integrityWeight Score added for DATABASE
 * @param networkWeight Score added for NETWORK when any circuit breaker is OPEN
 * @param riskFloor Scores below this produce no prediction
 * @param baselineLow Baseline added for LOW risk when the score is below 20
 * @param baselineMedium Baseline added for MEDIUM risk when the score is below 20
 * @param baselineHigh Baseline added for HIGH and CRITICAL risk when the score is below 20
 */
public record PredictionWeights(
    double failureRateThreshold,
    int failureRateWeight,
    Duration processingTimeThreshold,
    int processingTimeWeight,
    double integrityThreshold,
    int integrityWeight,
    int networkWeight,
    int riskFloor,
    int baselineLow,
    int baselineMedium,
    int baselineHigh
) {
    public static PredictionWeights defaults() {
        return new PredictionWeights(0.02, 30, Duration.ofMinutes(25), 20, 0.98, 25, 15, 25, 5, 15, 30);
    }
}
