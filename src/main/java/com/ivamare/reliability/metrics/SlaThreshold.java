package com.ivamare.reliability.metrics;

import java.time.Duration;

/**
 * Warning and critical levels for one SLA metric.
 *
 * @param metric Metric name, matched against {@code sla.<metric>}
 * @param warning Warning level
 * @param critical Critical level
 * @param window Evaluation window for periodic compliance checks
 * @param lowerIsWorse True for scores (integrity), false for costs (latency, error rate)
 */
public record SlaThreshold(
    String metric,
    double warning,
    double critical,
    Duration window,
    boolean lowerIsWorse
) {
    /**
     * Classify a single observed value.
     */
    public SlaStatus evaluate(double value) {
        if (lowerIsWorse) {
            if (value <= critical) {
                return SlaStatus.CRITICAL;
            }
            return value <= warning ? SlaStatus.WARNING : SlaStatus.COMPLIANT;
        }
        if (value >= critical) {
            return SlaStatus.CRITICAL;
        }
        return value >= warning ? SlaStatus.WARNING : SlaStatus.COMPLIANT;
    }
}
