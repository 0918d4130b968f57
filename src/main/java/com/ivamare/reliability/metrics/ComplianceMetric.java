package com.ivamare.reliability.metrics;

import java.time.Instant;

/**
 * Latest value of a compliance-related metric with its status against a 0.95 target.
 */
public record ComplianceMetric(
    String name,
    double value,
    double target,
    SlaStatus status,
    Instant timestamp,
    String description
) {
}
