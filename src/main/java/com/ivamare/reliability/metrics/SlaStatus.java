package com.ivamare.reliability.metrics;

/**
 * Compliance status of an SLA metric.
 */
public enum SlaStatus {
    COMPLIANT,
    WARNING,
    CRITICAL;

    /**
     * Numeric form used for {@code sla_compliance.*} samples: 1, 0.5 or 0.
     */
    public double score() {
        return switch (this) {
            case COMPLIANT -> 1.0;
            case WARNING -> 0.5;
            case CRITICAL -> 0.0;
        };
    }

    public static SlaStatus fromScore(double score) {
        if (score >= 1.0) {
            return COMPLIANT;
        }
        return score >= 0.5 ? WARNING : CRITICAL;
    }
}
