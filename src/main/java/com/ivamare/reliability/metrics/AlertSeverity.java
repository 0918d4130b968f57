package com.ivamare.reliability.metrics;

/**
 * Severity of a raised alert.
 */
public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL,
    EMERGENCY
}
