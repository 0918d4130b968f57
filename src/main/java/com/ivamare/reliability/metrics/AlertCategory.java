package com.ivamare.reliability.metrics;

/**
 * Area an alert belongs to.
 */
public enum AlertCategory {
    PERFORMANCE,
    COMPLIANCE,
    BUSINESS,
    SYSTEM
}
