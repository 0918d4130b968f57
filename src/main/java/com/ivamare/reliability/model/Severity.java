package com.ivamare.reliability.model;

/**
 * Severity of a chain violation, compliance finding or compliance rule.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
