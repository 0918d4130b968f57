package com.ivamare.reliability.model;

/**
 * Risk band used by job health, failure prediction and recovery strategies.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Whether this level is at least as severe as {@code other}.
     */
    public boolean isAtLeast(RiskLevel other) {
        return ordinal() >= other.ordinal();
    }
}
