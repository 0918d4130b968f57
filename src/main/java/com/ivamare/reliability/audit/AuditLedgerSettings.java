package com.ivamare.reliability.audit;

import java.math.BigDecimal;

/**
 * Tunables of the audit ledger.
 *
 * @param ringCapacity Entries kept in memory per chain
 * @param highValueThreshold AML high-value amount
 * @param defaultDailyLimit Daily limit when an event carries none
 * @param defaultMonthlyLimit Monthly limit when an event carries none
 * @param highRiskScore Risk score above which an event counts as high risk
 */
public record AuditLedgerSettings(
    int ringCapacity,
    BigDecimal highValueThreshold,
    BigDecimal defaultDailyLimit,
    BigDecimal defaultMonthlyLimit,
    double highRiskScore
) {
    public static final int DEFAULT_RING_CAPACITY = 100_000;

    public static AuditLedgerSettings defaults() {
        return new AuditLedgerSettings(
            DEFAULT_RING_CAPACITY,
            new BigDecimal("10000"),
            new BigDecimal("50000"),
            new BigDecimal("500000"),
            0.8
        );
    }

    public AuditLedgerSettings withRingCapacity(int capacity) {
        return new AuditLedgerSettings(capacity, highValueThreshold, defaultDailyLimit,
            defaultMonthlyLimit, highRiskScore);
    }
}
